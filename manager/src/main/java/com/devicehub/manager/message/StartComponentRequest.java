package com.devicehub.manager.message;

import com.devicehub.bus.Request;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.event.Level;

import java.util.Objects;

/**
 * A request for a component manager on a device to start a component.
 *
 * <p>The configuration blob is handed to the component unchanged.</p>
 */
public final class StartComponentRequest extends Request {

    private final String componentName;
    private final Level logLevel;
    private final Config conf;

    public StartComponentRequest(String componentName, Level logLevel, Config conf) {
        this.componentName = Objects.requireNonNull(componentName, "componentName");
        this.logLevel = logLevel != null ? logLevel : Level.INFO;
        this.conf = conf != null ? conf : ConfigFactory.empty();
    }

    public StartComponentRequest(String componentName, Level logLevel) {
        this(componentName, logLevel, null);
    }

    public StartComponentRequest(String componentName) {
        this(componentName, Level.INFO, null);
    }

    public String getComponentName() {
        return componentName;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public Config getConf() {
        return conf;
    }

    @Override
    public String toString() {
        return "StartComponentRequest{" +
               "componentName='" + componentName + '\'' +
               ", logLevel=" + logLevel +
               ", requestId=" + getRequestId() +
               '}';
    }
}
