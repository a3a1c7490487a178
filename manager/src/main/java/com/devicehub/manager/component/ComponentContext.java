package com.devicehub.manager.component;

import com.devicehub.bus.MessageBus;
import com.typesafe.config.Config;
import org.slf4j.event.Level;

/**
 * Everything a component receives from the manager that launches it.
 *
 * <p>The configuration blob is passed through from the start request untouched; the
 * manager never interprets it.</p>
 */
public final class ComponentContext {

    private final String componentName;
    private final String deviceAddress;
    private final String outputChannel;
    private final Signal stopSignal;
    private final Signal readySignal;
    private final Level logLevel;
    private final Config conf;
    private final MessageBus bus;

    public ComponentContext(String componentName, String deviceAddress, String outputChannel,
                            Signal stopSignal, Signal readySignal, Level logLevel,
                            Config conf, MessageBus bus) {
        this.componentName = componentName;
        this.deviceAddress = deviceAddress;
        this.outputChannel = outputChannel;
        this.stopSignal = stopSignal;
        this.readySignal = readySignal;
        this.logLevel = logLevel;
        this.conf = conf;
        this.bus = bus;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getDeviceAddress() {
        return deviceAddress;
    }

    public String getOutputChannel() {
        return outputChannel;
    }

    public Signal getStopSignal() {
        return stopSignal;
    }

    public Signal getReadySignal() {
        return readySignal;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public Config getConf() {
        return conf;
    }

    public MessageBus getBus() {
        return bus;
    }
}
