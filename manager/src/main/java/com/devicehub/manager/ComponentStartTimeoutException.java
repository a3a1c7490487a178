package com.devicehub.manager;

import java.time.Duration;

/**
 * A component did not report readiness within its startup timeout.
 */
public class ComponentStartTimeoutException extends ComponentStartException {

    private final Duration timeout;

    public ComponentStartTimeoutException(String componentName, Duration timeout) {
        super(componentName, "Component " + componentName + " refused to start within "
                + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
