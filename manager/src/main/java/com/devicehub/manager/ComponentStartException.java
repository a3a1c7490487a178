package com.devicehub.manager;

/**
 * Thrown (or carried in a not-started reply) when a component cannot be started.
 */
public class ComponentStartException extends RuntimeException {

    private final String componentName;

    public ComponentStartException(String componentName, String message) {
        super(message);
        this.componentName = componentName;
    }

    public ComponentStartException(String componentName, String message, Throwable cause) {
        super(message, cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
