package com.devicehub.manager;

/**
 * A start was refused because the manager already hosts its maximum number of components.
 */
public class AdmissionRejectedException extends ComponentStartException {

    private final int maxActiveComponents;

    public AdmissionRejectedException(String componentName, int maxActiveComponents) {
        super(componentName, "Cannot start " + componentName + ": limit of "
                + maxActiveComponents + " active components reached");
        this.maxActiveComponents = maxActiveComponents;
    }

    public int getMaxActiveComponents() {
        return maxActiveComponents;
    }
}
