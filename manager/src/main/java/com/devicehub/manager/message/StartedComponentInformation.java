package com.devicehub.manager.message;

import com.devicehub.bus.Message;

/**
 * Reply to a {@link StartComponentRequest}: where the started component publishes its output.
 */
public final class StartedComponentInformation extends Message {

    private final String outputChannel;
    private volatile boolean singleton;

    public StartedComponentInformation(String outputChannel) {
        this(outputChannel, false);
    }

    public StartedComponentInformation(String outputChannel, boolean singleton) {
        this.outputChannel = outputChannel;
        this.singleton = singleton;
    }

    /**
     * Create a distinct reply with the same output channel and singleton flag.
     * The request id is not carried over.
     */
    public StartedComponentInformation copy() {
        return new StartedComponentInformation(outputChannel, singleton);
    }

    public String getOutputChannel() {
        return outputChannel;
    }

    /**
     * Whether the component is shared by all requesters of the device.
     */
    public boolean isSingleton() {
        return singleton;
    }

    public void setSingleton(boolean singleton) {
        this.singleton = singleton;
    }

    @Override
    public String toString() {
        return "StartedComponentInformation{" +
               "outputChannel='" + outputChannel + '\'' +
               ", singleton=" + singleton +
               ", requestId=" + getRequestId() +
               '}';
    }
}
