package com.devicehub.manager.component;

import java.time.Duration;
import java.time.Instant;

/**
 * A launched component as tracked by the manager that owns it.
 */
public final class ComponentRuntimeInstance {

    private final String componentName;
    private final String outputChannel;
    private final Signal stopSignal;
    private final Signal readySignal;
    private final Thread thread;
    private final Instant startedAt;
    private final HostedComponent component;

    public ComponentRuntimeInstance(String componentName, String outputChannel,
                                    Signal stopSignal, Signal readySignal,
                                    Thread thread, Instant startedAt, HostedComponent component) {
        this.componentName = componentName;
        this.outputChannel = outputChannel;
        this.stopSignal = stopSignal;
        this.readySignal = readySignal;
        this.thread = thread;
        this.startedAt = startedAt;
        this.component = component;
    }

    /**
     * Wait for the component to report readiness.
     *
     * @return true if the ready signal was set within the timeout
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return readySignal.await(timeout);
    }

    /**
     * Ask the component to stop. Does not wait.
     */
    public void requestStop() {
        stopSignal.set();
    }

    /**
     * Wait for the component's thread to terminate.
     *
     * @param timeout the maximum time to wait; zero or negative only checks
     * @return true if the thread has terminated
     */
    public boolean join(Duration timeout) throws InterruptedException {
        long millis = timeout.toMillis();
        if (millis > 0) {
            thread.join(millis);
        }
        return !thread.isAlive();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public boolean isReady() {
        return readySignal.isSet();
    }

    public boolean isStopRequested() {
        return stopSignal.isSet();
    }

    public String getComponentName() {
        return componentName;
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

    public Thread getThread() {
        return thread;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public HostedComponent getComponent() {
        return component;
    }

    @Override
    public String toString() {
        return "ComponentRuntimeInstance{" +
               "name='" + componentName + '\'' +
               ", outputChannel='" + outputChannel + '\'' +
               ", ready=" + isReady() +
               ", alive=" + isAlive() +
               ", startedAt=" + startedAt +
               '}';
    }
}
