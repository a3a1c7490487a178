package com.devicehub.manager;

import com.devicehub.bus.Request;
import com.devicehub.manager.component.ComponentRuntimeInstance;

import java.time.Duration;

/**
 * Listener for manager activity. All methods have empty defaults.
 *
 * <p>Callbacks run on the thread handling the request (or performing shutdown) and
 * must not block. Exceptions thrown by a listener are logged and otherwise ignored.</p>
 */
public interface ManagerListener {

    /**
     * A new component instance was launched and registered as active.
     *
     * @param instance the instance
     * @param startupTime time from the start of the launch until registration
     */
    default void onComponentStarted(ComponentRuntimeInstance instance, Duration startupTime) {
    }

    /**
     * A start request was answered from the singleton cache without launching.
     */
    default void onComponentReused(String componentName) {
    }

    /**
     * A start request was answered with a not-started reply.
     */
    default void onComponentNotStarted(String componentName, Throwable cause) {
    }

    /**
     * A launched component missed its startup timeout.
     */
    default void onReadinessTimeout(ComponentRuntimeInstance instance) {
    }

    /**
     * A request was ignored.
     */
    default void onRequestIgnored(Request request) {
    }

    /**
     * The manager finished shutting down.
     *
     * @param stopped number of components that terminated within the grace period
     * @param abandoned number of components still running after the grace period
     */
    default void onShutdown(int stopped, int abandoned) {
    }
}
