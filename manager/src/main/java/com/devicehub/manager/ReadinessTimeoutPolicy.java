package com.devicehub.manager;

/**
 * What the manager does when a component misses its startup timeout.
 */
public enum ReadinessTimeoutPolicy {

    /**
     * Log an error, keep the component running and registered, reply as started.
     */
    WARN,

    /**
     * Ask the component to stop, do not register it, reply as not started.
     */
    FAIL
}
