package com.devicehub.manager;

/**
 * Represents the lifecycle state of a {@link ComponentManager}.
 *
 * <pre>
 * INITIALIZING ──► READY ──► SERVING ──► SHUTTING_DOWN ──► STOPPED
 *       │            │                        ▲
 *       └────────────┴────────────────────────┘
 * </pre>
 */
public enum ManagerState {

    /**
     * Manager constructed, not yet listening on the bus.
     */
    INITIALIZING,

    /**
     * Listening for requests; serve loop not entered yet.
     */
    READY,

    /**
     * Inside the serve loop.
     */
    SERVING,

    /**
     * Stop observed; active components are being stopped.
     * Requests other than stop are ignored from here on.
     */
    SHUTTING_DOWN,

    /**
     * Shutdown complete. No transitions from here.
     */
    STOPPED;

    /**
     * Check if the manager accepts start requests in this state.
     *
     * @return true if start requests are served
     */
    public boolean isAcceptingRequests() {
        return this == INITIALIZING || this == READY || this == SERVING;
    }

    /**
     * Check if transition to the target state is valid from this state.
     *
     * @param target the target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ManagerState target) {
        return switch (this) {
            case INITIALIZING -> target == READY || target == SHUTTING_DOWN;
            case READY -> target == SERVING || target == SHUTTING_DOWN;
            case SERVING -> target == SHUTTING_DOWN;
            case SHUTTING_DOWN -> target == STOPPED;
            case STOPPED -> false;
        };
    }
}
