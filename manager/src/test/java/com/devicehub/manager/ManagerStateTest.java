package com.devicehub.manager;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ManagerStateTest {

    @Test
    void forwardTransitionsAreValid() {
        assertTrue(ManagerState.INITIALIZING.canTransitionTo(ManagerState.READY));
        assertTrue(ManagerState.READY.canTransitionTo(ManagerState.SERVING));
        assertTrue(ManagerState.SERVING.canTransitionTo(ManagerState.SHUTTING_DOWN));
        assertTrue(ManagerState.SHUTTING_DOWN.canTransitionTo(ManagerState.STOPPED));
    }

    @Test
    void shutdownIsReachableBeforeServing() {
        assertTrue(ManagerState.INITIALIZING.canTransitionTo(ManagerState.SHUTTING_DOWN));
        assertTrue(ManagerState.READY.canTransitionTo(ManagerState.SHUTTING_DOWN));
    }

    @Test
    void stoppedIsTerminal() {
        for (ManagerState target : ManagerState.values()) {
            assertFalse(ManagerState.STOPPED.canTransitionTo(target));
        }
    }

    @Test
    void noBackwardTransitions() {
        assertFalse(ManagerState.SERVING.canTransitionTo(ManagerState.READY));
        assertFalse(ManagerState.SHUTTING_DOWN.canTransitionTo(ManagerState.SERVING));
        assertFalse(ManagerState.READY.canTransitionTo(ManagerState.INITIALIZING));
    }

    @Test
    void onlyPreShutdownStatesAcceptRequests() {
        assertTrue(ManagerState.INITIALIZING.isAcceptingRequests());
        assertTrue(ManagerState.READY.isAcceptingRequests());
        assertTrue(ManagerState.SERVING.isAcceptingRequests());
        assertFalse(ManagerState.SHUTTING_DOWN.isAcceptingRequests());
        assertFalse(ManagerState.STOPPED.isAcceptingRequests());
    }
}
