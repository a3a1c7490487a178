package com.devicehub.manager.logging;

import com.devicehub.manager.ComponentManager;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.event.Level;

import static org.junit.jupiter.api.Assertions.*;

class ManagerLoggingTest {

    @Test
    void managerLoggerIsScopedToDevice() {
        Logger logger = ManagerLogging.managerLogger(ComponentManager.class, "10.0.0.5", Level.INFO);

        assertEquals("ComponentManager-10.0.0.5", logger.getName());
    }

    @Test
    void componentLoggerAppliesRequestedLevel() {
        Logger logger = ManagerLogging.componentLogger("motor", "10.0.0.7", Level.WARN);

        assertEquals("motor-10.0.0.7", logger.getName());
        assertTrue(logger.isWarnEnabled());
        assertFalse(logger.isInfoEnabled());

        assertTrue(ManagerLogging.applyLevel(logger, Level.DEBUG));
        assertTrue(logger.isDebugEnabled());
    }

    @Test
    void nullLevelLeavesLoggerUnchanged() {
        Logger logger = ManagerLogging.componentLogger("echo", "10.0.0.8", Level.ERROR);

        assertFalse(ManagerLogging.applyLevel(logger, null));
        assertFalse(logger.isWarnEnabled());
    }

    @Test
    void laterStricterStartDoesNotSilenceSharedComponentLogger() {
        Logger first = ManagerLogging.componentLogger("camera", "10.0.0.9", Level.INFO);
        Logger second = ManagerLogging.componentLogger("camera", "10.0.0.9", Level.ERROR);

        assertSame(first, second);
        assertTrue(second.isInfoEnabled());

        ManagerLogging.componentLogger("camera", "10.0.0.9", Level.DEBUG);
        assertTrue(first.isDebugEnabled());
    }
}
