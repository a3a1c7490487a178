package com.devicehub.manager.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Creates the per-device loggers used by managers and their components.
 *
 * <p>Logger names follow {@code <name>-<deviceAddress>} so that output from several
 * devices writing to one log sink stays attributable. Levels are applied through
 * Logback when it is the bound backend; with other backends the requested level is
 * ignored and the backend's configuration applies.</p>
 */
public final class ManagerLogging {

    private static final Logger log = LoggerFactory.getLogger(ManagerLogging.class);

    private ManagerLogging() {}

    /**
     * Get the logger of a manager on a device.
     *
     * @param managerClass the manager type, whose simple name prefixes the logger name
     * @param deviceAddress the device address
     * @param level the minimum level to log
     */
    public static Logger managerLogger(Class<?> managerClass, String deviceAddress, Level level) {
        return scopedLogger(managerClass.getSimpleName(), deviceAddress, level);
    }

    /**
     * Get the logger of a component on a device.
     *
     * <p>Instances of one component on one device share this logger. A requested level
     * only ever makes it more verbose, so a later start at a stricter level does not
     * silence instances that are already running.</p>
     */
    public static Logger componentLogger(String componentName, String deviceAddress, Level level) {
        Logger logger = LoggerFactory.getLogger(loggerName(componentName, deviceAddress));
        if (level != null && logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            ch.qos.logback.classic.Level current = logbackLogger.getLevel();
            ch.qos.logback.classic.Level requested = ch.qos.logback.classic.Level.toLevel(level.name());
            if (current != null && current.toInt() <= requested.toInt()) {
                log.debug("Keeping level {} of {}, requested {}", current, logger.getName(), level);
                return logger;
            }
        }
        applyLevel(logger, level);
        return logger;
    }

    /**
     * Build the logger name for a scope on a device.
     */
    public static String loggerName(String scope, String deviceAddress) {
        return scope + "-" + deviceAddress;
    }

    /**
     * Set the level of a logger if the backend supports it.
     *
     * @param logger the logger
     * @param level the level, or null to leave the logger unchanged
     * @return true if the level was applied
     */
    public static boolean applyLevel(Logger logger, Level level) {
        if (level == null) {
            return false;
        }
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(ch.qos.logback.classic.Level.toLevel(level.name()));
            return true;
        }
        log.debug("Logging backend does not support runtime levels, ignoring {} for {}", level, logger.getName());
        return false;
    }

    private static Logger scopedLogger(String scope, String deviceAddress, Level level) {
        Logger logger = LoggerFactory.getLogger(loggerName(scope, deviceAddress));
        applyLevel(logger, level);
        return logger;
    }
}
