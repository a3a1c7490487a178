package com.devicehub.manager;

import com.typesafe.config.Config;
import org.slf4j.event.Level;

import java.time.Duration;

/**
 * Configuration for a component manager.
 * Parsed from the HOCON block {@code devicehub.manager { ... }}.
 */
public final class ManagerConfig {

    public static final String PATH = "devicehub.manager";

    private final String deviceAddress;
    private final boolean singleton;
    private final Duration pollInterval;
    private final Duration shutdownGracePeriod;
    private final Duration defaultStartupTimeout;
    private final ReadinessTimeoutPolicy readinessTimeoutPolicy;
    private final int maxActiveComponents;
    private final Level logLevel;

    private ManagerConfig(Builder builder) {
        this.deviceAddress = builder.deviceAddress;
        this.singleton = builder.singleton;
        this.pollInterval = builder.pollInterval;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
        this.defaultStartupTimeout = builder.defaultStartupTimeout;
        this.readinessTimeoutPolicy = builder.readinessTimeoutPolicy;
        this.maxActiveComponents = builder.maxActiveComponents;
        this.logLevel = builder.logLevel;
    }

    /**
     * Parse config from HOCON. Missing keys keep their defaults.
     * Expected format:
     * <pre>
     * devicehub.manager {
     *   device-address = ""
     *   singleton = false
     *   poll-interval = 100ms
     *   shutdown-grace-period = 5s
     *   default-startup-timeout = 10s
     *   readiness-timeout-policy = WARN
     *   max-active-components = 0
     *   log-level = INFO
     * }
     * </pre>
     *
     * @param config the root config
     */
    public static ManagerConfig fromConfig(Config config) {
        Builder builder = builder();
        if (!config.hasPath(PATH)) {
            return builder.build();
        }

        Config managerConfig = config.getConfig(PATH);
        if (managerConfig.hasPath("device-address")) {
            builder.deviceAddress(managerConfig.getString("device-address"));
        }
        if (managerConfig.hasPath("singleton")) {
            builder.singleton(managerConfig.getBoolean("singleton"));
        }
        if (managerConfig.hasPath("poll-interval")) {
            builder.pollInterval(managerConfig.getDuration("poll-interval"));
        }
        if (managerConfig.hasPath("shutdown-grace-period")) {
            builder.shutdownGracePeriod(managerConfig.getDuration("shutdown-grace-period"));
        }
        if (managerConfig.hasPath("default-startup-timeout")) {
            builder.defaultStartupTimeout(managerConfig.getDuration("default-startup-timeout"));
        }
        if (managerConfig.hasPath("readiness-timeout-policy")) {
            builder.readinessTimeoutPolicy(managerConfig.getEnum(ReadinessTimeoutPolicy.class, "readiness-timeout-policy"));
        }
        if (managerConfig.hasPath("max-active-components")) {
            builder.maxActiveComponents(managerConfig.getInt("max-active-components"));
        }
        if (managerConfig.hasPath("log-level")) {
            builder.logLevel(Level.valueOf(managerConfig.getString("log-level").toUpperCase()));
        }
        return builder.build();
    }

    /**
     * Create a default config.
     */
    public static ManagerConfig defaults() {
        return builder().build();
    }

    /**
     * The configured device address, or an empty string to resolve it from the network.
     */
    public String getDeviceAddress() {
        return deviceAddress;
    }

    public boolean hasDeviceAddress() {
        return !deviceAddress.isBlank();
    }

    public boolean isSingleton() {
        return singleton;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public Duration getDefaultStartupTimeout() {
        return defaultStartupTimeout;
    }

    public ReadinessTimeoutPolicy getReadinessTimeoutPolicy() {
        return readinessTimeoutPolicy;
    }

    /**
     * Maximum number of simultaneously active components; 0 means unlimited.
     */
    public int getMaxActiveComponents() {
        return maxActiveComponents;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .deviceAddress(deviceAddress)
                .singleton(singleton)
                .pollInterval(pollInterval)
                .shutdownGracePeriod(shutdownGracePeriod)
                .defaultStartupTimeout(defaultStartupTimeout)
                .readinessTimeoutPolicy(readinessTimeoutPolicy)
                .maxActiveComponents(maxActiveComponents)
                .logLevel(logLevel);
    }

    public static final class Builder {
        private String deviceAddress = "";
        private boolean singleton = false;
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration shutdownGracePeriod = Duration.ofSeconds(5);
        private Duration defaultStartupTimeout = Duration.ofSeconds(10);
        private ReadinessTimeoutPolicy readinessTimeoutPolicy = ReadinessTimeoutPolicy.WARN;
        private int maxActiveComponents = 0;
        private Level logLevel = Level.INFO;

        private Builder() {}

        public Builder deviceAddress(String deviceAddress) {
            this.deviceAddress = deviceAddress == null ? "" : deviceAddress;
            return this;
        }

        public Builder singleton(boolean singleton) {
            this.singleton = singleton;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        public Builder defaultStartupTimeout(Duration defaultStartupTimeout) {
            this.defaultStartupTimeout = defaultStartupTimeout;
            return this;
        }

        public Builder readinessTimeoutPolicy(ReadinessTimeoutPolicy readinessTimeoutPolicy) {
            this.readinessTimeoutPolicy = readinessTimeoutPolicy;
            return this;
        }

        public Builder maxActiveComponents(int maxActiveComponents) {
            this.maxActiveComponents = maxActiveComponents;
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ManagerConfig build() {
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("poll-interval must be positive: " + pollInterval);
            }
            if (shutdownGracePeriod.isNegative()) {
                throw new IllegalArgumentException("shutdown-grace-period must not be negative: " + shutdownGracePeriod);
            }
            if (defaultStartupTimeout.isNegative()) {
                throw new IllegalArgumentException("default-startup-timeout must not be negative: " + defaultStartupTimeout);
            }
            if (maxActiveComponents < 0) {
                throw new IllegalArgumentException("max-active-components must not be negative: " + maxActiveComponents);
            }
            return new ManagerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ManagerConfig{" +
                "deviceAddress='" + deviceAddress + '\'' +
                ", singleton=" + singleton +
                ", pollInterval=" + pollInterval +
                ", shutdownGracePeriod=" + shutdownGracePeriod +
                ", defaultStartupTimeout=" + defaultStartupTimeout +
                ", readinessTimeoutPolicy=" + readinessTimeoutPolicy +
                ", maxActiveComponents=" + maxActiveComponents +
                ", logLevel=" + logLevel +
                '}';
    }
}
