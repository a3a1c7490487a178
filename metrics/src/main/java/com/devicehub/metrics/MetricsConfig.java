package com.devicehub.metrics;

import com.typesafe.config.Config;

/**
 * Configuration for manager metrics.
 * Parsed from HOCON config block {@code devicehub.metrics { ... }}.
 */
public class MetricsConfig {

    public static final String PATH = "devicehub.metrics";

    private final boolean enabled;
    private final boolean includeJvm;

    private MetricsConfig(boolean enabled, boolean includeJvm) {
        this.enabled = enabled;
        this.includeJvm = includeJvm;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isIncludeJvm() {
        return includeJvm;
    }

    /**
     * Parse config from HOCON.
     * Expected format:
     * <pre>
     * devicehub.metrics {
     *   enabled = true
     *   include-jvm = true
     * }
     * </pre>
     */
    public static MetricsConfig fromConfig(Config config) {
        boolean enabled = true;
        boolean includeJvm = true;

        if (config.hasPath(PATH)) {
            Config metricsConfig = config.getConfig(PATH);

            if (metricsConfig.hasPath("enabled")) {
                enabled = metricsConfig.getBoolean("enabled");
            }
            if (metricsConfig.hasPath("include-jvm")) {
                includeJvm = metricsConfig.getBoolean("include-jvm");
            }
        }

        return new MetricsConfig(enabled, includeJvm);
    }

    /**
     * Create a default config with metrics enabled.
     */
    public static MetricsConfig defaults() {
        return new MetricsConfig(true, true);
    }

    /**
     * Create a config with metrics disabled.
     */
    public static MetricsConfig disabled() {
        return new MetricsConfig(false, false);
    }

    @Override
    public String toString() {
        return "MetricsConfig{enabled=" + enabled + ", includeJvm=" + includeJvm + "}";
    }
}
