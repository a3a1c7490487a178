package com.devicehub.metrics;

import com.devicehub.manager.ComponentManager;
import com.devicehub.metrics.binder.ManagerMetricsBinder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmInfoMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the {@link PrometheusMeterRegistry} that component managers report to.
 * Registers JVM binders (memory, GC, threads, class loading, CPU, uptime) when enabled.
 *
 * <pre>{@code
 * ManagerMetrics metrics = ManagerMetrics.create(MetricsConfig.fromConfig(config));
 * metrics.bind(manager);
 * String text = metrics.scrape();
 * }</pre>
 */
public class ManagerMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ManagerMetrics.class);

    private final MetricsConfig config;
    private final PrometheusMeterRegistry registry;
    private final List<AutoCloseable> closeables = new ArrayList<>();

    private ManagerMetrics(MetricsConfig config, PrometheusMeterRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * Create the metrics registry described by the config.
     * When metrics are disabled no registry is created and binding is a no-op.
     */
    public static ManagerMetrics create(MetricsConfig config) {
        if (!config.isEnabled()) {
            log.info("Metrics disabled");
            return new ManagerMetrics(config, null);
        }

        log.info("Initializing Prometheus metrics registry");
        ManagerMetrics metrics = new ManagerMetrics(config, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));

        if (config.isIncludeJvm()) {
            metrics.bindJvmMetrics();
        }
        return metrics;
    }

    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(registry);
        JvmGcMetrics gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        closeables.add(gcMetrics);
        new JvmThreadMetrics().bindTo(registry);
        new JvmInfoMetrics().bindTo(registry);
        new ClassLoaderMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);

        log.info("JVM metrics binders registered");
    }

    /**
     * Register the meters of a manager and subscribe them to its activity.
     *
     * @return the binder, or null when metrics are disabled
     */
    public ManagerMetricsBinder bind(ComponentManager manager) {
        if (registry == null) {
            return null;
        }
        ManagerMetricsBinder binder = new ManagerMetricsBinder(manager);
        binder.bindTo(registry);
        manager.addListener(binder);
        return binder;
    }

    /**
     * Get the Prometheus meter registry, or null when metrics are disabled.
     */
    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Get the meter registry as the generic interface.
     */
    public MeterRegistry getMeterRegistry() {
        return registry;
    }

    public MetricsConfig getMetricsConfig() {
        return config;
    }

    public boolean isEnabled() {
        return registry != null;
    }

    /**
     * Scrape all metrics in Prometheus text format.
     */
    public String scrape() {
        if (registry == null) {
            return "";
        }
        return registry.scrape();
    }

    @Override
    public void close() {
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close metrics binder: {}", e.getMessage());
            }
        }
        if (registry != null) {
            log.info("Closing metrics registry");
            registry.close();
        }
    }
}
