package com.devicehub.metrics.binder;

import com.devicehub.bus.Request;
import com.devicehub.manager.ComponentManager;
import com.devicehub.manager.ManagerListener;
import com.devicehub.manager.component.ComponentRuntimeInstance;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Registers component manager counters, the active component gauge and the startup timer.
 * All meters are tagged with the device address.
 */
public class ManagerMetricsBinder implements MeterBinder, ManagerListener {

    private static final Logger log = LoggerFactory.getLogger(ManagerMetricsBinder.class);

    private final ComponentManager manager;
    private final Tags tags;

    private Counter startedCounter;
    private Counter reusedCounter;
    private Counter ignoredCounter;
    private Counter failedCounter;
    private Counter readinessTimeoutCounter;
    private Timer startupTimer;

    public ManagerMetricsBinder(ComponentManager manager) {
        this.manager = manager;
        this.tags = Tags.of("device", manager.getDeviceAddress());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        startedCounter = Counter.builder("devicehub.manager.components.started")
                .description("Component instances launched")
                .tags(tags)
                .register(registry);

        reusedCounter = Counter.builder("devicehub.manager.components.reused")
                .description("Start requests answered by a running singleton")
                .tags(tags)
                .register(registry);

        ignoredCounter = Counter.builder("devicehub.manager.components.ignored")
                .description("Requests ignored")
                .tags(tags)
                .register(registry);

        failedCounter = Counter.builder("devicehub.manager.components.failed")
                .description("Start requests answered with not-started")
                .tags(tags)
                .register(registry);

        readinessTimeoutCounter = Counter.builder("devicehub.manager.components.readiness_timeouts")
                .description("Components that missed their startup timeout")
                .tags(tags)
                .register(registry);

        Gauge.builder("devicehub.manager.components.active", manager, ComponentManager::getActiveComponentCount)
                .description("Active component instances")
                .tags(tags)
                .register(registry);

        startupTimer = Timer.builder("devicehub.manager.startup.time")
                .description("Time from launch until a component is registered as active")
                .tags(tags)
                .register(registry);

        log.info("Registered manager metrics for device {}", manager.getDeviceAddress());
    }

    @Override
    public void onComponentStarted(ComponentRuntimeInstance instance, Duration startupTime) {
        if (startedCounter != null) {
            startedCounter.increment();
            startupTimer.record(startupTime);
        }
    }

    @Override
    public void onComponentReused(String componentName) {
        if (reusedCounter != null) {
            reusedCounter.increment();
        }
    }

    @Override
    public void onComponentNotStarted(String componentName, Throwable cause) {
        if (failedCounter != null) {
            failedCounter.increment();
        }
    }

    @Override
    public void onReadinessTimeout(ComponentRuntimeInstance instance) {
        if (readinessTimeoutCounter != null) {
            readinessTimeoutCounter.increment();
        }
    }

    @Override
    public void onRequestIgnored(Request request) {
        if (ignoredCounter != null) {
            ignoredCounter.increment();
        }
    }
}
