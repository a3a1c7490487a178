package com.devicehub.metrics.binder;

import com.devicehub.bus.LocalMessageBus;
import com.devicehub.manager.ComponentManager;
import com.devicehub.manager.ManagerConfig;
import com.devicehub.manager.SingletonComponentManager;
import com.devicehub.manager.component.ComponentClass;
import com.devicehub.manager.component.ComponentContext;
import com.devicehub.manager.component.HostedComponent;
import com.devicehub.manager.message.StartComponentRequest;
import com.devicehub.manager.registry.ComponentRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ManagerMetricsBinderTest {

    private static final String DEVICE = "10.0.0.5";

    static class IdleComponent extends HostedComponent {
        IdleComponent(ComponentContext context) {
            super(context);
        }
    }

    private LocalMessageBus bus;
    private ComponentManager manager;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        bus = new LocalMessageBus("test-bus");
        registry = new SimpleMeterRegistry();
        ComponentRegistry components = ComponentRegistry.of(
                ComponentClass.of("echo", IdleComponent::new),
                ComponentClass.of("camera", context -> {
                    throw new IllegalStateException("no camera attached");
                }));
        manager = new SingletonComponentManager(components, bus, DEVICE, ManagerConfig.builder()
                .singleton(true)
                .shutdownGracePeriod(Duration.ofSeconds(1))
                .build());

        ManagerMetricsBinder binder = new ManagerMetricsBinder(manager);
        binder.bindTo(registry);
        manager.addListener(binder);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        bus.close();
        registry.close();
    }

    private double counter(String name) {
        return registry.get(name).tag("device", DEVICE).counter().count();
    }

    @Test
    void countsStartsReusesAndFailures() {
        manager.handleRequest(new StartComponentRequest("echo"));
        manager.handleRequest(new StartComponentRequest("echo"));
        manager.handleRequest(new StartComponentRequest("camera"));
        manager.handleRequest(new StartComponentRequest("lidar"));

        assertEquals(1.0, counter("devicehub.manager.components.started"));
        assertEquals(1.0, counter("devicehub.manager.components.reused"));
        assertEquals(1.0, counter("devicehub.manager.components.failed"));
        assertEquals(1.0, counter("devicehub.manager.components.ignored"));
        assertEquals(0.0, counter("devicehub.manager.components.readiness_timeouts"));
    }

    @Test
    void activeGaugeFollowsManager() {
        assertEquals(0.0, registry.get("devicehub.manager.components.active").gauge().value());

        manager.handleRequest(new StartComponentRequest("echo"));

        assertEquals(1.0, registry.get("devicehub.manager.components.active").gauge().value());
    }

    @Test
    void startupTimeRecorded() {
        manager.handleRequest(new StartComponentRequest("echo"));

        assertEquals(1, registry.get("devicehub.manager.startup.time").timer().count());
    }
}
