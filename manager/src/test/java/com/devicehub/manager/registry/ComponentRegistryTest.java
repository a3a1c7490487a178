package com.devicehub.manager.registry;

import com.devicehub.manager.component.ComponentClass;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentRegistryTest {

    @Test
    void lookupByName() {
        ComponentClass echo = ComponentClass.of("echo", ConfiguredComponent::new);
        ComponentClass motor = ComponentClass.of("motor", Duration.ofSeconds(3), ConfiguredComponent::new);

        ComponentRegistry registry = ComponentRegistry.of(echo, motor);

        assertEquals(2, registry.size());
        assertTrue(registry.contains("echo"));
        assertFalse(registry.contains("camera"));
        assertFalse(registry.contains(null));
        assertSame(motor, registry.get("motor"));
        assertTrue(registry.find("camera").isEmpty());
        assertEquals(List.of("echo", "motor"), registry.getNames());
        assertThrows(IllegalArgumentException.class, () -> registry.get("camera"));
    }

    @Test
    void duplicateNamesRejected() {
        assertThrows(IllegalArgumentException.class, () -> ComponentRegistry.of(
                ComponentClass.of("echo", ConfiguredComponent::new),
                ComponentClass.of("echo", ConfiguredComponent::new)));
    }

    @Test
    void blankNameRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ComponentRegistry.of(ComponentClass.of(" ", ConfiguredComponent::new)));
    }

    @Test
    void emptyRegistry() {
        ComponentRegistry registry = ComponentRegistry.of();

        assertTrue(registry.isEmpty());
        assertTrue(registry.getNames().isEmpty());
    }

    @Test
    void fromConfigSkipsDisabledAndAppliesDefaultTimeout() {
        Config root = ConfigFactory.parseString("""
            devicehub.manager.default-startup-timeout = 4s
            devicehub.components {
              echo { class = "com.devicehub.manager.registry.ConfiguredComponent" }
              motor { class = "com.devicehub.manager.registry.ConfiguredComponent", startup-timeout = 1s }
              camera { class = "com.devicehub.manager.registry.ConfiguredComponent", enabled = false }
            }
            """);

        ComponentRegistry registry = ComponentRegistry.fromConfig(root);

        assertEquals(List.of("echo", "motor"), registry.getNames());
        assertEquals(Duration.ofSeconds(4), registry.get("echo").getStartupTimeout());
        assertEquals(Duration.ofSeconds(1), registry.get("motor").getStartupTimeout());
        assertEquals("echo:10.0.0.5", registry.get("echo").getOutputChannel("10.0.0.5"));
    }
}
