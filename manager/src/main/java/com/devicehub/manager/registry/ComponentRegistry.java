package com.devicehub.manager.registry;

import com.devicehub.manager.ManagerConfig;
import com.devicehub.manager.component.ComponentClass;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from component name to {@link ComponentClass}.
 *
 * <p>Names are unique; iteration follows registration order.</p>
 *
 * <pre>{@code
 * ComponentRegistry registry = ComponentRegistry.of(
 *     ComponentClass.of("echo", EchoComponent::new),
 *     ComponentClass.of("motor", Duration.ofSeconds(3), MotorComponent::new));
 * }</pre>
 */
public final class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<String, ComponentClass> componentClasses;

    private ComponentRegistry(Map<String, ComponentClass> componentClasses) {
        this.componentClasses = Collections.unmodifiableMap(componentClasses);
    }

    /**
     * Create a registry from component classes.
     *
     * @throws IllegalArgumentException if two classes share a name
     */
    public static ComponentRegistry of(ComponentClass... componentClasses) {
        return of(Arrays.asList(componentClasses));
    }

    /**
     * Create a registry from component classes.
     *
     * @throws IllegalArgumentException if two classes share a name
     */
    public static ComponentRegistry of(Collection<? extends ComponentClass> componentClasses) {
        Map<String, ComponentClass> byName = new LinkedHashMap<>();
        for (ComponentClass componentClass : componentClasses) {
            String name = componentClass.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Component name must not be empty: " + componentClass);
            }
            if (byName.putIfAbsent(name, componentClass) != null) {
                throw new IllegalArgumentException("Duplicate component name: " + name);
            }
        }
        return new ComponentRegistry(byName);
    }

    /**
     * Create a registry from the enabled entries of {@code devicehub.components}.
     * Entries without a startup timeout use {@code devicehub.manager.default-startup-timeout}.
     *
     * @param config the root configuration
     */
    public static ComponentRegistry fromConfig(Config config) {
        ManagerConfig managerConfig = ManagerConfig.fromConfig(config);
        List<ComponentClass> classes = new ArrayList<>();

        for (ComponentDefinition def : ComponentDefinition.loadAll(config,
                managerConfig.getDefaultStartupTimeout()).values()) {
            if (!def.isEnabled()) {
                log.info("Component {} is disabled", def.getName());
                continue;
            }
            classes.add(def.toComponentClass());
        }

        log.info("Loaded {} component classes from configuration", classes.size());
        return of(classes);
    }

    public boolean contains(String name) {
        return name != null && componentClasses.containsKey(name);
    }

    public Optional<ComponentClass> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(componentClasses.get(name));
    }

    /**
     * Get a component class by name.
     *
     * @throws IllegalArgumentException if no class has that name
     */
    public ComponentClass get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown component: " + name));
    }

    /**
     * Get the registered names in registration order.
     */
    public List<String> getNames() {
        return List.copyOf(componentClasses.keySet());
    }

    public Collection<ComponentClass> getComponentClasses() {
        return componentClasses.values();
    }

    public int size() {
        return componentClasses.size();
    }

    public boolean isEmpty() {
        return componentClasses.isEmpty();
    }

    @Override
    public String toString() {
        return "ComponentRegistry" + componentClasses.keySet();
    }
}
