package com.devicehub.manager.registry;

import com.devicehub.manager.component.ComponentClass;
import com.devicehub.manager.component.ComponentContext;
import com.devicehub.manager.component.HostedComponent;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a hosted component class parsed from configuration.
 *
 * <p>Component definitions in HOCON config look like:</p>
 * <pre>{@code
 * devicehub.components {
 *   echo {
 *     enabled = true
 *     class = "com.devicehub.apps.host.EchoComponent"
 *     startup-timeout = 5s
 *   }
 * }
 * }</pre>
 *
 * <p>The key is the component name. The class must extend {@link HostedComponent} and
 * have a public constructor taking a {@link ComponentContext}.</p>
 */
public class ComponentDefinition {

    private static final Logger log = LoggerFactory.getLogger(ComponentDefinition.class);

    public static final String PATH = "devicehub.components";

    private final String name;
    private final boolean enabled;
    private final Class<? extends HostedComponent> componentType;
    private final Duration startupTimeout;

    private ComponentDefinition(String name, boolean enabled,
                                Class<? extends HostedComponent> componentType, Duration startupTimeout) {
        this.name = name;
        this.enabled = enabled;
        this.componentType = componentType;
        this.startupTimeout = startupTimeout;
    }

    /**
     * Parse a component definition from configuration.
     *
     * @param name the component name (key in config)
     * @param config the component's configuration block
     * @param defaultStartupTimeout the timeout used when the block declares none
     * @return the parsed component definition
     */
    public static ComponentDefinition fromConfig(String name, Config config, Duration defaultStartupTimeout) {
        boolean enabled = !config.hasPath("enabled") || config.getBoolean("enabled");
        Class<? extends HostedComponent> componentType = loadComponentType(config.getString("class"));
        Duration startupTimeout = config.hasPath("startup-timeout")
                ? config.getDuration("startup-timeout") : defaultStartupTimeout;

        return new ComponentDefinition(name, enabled, componentType, startupTimeout);
    }

    /**
     * Load all component definitions from the root configuration.
     *
     * @param rootConfig the root configuration containing a {@code devicehub.components} section
     * @param defaultStartupTimeout the timeout for definitions that declare none
     * @return map of component name to definition, in configuration order
     */
    public static Map<String, ComponentDefinition> loadAll(Config rootConfig, Duration defaultStartupTimeout) {
        Map<String, ComponentDefinition> result = new LinkedHashMap<>();

        if (!rootConfig.hasPath(PATH)) {
            return result;
        }

        Config componentsConfig = rootConfig.getConfig(PATH);

        for (String name : componentsConfig.root().keySet()) {
            try {
                ComponentDefinition def = fromConfig(name, componentsConfig.getConfig(name), defaultStartupTimeout);
                result.put(name, def);
                log.debug("Loaded component definition: {} (class={})", name, def.getComponentType().getName());
            } catch (Exception e) {
                log.error("Failed to load component definition '{}': {}", name, e.getMessage());
                throw new IllegalArgumentException("Failed to load component definition: " + name, e);
            }
        }

        return result;
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends HostedComponent> loadComponentType(String className) {
        try {
            Class<?> clazz = Class.forName(className);
            if (!HostedComponent.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException(
                    "Type " + className + " does not extend " + HostedComponent.class.getSimpleName());
            }
            return (Class<? extends HostedComponent>) clazz;
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Component class not found: " + className, e);
        }
    }

    /**
     * Create the component class described by this definition.
     *
     * @throws IllegalArgumentException if the type has no public {@code (ComponentContext)} constructor
     */
    public ComponentClass toComponentClass() {
        Constructor<? extends HostedComponent> constructor;
        try {
            constructor = componentType.getConstructor(ComponentContext.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(componentType.getName()
                    + " needs a public constructor taking a ComponentContext", e);
        }

        return ComponentClass.of(name, startupTimeout, context -> {
            try {
                return constructor.newInstance(context);
            } catch (InvocationTargetException e) {
                // Surface the constructor's own failure
                Throwable cause = e.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw e;
            }
        });
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Class<? extends HostedComponent> getComponentType() {
        return componentType;
    }

    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    @Override
    public String toString() {
        return "ComponentDefinition{" +
               "name='" + name + '\'' +
               ", enabled=" + enabled +
               ", type=" + componentType.getSimpleName() +
               ", startupTimeout=" + startupTimeout +
               '}';
    }
}
