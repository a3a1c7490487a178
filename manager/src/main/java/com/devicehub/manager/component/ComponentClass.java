package com.devicehub.manager.component;

import java.time.Duration;
import java.util.Objects;

/**
 * A kind of component a manager can host, identified by a unique name.
 *
 * <p>The output channel of a component is derived only from its class and the device
 * address, so a requester can compute it independently of the manager.</p>
 */
public interface ComponentClass {

    /**
     * Startup timeout used when a class does not declare one.
     */
    Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Get the unique component name.
     */
    String getName();

    /**
     * Get how long the manager waits for a new instance to become ready.
     */
    default Duration getStartupTimeout() {
        return DEFAULT_STARTUP_TIMEOUT;
    }

    /**
     * Get the channel an instance of this class publishes to on the given device.
     *
     * @param deviceAddress the network address of the device
     * @return {@code <name>:<deviceAddress>}
     */
    default String getOutputChannel(String deviceAddress) {
        return getName() + ":" + deviceAddress;
    }

    /**
     * Create a new, not yet running, component instance.
     *
     * @param context the launch context
     * @return the component
     * @throws Exception if the component cannot be constructed
     */
    HostedComponent create(ComponentContext context) throws Exception;

    /**
     * Create a component class from a name, timeout and factory.
     */
    static ComponentClass of(String name, Duration startupTimeout, ComponentFactory factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(factory, "factory");
        return new ComponentClass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Duration getStartupTimeout() {
                return startupTimeout;
            }

            @Override
            public HostedComponent create(ComponentContext context) throws Exception {
                return factory.create(context);
            }

            @Override
            public String toString() {
                return "ComponentClass{name='" + name + "', startupTimeout=" + startupTimeout + "}";
            }
        };
    }

    /**
     * Create a component class with the default startup timeout.
     */
    static ComponentClass of(String name, ComponentFactory factory) {
        return of(name, DEFAULT_STARTUP_TIMEOUT, factory);
    }
}
