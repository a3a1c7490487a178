package com.devicehub.manager.component;

/**
 * Factory for creating {@link HostedComponent} instances.
 *
 * <p>Example:</p>
 * <pre>{@code
 * ComponentFactory factory = EchoComponent::new;
 * ComponentClass echo = ComponentClass.of("echo", Duration.ofSeconds(5), factory);
 * }</pre>
 */
@FunctionalInterface
public interface ComponentFactory {

    /**
     * Create a component bound to the given context. The component must not start
     * any work here; it runs once the manager hands it to its own thread.
     *
     * @param context the launch context
     * @return the created component
     * @throws Exception if creation fails
     */
    HostedComponent create(ComponentContext context) throws Exception;
}
