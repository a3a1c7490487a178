package com.devicehub.manager;

import com.devicehub.bus.MessageBus;
import com.devicehub.config.ClockProvider;
import com.devicehub.manager.message.StartComponentRequest;
import com.devicehub.manager.message.StartedComponentInformation;
import com.devicehub.manager.registry.ComponentRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link ComponentManager} that runs at most one instance of each component.
 *
 * <p>The first successful start of a component is cached; later start requests for the
 * same name are answered from the cache without launching anything, so every requester
 * connects to the same output channel. Replies are distinct copies flagged as
 * singleton. Failed starts are not cached and the next request tries again.</p>
 *
 * <p>The cache belongs to this manager instance. Concurrent first requests for one name
 * are serialized so that only one instance is launched.</p>
 */
public class SingletonComponentManager extends ComponentManager {

    private final Map<String, StartedComponentInformation> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> startLocks = new ConcurrentHashMap<>();

    public SingletonComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress,
                                     ManagerConfig config, ClockProvider clock) {
        super(registry, bus, deviceAddress, config, clock);
    }

    public SingletonComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress,
                                     ManagerConfig config) {
        this(registry, bus, deviceAddress, config, ClockProvider.system());
    }

    public SingletonComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress) {
        this(registry, bus, deviceAddress, ManagerConfig.defaults(), ClockProvider.system());
    }

    @Override
    public StartOutcome startComponent(StartComponentRequest request) {
        String name = request.getComponentName();
        if (!getRegistry().contains(name) || !getState().isAcceptingRequests()) {
            return StartOutcome.ignored();
        }

        Object lock = startLocks.computeIfAbsent(name, k -> new Object());
        synchronized (lock) {
            StartedComponentInformation cached = cache.get(name);
            if (cached != null) {
                logger.info("Reusing existing component {}", name);
                notifyListeners(l -> l.onComponentReused(name));
                return StartOutcome.started(cached.copy());
            }

            logger.info("Starting new component {}", name);
            StartOutcome outcome = super.startComponent(request);
            if (outcome instanceof StartOutcome.Started started) {
                StartedComponentInformation information = started.information();
                information.setSingleton(true);
                cache.put(name, information);
                return StartOutcome.started(information.copy());
            }
            return outcome;
        }
    }

    /**
     * Check whether a component has a cached running instance.
     */
    public boolean isCached(String componentName) {
        return cache.containsKey(componentName);
    }

    /**
     * Get a snapshot of the cached replies by component name.
     */
    public Map<String, StartedComponentInformation> getCachedComponents() {
        return Map.copyOf(cache);
    }
}
