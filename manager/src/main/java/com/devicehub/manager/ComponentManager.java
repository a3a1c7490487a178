package com.devicehub.manager;

import com.devicehub.bus.IgnoreRequestMessage;
import com.devicehub.bus.Message;
import com.devicehub.bus.MessageBus;
import com.devicehub.bus.Request;
import com.devicehub.bus.StopRequest;
import com.devicehub.bus.Subscription;
import com.devicehub.bus.SuccessMessage;
import com.devicehub.config.ClockProvider;
import com.devicehub.manager.component.ComponentClass;
import com.devicehub.manager.component.ComponentContext;
import com.devicehub.manager.component.ComponentRuntimeInstance;
import com.devicehub.manager.component.HostedComponent;
import com.devicehub.manager.component.Signal;
import com.devicehub.manager.logging.ManagerLogging;
import com.devicehub.manager.message.NotStartedMessage;
import com.devicehub.manager.message.StartComponentRequest;
import com.devicehub.manager.message.StartedComponentInformation;
import com.devicehub.manager.registry.ComponentRegistry;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Starts components on this device when requested over the message bus.
 *
 * <p>The manager serves the bus channel named after the device address. Each request
 * gets exactly one reply:</p>
 * <ul>
 *   <li>{@link StopRequest} - sets the stop signal, replies {@link SuccessMessage}</li>
 *   <li>{@link StartComponentRequest} for a registered name - launches the component on
 *       its own thread and replies {@link StartedComponentInformation} or {@link NotStartedMessage}</li>
 *   <li>anything else - replies {@link IgnoreRequestMessage}</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ComponentManager manager = new ComponentManager(registry, bus, "10.0.0.5", ManagerConfig.defaults());
 * manager.initialize();   // start listening
 * manager.serve();        // blocks until a StopRequest arrives, then shuts down
 * }</pre>
 *
 * <p>Components are never removed individually: every started instance stays in the
 * active list until the manager shuts down.</p>
 */
public class ComponentManager {

    private final ComponentRegistry registry;
    private final MessageBus bus;
    private final String deviceAddress;
    private final ManagerConfig config;
    private final ClockProvider clock;

    /**
     * Logger named {@code <ManagerClass>-<deviceAddress>}.
     */
    protected final Logger logger;

    private final Signal stopSignal = new Signal();
    private final Signal readySignal = new Signal();
    private final AtomicReference<ManagerState> state = new AtomicReference<>(ManagerState.INITIALIZING);
    private final Object lifecycleLock = new Object();

    private final List<ComponentRuntimeInstance> activeComponents = new CopyOnWriteArrayList<>();
    private final AtomicInteger admittedComponents = new AtomicInteger();
    private final List<ManagerListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Subscription subscription;

    public ComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress,
                            ManagerConfig config, ClockProvider clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.deviceAddress = Objects.requireNonNull(deviceAddress, "deviceAddress");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = ManagerLogging.managerLogger(getClass(), deviceAddress, config.getLogLevel());
        logger.info("Manager on device {} starting", deviceAddress);
    }

    public ComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress, ManagerConfig config) {
        this(registry, bus, deviceAddress, config, ClockProvider.system());
    }

    public ComponentManager(ComponentRegistry registry, MessageBus bus, String deviceAddress) {
        this(registry, bus, deviceAddress, ManagerConfig.defaults(), ClockProvider.system());
    }

    // ==================== Lifecycle ====================

    /**
     * Register the request handler on the device channel.
     * Transitions from INITIALIZING to READY.
     *
     * @throws IllegalStateException if not in INITIALIZING state
     */
    public void initialize() {
        synchronized (lifecycleLock) {
            ManagerState current = state.get();
            if (!current.canTransitionTo(ManagerState.READY)) {
                throw new IllegalStateException("Cannot initialize from state: " + current);
            }
            subscription = bus.registerRequestHandler(deviceAddress, (channel, request) -> handleRequest(request));
            state.set(ManagerState.READY);
        }

        logger.info("{} on {} hosting components: {}",
                getClass().getSimpleName(), deviceAddress, registry.getNames());
        readySignal.set();
    }

    /**
     * Listen for requests until the manager is asked to stop, then shut down.
     *
     * <p>The stop signal is polled with {@link ManagerConfig#getPollInterval()} so the
     * calling thread stays responsive to interruption; an interrupt also shuts down.</p>
     */
    public void serve() {
        if (state.get() == ManagerState.INITIALIZING) {
            initialize();
        }
        synchronized (lifecycleLock) {
            ManagerState current = state.get();
            if (!current.canTransitionTo(ManagerState.SERVING)) {
                throw new IllegalStateException("Cannot serve from state: " + current);
            }
            state.set(ManagerState.SERVING);
        }

        logger.debug("Serving requests on channel {}", deviceAddress);
        try {
            while (!stopSignal.await(config.getPollInterval())) {
                // poll until stop is requested
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Interrupted while serving, shutting down");
        }

        shutdown();
        logger.info("Stopped component manager");
    }

    /**
     * Stop serving requests and ask all active components to stop.
     *
     * <p>Waits up to {@link ManagerConfig#getShutdownGracePeriod()} in total for the
     * component threads to terminate. Threads still running afterwards are abandoned
     * (logged, not killed). Failures are logged and never thrown. Calling this more
     * than once has no further effect.</p>
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            ManagerState current = state.get();
            if (!current.canTransitionTo(ManagerState.SHUTTING_DOWN)) {
                logger.debug("Shutdown ignored in state {}", current);
                return;
            }
            state.set(ManagerState.SHUTTING_DOWN);
        }
        stopSignal.set();

        logger.info("Trying to exit manager gracefully...");

        List<ComponentRuntimeInstance> instances = List.copyOf(activeComponents);
        List<String> abandoned = new ArrayList<>();
        try {
            closeSubscription();

            for (ComponentRuntimeInstance instance : instances) {
                instance.requestStop();
            }

            long deadline = clock.nanoTime() + config.getShutdownGracePeriod().toNanos();
            for (ComponentRuntimeInstance instance : instances) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - clock.nanoTime()));
                if (!joinQuietly(instance, remaining)) {
                    abandoned.add(instance.getComponentName());
                }
            }
        } catch (Exception e) {
            logger.error("Graceful exit has failed", e);
        } finally {
            state.set(ManagerState.STOPPED);
        }

        if (abandoned.isEmpty()) {
            logger.info("Graceful exit was successful ({} components stopped)", instances.size());
        } else {
            logger.warn("Abandoned {} components that did not stop within {}ms: {}",
                    abandoned.size(), config.getShutdownGracePeriod().toMillis(), abandoned);
        }

        int stopped = instances.size() - abandoned.size();
        notifyListeners(l -> l.onShutdown(stopped, abandoned.size()));
    }

    // ==================== Request Handling ====================

    /**
     * Handle one request received on the device channel. Never throws.
     *
     * @param request the request
     * @return the reply
     */
    public Message handleRequest(Request request) {
        if (request instanceof StopRequest) {
            logger.info("Stop requested");
            stopSignal.set();
            // A request must always be replied to, even one that stops the manager
            return new SuccessMessage();
        }

        if (!state.get().isAcceptingRequests()) {
            logger.info("{} ignored request {} while {}", getClass().getSimpleName(), request, state.get());
            notifyListeners(l -> l.onRequestIgnored(request));
            return new IgnoreRequestMessage();
        }

        if (request instanceof StartComponentRequest start && registry.contains(start.getComponentName())) {
            logger.info("{} handling request {}", getClass().getSimpleName(), start.getComponentName());
            try {
                return startComponent(start).toReply();
            } catch (RuntimeException | LinkageError e) {
                logger.error("Unexpected failure starting {}", start.getComponentName(), e);
                notifyListeners(l -> l.onComponentNotStarted(start.getComponentName(), e));
                return new NotStartedMessage(e);
            }
        }

        logger.info("{} ignored request {}", getClass().getSimpleName(), request);
        notifyListeners(l -> l.onRequestIgnored(request));
        return new IgnoreRequestMessage();
    }

    /**
     * Launch a new instance of the requested component and wait for it to become ready.
     *
     * <p>The output channel is {@link ComponentClass#getOutputChannel(String)} for this
     * device. If the component misses its startup timeout, the configured
     * {@link ReadinessTimeoutPolicy} decides between keeping it (WARN) and failing
     * the start (FAIL).</p>
     *
     * @param request the start request
     * @return STARTED with the output channel, FAILED with the cause, or IGNORED if the
     *         component is unknown or the manager is shutting down
     */
    public StartOutcome startComponent(StartComponentRequest request) {
        ComponentClass componentClass = registry.find(request.getComponentName()).orElse(null);
        if (componentClass == null || !state.get().isAcceptingRequests()) {
            return StartOutcome.ignored();
        }

        String name = componentClass.getName();
        String outputChannel = componentClass.getOutputChannel(deviceAddress);

        if (!admit()) {
            AdmissionRejectedException rejected = new AdmissionRejectedException(name, config.getMaxActiveComponents());
            logger.warn(rejected.getMessage());
            return notStarted(name, rejected);
        }

        long startNanos = clock.nanoTime();
        ComponentRuntimeInstance instance;
        try {
            instance = launch(componentClass, outputChannel, request);
        } catch (Exception | LinkageError e) {
            // LinkageError covers components whose native or static initialization fails
            admittedComponents.decrementAndGet();
            logger.warn("Component {} failed to start: {}", name, e.toString());
            return notStarted(name, e);
        }

        Duration timeout = componentClass.getStartupTimeout();
        if (!awaitReady(instance, timeout)) {
            logger.error("Component {} refused to start within {}ms!", name, timeout.toMillis());
            notifyListeners(l -> l.onReadinessTimeout(instance));

            if (config.getReadinessTimeoutPolicy() == ReadinessTimeoutPolicy.FAIL) {
                instance.requestStop();
                admittedComponents.decrementAndGet();
                return notStarted(name, new ComponentStartTimeoutException(name, timeout));
            }
        }

        synchronized (lifecycleLock) {
            if (!state.get().isAcceptingRequests()) {
                // Shutdown began while this component was starting; it would never be stopped
                instance.requestStop();
                admittedComponents.decrementAndGet();
                return notStarted(name, new ComponentStartException(name, "Manager is shutting down"));
            }
            activeComponents.add(instance);
        }

        Duration startupTime = clock.elapsedSince(startNanos);
        logger.info("Started component {} on {} in {}ms", name, outputChannel, startupTime.toMillis());
        notifyListeners(l -> l.onComponentStarted(instance, startupTime));

        return StartOutcome.started(new StartedComponentInformation(outputChannel));
    }

    /**
     * Create the component and start its thread.
     */
    private ComponentRuntimeInstance launch(ComponentClass componentClass, String outputChannel,
                                            StartComponentRequest request) throws Exception {
        Signal componentStop = new Signal();
        Signal componentReady = new Signal();
        ComponentContext context = new ComponentContext(componentClass.getName(), deviceAddress, outputChannel,
                componentStop, componentReady, request.getLogLevel(), request.getConf(), bus);

        HostedComponent component = componentClass.create(context);
        if (component == null) {
            throw new ComponentStartException(componentClass.getName(), "Factory returned no component");
        }

        Thread thread = new Thread(component, componentClass.getName());
        // Abandoned components must not keep the JVM alive
        thread.setDaemon(true);
        try {
            thread.start();
        } catch (OutOfMemoryError e) {
            componentStop.set();
            throw new ComponentStartException(componentClass.getName(), "Could not create component thread", e);
        }

        return new ComponentRuntimeInstance(componentClass.getName(), outputChannel,
                componentStop, componentReady, thread, clock.instant(), component);
    }

    private boolean admit() {
        int max = config.getMaxActiveComponents();
        if (max <= 0) {
            admittedComponents.incrementAndGet();
            return true;
        }
        while (true) {
            int current = admittedComponents.get();
            if (current >= max) {
                return false;
            }
            if (admittedComponents.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private boolean awaitReady(ComponentRuntimeInstance instance, Duration timeout) {
        try {
            return instance.awaitReady(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return instance.isReady();
        }
    }

    private StartOutcome notStarted(String componentName, Throwable cause) {
        notifyListeners(l -> l.onComponentNotStarted(componentName, cause));
        return StartOutcome.failed(cause);
    }

    private boolean joinQuietly(ComponentRuntimeInstance instance, Duration timeout) {
        try {
            if (instance.join(timeout)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.warn("Component {} did not stop in time, abandoning it", instance.getComponentName());
        return false;
    }

    private void closeSubscription() {
        Subscription current = subscription;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (Exception e) {
            logger.error("Failed to close bus subscription on {}", current.getChannel(), e);
        }
    }

    // ==================== Listeners ====================

    public void addListener(ManagerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ManagerListener listener) {
        listeners.remove(listener);
    }

    /**
     * Invoke a callback on every listener, logging listener failures.
     */
    protected void notifyListeners(Consumer<ManagerListener> callback) {
        for (ManagerListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                logger.error("Error notifying manager listener", e);
            }
        }
    }

    // ==================== Accessors ====================

    public ManagerState getState() {
        return state.get();
    }

    public boolean isStopRequested() {
        return stopSignal.isSet();
    }

    /**
     * Wait until the manager is listening for requests.
     *
     * @return true if ready within the timeout
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return readySignal.await(timeout);
    }

    /**
     * Get a snapshot of the active components, in start order.
     */
    public List<ComponentRuntimeInstance> getActiveComponents() {
        return List.copyOf(activeComponents);
    }

    public int getActiveComponentCount() {
        return activeComponents.size();
    }

    public ComponentRegistry getRegistry() {
        return registry;
    }

    public String getDeviceAddress() {
        return deviceAddress;
    }

    public ManagerConfig getConfig() {
        return config;
    }

    public MessageBus getBus() {
        return bus;
    }
}
