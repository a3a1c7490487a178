package com.devicehub.manager.component;

import com.devicehub.bus.Message;
import com.devicehub.manager.logging.ManagerLogging;
import org.slf4j.Logger;

/**
 * Base class for components run by a component manager.
 *
 * <p>The manager runs each instance on its own thread. {@link #run()} drives the
 * component through its life:</p>
 * <ol>
 *   <li>{@link #startUp()} - acquire resources, subscribe to inputs</li>
 *   <li>the ready signal is set</li>
 *   <li>{@link #runUntilStopped()} - by default blocks until the stop signal is set</li>
 *   <li>{@link #shutDown()} - always called, also after a failure</li>
 * </ol>
 *
 * <p>Subclasses must expose a public constructor taking a {@link ComponentContext} to be
 * loadable from configuration.</p>
 */
public abstract class HostedComponent implements Runnable {

    private final ComponentContext context;

    /**
     * Logger named {@code <componentName>-<deviceAddress>} at the requested level.
     */
    protected final Logger logger;

    protected HostedComponent(ComponentContext context) {
        this.context = context;
        this.logger = ManagerLogging.componentLogger(
                context.getComponentName(), context.getDeviceAddress(), context.getLogLevel());
    }

    @Override
    public final void run() {
        String name = getName();
        try {
            startUp();
            context.getReadySignal().set();
            logger.info("[{}] Ready, output channel {}", name, context.getOutputChannel());
            runUntilStopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[{}] Interrupted", name);
        } catch (Exception e) {
            logger.error("[{}] Component failed", name, e);
        } finally {
            try {
                shutDown();
            } catch (Exception e) {
                logger.error("[{}] Error during shutdown", name, e);
            }
            logger.info("[{}] Stopped", name);
        }
    }

    /**
     * Prepare the component. The ready signal is set when this returns normally.
     *
     * @throws Exception if the component cannot start; the ready signal is then never set
     */
    protected void startUp() throws Exception {
    }

    /**
     * Do the component's work until it is asked to stop.
     * The default implementation waits for the stop signal.
     *
     * @throws Exception if the work fails
     */
    protected void runUntilStopped() throws Exception {
        context.getStopSignal().await();
    }

    /**
     * Release the component's resources.
     *
     * @throws Exception if cleanup fails
     */
    protected void shutDown() throws Exception {
    }

    /**
     * Publish a message on this component's output channel.
     */
    protected void publish(Message message) {
        context.getBus().publish(context.getOutputChannel(), message);
    }

    public boolean isStopRequested() {
        return context.getStopSignal().isSet();
    }

    public String getName() {
        return context.getComponentName();
    }

    public ComponentContext getContext() {
        return context;
    }
}
