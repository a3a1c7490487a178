package com.devicehub.apps.common;

import ch.qos.logback.classic.Level;
import com.devicehub.config.ConfigLoader;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Base class for applications providing common initialization and lifecycle management.
 *
 * <p>Subclasses should:</p>
 * <ul>
 *   <li>Define command-line options using picocli annotations</li>
 *   <li>Implement {@link #getConfigFiles()} to return config file paths</li>
 *   <li>Build their services in {@link #initialize(Config)}</li>
 *   <li>Block in {@link #run(Config)} until the application should exit</li>
 *   <li>Release resources in {@link #shutdown()}</li>
 * </ul>
 *
 * <p>A JVM shutdown hook calls {@link #onShutdownSignal()} and then waits up to
 * {@link #getShutdownTimeout()} for {@link #run(Config)} to return and
 * {@link #shutdown()} to complete.</p>
 */
public abstract class ApplicationBase implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ApplicationBase.class);

    protected Config config;
    protected volatile boolean running = true;

    private final CountDownLatch terminated = new CountDownLatch(1);

    @Override
    public Integer call() throws Exception {
        try {
            // Load configuration
            List<String> configFiles = getConfigFiles();
            log.info("Loading configuration from: {}", configFiles);
            config = ConfigLoader.load(configFiles);

            initialize(config);

            // Register shutdown hook
            Runtime.getRuntime().addShutdownHook(new Thread(this::handleShutdownSignal, "shutdown-hook"));

            return run(config);

        } catch (Exception e) {
            log.error("Error in application", e);
            return 1;
        } finally {
            running = false;
            shutdown();
            terminated.countDown();
        }
    }

    private void handleShutdownSignal() {
        log.info("Shutdown signal received");
        running = false;
        try {
            onShutdownSignal();
        } catch (Exception e) {
            log.warn("Error handling shutdown signal: {}", e.getMessage());
        }

        try {
            if (!terminated.await(getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Application did not terminate within {}ms", getShutdownTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the list of configuration files to load.
     *
     * @return list of config file paths
     */
    protected abstract List<String> getConfigFiles();

    /**
     * Create the application's services from the loaded configuration.
     *
     * @param config the merged configuration
     * @throws Exception if the application cannot start
     */
    protected void initialize(Config config) throws Exception {
        // Override in subclasses
    }

    /**
     * Run the application logic. Returns when the application should exit.
     *
     * @param config the merged configuration
     * @return exit code (0 for success)
     * @throws Exception if an error occurs
     */
    protected abstract int run(Config config) throws Exception;

    /**
     * Called from the JVM shutdown hook. Should make {@link #run(Config)} return.
     */
    protected void onShutdownSignal() throws Exception {
        // Override in subclasses
    }

    /**
     * How long the shutdown hook waits for the application to terminate.
     */
    protected Duration getShutdownTimeout() {
        return Duration.ofSeconds(10);
    }

    /**
     * Shutdown the application and release resources.
     * Called once when {@link #call()} completes, also after a failure.
     */
    protected void shutdown() {
        // Override in subclasses
    }

    /**
     * Set the log level for the devicehub packages.
     *
     * @param level the log level (e.g., "ERROR", "WARN", "INFO", "DEBUG")
     */
    protected void setLogLevel(String level) {
        ch.qos.logback.classic.Logger logger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.devicehub");
        logger.setLevel(Level.toLevel(level));
    }

    /**
     * Check if the application is still running.
     */
    protected boolean isRunning() {
        return running;
    }

    /**
     * Get the loaded configuration, available once {@link #call()} has loaded it.
     */
    protected Config getConfig() {
        return config;
    }
}
