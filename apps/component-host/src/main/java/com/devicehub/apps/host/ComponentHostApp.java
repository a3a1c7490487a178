package com.devicehub.apps.host;

import com.devicehub.apps.common.ApplicationBase;
import com.devicehub.bus.BusException;
import com.devicehub.bus.LocalMessageBus;
import com.devicehub.bus.MessageBus;
import com.devicehub.manager.ComponentManager;
import com.devicehub.manager.ComponentManagerClient;
import com.devicehub.manager.ManagerConfig;
import com.devicehub.manager.SingletonComponentManager;
import com.devicehub.manager.address.DeviceAddressResolver;
import com.devicehub.manager.registry.ComponentRegistry;
import com.devicehub.metrics.ManagerMetrics;
import com.devicehub.metrics.MetricsConfig;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hosts the configured components of one device.
 * <p>
 * Starts a component manager listening on the device address and serves start
 * requests until a stop request arrives or the process is interrupted.
 */
@Command(name = "component-host", mixinStandardHelpOptions = true,
         description = "Hosts device components started over the message bus")
public class ComponentHostApp extends ApplicationBase {

    private static final Logger log = LoggerFactory.getLogger(ComponentHostApp.class);

    @Option(names = {"-c", "--config"}, description = "Configuration files (default: component-host.conf)")
    private List<String> configFiles = new ArrayList<>(List.of("component-host.conf"));

    @Option(names = {"-a", "--device-address"}, description = "Device address (default: detected from the network)")
    private String deviceAddress;

    @Option(names = {"--singleton"}, description = "Share one instance of each component among requesters")
    private boolean singleton;

    @Option(names = {"--log-level"}, description = "Log level for devicehub loggers (ERROR, WARN, INFO, DEBUG)")
    private String logLevel;

    private final CountDownLatch ready = new CountDownLatch(1);

    private MessageBus bus;
    private ComponentManager manager;
    private ManagerMetrics metrics;
    private ManagerConfig managerConfig;

    @Override
    protected List<String> getConfigFiles() {
        return configFiles;
    }

    @Override
    protected void initialize(Config config) throws Exception {
        if (logLevel != null) {
            setLogLevel(logLevel);
        }

        managerConfig = applyOptions(ManagerConfig.fromConfig(config));
        String address = DeviceAddressResolver.fromConfig(managerConfig).resolve();
        ComponentRegistry registry = ComponentRegistry.fromConfig(config);
        if (registry.isEmpty()) {
            log.warn("No components configured under devicehub.components");
        }

        bus = new LocalMessageBus("bus-" + address);
        manager = managerConfig.isSingleton()
                ? new SingletonComponentManager(registry, bus, address, managerConfig)
                : new ComponentManager(registry, bus, address, managerConfig);

        metrics = ManagerMetrics.create(MetricsConfig.fromConfig(config));
        metrics.bind(manager);

        manager.initialize();
        ready.countDown();
    }

    private ManagerConfig applyOptions(ManagerConfig fromConfig) {
        ManagerConfig.Builder builder = fromConfig.toBuilder();
        if (deviceAddress != null) {
            builder.deviceAddress(deviceAddress);
        }
        if (singleton) {
            builder.singleton(true);
        }
        if (logLevel != null) {
            builder.logLevel(Level.valueOf(logLevel.toUpperCase()));
        }
        return builder.build();
    }

    @Override
    protected int run(Config config) {
        logStartupInfo();
        manager.serve();
        return 0;
    }

    private void logStartupInfo() {
        log.info("======================================================");
        log.info("  Component Host Started");
        log.info("======================================================");
        log.info("Device address: {}", manager.getDeviceAddress());
        log.info("Manager: {}", manager.getClass().getSimpleName());
        for (String name : manager.getRegistry().getNames()) {
            log.info("  - {} -> {}", name,
                    manager.getRegistry().get(name).getOutputChannel(manager.getDeviceAddress()));
        }
        log.info("Metrics: {}", metrics.isEnabled() ? "enabled" : "disabled");
        log.info("======================================================");
    }

    @Override
    protected void onShutdownSignal() {
        ComponentManager current = manager;
        if (current == null || !current.getState().isAcceptingRequests()) {
            return;
        }

        // Stop through the bus so the serve loop exits the same way as for a remote stop
        try {
            new ComponentManagerClient(bus, Duration.ofSeconds(2)).requestStop(current.getDeviceAddress());
        } catch (BusException e) {
            log.warn("Stop request failed, shutting down directly: {}", e.getMessage());
            current.shutdown();
        }
    }

    @Override
    protected Duration getShutdownTimeout() {
        Duration grace = managerConfig != null
                ? managerConfig.getShutdownGracePeriod() : ManagerConfig.defaults().getShutdownGracePeriod();
        return grace.plusSeconds(5);
    }

    @Override
    protected void shutdown() {
        if (manager != null) {
            manager.shutdown();
        }
        if (metrics != null) {
            metrics.close();
        }
        if (bus != null) {
            bus.close();
        }
    }

    /**
     * Wait until the manager listens for requests.
     *
     * @return true if ready within the timeout
     */
    boolean awaitReady(Duration timeout) throws InterruptedException {
        return ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    ComponentManager getManager() {
        return manager;
    }

    MessageBus getBus() {
        return bus;
    }

    ManagerMetrics getMetrics() {
        return metrics;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ComponentHostApp()).execute(args);
        System.exit(exitCode);
    }
}
