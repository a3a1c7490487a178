package com.devicehub.apps.host;

import com.devicehub.bus.Message;
import com.devicehub.bus.SuccessMessage;
import com.devicehub.manager.ComponentManagerClient;
import com.devicehub.manager.ManagerState;
import com.devicehub.manager.SingletonComponentManager;
import com.devicehub.manager.message.StartedComponentInformation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ComponentHostAppTest {

    private static final String DEVICE = "10.0.0.5";

    @TempDir
    Path tempDir;

    private Path writeTestConfig() throws Exception {
        Path configFile = tempDir.resolve("test-host.conf");
        Files.writeString(configFile, """
            devicehub.manager {
              poll-interval = 20ms
              shutdown-grace-period = 1s
            }
            devicehub.metrics.include-jvm = false
            """);
        return configFile;
    }

    @Test
    void servesEchoUntilStopRequested() throws Exception {
        ComponentHostApp app = new ComponentHostApp();
        new CommandLine(app).parseArgs(
                "-c", "component-host.conf",
                "-c", writeTestConfig().toString(),
                "-a", DEVICE,
                "--singleton");

        AtomicInteger exitCode = new AtomicInteger(-1);
        Thread hostThread = new Thread(() -> {
            try {
                exitCode.set(app.call());
            } catch (Exception e) {
                exitCode.set(99);
            }
        }, "component-host");
        hostThread.start();

        try {
            assertTrue(app.awaitReady(Duration.ofSeconds(5)));
            assertInstanceOf(SingletonComponentManager.class, app.getManager());

            ComponentManagerClient client = new ComponentManagerClient(app.getBus(), Duration.ofSeconds(5));
            StartedComponentInformation info = client.startComponent(DEVICE, "echo");
            assertEquals("echo:" + DEVICE, info.getOutputChannel());
            assertTrue(info.isSingleton());

            List<Message> echoed = new CopyOnWriteArrayList<>();
            CountDownLatch received = new CountDownLatch(1);
            app.getBus().subscribe(info.getOutputChannel(), message -> {
                echoed.add(message);
                received.countDown();
            });

            SuccessMessage ping = new SuccessMessage();
            app.getBus().publish(EchoComponent.inputChannel(info.getOutputChannel()), ping);

            assertTrue(received.await(2, TimeUnit.SECONDS));
            assertSame(ping, echoed.get(0));
            assertTrue(app.getMetrics().scrape().contains("devicehub_manager_components_started_total"));

            assertTrue(client.requestStop(DEVICE));
        } finally {
            hostThread.join(5000);
        }

        assertFalse(hostThread.isAlive());
        assertEquals(0, exitCode.get());
        assertEquals(ManagerState.STOPPED, app.getManager().getState());
    }

    @Test
    void invalidComponentConfigurationExitsWithOne() throws Exception {
        Path configFile = tempDir.resolve("broken.conf");
        Files.writeString(configFile, "devicehub.components.camera.class = \"com.example.MissingCamera\"\n");

        ComponentHostApp app = new ComponentHostApp();
        new CommandLine(app).parseArgs("-c", configFile.toString(), "-a", DEVICE);

        assertEquals(1, app.call());
    }

    @Test
    void helpOptionIsAvailable() {
        CommandLine commandLine = new CommandLine(new ComponentHostApp());

        assertEquals("component-host", commandLine.getCommandName());
        assertTrue(commandLine.getUsageMessage().contains("--device-address"));
        assertTrue(commandLine.getUsageMessage().contains("--singleton"));
    }
}
