package com.devicehub.apps.common;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationBaseTest {

    @TempDir
    Path tempDir;

    static class RecordingApplication extends ApplicationBase {
        final List<String> calls = new ArrayList<>();
        final List<String> configFiles;
        final boolean failInitialize;

        RecordingApplication(List<String> configFiles, boolean failInitialize) {
            this.configFiles = configFiles;
            this.failInitialize = failInitialize;
        }

        @Override
        protected List<String> getConfigFiles() {
            return configFiles;
        }

        @Override
        protected void initialize(Config config) {
            calls.add("initialize");
            if (failInitialize) {
                throw new IllegalStateException("no bus");
            }
        }

        @Override
        protected int run(Config config) {
            calls.add("run:" + config.getString("devicehub.manager.device-address"));
            assertTrue(isRunning());
            return 0;
        }

        @Override
        protected void shutdown() {
            calls.add("shutdown");
        }
    }

    @Test
    void runsLifecycleWithLoadedConfig() throws Exception {
        Path configFile = tempDir.resolve("host.conf");
        Files.writeString(configFile, "devicehub.manager.device-address = \"10.0.0.5\"\n");
        RecordingApplication app = new RecordingApplication(List.of(configFile.toString()), false);

        int exitCode = app.call();

        assertEquals(0, exitCode);
        assertEquals(List.of("initialize", "run:10.0.0.5", "shutdown"), app.calls);
        assertFalse(app.isRunning());
        assertEquals("10.0.0.5", app.getConfig().getString("devicehub.manager.device-address"));
    }

    @Test
    void initializationFailureExitsWithOne() throws Exception {
        Path configFile = tempDir.resolve("host.conf");
        Files.writeString(configFile, "devicehub.manager.device-address = \"10.0.0.5\"\n");
        RecordingApplication app = new RecordingApplication(List.of(configFile.toString()), true);

        int exitCode = app.call();

        assertEquals(1, exitCode);
        assertEquals(List.of("initialize", "shutdown"), app.calls);
    }
}
