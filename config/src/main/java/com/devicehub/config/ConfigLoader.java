package com.devicehub.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Arrays;
import java.util.List;

/**
 * Loads and merges configuration from multiple sources.
 *
 * <p>Configuration is loaded in the following order (later sources override earlier):
 * <ol>
 *   <li>reference.conf (from classpath - defaults)</li>
 *   <li>application.conf (from classpath)</li>
 *   <li>Config files specified via {@link #load(String...)} or {@link #load(List)}</li>
 *   <li>System properties</li>
 *   <li>Environment variables</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Config config = ConfigLoader.load("device.conf", "components.conf");
 * ManagerConfig managerConfig = ManagerConfig.fromConfig(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Load configuration with additional config files.
     * Files are loaded in order, with later files overriding earlier ones.
     *
     * @param configFiles paths to config files
     * @return merged configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load configuration with additional config files.
     *
     * <p>Each path is looked up on the file system first, then on the classpath.
     * Paths found in neither place are skipped with a warning.</p>
     *
     * @param configFiles list of paths to config files
     * @return merged configuration
     * @throws ConfigurationException if a file cannot be parsed
     */
    public static Config load(List<String> configFiles) {
        Config config = ConfigFactory.defaultReference();
        config = ConfigFactory.defaultApplication().withFallback(config);

        // Later files override earlier ones
        for (String filePath : configFiles) {
            Config fileConfig = loadConfigFile(filePath);
            if (fileConfig != null) {
                config = fileConfig.withFallback(config);
                log.info("Loaded config file: {}", filePath);
            }
        }

        config = ConfigFactory.systemProperties().withFallback(config);
        config = ConfigFactory.systemEnvironment().withFallback(config);
        return config.resolve();
    }

    private static Config loadConfigFile(String path) {
        File file = new File(path);
        if (file.exists()) {
            try {
                return ConfigFactory.parseFile(file, ConfigParseOptions.defaults());
            } catch (Exception e) {
                log.error("Failed to parse config file: {}", path, e);
                throw new ConfigurationException("Failed to parse config file: " + path, e);
            }
        }

        Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
        if (!classpathConfig.isEmpty()) {
            return classpathConfig;
        }
        log.warn("Config file not found: {}", path);
        return null;
    }

    /**
     * Exception thrown when configuration loading fails.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
