package org.conclave.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the node configuration from its layered sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dconclave.manager.stop-timeout=5s})</li>
 *   <li>Environment variables prefixed with {@code CONCLAVE_}, mapped the way Typesafe Config maps
 *       environment overrides: {@code _} becomes {@code .}, {@code __} becomes {@code -} and
 *       {@code ___} becomes {@code _}. {@code CONCLAVE_BUS_LANES_NORMAL=50} sets
 *       {@code conclave.bus.lanes.normal}, {@code CONCLAVE_MANAGER_STOP__TIMEOUT=5s} sets
 *       {@code conclave.manager.stop-timeout}</li>
 *   <li>The configuration file given on the command line, or {@code conclave.conf} in the
 *       working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE = "conclave.conf";
    static final String ENV_PREFIX = "CONCLAVE_";
    private static final String ROOT_PREFIX = "conclave.";

    private ConfigLoader() {
        // static helper
    }

    /**
     * Loads the configuration using {@code conclave.conf} in the working directory if present.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile File given by the user, or {@code null} for the default file.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly given file does not exist.
     */
    public static Config load(File explicitFile) {
        return load(explicitFile, System.getenv());
    }

    static Config load(File explicitFile, Map<String, String> environment) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            File defaultFile = new File(DEFAULT_CONFIG_FILE);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("No '{}' in the working directory, using defaults", DEFAULT_CONFIG_FILE);
                fileConfig = ConfigFactory.empty();
            }
        }

        return ConfigFactory.systemProperties()
                .withFallback(environmentConfig(environment))
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    static Config environmentConfig(Map<String, String> environment) {
        Map<String, Object> mapped = new HashMap<>();
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (!entry.getKey().startsWith(ENV_PREFIX)) {
                continue;
            }
            String key = toPath(entry.getKey());
            if (key == null || !key.startsWith(ROOT_PREFIX) || key.endsWith(".")) {
                LOG.debug("Ignoring environment variable '{}': not a configuration path", entry.getKey());
                continue;
            }
            mapped.put(key, entry.getValue());
        }
        return ConfigFactory.parseMap(mapped, "environment variables");
    }

    /**
     * @return The configuration path for an environment variable name, or {@code null} for a run
     *         of four or more underscores.
     */
    static String toPath(String variable) {
        String lower = variable.toLowerCase(Locale.ROOT);
        StringBuilder path = new StringBuilder(lower.length());
        int i = 0;
        while (i < lower.length()) {
            char c = lower.charAt(i);
            if (c != '_') {
                path.append(c);
                i++;
                continue;
            }
            int run = 0;
            while (i + run < lower.length() && lower.charAt(i + run) == '_') {
                run++;
            }
            switch (run) {
                case 1 -> path.append('.');
                case 2 -> path.append('-');
                case 3 -> path.append('_');
                default -> {
                    return null;
                }
            }
            i += run;
        }
        return path.toString();
    }
}
