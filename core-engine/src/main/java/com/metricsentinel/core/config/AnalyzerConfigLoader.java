package com.metricsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link AnalyzerConfig} from a YAML source.
 *
 * <p>
 * Expected YAML structure (all keys optional):
 * </p>
 *
 * <pre>
 * windowSize: 100
 * sensitivity: 2.0
 * minDataPoints: 10
 * enableTrendAnalysis: true
 * enableSeasonalityDetection: true
 * historyCapacity: 100
 * seasonalityPeriod: 24
 * </pre>
 *
 * <p>
 * Any other top-level key is kept as an extension.
 * </p>
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code from*} method validates the parsed values so that a bad
 * document fails at load time instead of producing undefined detection
 * behaviour.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyzerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYZER_CONFIG_PATH";

    /** Classpath resource used when no override is set. */
    public static final String DEFAULT_RESOURCE = "analyzer.yml";

    private AnalyzerConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AnalyzerConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analyzer config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analyzer config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyzerConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyzerConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalyzerConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Build a configuration from already-parsed key/value options.
     *
     * <p>
     * All conversion errors are collected and reported together.
     * </p>
     *
     * @param options option map; must not be {@code null}
     * @return validated configuration
     * @throws IllegalStateException if one or more options are invalid
     */
    public static AnalyzerConfig fromMap(Map<String, ?> options) {
        Objects.requireNonNull(options, "Options must not be null");
        AnalyzerConfig.Builder builder = AnalyzerConfig.builder();
        List<String> errors = new ArrayList<>();

        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            Object raw = entry.getValue();
            try {
                switch (key) {
                    case "windowSize" -> builder.windowSize(toInt(key, raw));
                    case "sensitivity" -> builder.sensitivity(toDouble(key, raw));
                    case "minDataPoints" -> builder.minDataPoints(toInt(key, raw));
                    case "enableTrendAnalysis" -> builder.enableTrendAnalysis(toBoolean(key, raw));
                    case "enableSeasonalityDetection" -> builder.enableSeasonalityDetection(toBoolean(key, raw));
                    case "historyCapacity" -> builder.historyCapacity(toInt(key, raw));
                    case "seasonalityPeriod" -> builder.seasonalityPeriod(toInt(key, raw));
                    default -> {
                        LOG.debug("Keeping unrecognized option '{}' as extension", key);
                        builder.extension(key, raw);
                    }
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (errors.isEmpty()) {
            try {
                return builder.build();
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        throw new IllegalStateException(
                "Analyzer configuration validation failed:\n  - "
                        + String.join("\n  - ", errors));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalyzerConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analyzer configuration: " + e.getMessage(), e);
        }

        if (document == null) {
            LOG.warn("Analyzer configuration is empty - using defaults");
            return AnalyzerConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalStateException(
                    "Analyzer configuration must be a mapping, got: " + document.getClass().getSimpleName());
        }

        Map<String, Object> typed = new LinkedHashMap<>();
        map.forEach((k, v) -> typed.put(String.valueOf(k), v));

        AnalyzerConfig config = fromMap(typed);
        LOG.info("Loaded analyzer configuration: {}", config);
        return config;
    }

    private static int toInt(String key, Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            long v = ((Number) raw).longValue();
            if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("'" + key + "' is out of range: " + raw);
            }
            return (int) v;
        }
        if (raw instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be an integer, got: '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + raw);
    }

    private static double toDouble(String key, Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + key + "' must be a number, got: '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be a number, got: " + raw);
    }

    private static boolean toBoolean(String key, Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + raw);
    }
}
