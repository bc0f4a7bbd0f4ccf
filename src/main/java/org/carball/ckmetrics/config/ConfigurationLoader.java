package org.carball.ckmetrics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String ENV_INCLUDE_TESTS = "CK_INCLUDE_TESTS";
    public static final String ENV_MAX_FILE_SIZE = "CK_MAX_FILE_SIZE";
    public static final String ENV_WORKERS = "CK_WORKERS";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public CohesionAnalyzerConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        CohesionAnalyzerConfig.CohesionAnalyzerConfigBuilder builder = CohesionAnalyzerConfig.builder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        CohesionAnalyzerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads report thresholds from a YAML file. A missing or unreadable file falls back
     * to the defaults.
     */
    public MetricThresholds loadThresholds(Path configPath) {
        if (configPath == null) {
            log.debug("No threshold file given, using defaults");
            return MetricThresholds.defaults();
        }
        if (!Files.exists(configPath)) {
            log.warn("Threshold file not found: {}, using defaults", configPath);
            return MetricThresholds.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            MetricThresholds thresholds = mapper.readValue(configPath.toFile(), MetricThresholds.class);
            if (thresholds == null) {
                log.warn("Threshold file {} is empty, using defaults", configPath);
                return MetricThresholds.defaults();
            }
            thresholds.validate();
            log.info("Loaded thresholds from {}: {}", configPath, thresholds.getDescription());
            return thresholds;
        } catch (IOException e) {
            log.error("Failed to load thresholds from {}: {}, using defaults", configPath, e.getMessage());
            return MetricThresholds.defaults();
        }
    }

    private void applyEnvironmentVariables(CohesionAnalyzerConfig.CohesionAnalyzerConfigBuilder builder) {
        if (environment.containsKey(ENV_INCLUDE_TESTS)) {
            builder.skipTestFiles(!Boolean.parseBoolean(environment.get(ENV_INCLUDE_TESTS).trim()));
        }
        if (environment.containsKey(ENV_MAX_FILE_SIZE)) {
            String value = environment.get(ENV_MAX_FILE_SIZE);
            try {
                builder.maxFileSize(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_MAX_FILE_SIZE, value);
            }
        }
        if (environment.containsKey(ENV_WORKERS)) {
            String value = environment.get(ENV_WORKERS);
            try {
                builder.workerThreads(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_WORKERS, value);
            }
        }
    }

    private void applyCLIArguments(CohesionAnalyzerConfig.CohesionAnalyzerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--include-tests".equals(arg)) {
                builder.skipTestFiles(false);
                continue;
            }
            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--max-file-size":
                        builder.maxFileSize(Long.parseLong(value));
                        break;
                    case "--workers":
                        builder.workerThreads(Integer.parseInt(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for analyzer configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Analyzer Configuration Options:

            CLI Arguments:
              --include-tests              Analyze test files too (skipped by default)
              --max-file-size <bytes>      Skip files larger than this (0 = no limit)
              --workers <num>              Worker threads (default: 2 x CPU cores)

            Environment Variables:
              CK_INCLUDE_TESTS             true to behave like --include-tests
              CK_MAX_FILE_SIZE             Same as --max-file-size
              CK_WORKERS                   Same as --workers

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
