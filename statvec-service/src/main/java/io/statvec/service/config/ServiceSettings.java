package io.statvec.service.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Runtime settings for the vectorization service.
///
/// Settings are layered: built-in defaults, then environment variables, then an optional YAML
/// file, then command line options. Each layer only replaces the values it actually names.
///
/// A YAML settings file uses the same names as the record components:
/// ```yaml
/// clientId: hospital-a
/// smpcUrl: http://smpc:9000
/// orchestratorUrl: http://orchestrator:5000
/// outputDir: /var/statvec/output
/// resultsDir: /var/statvec/results
/// port: 5001
/// polling:
///   enabled: true
///   intervalSeconds: 10
///   timeoutSeconds: 1200
/// datasetRoots:
///   - /app
///   - /data
/// ```
/// @param clientId identifier this node reports to the orchestrator, may be null
/// @param smpcUrl base URL of the SMPC node, may be null
/// @param orchestratorUrl base URL of the orchestrator, may be null
/// @param outputDir where enhanced datasets, encoders and schemas are written
/// @param resultsDir where polled job results are written
/// @param port HTTP port of the `/vectorize` endpoint
/// @param pollingEnabled whether to poll the orchestrator after a successful notification
/// @param pollingInterval time between job status polls
/// @param pollingTimeout how long to keep polling before giving up
/// @param datasetRoots directories tried, in order, for relative dataset paths
public record ServiceSettings(
    String clientId,
    String smpcUrl,
    String orchestratorUrl,
    Path outputDir,
    Path resultsDir,
    int port,
    boolean pollingEnabled,
    Duration pollingInterval,
    Duration pollingTimeout,
    List<Path> datasetRoots
) {
    private static final Logger logger = LogManager.getLogger(ServiceSettings.class);

    public static final int DEFAULT_PORT = 5001;
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_POLLING_TIMEOUT = Duration.ofMinutes(20);

    public static final String ENV_CLIENT_ID = "ID";
    public static final String ENV_SMPC_URL = "SMPC_URL";
    public static final String ENV_ORCHESTRATOR_URL = "ORCHESTRATOR_URL";
    public static final String ENV_OUTPUT_DIR = "STATVEC_OUTPUT_DIR";
    public static final String ENV_RESULTS_DIR = "STATVEC_RESULTS_DIR";
    public static final String ENV_PORT = "STATVEC_PORT";
    public static final String ENV_POLLING_ENABLED = "STATVEC_POLLING_ENABLED";
    public static final String ENV_POLLING_INTERVAL = "STATVEC_POLLING_INTERVAL";
    public static final String ENV_POLLING_TIMEOUT = "STATVEC_POLLING_TIMEOUT";
    public static final String ENV_DATASET_ROOTS = "STATVEC_DATASET_ROOTS";

    public ServiceSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new IllegalArgumentException("polling interval must be positive: " + pollingInterval);
        }
        clientId = blankToNull(clientId);
        smpcUrl = blankToNull(smpcUrl);
        orchestratorUrl = blankToNull(orchestratorUrl);
        datasetRoots = List.copyOf(datasetRoots);
    }

    /// @return settings with no collaborators configured and polling off
    public static ServiceSettings defaults() {
        return new ServiceSettings(null, null, null, Path.of("output"), Path.of("results"), DEFAULT_PORT,
            false, DEFAULT_POLLING_INTERVAL, DEFAULT_POLLING_TIMEOUT, List.of(Path.of("/app")));
    }

    /// @return the defaults overlaid with the process environment
    public static ServiceSettings fromEnvironment() {
        return defaults().withEnvironment(System.getenv());
    }

    /// Load settings from the environment and, when given, a YAML file.
    /// @param yamlFile a settings file, or null
    /// @return the layered settings
    /// @throws IOException if the file cannot be read
    public static ServiceSettings load(Path yamlFile) throws IOException {
        ServiceSettings settings = fromEnvironment();
        return yamlFile == null ? settings : settings.withYaml(yamlFile);
    }

    /// Overlay environment variables. Variables that are absent or blank leave the current value.
    /// Durations are given in seconds and dataset roots as a path-separator delimited list.
    /// @param env the environment
    /// @return the overlaid settings
    public ServiceSettings withEnvironment(Map<String, String> env) {
        return new ServiceSettings(
            pick(env.get(ENV_CLIENT_ID), clientId),
            pick(env.get(ENV_SMPC_URL), smpcUrl),
            pick(env.get(ENV_ORCHESTRATOR_URL), orchestratorUrl),
            present(env.get(ENV_OUTPUT_DIR)) ? Path.of(env.get(ENV_OUTPUT_DIR).trim()) : outputDir,
            present(env.get(ENV_RESULTS_DIR)) ? Path.of(env.get(ENV_RESULTS_DIR).trim()) : resultsDir,
            present(env.get(ENV_PORT)) ? parseInt(ENV_PORT, env.get(ENV_PORT)) : port,
            present(env.get(ENV_POLLING_ENABLED)) ? Boolean.parseBoolean(env.get(ENV_POLLING_ENABLED).trim()) : pollingEnabled,
            present(env.get(ENV_POLLING_INTERVAL)) ? seconds(ENV_POLLING_INTERVAL, env.get(ENV_POLLING_INTERVAL)) : pollingInterval,
            present(env.get(ENV_POLLING_TIMEOUT)) ? seconds(ENV_POLLING_TIMEOUT, env.get(ENV_POLLING_TIMEOUT)) : pollingTimeout,
            present(env.get(ENV_DATASET_ROOTS)) ? splitRoots(env.get(ENV_DATASET_ROOTS)) : datasetRoots
        );
    }

    /// Overlay a YAML settings file.
    /// @param yamlFile the file to read
    /// @return the overlaid settings
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not a YAML mapping or holds values of the wrong shape
    public ServiceSettings withYaml(Path yamlFile) throws IOException {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object loaded = yaml.loadFromString(Files.readString(yamlFile));
        if (loaded == null) {
            logger.debug("settings file {} is empty", yamlFile);
            return this;
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("settings file " + yamlFile + " must hold a YAML mapping");
        }
        logger.info("applying settings from {}", yamlFile);

        boolean enabled = pollingEnabled;
        Duration interval = pollingInterval;
        Duration timeout = pollingTimeout;
        Object polling = map.get("polling");
        if (polling instanceof Map<?, ?> pollingMap) {
            if (pollingMap.get("enabled") != null) {
                enabled = Boolean.parseBoolean(String.valueOf(pollingMap.get("enabled")));
            }
            if (pollingMap.get("intervalSeconds") != null) {
                interval = seconds("polling.intervalSeconds", String.valueOf(pollingMap.get("intervalSeconds")));
            }
            if (pollingMap.get("timeoutSeconds") != null) {
                timeout = seconds("polling.timeoutSeconds", String.valueOf(pollingMap.get("timeoutSeconds")));
            }
        } else if (polling != null) {
            throw new IllegalArgumentException("'polling' must be a mapping in " + yamlFile);
        }

        List<Path> roots = datasetRoots;
        Object rootsValue = map.get("datasetRoots");
        if (rootsValue instanceof List<?> list) {
            roots = new ArrayList<>();
            for (Object root : list) {
                roots.add(Path.of(String.valueOf(root)));
            }
        } else if (rootsValue != null) {
            roots = splitRoots(String.valueOf(rootsValue));
        }

        return new ServiceSettings(
            text(map.get("clientId"), clientId),
            text(map.get("smpcUrl"), smpcUrl),
            text(map.get("orchestratorUrl"), orchestratorUrl),
            map.get("outputDir") != null ? Path.of(String.valueOf(map.get("outputDir"))) : outputDir,
            map.get("resultsDir") != null ? Path.of(String.valueOf(map.get("resultsDir"))) : resultsDir,
            map.get("port") != null ? parseInt("port", String.valueOf(map.get("port"))) : port,
            enabled,
            interval,
            timeout,
            roots
        );
    }

    public ServiceSettings withClientId(String value) {
        return new ServiceSettings(value, smpcUrl, orchestratorUrl, outputDir, resultsDir, port,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withSmpcUrl(String value) {
        return new ServiceSettings(clientId, value, orchestratorUrl, outputDir, resultsDir, port,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withOrchestratorUrl(String value) {
        return new ServiceSettings(clientId, smpcUrl, value, outputDir, resultsDir, port,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withOutputDir(Path value) {
        return new ServiceSettings(clientId, smpcUrl, orchestratorUrl, value, resultsDir, port,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withResultsDir(Path value) {
        return new ServiceSettings(clientId, smpcUrl, orchestratorUrl, outputDir, value, port,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withPort(int value) {
        return new ServiceSettings(clientId, smpcUrl, orchestratorUrl, outputDir, resultsDir, value,
            pollingEnabled, pollingInterval, pollingTimeout, datasetRoots);
    }

    public ServiceSettings withPolling(boolean enabled, Duration interval, Duration timeout) {
        return new ServiceSettings(clientId, smpcUrl, orchestratorUrl, outputDir, resultsDir, port,
            enabled, interval, timeout, datasetRoots);
    }

    public ServiceSettings withDatasetRoots(List<Path> value) {
        return new ServiceSettings(clientId, smpcUrl, orchestratorUrl, outputDir, resultsDir, port,
            pollingEnabled, pollingInterval, pollingTimeout, value);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return present(value) ? value.trim() : null;
    }

    private static String pick(String override, String current) {
        return present(override) ? override.trim() : current;
    }

    private static String text(Object override, String current) {
        return override == null ? current : pick(String.valueOf(override), current);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, found '" + value + "'", e);
        }
    }

    private static Duration seconds(String name, String value) {
        return Duration.ofSeconds(parseInt(name, value));
    }

    private static List<Path> splitRoots(String value) {
        List<Path> roots = new ArrayList<>();
        for (String part : value.split(File.pathSeparator)) {
            if (!part.isBlank()) {
                roots.add(Path.of(part.trim()));
            }
        }
        return roots;
    }
}
