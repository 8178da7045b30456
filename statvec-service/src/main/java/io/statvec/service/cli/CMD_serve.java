package io.statvec.service.cli;

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

import io.statvec.service.cli.common.SettingsOption;
import io.statvec.service.config.ServiceSettings;
import io.statvec.service.http.VectorizationServer;
import io.statvec.service.pipeline.VectorizationPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

/// Run the vectorization HTTP service until the process is stopped.
@CommandLine.Command(name = "serve",
    header = "Run the /vectorize HTTP endpoint",
    description = "Starts an HTTP server answering POST /vectorize. SMPC, orchestrator and polling\n" +
        "settings come from the environment and the optional settings file.",
    mixinStandardHelpOptions = true)
public class CMD_serve implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_serve.class);

    @CommandLine.Mixin
    private SettingsOption settingsOption = new SettingsOption();

    @CommandLine.Option(names = {"-p", "--port"},
        description = "Port to listen on (default: STATVEC_PORT or " + ServiceSettings.DEFAULT_PORT + ")")
    private Integer port;

    @CommandLine.Option(names = {"--host"}, defaultValue = "0.0.0.0",
        description = "Interface to bind (default: ${DEFAULT-VALUE})")
    private String host;

    @Override
    public Integer call() {
        ServiceSettings settings;
        try {
            settings = settingsOption.load();
            if (port != null) {
                settings = settings.withPort(port);
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.error("unable to load settings: {}", e.getMessage());
            return 2;
        }

        logger.info("smpc={} orchestrator={} clientId={} polling={}",
            settings.smpcUrl(), settings.orchestratorUrl(), settings.clientId(), settings.pollingEnabled());
        try (VectorizationServer server = new VectorizationServer(new VectorizationPipeline(settings), host, settings.port())) {
            server.start();
            server.join();
            return 0;
        } catch (IOException e) {
            logger.error("unable to start server: {}", e.getMessage(), e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
    }
}
