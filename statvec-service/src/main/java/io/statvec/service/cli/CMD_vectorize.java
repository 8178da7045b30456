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

import com.fasterxml.jackson.databind.JsonNode;
import io.statvec.service.cli.common.SettingsOption;
import io.statvec.service.config.ServiceSettings;
import io.statvec.service.downstream.PollOutcome;
import io.statvec.service.pipeline.PipelineReport;
import io.statvec.service.pipeline.PipelineRequest;
import io.statvec.service.pipeline.VectorizationPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/// Vectorize one dataset and relay the result, then exit.
@CommandLine.Command(name = "vectorize",
    header = "Vectorize a dataset, update SMPC and notify the orchestrator",
    description = "Fetches the dataset at --url (a URL or a local path), writes the enhanced dataset,\n" +
        "encoders and schema to the output directory, and when --jobId and an SMPC URL are known,\n" +
        "posts the first encoder to SMPC and notifies the orchestrator. When polling is enabled\n" +
        "the command waits for the job's results before exiting.\n" +
        "Exit codes: 0 done, 1 dataset not loaded, 2 invalid settings, 3 polling failed,\n" +
        "4 outputs not written.",
    mixinStandardHelpOptions = true)
public class CMD_vectorize implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_vectorize.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SettingsOption settingsOption = new SettingsOption();

    @CommandLine.Option(names = {"--url"}, required = true,
        description = "The URL or local file path of the dataset to vectorize")
    private String url;

    @CommandLine.Option(names = {"--query"},
        description = "Only vectorize the feature with this exact name")
    private String query;

    @CommandLine.Option(names = {"--jobId"},
        description = "Job ID for the SMPC and orchestrator calls")
    private String jobId;

    @CommandLine.Option(names = {"--clientId"},
        description = "Client ID reported to the orchestrator (default: the ID environment variable)")
    private String clientId;

    @CommandLine.Option(names = {"--totalClients"},
        description = "Number of clients taking part in the job")
    private Integer totalClients;

    @CommandLine.Option(names = {"--smpcUrl"},
        description = "Base URL of the SMPC node (default: the SMPC_URL environment variable)")
    private String smpcUrl;

    @CommandLine.Option(names = {"--orchestratorUrl"},
        description = "Base URL of the orchestrator (default: the ORCHESTRATOR_URL environment variable)")
    private String orchestratorUrl;

    @CommandLine.Option(names = {"-o", "--output"},
        description = "Output directory for the enhanced dataset, encoders and schema")
    private Path output;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ServiceSettings settings;
        try {
            settings = applyOptions(settingsOption.load());
        } catch (IOException | IllegalArgumentException e) {
            logger.error("unable to load settings: {}", e.getMessage());
            return 2;
        }

        VectorizationPipeline pipeline = new VectorizationPipeline(settings);
        JsonNode dataset;
        try {
            dataset = pipeline.fetch(url);
        } catch (IOException e) {
            logger.error("unable to load dataset from {}: {}", url, e.getMessage());
            return 1;
        }
        PipelineReport report;
        try {
            report = pipeline.process(new PipelineRequest(url, query, jobId, clientId, totalClients), dataset);
        } catch (IOException e) {
            logger.error("unable to write outputs to {}: {}", settings.outputDir(), e.getMessage());
            return 4;
        }

        out.printf("vectorized %d schema entries into %d encoder(s)%n", report.schemaCount(), report.encodersCount());
        out.printf("enhanced dataset: %s%n", report.outputs().enhancedData());
        out.printf("encoders:         %s%n", report.outputs().encodersOnly());
        out.printf("schema:           %s%n", report.outputs().schema());
        out.printf("smpc posted: %s, orchestrator notified: %s%n", report.smpcPosted(), report.orchestratorNotified());

        if (report.polling().isPresent()) {
            try {
                PollOutcome outcome = report.polling().get().get();
                out.printf("polling %s: %s%n", outcome.result(), outcome.detail());
                return outcome.isSuccess() ? 0 : 3;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 3;
            } catch (ExecutionException e) {
                logger.error("polling failed for job {}", jobId, e.getCause());
                return 3;
            }
        }
        return 0;
    }

    private ServiceSettings applyOptions(ServiceSettings settings) {
        ServiceSettings applied = settings;
        if (smpcUrl != null) {
            applied = applied.withSmpcUrl(smpcUrl);
        }
        if (orchestratorUrl != null) {
            applied = applied.withOrchestratorUrl(orchestratorUrl);
        }
        if (clientId != null) {
            applied = applied.withClientId(clientId);
        }
        if (output != null) {
            applied = applied.withOutputDir(output);
        }
        return applied;
    }
}
