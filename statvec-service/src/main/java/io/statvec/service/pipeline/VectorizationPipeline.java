package io.statvec.service.pipeline;

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
import io.statvec.encoding.EncodedVector;
import io.statvec.encoding.EnhancementResult;
import io.statvec.encoding.VectorizationEngine;
import io.statvec.service.config.ServiceSettings;
import io.statvec.service.downstream.OrchestratorClient;
import io.statvec.service.downstream.OrchestratorPoller;
import io.statvec.service.downstream.PollOutcome;
import io.statvec.service.downstream.SmpcClient;
import io.statvec.service.fetch.DatasetFetcher;
import io.statvec.service.output.OutputPaths;
import io.statvec.service.output.VectorizationOutputs;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// Runs one vectorization request end to end.
///
/// The steps are: fetch the dataset, enhance it, write the three output documents, post the
/// first encoder to SMPC, notify the orchestrator, and start polling for results. Each
/// downstream step runs only when the previous one succeeded and its settings are present.
/// Downstream failures are logged and reported, never thrown.
public class VectorizationPipeline {
    private static final Logger logger = LogManager.getLogger(VectorizationPipeline.class);

    private final ServiceSettings settings;
    private final DatasetFetcher fetcher;
    private final VectorizationEngine engine;
    private final SmpcClient smpcClient;
    private final OrchestratorClient orchestratorClient;
    private final OrchestratorPoller poller;

    public VectorizationPipeline(ServiceSettings settings) {
        this(settings, new OkHttpClient(), new VectorizationEngine());
    }

    public VectorizationPipeline(ServiceSettings settings, OkHttpClient httpClient, VectorizationEngine engine) {
        this.settings = settings;
        this.engine = engine;
        this.fetcher = new DatasetFetcher(httpClient, settings.datasetRoots());
        this.smpcClient = settings.smpcUrl() == null ? null : new SmpcClient(settings.smpcUrl(), httpClient);
        this.orchestratorClient = settings.orchestratorUrl() == null ? null
            : new OrchestratorClient(settings.orchestratorUrl(), httpClient);
        this.poller = orchestratorClient == null ? null : new OrchestratorPoller(orchestratorClient,
            settings.pollingInterval(), settings.pollingTimeout(), settings.resultsDir());
    }

    /// Fetch and process a request.
    /// @param request the request
    /// @return the report
    /// @throws IOException if the dataset cannot be loaded or the outputs cannot be written
    public PipelineReport run(PipelineRequest request) throws IOException {
        return process(request, fetch(request.url()));
    }

    /// @param url the dataset URL or path
    /// @return the loaded dataset
    /// @throws IOException if the dataset cannot be loaded, see {@link DatasetFetcher#fetch(String)}
    public JsonNode fetch(String url) throws IOException {
        logger.info("starting dataset fetch from {}", url);
        JsonNode dataset = fetcher.fetch(url);
        logger.info("fetched dataset from {}", url);
        return dataset;
    }

    /// Process an already loaded dataset.
    /// @param request the request the dataset belongs to
    /// @param dataset the dataset
    /// @return the report
    /// @throws IOException if the outputs cannot be written
    public PipelineReport process(PipelineRequest request, JsonNode dataset) throws IOException {
        if (request.query() != null && !request.query().isBlank()) {
            logger.info("only vectorizing the feature named {}", request.query());
        }
        EnhancementResult result = engine.enhance(dataset, request.query());
        OutputPaths outputs = VectorizationOutputs.write(settings.outputDir(), result);

        String jobId = request.jobId();
        if (smpcClient == null || jobId == null || jobId.isBlank()) {
            logger.info("no SMPC URL or job id, skipping SMPC and orchestrator steps");
            return new PipelineReport(result, outputs, false, false, Optional.empty());
        }

        EncodedVector first = result.firstEncoder();
        boolean posted = smpcClient.postEncoder(jobId, first);
        String clientId = request.clientId() != null ? request.clientId() : settings.clientId();
        if (!posted || orchestratorClient == null || clientId == null || request.totalClients() == null) {
            logger.info("SMPC update failed or orchestrator details missing, not notifying the orchestrator");
            return new PipelineReport(result, outputs, posted, false, Optional.empty());
        }

        boolean notified = orchestratorClient.notify(jobId, clientId, request.totalClients(), result.schema());
        if (!notified) {
            logger.warn("failed to notify orchestrator for job {}", jobId);
            return new PipelineReport(result, outputs, true, false, Optional.empty());
        }
        logger.info("notified orchestrator for job {}", jobId);

        Optional<CompletableFuture<PollOutcome>> polling = Optional.empty();
        if (settings.pollingEnabled()) {
            polling = Optional.of(poller.startPolling(jobId, result.schema()));
        }
        return new PipelineReport(result, outputs, true, true, polling);
    }

    public ServiceSettings getSettings() {
        return settings;
    }
}
