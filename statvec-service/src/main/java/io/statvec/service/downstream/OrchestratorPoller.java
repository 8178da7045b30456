package io.statvec.service.downstream;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.statvec.encoding.FeatureVector;
import io.statvec.encoding.StatvecJson;
import io.statvec.encoding.schema.SchemaDecoder;
import io.statvec.encoding.schema.SchemaEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// Polls the orchestrator until a job completes, then saves its aggregated results.
///
/// Used where this node cannot accept incoming requests and so has to fetch the outcome
/// itself. Each job is polled on its own daemon thread at a fixed interval until the job
/// completes, fails, or the timeout runs out. There is no way to cancel a run early.
///
/// On completion a results document is written to
/// `{resultsDir}/{jobId}_results_{yyyyMMdd_HHmmss}.json`. When the aggregated results are a
/// flat numeric array covering the schema that was sent, a `decodedResults` object splits them
/// back into per-feature vectors.
public class OrchestratorPoller {
    private static final Logger logger = LogManager.getLogger(OrchestratorPoller.class);

    public static final String SOURCE = "orchestrator_polling";
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final OrchestratorClient client;
    private final Duration interval;
    private final Duration timeout;
    private final Path resultsDir;
    private final Clock clock;

    public OrchestratorPoller(OrchestratorClient client, Duration interval, Duration timeout, Path resultsDir) {
        this(client, interval, timeout, resultsDir, Clock.systemDefaultZone());
    }

    public OrchestratorPoller(OrchestratorClient client, Duration interval, Duration timeout, Path resultsDir, Clock clock) {
        this.client = client;
        this.interval = interval;
        this.timeout = timeout;
        this.resultsDir = resultsDir;
        this.clock = clock;
    }

    /// Start polling a job in the background.
    /// @param jobId the job to poll
    /// @param schema the schema sent with the job, used to decode the results
    /// @return a future completed with the outcome when polling stops
    public CompletableFuture<PollOutcome> startPolling(String jobId, List<SchemaEntry> schema) {
        logger.info("starting background polling for job {} (interval {}s, timeout {}s)",
            jobId, interval.toSeconds(), timeout.toSeconds());
        CompletableFuture<PollOutcome> future = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                future.complete(pollUntilComplete(jobId, schema));
            } catch (RuntimeException e) {
                logger.error("polling for job {} stopped unexpectedly", jobId, e);
                future.completeExceptionally(e);
            }
        }, "orchestrator-poller-" + jobId);
        thread.setDaemon(true);
        thread.start();
        return future;
    }

    /// Poll a job on the calling thread.
    /// @param jobId the job to poll
    /// @param schema the schema sent with the job
    /// @return how polling ended
    public PollOutcome pollUntilComplete(String jobId, List<SchemaEntry> schema) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int polls = 0;
        while (System.nanoTime() < deadline) {
            polls++;
            Optional<JobStatus> status = client.jobStatus(jobId);
            if (status.isPresent()) {
                JobState state = status.get().state();
                logger.info("poll #{}: job {} status = {}", polls, jobId, status.get().status());
                if (state == JobState.COMPLETED) {
                    try {
                        Path saved = saveResults(jobId, status.get(), schema);
                        return PollOutcome.completed(jobId, polls, saved);
                    } catch (IOException e) {
                        logger.error("failed to save results for job {}: {}", jobId, e.getMessage());
                        return PollOutcome.ended(jobId, PollOutcome.Result.SAVE_FAILED, polls, e.getMessage());
                    }
                }
                if (state.isFailure()) {
                    logger.error("job {} failed with status {}", jobId, status.get().status());
                    return PollOutcome.ended(jobId, PollOutcome.Result.FAILED, polls, "job status " + status.get().status());
                }
            } else {
                logger.warn("poll #{}: no status received for job {}", polls, jobId);
            }

            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PollOutcome.ended(jobId, PollOutcome.Result.INTERRUPTED, polls, "interrupted");
            }
        }
        logger.error("polling timeout for job {} after {} polls", jobId, polls);
        return PollOutcome.ended(jobId, PollOutcome.Result.TIMED_OUT, polls, "no result within " + timeout);
    }

    /// Write the results document for a completed job.
    /// @param jobId the job
    /// @param status the completed status report
    /// @param schema the schema sent with the job
    /// @return the written file
    /// @throws IOException if the file cannot be written
    public Path saveResults(String jobId, JobStatus status, List<SchemaEntry> schema) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        ObjectNode results = StatvecJson.MAPPER.createObjectNode();
        results.put("jobId", jobId);
        results.put("timestamp", now.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        results.put("status", JobState.COMPLETED.name());
        results.set("aggregatedResults", status.aggregatedResults());
        results.set("metadata", status.metadata());
        results.put("retrievedAt", LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        results.put("source", SOURCE);
        decode(status.aggregatedResults(), schema).ifPresent(decoded -> results.set("decodedResults", decoded));

        Files.createDirectories(resultsDir);
        Path file = resultsDir.resolve(jobId + "_results_" + now.format(FILE_STAMP) + ".json");
        StatvecJson.MAPPER.writeValue(file.toFile(), results);
        logger.info("saved results for job {} to {} ({} values)", jobId, file, status.aggregatedResults().size());
        return file;
    }

    static Optional<ObjectNode> decode(JsonNode aggregated, List<SchemaEntry> schema) {
        if (schema == null || schema.isEmpty() || !aggregated.isArray()) {
            return Optional.empty();
        }
        List<Number> values = new ArrayList<>(aggregated.size());
        for (JsonNode value : aggregated) {
            if (!value.isNumber()) {
                return Optional.empty();
            }
            values.add(value.numberValue());
        }
        try {
            Map<String, FeatureVector> split = SchemaDecoder.split(schema, new FeatureVector(values));
            ObjectNode decoded = StatvecJson.MAPPER.createObjectNode();
            split.forEach((name, vector) -> decoded.set(name, StatvecJson.MAPPER.valueToTree(vector)));
            return Optional.of(decoded);
        } catch (IllegalArgumentException e) {
            logger.debug("aggregated results do not match the schema: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
