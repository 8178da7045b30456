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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import io.statvec.encoding.StatvecJson;
import io.statvec.encoding.schema.SchemaEntry;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/// Talks to the computations orchestrator: completion notifications and job status.
public class OrchestratorClient {
    private static final Logger logger = LogManager.getLogger(OrchestratorClient.class);

    public static final Duration NOTIFY_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration STATUS_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final OkHttpClient notifyClient;
    private final OkHttpClient statusClient;

    public OrchestratorClient(String baseUrl) {
        this(baseUrl, new OkHttpClient());
    }

    public OrchestratorClient(String baseUrl, OkHttpClient httpClient) {
        this.baseUrl = Urls.trimTrailingSlash(baseUrl);
        this.notifyClient = httpClient.newBuilder().callTimeout(NOTIFY_TIMEOUT).build();
        this.statusClient = httpClient.newBuilder().callTimeout(STATUS_TIMEOUT).build();
    }

    /// Tell the orchestrator this client has pushed its data to SMPC.
    /// @param jobId the job identifier
    /// @param clientId this client's identifier
    /// @param totalClients how many clients take part in the job
    /// @param schema the layout of the vector that was posted
    /// @return true only if the orchestrator answered HTTP 200
    public boolean notify(String jobId, String clientId, int totalClients, List<SchemaEntry> schema) {
        String url = baseUrl + "/api/update";
        logger.info("notifying orchestrator at {} for job {} ({} schema entries)", url, jobId, schema.size());
        try {
            String json = StatvecJson.MAPPER.writeValueAsString(new UpdateNotice(jobId, clientId, totalClients, schema));
            Request request = new Request.Builder().url(url).post(RequestBody.create(json, SmpcClient.JSON)).build();
            try (Response response = notifyClient.newCall(request).execute()) {
                logger.info("orchestrator response: {} {}", response.code(), response.message());
                return response.code() == 200;
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("error notifying orchestrator at {}: {}", url, e.getMessage());
            return false;
        }
    }

    /// Ask the orchestrator for the status of a job.
    /// @param jobId the job identifier
    /// @return the status, or empty when the job is unknown, the response is unusable, or the
    /// request failed
    public Optional<JobStatus> jobStatus(String jobId) {
        String url = baseUrl + "/api/job-status/" + jobId;
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            logger.error("invalid job status URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }
        try (Response response = statusClient.newCall(request).execute()) {
            if (response.code() == 404) {
                logger.warn("job {} not found (404)", jobId);
                return Optional.empty();
            }
            if (response.code() != 200) {
                logger.warn("unexpected status {} polling job {}", response.code(), jobId);
                return Optional.empty();
            }
            ResponseBody body = response.body();
            JsonNode node = StatvecJson.MAPPER.readTree(body == null ? "" : body.string());
            if (!node.isObject()) {
                logger.warn("job status for {} is not a JSON object", jobId);
                return Optional.empty();
            }
            return Optional.of(JobStatus.fromJson(node));
        } catch (IOException e) {
            logger.error("error polling job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @JsonPropertyOrder({"jobId", "clientId", "totalClients", "schema"})
    record UpdateNotice(String jobId, String clientId, int totalClients, List<SchemaEntry> schema) {
    }
}
