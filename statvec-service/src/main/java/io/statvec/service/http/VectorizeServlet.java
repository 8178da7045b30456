package io.statvec.service.http;

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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.statvec.encoding.StatvecJson;
import io.statvec.service.fetch.DatasetFetchException;
import io.statvec.service.fetch.DatasetNotFoundException;
import io.statvec.service.output.OutputPaths;
import io.statvec.service.pipeline.PipelineReport;
import io.statvec.service.pipeline.PipelineRequest;
import io.statvec.service.pipeline.VectorizationPipeline;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;

/// `POST /vectorize`: fetch a dataset, vectorize it and relay the result downstream.
///
/// Request body:
/// ```json
/// {"url": "cohort.json", "jobId": "job-1", "clientsList": ["a", "b"], "query": "age"}
/// ```
/// Only `url` is required. The number of clients is the size of `clientsList` when given,
/// otherwise the `totalClients` field. The client id comes from the service settings.
///
/// Dataset problems answer 400 with `{"error": "..."}`; a processed dataset answers 200 with
/// the output paths and counts, whether or not the downstream steps succeeded.
public class VectorizeServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(VectorizeServlet.class);

    private final transient VectorizationPipeline pipeline;

    public VectorizeServlet(VectorizationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        JsonNode body;
        try {
            body = StatvecJson.MAPPER.readTree(req.getInputStream());
        } catch (JsonProcessingException e) {
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("Invalid JSON in request body: " + e.getOriginalMessage()));
            return;
        }
        if (body == null || body.isMissingNode() || body.isNull()) {
            body = StatvecJson.MAPPER.createObjectNode();
        }
        if (!body.isObject()) {
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("Request body must be a JSON object"));
            return;
        }

        String url = text(body, "url");
        if (url == null || url.isBlank()) {
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("Missing 'url' in request body"));
            return;
        }
        PipelineRequest request = new PipelineRequest(url, text(body, "query"), text(body, "jobId"), null,
            totalClients(body));

        JsonNode dataset;
        try {
            dataset = pipeline.fetch(url);
        } catch (DatasetNotFoundException e) {
            logger.error("file not found: {}", e.getMessage());
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("File not found: " + e.getMessage()));
            return;
        } catch (DatasetFetchException e) {
            logger.error("failed to fetch dataset from {}: {}", url, e.getMessage());
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("Failed to fetch dataset: " + e.getMessage()));
            return;
        } catch (IOException e) {
            logger.error("error loading dataset from {}: {}", url, e.getMessage());
            respond(resp, HttpServletResponse.SC_BAD_REQUEST, error("Error loading dataset: " + e.getMessage()));
            return;
        }

        PipelineReport report;
        try {
            report = pipeline.process(request, dataset);
        } catch (IOException e) {
            logger.error("failed to write outputs for {}", url, e);
            respond(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, error("Failed to write outputs: " + e.getMessage()));
            return;
        }
        respond(resp, HttpServletResponse.SC_OK, VectorizeResponse.of(report));
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static Integer totalClients(JsonNode body) {
        JsonNode clients = body.get("clientsList");
        if (clients != null && clients.isArray()) {
            return clients.size();
        }
        JsonNode total = body.get("totalClients");
        if (total != null && total.canConvertToInt()) {
            return total.intValue();
        }
        return null;
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message);
    }

    private static void respond(HttpServletResponse resp, int status, Object payload) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        StatvecJson.MAPPER.writeValue(resp.getWriter(), payload);
    }

    @JsonPropertyOrder({"message", "outputPaths", "encodersCount", "schemaCount", "smpcPosted", "orchestratorNotified"})
    record VectorizeResponse(
        String message,
        Paths outputPaths,
        int encodersCount,
        int schemaCount,
        boolean smpcPosted,
        boolean orchestratorNotified
    ) {
        static VectorizeResponse of(PipelineReport report) {
            OutputPaths outputs = report.outputs();
            return new VectorizeResponse(
                "Vectorization completed.",
                new Paths(outputs.enhancedData().toString(), outputs.encodersOnly().toString(), outputs.schema().toString()),
                report.encodersCount(),
                report.schemaCount(),
                report.smpcPosted(),
                report.orchestratorNotified()
            );
        }
    }

    @JsonPropertyOrder({"enhancedData", "encodersOnly", "schema"})
    record Paths(String enhancedData, String encodersOnly, String schema) {
    }
}
