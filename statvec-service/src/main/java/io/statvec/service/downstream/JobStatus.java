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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

/// A job status report from the orchestrator.
/// @param state the parsed state
/// @param status the status string as reported
/// @param aggregatedResults the aggregated results, an empty array when absent
/// @param metadata job metadata, an empty object when absent
public record JobStatus(JobState state, String status, JsonNode aggregatedResults, JsonNode metadata) {

    public JobStatus {
        if (aggregatedResults == null || aggregatedResults.isMissingNode() || aggregatedResults instanceof NullNode) {
            aggregatedResults = JsonNodeFactory.instance.arrayNode();
        }
        if (metadata == null || metadata.isMissingNode() || metadata instanceof NullNode) {
            metadata = JsonNodeFactory.instance.objectNode();
        }
    }

    /// @param body the status response body
    /// @return the status it describes
    public static JobStatus fromJson(JsonNode body) {
        JsonNode status = body.path("status");
        String text = status.isTextual() ? status.textValue() : "UNKNOWN";
        return new JobStatus(JobState.parse(text), text, body.get("aggregatedResults"), body.get("metadata"));
    }
}
