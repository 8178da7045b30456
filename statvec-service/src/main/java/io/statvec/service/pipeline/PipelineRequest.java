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

/// One vectorization request.
/// @param url the dataset URL or path
/// @param query a single feature name to vectorize, or null for all
/// @param jobId the job to report to SMPC and the orchestrator, or null
/// @param clientId this client's identifier, or null to use the configured one
/// @param totalClients the number of clients in the job, or null when unknown
public record PipelineRequest(String url, String query, String jobId, String clientId, Integer totalClients) {

    public PipelineRequest {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("a dataset url is required");
        }
    }

    /// @param url the dataset URL or path
    /// @return a request that only vectorizes, with no downstream reporting
    public static PipelineRequest of(String url) {
        return new PipelineRequest(url, null, null, null, null);
    }
}
