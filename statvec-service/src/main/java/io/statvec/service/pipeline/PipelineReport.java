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

import io.statvec.encoding.EnhancementResult;
import io.statvec.service.downstream.PollOutcome;
import io.statvec.service.output.OutputPaths;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// What a pipeline run produced and which downstream steps succeeded.
/// @param result the vectorization result
/// @param outputs where the result was written
/// @param smpcPosted whether SMPC accepted the encoder
/// @param orchestratorNotified whether the orchestrator accepted the notification
/// @param polling the background poll for the job's results, when one was started
public record PipelineReport(
    EnhancementResult result,
    OutputPaths outputs,
    boolean smpcPosted,
    boolean orchestratorNotified,
    Optional<CompletableFuture<PollOutcome>> polling
) {

    public int encodersCount() {
        return result.encoders().size();
    }

    public int schemaCount() {
        return result.schema().size();
    }
}
