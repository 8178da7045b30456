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

import java.nio.file.Path;
import java.util.Optional;

/// How a polling run ended.
/// @param jobId the polled job
/// @param result the kind of ending
/// @param polls how many status requests were made
/// @param resultsFile the saved results, present only for {@link Result#COMPLETED}
/// @param detail a short human-readable explanation
public record PollOutcome(String jobId, Result result, int polls, Optional<Path> resultsFile, String detail) {

    public enum Result {
        /// the job completed and its results were saved
        COMPLETED,
        /// the orchestrator reported FAILED or ERROR
        FAILED,
        /// the job completed but its results could not be saved
        SAVE_FAILED,
        /// the polling timeout expired first
        TIMED_OUT,
        /// the polling thread was interrupted
        INTERRUPTED
    }

    public static PollOutcome completed(String jobId, int polls, Path resultsFile) {
        return new PollOutcome(jobId, Result.COMPLETED, polls, Optional.of(resultsFile), "results saved to " + resultsFile);
    }

    public static PollOutcome ended(String jobId, Result result, int polls, String detail) {
        return new PollOutcome(jobId, result, polls, Optional.empty(), detail);
    }

    /// @return true if results were retrieved and saved
    public boolean isSuccess() {
        return result == Result.COMPLETED;
    }
}
