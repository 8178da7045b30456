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

import java.util.Locale;

/// Lifecycle states an orchestrator reports for a job.
public enum JobState {
    WAITING,
    IN_PROGRESS,
    AGGREGATING,
    COMPLETED,
    FAILED,
    ERROR,
    /// any status string this client does not know; polling continues
    UNKNOWN;

    /// @param status the status string from the orchestrator, in any case
    /// @return the matching state, or {@link #UNKNOWN}
    public static JobState parse(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /// @return true if the job ended without results
    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }
}
