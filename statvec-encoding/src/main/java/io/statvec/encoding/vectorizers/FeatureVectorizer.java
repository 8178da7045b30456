package io.statvec.encoding.vectorizers;

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
import io.statvec.encoding.FeatureVector;

import java.util.List;

/// Converts one statistics record into a fixed-length {@link FeatureVector}.
///
/// Implementations are stateless. Missing statistics are replaced with zero values so the
/// vector length never depends on what a record happens to contain.
public interface FeatureVectorizer {

    /// @param statistics
    ///     the statistics record; null or a JSON null is treated as an empty record
    /// @return a vector of exactly {@link #vectorLength()} elements
    /// @throws IllegalArgumentException
    ///     if the record is not a JSON object, or a statistic that must be numeric is not
    FeatureVector vectorize(JsonNode statistics);

    /// @return the names of the vector elements, in order
    List<String> fieldNames();

    /// @return the fixed number of elements produced by {@link #vectorize(JsonNode)}
    default int vectorLength() {
        return fieldNames().size();
    }
}
