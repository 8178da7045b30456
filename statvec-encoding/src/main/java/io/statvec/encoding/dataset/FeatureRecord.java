package io.statvec.encoding.dataset;

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
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/// One feature read from a dataset, independent of the dataset's layout.
/// @param name
///     the feature name
/// @param declaredType
///     the data type declared by dataset metadata, or null when it must be inferred
/// @param statistics
///     the statistics record, possibly null
/// @param container
///     the node of the working dataset that receives the vectorized statistics
/// @param field
///     the field of {@code container} holding this feature's statistics, or null when the
///     vectorized statistics go directly on {@code container}
public record FeatureRecord(
        String name,
        String declaredType,
        JsonNode statistics,
        ObjectNode container,
        String field
) {

    /// the field added to each vectorized feature
    public static final String VECTORIZED_STATISTICS = "vectorized_statistics";

    /// holds the original value of a keyed entry that was not an object once it has been wrapped
    public static final String ORIGINAL_STATISTICS = "statistics";

    public FeatureRecord {
        Objects.requireNonNull(container, "container");
    }

    /// @return true if metadata declares a non-blank data type
    public boolean hasDeclaredType() {
        return declaredType != null && !declaredType.isBlank();
    }

    /// Store the vectorized statistics for this feature.
    ///
    /// A keyed entry whose value is not an object is replaced by
    /// `{"statistics": <original value>, "vectorized_statistics": ...}`.
    /// @param vectorized the value to store under {@value #VECTORIZED_STATISTICS}
    public void attach(JsonNode vectorized) {
        if (field == null) {
            container.set(VECTORIZED_STATISTICS, vectorized);
            return;
        }
        JsonNode current = container.get(field);
        ObjectNode holder;
        if (current instanceof ObjectNode node) {
            holder = node;
        } else {
            holder = container.objectNode();
            holder.set(ORIGINAL_STATISTICS, current == null ? NullNode.getInstance() : current);
            container.set(field, holder);
        }
        holder.set(VECTORIZED_STATISTICS, vectorized);
    }
}
