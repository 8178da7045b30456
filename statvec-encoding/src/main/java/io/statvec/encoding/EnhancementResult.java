package io.statvec.encoding;

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
import io.statvec.encoding.dataset.DatasetFormat;
import io.statvec.encoding.schema.SchemaEntry;

import java.util.List;

/// The output of one {@link VectorizationEngine#enhance} call.
/// @param enhancedDataset
///     the dataset with `vectorized_statistics` added to every vectorized feature
/// @param encoders
///     a single {@link AggregatedEncoder} for a full dataset; the per-feature encoders (at most
///     one) for a query, or when nothing was vectorized
/// @param schema
///     the offset directory of the vectorized features
/// @param format
///     the detected dataset layout
public record EnhancementResult(
        JsonNode enhancedDataset,
        List<EncodedVector> encoders,
        List<SchemaEntry> schema,
        DatasetFormat format
) {

    public EnhancementResult {
        encoders = List.copyOf(encoders);
        schema = List.copyOf(schema);
    }

    /// @return the encoder sent downstream: the first one, or an empty placeholder
    public EncodedVector firstEncoder() {
        return encoders.isEmpty() ? EncoderObject.empty() : encoders.get(0);
    }
}
