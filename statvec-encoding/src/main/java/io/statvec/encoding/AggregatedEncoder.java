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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/// All per-feature vectors of one dataset flattened into a single vector, in schema order.
/// @param type
///     always {@link WireType#MIXED}; receivers read per-feature kinds from the schema
/// @param data
///     the concatenated vectors
/// @param vectorLength
///     the total number of values
/// @param totalFeatures
///     how many feature vectors were concatenated
/// @param supportedDataTypes
///     the data types this encoder version can vectorize
@JsonPropertyOrder({"type", "data", "vectorLength", "totalFeatures", "supportedDataTypes"})
public record AggregatedEncoder(
        WireType type,
        FeatureVector data,
        int vectorLength,
        int totalFeatures,
        List<String> supportedDataTypes
) implements EncodedVector {

    public AggregatedEncoder {
        supportedDataTypes = List.copyOf(supportedDataTypes);
    }

    /// Flatten per-feature encoders into one.
    /// @param parts the per-feature encoders, in schema order
    /// @param supportedDataTypes the supported data type names
    /// @return the aggregate
    public static AggregatedEncoder of(List<EncoderObject> parts, List<String> supportedDataTypes) {
        FeatureVector flattened = FeatureVector.concat(parts.stream().map(EncoderObject::data).toList());
        return new AggregatedEncoder(
                WireType.MIXED,
                flattened,
                flattened.length(),
                parts.size(),
                supportedDataTypes
        );
    }
}
