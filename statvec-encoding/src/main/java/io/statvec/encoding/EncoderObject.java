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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// The encoded form of a single feature's vector.
/// @param type
///     the wire type derived from the data type
/// @param data
///     the vector, unmodified
/// @param dataType
///     the upper-cased data type name; null only for the empty placeholder payload
/// @param vectorLength
///     the number of elements in {@code data}
@JsonPropertyOrder({"type", "data", "dataType", "vectorLength"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncoderObject(WireType type, FeatureVector data, String dataType, int vectorLength)
        implements EncodedVector {

    public EncoderObject {
        if (data.length() != vectorLength) {
            throw new IllegalArgumentException(
                    "vectorLength " + vectorLength + " does not match data length " + data.length());
        }
    }

    /// @return the payload sent downstream when a dataset produced no vectors at all
    public static EncoderObject empty() {
        return new EncoderObject(WireType.INT, FeatureVector.EMPTY, null, 0);
    }
}
