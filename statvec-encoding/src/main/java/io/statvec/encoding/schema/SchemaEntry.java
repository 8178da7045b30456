package io.statvec.encoding.schema;

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

/// Where one feature's vector sits in a flattened aggregate vector.
/// @param featureName the feature name
/// @param dataType the upper-cased data type name
/// @param offset index of the first element in the aggregate vector
/// @param length number of elements
/// @param fields the element names; empty when the fallback vector was used
@JsonPropertyOrder({"featureName", "dataType", "offset", "length", "fields"})
public record SchemaEntry(String featureName, String dataType, int offset, int length, List<String> fields) {

    public SchemaEntry {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset and length must be non-negative: " + offset + "," + length);
        }
        fields = List.copyOf(fields);
    }

    /// @return the offset just past this entry
    public int end() {
        return offset + length;
    }
}
