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

import io.statvec.encoding.DataType;
import io.statvec.encoding.FeatureVector;

import java.util.ArrayList;
import java.util.List;

/// Assigns contiguous offset ranges to feature vectors in the order they are appended.
///
/// The first entry starts at 0 and each following entry starts where the previous one ended.
/// Appending the same features in the same order always produces the same schema, which lets
/// independent parties agree on offsets without talking to each other.
public class SchemaBuilder {

    private final List<SchemaEntry> entries = new ArrayList<>();
    private int offset = 0;

    /// @param featureName the feature name
    /// @param dataType the data type name
    /// @param vector the feature's vector
    /// @param fields the element names of the vector
    /// @return the entry recorded for this feature
    public SchemaEntry append(String featureName, String dataType, FeatureVector vector, List<String> fields) {
        SchemaEntry entry = new SchemaEntry(featureName, DataType.normalize(dataType), offset, vector.length(),
                fields.size() == vector.length() ? fields : List.of());
        entries.add(entry);
        offset += vector.length();
        return entry;
    }

    /// @return the entries so far, in append order
    public List<SchemaEntry> entries() {
        return List.copyOf(entries);
    }

    /// @return the total number of elements covered
    public int totalLength() {
        return offset;
    }
}
