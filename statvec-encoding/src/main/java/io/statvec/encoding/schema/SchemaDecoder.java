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

import io.statvec.encoding.FeatureVector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Slices an aggregate vector back into per-feature vectors using a schema list.
public final class SchemaDecoder {

    private SchemaDecoder() {
    }

    /// @param schema the schema list the aggregate was built with
    /// @param aggregate the flattened vector
    /// @return feature name to vector, in schema order
    /// @throws IllegalArgumentException
    ///     if the schema has gaps or overlaps, or does not cover the aggregate exactly
    public static Map<String, FeatureVector> split(List<SchemaEntry> schema, FeatureVector aggregate) {
        validate(schema);
        int covered = schema.isEmpty() ? 0 : schema.get(schema.size() - 1).end();
        if (covered != aggregate.length()) {
            throw new IllegalArgumentException(
                    "schema covers " + covered + " elements but the vector has " + aggregate.length());
        }
        Map<String, FeatureVector> features = new LinkedHashMap<>();
        for (SchemaEntry entry : schema) {
            features.put(entry.featureName(), aggregate.slice(entry.offset(), entry.length()));
        }
        return features;
    }

    /// @param schema a schema list
    /// @throws IllegalArgumentException
    ///     unless the first entry starts at 0 and every entry starts where the previous one ended
    public static void validate(List<SchemaEntry> schema) {
        int expected = 0;
        for (SchemaEntry entry : schema) {
            if (entry.offset() != expected) {
                throw new IllegalArgumentException(
                        "schema entry '" + entry.featureName() + "' starts at " + entry.offset() + ", expected " + expected);
            }
            expected = entry.end();
        }
    }
}
