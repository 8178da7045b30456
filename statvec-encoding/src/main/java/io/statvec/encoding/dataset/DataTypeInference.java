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
import io.statvec.encoding.DataType;

import java.util.Iterator;
import java.util.Set;

/// Guesses a feature's data type from the shape of its statistics record.
public final class DataTypeInference {

    private static final Set<String> RECOGNIZED = Set.of(
            "numOfNotNull", "numOfTrue", "valueSet", "cardinalityPerItem",
            "min", "max", "avg", "q1", "q2", "q3"
    );

    private DataTypeInference() {
    }

    /// Checked in order: `numOfTrue` is boolean; `valueSet` with `cardinalityPerItem` is
    /// nominal; `min`, `max` and `avg` together are numeric; a lone `numOfNotNull` is a
    /// datetime. Anything else is unknown.
    /// @param statistics a statistics record
    /// @return the inferred type
    public static DataType infer(JsonNode statistics) {
        if (statistics == null || !statistics.isObject()) {
            return DataType.UNKNOWN;
        }
        if (statistics.has("numOfTrue")) {
            return DataType.BOOLEAN;
        }
        if (statistics.has("valueSet") && statistics.has("cardinalityPerItem")) {
            return DataType.NOMINAL;
        }
        if (statistics.has("min") && statistics.has("max") && statistics.has("avg")) {
            return DataType.NUMERIC;
        }
        if (statistics.has("numOfNotNull") && recognizedFieldCount(statistics) == 1) {
            return DataType.DATETIME;
        }
        return DataType.UNKNOWN;
    }

    private static int recognizedFieldCount(JsonNode statistics) {
        int count = 0;
        Iterator<String> names = statistics.fieldNames();
        while (names.hasNext()) {
            if (RECOGNIZED.contains(names.next())) {
                count++;
            }
        }
        return count;
    }
}
