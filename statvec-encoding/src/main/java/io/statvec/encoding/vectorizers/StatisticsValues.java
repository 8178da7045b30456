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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/// Lenient readers for loosely-typed statistics records.
public final class StatisticsValues {

    /// count of non-null observations, present in every record shape
    public static final String NUM_OF_NOT_NULL = "numOfNotNull";

    private StatisticsValues() {
    }

    /// @param statistics a statistics record, possibly null
    /// @return the record as an object node; absent records become an empty object
    /// @throws IllegalArgumentException if the record is present but not a JSON object
    public static ObjectNode requireRecord(JsonNode statistics) {
        if (statistics == null || statistics.isNull() || statistics.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!statistics.isObject()) {
            throw new IllegalArgumentException(
                    "statistics must be a JSON object, found " + statistics.getNodeType());
        }
        return (ObjectNode) statistics;
    }

    /// Read a numeric statistic.
    /// @param record the statistics record
    /// @param key the statistic name
    /// @param fallback the value used when the statistic is absent or null
    /// @return a {@link Long} for integral values, a {@link Double} otherwise
    /// @throws IllegalArgumentException if the statistic is present but not numeric
    public static Number number(JsonNode record, String key, Number fallback) {
        JsonNode node = record.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        return toNumber(node, key);
    }

    /// @param record the statistics record
    /// @param key the statistic name
    /// @return the statistic as a double, 0.0 when absent
    public static double real(JsonNode record, String key) {
        return number(record, key, 0.0d).doubleValue();
    }

    /// @param node a JSON value
    /// @param label what the value is, for error messages
    /// @return the value as a {@link Long} or {@link Double}
    /// @throws IllegalArgumentException if the value is not a finite number or finite numeric text
    public static Number toNumber(JsonNode node, String label) {
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return finite(node.doubleValue(), label, node.asText());
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException notIntegral) {
                double parsed;
                try {
                    parsed = Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("statistic '" + label + "' is not numeric: " + text, e);
                }
                return finite(parsed, label, text);
            }
        }
        throw new IllegalArgumentException(
                "statistic '" + label + "' is not numeric: " + node.getNodeType());
    }

    // NaN and infinities have no JSON number form
    private static Double finite(double value, String label, String text) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("statistic '" + label + "' is not a finite number: " + text);
        }
        return value;
    }

    /// @param value a count
    /// @return true if the count is zero
    public static boolean isZero(Number value) {
        return value.doubleValue() == 0.0d;
    }
}
