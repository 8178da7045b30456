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

import java.util.Iterator;
import java.util.List;

/// `[numOfNotNull, numUniqueValues, topValueCount]`, shared by nominal and ordinal features.
///
/// `numUniqueValues` is the size of `valueSet`. `topValueCount` is the largest count in
/// `cardinalityPerItem`, which may be a list of counts or a category to count mapping. Any other
/// shape counts as zero.
public class CategoricalVectorizer implements FeatureVectorizer {

    private static final List<String> FIELDS =
            List.of(StatisticsValues.NUM_OF_NOT_NULL, "numUniqueValues", "topValueCount");

    @Override
    public FeatureVector vectorize(JsonNode statistics) {
        JsonNode record = StatisticsValues.requireRecord(statistics);
        Number notNull = StatisticsValues.number(record, StatisticsValues.NUM_OF_NOT_NULL, 0L);
        if (StatisticsValues.isZero(notNull)) {
            return FeatureVector.of(0L, 0L, 0L);
        }
        return FeatureVector.of(
                notNull,
                uniqueValues(record.get("valueSet")),
                topValueCount(record.get("cardinalityPerItem"))
        );
    }

    private static long uniqueValues(JsonNode valueSet) {
        if (valueSet != null && (valueSet.isArray() || valueSet.isObject())) {
            return valueSet.size();
        }
        return 0L;
    }

    private static Number topValueCount(JsonNode cardinality) {
        if (cardinality == null || !(cardinality.isArray() || cardinality.isObject())) {
            return 0L;
        }
        Number top = null;
        Iterator<JsonNode> counts = cardinality.elements();
        while (counts.hasNext()) {
            Number count = StatisticsValues.toNumber(counts.next(), "cardinalityPerItem");
            if (top == null || count.doubleValue() > top.doubleValue()) {
                top = count;
            }
        }
        return top == null ? 0L : top;
    }

    @Override
    public List<String> fieldNames() {
        return FIELDS;
    }
}
