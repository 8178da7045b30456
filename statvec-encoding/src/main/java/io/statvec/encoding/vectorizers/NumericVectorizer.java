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

import java.util.ArrayList;
import java.util.List;

/// `[numOfNotNull, min, max, avg, q1, q2, q3]`
///
/// A record with no non-null observations yields `[0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0]`, whatever
/// else it holds. Missing summary statistics are written as `0.0`.
public class NumericVectorizer implements FeatureVectorizer {

    private static final List<String> SUMMARY = List.of("min", "max", "avg", "q1", "q2", "q3");
    private static final List<String> FIELDS;

    static {
        List<String> fields = new ArrayList<>();
        fields.add(StatisticsValues.NUM_OF_NOT_NULL);
        fields.addAll(SUMMARY);
        FIELDS = List.copyOf(fields);
    }

    @Override
    public FeatureVector vectorize(JsonNode statistics) {
        JsonNode record = StatisticsValues.requireRecord(statistics);
        Number notNull = StatisticsValues.number(record, StatisticsValues.NUM_OF_NOT_NULL, 0L);

        List<Number> values = new ArrayList<>(FIELDS.size());
        if (StatisticsValues.isZero(notNull)) {
            values.add(0L);
            for (int i = 0; i < SUMMARY.size(); i++) {
                values.add(0.0d);
            }
            return new FeatureVector(values);
        }

        values.add(notNull);
        for (String field : SUMMARY) {
            values.add(StatisticsValues.real(record, field));
        }
        return new FeatureVector(values);
    }

    @Override
    public List<String> fieldNames() {
        return FIELDS;
    }
}
