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

import java.util.List;

/// `[numOfNotNull, numOfTrue]`
public class BooleanVectorizer implements FeatureVectorizer {

    private static final List<String> FIELDS = List.of(StatisticsValues.NUM_OF_NOT_NULL, "numOfTrue");

    @Override
    public FeatureVector vectorize(JsonNode statistics) {
        JsonNode record = StatisticsValues.requireRecord(statistics);
        return FeatureVector.of(
                StatisticsValues.number(record, StatisticsValues.NUM_OF_NOT_NULL, 0L),
                StatisticsValues.number(record, "numOfTrue", 0L)
        );
    }

    @Override
    public List<String> fieldNames() {
        return FIELDS;
    }
}
