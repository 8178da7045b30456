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
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/// Reads datasets whose `entries` is a list of entries, each holding a
/// `featureSet.features` list of `{name, dataType, statistics}` objects.
public class LegacyDatasetReader implements DatasetReader {

    @Override
    public List<FeatureRecord> read(JsonNode dataset) {
        List<FeatureRecord> features = new ArrayList<>();
        for (JsonNode entry : dataset.get(DatasetFormat.ENTRIES)) {
            JsonNode featureList = entry.path("featureSet").path("features");
            if (!featureList.isArray()) {
                continue;
            }
            for (JsonNode feature : featureList) {
                if (feature instanceof ObjectNode node) {
                    features.add(new FeatureRecord(
                            node.path("name").textValue(),
                            node.path("dataType").textValue(),
                            node.get("statistics"),
                            node,
                            null
                    ));
                }
            }
        }
        return features;
    }
}
