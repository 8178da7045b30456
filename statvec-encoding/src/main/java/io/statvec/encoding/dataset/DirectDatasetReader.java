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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Reads datasets whose `entries` maps feature names to statistics records. An optional
/// sibling `features` list of `{name, dataType}` supplies declared types.
///
/// Vectorized statistics are attached inside each entry's record; an entry that is not an
/// object is wrapped as `{"statistics": <value>, "vectorized_statistics": ...}`.
public class DirectDatasetReader implements DatasetReader {

    @Override
    public List<FeatureRecord> read(JsonNode dataset) {
        Map<String, String> declaredTypes = declaredTypes(dataset.get("features"));
        List<FeatureRecord> features = new ArrayList<>();
        ObjectNode container = (ObjectNode) dataset.get(DatasetFormat.ENTRIES);
        Iterator<Map.Entry<String, JsonNode>> entries = container.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            features.add(new FeatureRecord(
                    entry.getKey(),
                    declaredTypes.get(entry.getKey()),
                    entry.getValue(),
                    container,
                    entry.getKey()
            ));
        }
        return features;
    }

    private static Map<String, String> declaredTypes(JsonNode metadata) {
        Map<String, String> types = new HashMap<>();
        if (metadata == null || !metadata.isArray()) {
            return types;
        }
        for (JsonNode feature : metadata) {
            JsonNode name = feature.get("name");
            JsonNode dataType = feature.get("dataType");
            if (name != null && name.isTextual() && dataType != null && dataType.isTextual()) {
                types.put(name.textValue(), dataType.textValue());
            }
        }
        return types;
    }
}
