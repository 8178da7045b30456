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

/// The dataset layouts that can be vectorized.
public enum DatasetFormat {
    /// `entries` is an object mapping feature name to statistics
    DIRECT(new DirectDatasetReader()),
    /// `entries` is a list of entries holding `featureSet.features`
    LEGACY(new LegacyDatasetReader()),
    /// anything else; nothing is vectorized
    UNKNOWN(null);

    /// the top level field holding a dataset's features
    public static final String ENTRIES = "entries";

    private final DatasetReader reader;

    DatasetFormat(DatasetReader reader) {
        this.reader = reader;
    }

    /// @return the reader for this layout
    /// @throws IllegalStateException for {@link #UNKNOWN}
    public DatasetReader reader() {
        if (reader == null) {
            throw new IllegalStateException("no reader for " + this + " datasets");
        }
        return reader;
    }

    /// @param dataset a parsed dataset, possibly null
    /// @return the layout of the dataset
    public static DatasetFormat detect(JsonNode dataset) {
        if (dataset == null || !dataset.isObject()) {
            return UNKNOWN;
        }
        JsonNode entries = dataset.get(ENTRIES);
        if (entries == null) {
            return UNKNOWN;
        }
        if (entries.isObject()) {
            return DIRECT;
        }
        if (entries.isArray()) {
            return LEGACY;
        }
        return UNKNOWN;
    }
}
