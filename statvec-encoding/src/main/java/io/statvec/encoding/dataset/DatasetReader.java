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

import java.util.List;

/// Reads the features of one dataset layout into a common form.
public interface DatasetReader {

    /// @param dataset
    ///     the working copy of a dataset; returned records point into this tree
    /// @return the features in encounter order
    List<FeatureRecord> read(JsonNode dataset);
}
