package io.statvec.encoding;

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

import java.util.List;

/// Describes the vector layout produced for one data type.
/// @param dataType the upper-cased data type name
/// @param vectorLength the number of elements
/// @param fields the element names, in order
public record VectorSchema(String dataType, int vectorLength, List<String> fields) {
    public VectorSchema {
        fields = List.copyOf(fields);
    }
}
