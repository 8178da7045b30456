/// Turns loosely-typed feature statistics into fixed-length numeric vectors.
///
/// ## Key Components
///
/// - {@link io.statvec.encoding.VectorizationEngine}: reads a dataset, vectorizes each feature
///   and flattens the vectors into one aggregate
/// - {@link io.statvec.encoding.Encoder}: vectorizer registry and encoder object factory
/// - {@link io.statvec.encoding.schema.SchemaBuilder}: offset directory of the aggregate
///
/// ## Usage Example
///
/// ```java
/// EnhancementResult result = new VectorizationEngine().enhance(dataset);
/// EncodedVector aggregate = result.firstEncoder();
/// List<SchemaEntry> schema = result.schema();
/// ```
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
