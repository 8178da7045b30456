/// Per-data-type conversions from a feature statistics record to a fixed-length vector.
///
/// Every vectorizer is stateless and safe to share between threads. Missing statistics are
/// substituted with zeros; only structurally wrong records (a statistics value that is not
/// an object, a non-numeric count) make {@link io.statvec.encoding.vectorizers.FeatureVectorizer#vectorize}
/// throw, and the {@link io.statvec.encoding.Encoder} turns those into a fallback vector.
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
