/// The `statvec` command line.
///
/// - `statvec vectorize --url cohort.json --jobId job-1 --totalClients 2` runs one request
/// - `statvec serve --port 5001` runs the HTTP endpoint
/// - `statvec types` prints the vector layout of each supported data type
package io.statvec.service.cli;


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
