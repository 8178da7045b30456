package io.statvec.jetty.testserver;

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

/// A request received by a {@link StubEndpoint}.
/// @param method the HTTP method
/// @param path the request path, without the query string
/// @param query the raw query string, or null
/// @param contentType the content type header, or null
/// @param body the request body decoded as UTF-8
public record RecordedRequest(String method, String path, String query, String contentType, String body) {
}
