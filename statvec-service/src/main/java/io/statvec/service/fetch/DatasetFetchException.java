package io.statvec.service.fetch;

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

import java.io.IOException;

/// A remote dataset could not be retrieved: transport failure or a non-2xx response.
public class DatasetFetchException extends IOException {

    private final String url;
    private final int statusCode;

    /// Create an exception for an HTTP error response.
    /// @param url the requested URL
    /// @param statusCode the response status
    /// @param reason the response message
    public DatasetFetchException(String url, int statusCode, String reason) {
        super("HTTP " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason) + " for url: " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    /// Create an exception for a transport failure.
    /// @param url the requested URL
    /// @param cause the underlying failure
    public DatasetFetchException(String url, Throwable cause) {
        super(cause.getMessage() == null ? cause.getClass().getSimpleName() + " for url: " + url
            : cause.getMessage() + " for url: " + url, cause);
        this.url = url;
        this.statusCode = -1;
    }

    /// @return the requested URL
    public String getUrl() {
        return url;
    }

    /// @return the HTTP status, or -1 when no response was received
    public int getStatusCode() {
        return statusCode;
    }
}
