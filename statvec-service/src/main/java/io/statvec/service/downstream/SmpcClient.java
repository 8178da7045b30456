package io.statvec.service.downstream;

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

import io.statvec.encoding.EncodedVector;
import io.statvec.encoding.StatvecJson;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;

/// Posts an encoder object to an SMPC node at `{baseUrl}/api/update-dataset/{jobId}`.
public class SmpcClient {
    private static final Logger logger = LogManager.getLogger(SmpcClient.class);

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    public static final Duration POST_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final OkHttpClient httpClient;

    public SmpcClient(String baseUrl) {
        this(baseUrl, new OkHttpClient());
    }

    public SmpcClient(String baseUrl, OkHttpClient httpClient) {
        this.baseUrl = Urls.trimTrailingSlash(baseUrl);
        this.httpClient = httpClient.newBuilder().callTimeout(POST_TIMEOUT).build();
    }

    /// Post one encoder for a job.
    /// @param jobId the job identifier
    /// @param encoder the encoder object or aggregated encoder to send
    /// @return true only if the node answered HTTP 200
    public boolean postEncoder(String jobId, EncodedVector encoder) {
        String url = baseUrl + "/api/update-dataset/" + jobId;
        logger.info("posting {}-element encoder to SMPC at {}", encoder.vectorLength(), url);
        try {
            String json = StatvecJson.MAPPER.writeValueAsString(encoder);
            Request request = new Request.Builder().url(url).post(RequestBody.create(json, JSON)).build();
            try (Response response = httpClient.newCall(request).execute()) {
                logger.info("SMPC response: {} {}", response.code(), response.message());
                if (response.code() == 200) {
                    return true;
                }
                logger.warn("SMPC did not accept the encoder for job {}: HTTP {}", jobId, response.code());
                return false;
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("error posting encoder to SMPC at {}: {}", url, e.getMessage());
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
