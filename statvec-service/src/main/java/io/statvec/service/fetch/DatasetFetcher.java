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

import com.fasterxml.jackson.databind.JsonNode;
import io.statvec.encoding.StatvecJson;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/// Loads a dataset from a URL, a local file, or a study API.
///
/// A location is treated as a URL only when it has both a scheme and a host. Anything else is
/// a filesystem path. Absolute paths must exist as given; relative paths are tried against an
/// ordered list of candidates: the path itself, then the path under each configured dataset
/// root, then under `..` and `./app`. The first existing candidate wins.
public class DatasetFetcher {
    private static final Logger logger = LogManager.getLogger(DatasetFetcher.class);

    public static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);

    private final OkHttpClient httpClient;
    private final List<Path> datasetRoots;

    /// @param datasetRoots directories to try for relative paths, in order
    public DatasetFetcher(List<Path> datasetRoots) {
        this(new OkHttpClient(), datasetRoots);
    }

    /// @param httpClient the client to share connections with
    /// @param datasetRoots directories to try for relative paths, in order
    public DatasetFetcher(OkHttpClient httpClient, List<Path> datasetRoots) {
        this.httpClient = httpClient.newBuilder().callTimeout(FETCH_TIMEOUT).build();
        this.datasetRoots = List.copyOf(datasetRoots);
    }

    /// @param location a dataset location
    /// @return true if the location has both a scheme and a host
    public static boolean isUrl(String location) {
        try {
            URI uri = new URI(location);
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /// Load a dataset.
    /// @param location a URL or a filesystem path
    /// @return the parsed dataset
    /// @throws DatasetNotFoundException if a path does not resolve to a file
    /// @throws DatasetFetchException if a URL cannot be retrieved
    /// @throws IOException if the content is not valid JSON or cannot be read
    public JsonNode fetch(String location) throws IOException {
        if (isUrl(location)) {
            return fetchUrl(location);
        }
        return fetchFile(location);
    }

    /// Load a dataset from a study API, at `{baseApiUrl}/api/datasets/{studyId}`.
    /// @param baseApiUrl the API base URL
    /// @param studyId the study identifier
    /// @return the parsed dataset
    /// @throws DatasetFetchException if the base URL is invalid or the request fails
    /// @throws IOException if the content is not valid JSON
    public JsonNode fetchStudy(String baseApiUrl, String studyId) throws IOException {
        HttpUrl base = HttpUrl.parse(baseApiUrl);
        if (base == null) {
            throw new DatasetFetchException(baseApiUrl,
                new IllegalArgumentException("not an http or https URL"));
        }
        HttpUrl url = base.newBuilder()
            .addPathSegment("api")
            .addPathSegment("datasets")
            .addPathSegment(studyId)
            .build();
        logger.info("fetching study {} from {}", studyId, url);
        return fetchUrl(url.toString());
    }

    /// @param location a relative or absolute path
    /// @return the paths tried for that location, in order
    public List<Path> candidates(String location) {
        Path path = Path.of(location);
        List<Path> candidates = new ArrayList<>();
        candidates.add(path);
        if (path.isAbsolute()) {
            return candidates;
        }
        for (Path root : datasetRoots) {
            candidates.add(root.resolve(path));
        }
        candidates.add(Path.of("..").resolve(path));
        candidates.add(Path.of("app").resolve(path));
        return candidates;
    }

    private JsonNode fetchUrl(String url) throws IOException {
        logger.info("fetching dataset from URL: {}", url);
        Request request;
        try {
            request = new Request.Builder().url(url).header("Accept", "application/json").get().build();
        } catch (IllegalArgumentException e) {
            throw new DatasetFetchException(url, e);
        }

        String content;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DatasetFetchException(url, response.code(), response.message());
            }
            ResponseBody body = response.body();
            content = body == null ? "" : body.string();
        } catch (DatasetFetchException e) {
            throw e;
        } catch (IOException e) {
            throw new DatasetFetchException(url, e);
        }
        logger.debug("received {} characters from {}", content.length(), url);
        return StatvecJson.MAPPER.readTree(content);
    }

    private JsonNode fetchFile(String location) throws IOException {
        List<Path> candidates;
        try {
            candidates = candidates(location);
        } catch (InvalidPathException e) {
            throw new DatasetNotFoundException(location, List.of());
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                logger.info("reading dataset from {}", candidate);
                return StatvecJson.MAPPER.readTree(candidate.toFile());
            }
        }
        throw new DatasetNotFoundException(location, candidates);
    }
}
