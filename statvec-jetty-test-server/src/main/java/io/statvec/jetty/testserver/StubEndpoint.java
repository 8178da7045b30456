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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// A canned HTTP endpoint that records what it receives.
///
/// Responses are queued with {@link #respond(int, String)} and handed out in order. The last
/// queued response is repeated once the queue is down to one entry, so a single call sets a
/// fixed reply and several calls script a conversation (for example a job that reports
/// `running` twice before `completed`).
public class StubEndpoint extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(StubEndpoint.class);

    private final String path;
    private final Deque<Response> responses = new ArrayDeque<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    StubEndpoint(String path) {
        this.path = path;
    }

    /// Queue a JSON response.
    /// @param status the HTTP status code
    /// @param body the response body
    /// @return this endpoint, for chaining
    public StubEndpoint respond(int status, String body) {
        synchronized (responses) {
            responses.addLast(new Response(status, body));
        }
        return this;
    }

    /// @return the requests received so far, oldest first
    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    /// @return the most recent request body, or null when nothing was received
    public String lastBody() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1).body();
    }

    /// @return the path this endpoint is mounted on
    public String path() {
        return path;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new RecordedRequest(req.getMethod(), req.getRequestURI(), req.getQueryString(),
            req.getContentType(), body));
        logger.debug("{} {} ({} bytes)", req.getMethod(), req.getRequestURI(), body.length());

        Response response = next();
        resp.setStatus(response.status());
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(response.body());
    }

    private Response next() {
        synchronized (responses) {
            if (responses.isEmpty()) {
                return new Response(HttpServletResponse.SC_OK, "{}");
            }
            return responses.size() > 1 ? responses.pollFirst() : responses.peekFirst();
        }
    }

    private record Response(int status, String body) {
    }
}
