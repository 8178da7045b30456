package io.statvec.service.http;

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

import io.statvec.service.pipeline.VectorizationPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;

/// Embedded Jetty server exposing the `/vectorize` endpoint.
///
/// Port 0 binds a free port, which {@link #getPort()} reports once started.
public class VectorizationServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(VectorizationServer.class);

    public static final String VECTORIZE_PATH = "/vectorize";

    private final String host;
    private final int requestedPort;
    private final VectorizationPipeline pipeline;
    private Server server;
    private ServerConnector connector;

    public VectorizationServer(VectorizationPipeline pipeline, int port) {
        this(pipeline, "0.0.0.0", port);
    }

    public VectorizationServer(VectorizationPipeline pipeline, String host, int port) {
        this.pipeline = pipeline;
        this.host = host;
        this.requestedPort = port;
    }

    /// Start serving.
    /// @throws IOException if the server cannot be started
    public void start() throws IOException {
        server = new Server();
        connector = new ServerConnector(server);
        connector.setHost(host);
        connector.setPort(requestedPort);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new VectorizeServlet(pipeline)), VECTORIZE_PATH);
        server.setHandler(context);

        try {
            server.start();
        } catch (Exception e) {
            throw new IOException("Failed to start vectorization server on port " + requestedPort, e);
        }
        logger.info("vectorization service listening on {}:{}", host, getPort());
    }

    /// Block until the server stops.
    /// @throws InterruptedException if interrupted while waiting
    public void join() throws InterruptedException {
        server.join();
    }

    /// @return the bound port, or the requested port before start
    public int getPort() {
        return connector == null ? requestedPort : connector.getLocalPort();
    }

    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("vectorization service stopped");
            } catch (Exception e) {
                logger.error("Error stopping vectorization server", e);
            }
        }
    }
}
