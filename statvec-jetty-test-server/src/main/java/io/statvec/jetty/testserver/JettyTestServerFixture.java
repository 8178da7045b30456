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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A test fixture that starts a Jetty web server hosting dataset files and stub endpoints.
 * <p>
 * Files under the resources root are served as-is. Stub endpoints registered with
 * {@link #stub(String)} before {@link #start()} stand in for the downstream services a
 * pipeline talks to and record every request they receive.
 * <p>
 * Example usage:
 * ```java
 * try (JettyTestServerFixture server = new JettyTestServerFixture(Path.of("src/test/resources/testserver"))) {
 *     StubEndpoint smpc = server.stub("/api/update-dataset").respond(200, "{}");
 *     server.start();
 *     String datasetUrl = server.url("datasets/cohort.json");
 *     // exercise code against datasetUrl and smpc
 * }
 * ```
 */
public class JettyTestServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyTestServerFixture.class);

    private Server server;
    private int port;
    private final Path resourcesRoot;
    private final Map<String, StubEndpoint> stubs = new LinkedHashMap<>();
    private final Map<Path, FileTime> fileTimestamps = new HashMap<>();

    /**
     * Creates a fixture that serves no files, only stub endpoints.
     */
    public JettyTestServerFixture() {
        this(null);
    }

    /**
     * Creates a fixture serving files from the given directory.
     *
     * @param resourcesRoot The root directory containing the files to serve, or null for none
     */
    public JettyTestServerFixture(Path resourcesRoot) {
        this.resourcesRoot = resourcesRoot;
        if (resourcesRoot != null) {
            if (!Files.isDirectory(resourcesRoot)) {
                throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
            }
            snapshotTimestamps(resourcesRoot);
        }
    }

    /**
     * Registers a stub endpoint. Stubs must be registered before the server is started.
     *
     * @param path the exact request path, starting with '/'
     * @return the endpoint, for queuing responses and reading recorded requests
     */
    public StubEndpoint stub(String path) {
        if (server != null) {
            throw new IllegalStateException("stubs must be registered before start(): " + path);
        }
        return stubs.computeIfAbsent(path, StubEndpoint::new);
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        server.setHandler(context);

        for (StubEndpoint stub : stubs.values()) {
            context.addServlet(new ServletHolder(stub), stub.path());
        }

        if (resourcesRoot != null) {
            context.setResourceBase(resourcesRoot.toAbsolutePath().toString());
            ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
            defaultServlet.setInitParameter("dirAllowed", "false");
            defaultServlet.setInitParameter("etags", "true");
            context.addServlet(defaultServlet, "/");
        }

        try {
            server.start();
            logger.info("Jetty test server started on port {} with {} stubs, serving {}",
                port, stubs.size(), resourcesRoot == null ? "no files" : resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server.
     *
     * @return The base URL of the server, ending in '/'
     */
    public URL getBaseUrl() {
        try {
            return new URL(getBaseUri() + "/");
        } catch (Exception e) {
            throw new RuntimeException("Failed to create server URL", e);
        }
    }

    /// @return the base URL as a string without a trailing '/'
    public String getBaseUri() {
        return "http://127.0.0.1:" + port;
    }

    /// @param relative a path relative to the server root, with or without a leading '/'
    /// @return the absolute URL of that path on this server
    public String url(String relative) {
        return getBaseUri() + (relative.startsWith("/") ? relative : "/" + relative);
    }

    /**
     * Stops the server and verifies that no served file has been modified.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
        checkForModifiedFiles();
    }

    private void snapshotTimestamps(Path directory) {
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    fileTimestamps.put(file, Files.getLastModifiedTime(file));
                    return FileVisitResult.CONTINUE;
                }
            });
            logger.debug("Took timestamp snapshot of {} files in {}", fileTimestamps.size(), directory);
        } catch (IOException e) {
            logger.warn("Failed to take file timestamp snapshot: {}", e.getMessage());
        }
    }

    private void checkForModifiedFiles() {
        for (Map.Entry<Path, FileTime> entry : fileTimestamps.entrySet()) {
            Path file = entry.getKey();
            try {
                if (!Files.exists(file)) {
                    throw new IllegalStateException("Tests are not allowed to delete served files: " + file);
                }
                if (!Files.getLastModifiedTime(file).equals(entry.getValue())) {
                    throw new IllegalStateException("Tests are not allowed to modify served files: " + file);
                }
            } catch (IOException e) {
                logger.warn("Failed to check {} for modification: {}", file, e.getMessage());
            }
        }
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }
}
