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

import com.fasterxml.jackson.databind.JsonNode;
import io.statvec.encoding.StatvecJson;
import io.statvec.encoding.schema.SchemaEntry;
import io.statvec.jetty.testserver.JettyTestServerFixture;
import io.statvec.jetty.testserver.StubEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class OrchestratorPollerTest {

    private static final List<SchemaEntry> SCHEMA = List.of(
        new SchemaEntry("smoker", "BOOLEAN", 0, 2, List.of("numOfNotNull", "numOfTrue")),
        new SchemaEntry("year", "NOMINAL", 2, 3, List.of("numOfNotNull", "numUniqueValues", "topValueCount"))
    );
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path resultsDir;

    private JettyTestServerFixture server;
    private StubEndpoint eventuallyDone;
    private StubEndpoint failing;
    private StubEndpoint stuck;

    @BeforeEach
    public void setUp() throws IOException {
        server = new JettyTestServerFixture();
        eventuallyDone = server.stub("/api/job-status/job-7")
            .respond(200, "{\"status\":\"WAITING\"}")
            .respond(404, "{}")
            .respond(200, "{\"status\":\"AGGREGATING\"}")
            .respond(200, "{\"status\":\"COMPLETED\",\"aggregatedResults\":[200,150,28,6,14],"
                + "\"metadata\":{\"participants\":2}}");
        failing = server.stub("/api/job-status/job-8")
            .respond(200, "{\"status\":\"IN_PROGRESS\"}")
            .respond(200, "{\"status\":\"FAILED\"}");
        stuck = server.stub("/api/job-status/job-9").respond(200, "{\"status\":\"running\"}");
        server.start();
    }

    @AfterEach
    public void tearDown() {
        server.close();
    }

    private OrchestratorPoller poller(Duration timeout) {
        return new OrchestratorPoller(new OrchestratorClient(server.getBaseUri()),
            Duration.ofMillis(20), timeout, resultsDir, CLOCK);
    }

    @Test
    public void testCompletedJobSavesResults() throws Exception {
        PollOutcome outcome = poller(Duration.ofSeconds(10)).startPolling("job-7", SCHEMA).get(10, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.polls()).isEqualTo(4);
        assertThat(eventuallyDone.requests()).hasSize(4);

        Path file = outcome.resultsFile().orElseThrow();
        assertThat(file).isEqualTo(resultsDir.resolve("job-7_results_20260301_101530.json"));
        JsonNode saved = StatvecJson.MAPPER.readTree(Files.readString(file));
        assertThat(saved.get("jobId").asText()).isEqualTo("job-7");
        assertThat(saved.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(saved.get("source").asText()).isEqualTo("orchestrator_polling");
        assertThat(saved.get("timestamp").asText()).isEqualTo("2026-03-01T10:15:30");
        assertThat(saved.get("retrievedAt").asText()).isEqualTo("2026-03-01T10:15:30");
        assertThat(saved.get("aggregatedResults").size()).isEqualTo(5);
        assertThat(saved.at("/metadata/participants").asInt()).isEqualTo(2);
        assertThat(saved.at("/decodedResults/smoker").toString()).isEqualTo("[200,150]");
        assertThat(saved.at("/decodedResults/year").toString()).isEqualTo("[28,6,14]");
    }

    @Test
    public void testFailedJobStops() {
        PollOutcome outcome = poller(Duration.ofSeconds(10)).pollUntilComplete("job-8", SCHEMA);
        assertThat(outcome.result()).isEqualTo(PollOutcome.Result.FAILED);
        assertThat(outcome.polls()).isEqualTo(2);
        assertThat(outcome.resultsFile()).isEmpty();
        assertThat(failing.requests()).hasSize(2);
    }

    @Test
    public void testTimeout() {
        PollOutcome outcome = poller(Duration.ofMillis(200)).pollUntilComplete("job-9", SCHEMA);
        assertThat(outcome.result()).isEqualTo(PollOutcome.Result.TIMED_OUT);
        assertThat(outcome.polls()).isGreaterThan(1);
        assertThat(stuck.requests()).hasSize(outcome.polls());
    }

    @Test
    public void testResultsNotMatchingSchemaAreNotDecoded() throws Exception {
        JobStatus status = JobStatus.fromJson(StatvecJson.MAPPER.readTree(
            "{\"status\":\"COMPLETED\",\"aggregatedResults\":[1,2,3]}"));
        Path file = poller(Duration.ofSeconds(1)).saveResults("job-x", status, SCHEMA);

        JsonNode saved = StatvecJson.MAPPER.readTree(Files.readString(file));
        assertThat(saved.has("decodedResults")).isFalse();
        assertThat(saved.get("metadata").isObject()).isTrue();
    }

    @Test
    public void testNonNumericResultsAreNotDecoded() throws Exception {
        JsonNode aggregated = StatvecJson.MAPPER.readTree("[{\"feature\":\"smoker\"}]");
        assertThat(OrchestratorPoller.decode(aggregated, SCHEMA)).isEmpty();
        assertThat(OrchestratorPoller.decode(StatvecJson.MAPPER.readTree("[1,2,3,4,5]"), List.of())).isEmpty();
        assertThat(OrchestratorPoller.decode(StatvecJson.MAPPER.readTree("[1,2,3,4,5]"), SCHEMA)).isPresent();
    }
}
