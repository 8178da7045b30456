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

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class OrchestratorClientTest {

    private static final List<SchemaEntry> SCHEMA = List.of(
        new SchemaEntry("smoker", "BOOLEAN", 0, 2, List.of("numOfNotNull", "numOfTrue")),
        new SchemaEntry("year", "NOMINAL", 2, 3, List.of("numOfNotNull", "numUniqueValues", "topValueCount"))
    );

    private JettyTestServerFixture server;
    private StubEndpoint update;
    private OrchestratorClient client;

    @BeforeEach
    public void setUp() throws IOException {
        server = new JettyTestServerFixture();
        update = server.stub("/api/update").respond(200, "{}");
        server.stub("/api/job-status/done").respond(200,
            "{\"status\":\"COMPLETED\",\"aggregatedResults\":[1,2,3],\"metadata\":{\"clients\":2}}");
        server.stub("/api/job-status/odd").respond(200, "{\"status\":\"Paused\"}");
        server.stub("/api/job-status/bare").respond(200, "{}");
        server.stub("/api/job-status/list").respond(200, "[]");
        server.stub("/api/job-status/gone").respond(404, "{}");
        server.stub("/api/job-status/broken").respond(500, "{}");
        server.start();
        client = new OrchestratorClient(server.getBaseUri());
    }

    @AfterEach
    public void tearDown() {
        server.close();
    }

    @Test
    public void testNotifySendsSchema() throws IOException {
        assertThat(client.notify("job-1", "hospital-a", 3, SCHEMA)).isTrue();

        JsonNode body = StatvecJson.MAPPER.readTree(update.lastBody());
        assertThat(body.get("jobId").asText()).isEqualTo("job-1");
        assertThat(body.get("clientId").asText()).isEqualTo("hospital-a");
        assertThat(body.get("totalClients").asInt()).isEqualTo(3);
        assertThat(body.get("schema").size()).isEqualTo(2);
        assertThat(body.at("/schema/1/featureName").asText()).isEqualTo("year");
        assertThat(body.at("/schema/1/offset").asInt()).isEqualTo(2);
        assertThat(body.at("/schema/0/fields/1").asText()).isEqualTo("numOfTrue");
    }

    @Test
    public void testNotifyFailure() {
        OrchestratorClient unreachable = new OrchestratorClient("http://127.0.0.1:1");
        assertThat(unreachable.notify("job-1", "hospital-a", 3, SCHEMA)).isFalse();
    }

    @Test
    public void testCompletedStatus() {
        Optional<JobStatus> status = client.jobStatus("done");
        assertThat(status).isPresent();
        assertThat(status.get().state()).isEqualTo(JobState.COMPLETED);
        assertThat(status.get().aggregatedResults().size()).isEqualTo(3);
        assertThat(status.get().metadata().get("clients").asInt()).isEqualTo(2);
    }

    @Test
    public void testUnrecognizedAndMissingStatus() {
        JobStatus odd = client.jobStatus("odd").orElseThrow();
        assertThat(odd.state()).isEqualTo(JobState.UNKNOWN);
        assertThat(odd.status()).isEqualTo("Paused");
        assertThat(odd.aggregatedResults().isArray()).isTrue();
        assertThat(odd.metadata().isObject()).isTrue();

        assertThat(client.jobStatus("bare").orElseThrow().state()).isEqualTo(JobState.UNKNOWN);
    }

    @Test
    public void testUnusableResponsesAreEmpty() {
        assertThat(client.jobStatus("gone")).isEmpty();
        assertThat(client.jobStatus("broken")).isEmpty();
        assertThat(client.jobStatus("list")).isEmpty();
        assertThat(new OrchestratorClient("http://127.0.0.1:1").jobStatus("x")).isEmpty();
    }

    @Test
    public void testJobStateParsing() {
        assertThat(JobState.parse("in_progress")).isEqualTo(JobState.IN_PROGRESS);
        assertThat(JobState.parse(" Aggregating ")).isEqualTo(JobState.AGGREGATING);
        assertThat(JobState.parse("RUNNING")).isEqualTo(JobState.UNKNOWN);
        assertThat(JobState.parse(null)).isEqualTo(JobState.UNKNOWN);
        assertThat(JobState.FAILED.isFailure()).isTrue();
        assertThat(JobState.ERROR.isFailure()).isTrue();
        assertThat(JobState.WAITING.isFailure()).isFalse();
    }
}
