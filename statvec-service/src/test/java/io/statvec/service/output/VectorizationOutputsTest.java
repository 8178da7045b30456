package io.statvec.service.output;

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
import io.statvec.encoding.EnhancementResult;
import io.statvec.encoding.StatvecJson;
import io.statvec.encoding.VectorizationEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class VectorizationOutputsTest {

    @Test
    public void testWritesThreeDocuments(@TempDir Path dir) throws Exception {
        JsonNode dataset = StatvecJson.MAPPER.readTree(
            Path.of("src/test/resources/testserver/datasets/study-42.json").toFile());
        EnhancementResult result = new VectorizationEngine().enhance(dataset);

        Path target = dir.resolve("nested/output");
        OutputPaths paths = VectorizationOutputs.write(target, result);

        assertThat(paths.enhancedData()).isEqualTo(target.resolve("enhanced_dataset.json")).exists();
        assertThat(paths.encodersOnly()).isEqualTo(target.resolve("encoders_only.json")).exists();
        assertThat(paths.schema()).isEqualTo(target.resolve("schema.json")).exists();

        JsonNode encoders = StatvecJson.MAPPER.readTree(Files.readString(paths.encodersOnly()));
        assertThat(encoders.isArray()).isTrue();
        assertThat(encoders.get(0).get("type").asText()).isEqualTo("mixed");
        assertThat(encoders.get(0).get("totalFeatures").asInt()).isEqualTo(2);
        assertThat(encoders.get(0).get("data").toString()).isEqualTo("[100,75,10,1.5,98.7,45.2,25.0,44.5,65.8]");

        JsonNode schema = StatvecJson.MAPPER.readTree(Files.readString(paths.schema()));
        assertThat(schema.get(1).get("offset").asInt()).isEqualTo(2);

        JsonNode enhanced = StatvecJson.MAPPER.readTree(Files.readString(paths.enhancedData()));
        assertThat(enhanced.at("/entries/smoker/vectorized_statistics/dataType").asText()).isEqualTo("BOOLEAN");
        assertThat(Files.readString(paths.schema())).contains("\n");
    }

    @Test
    public void testOverwritesPreviousRun(@TempDir Path dir) throws Exception {
        EnhancementResult empty = new VectorizationEngine().enhance(StatvecJson.MAPPER.readTree("{\"entries\":{}}"));
        Files.writeString(dir.resolve("schema.json"), "stale");
        OutputPaths paths = VectorizationOutputs.write(dir, empty);
        assertThat(StatvecJson.MAPPER.readTree(Files.readString(paths.schema())).size()).isZero();
    }
}
