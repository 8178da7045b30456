package io.statvec.encoding;

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
import com.fasterxml.jackson.databind.node.NullNode;
import io.statvec.encoding.dataset.DatasetFormat;
import io.statvec.encoding.dataset.FeatureRecord;
import io.statvec.encoding.schema.SchemaDecoder;
import io.statvec.encoding.schema.SchemaEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class VectorizationEngineTest {

    private VectorizationEngine engine;

    @BeforeEach
    public void setUp() {
        engine = new VectorizationEngine();
    }

    private static JsonNode load(String name) throws IOException {
        try (InputStream in = VectorizationEngineTest.class.getResourceAsStream("/datasets/" + name)) {
            assertThat(in).as("fixture " + name).isNotNull();
            return StatvecJson.MAPPER.readTree(in);
        }
    }

    private static JsonNode json(String text) throws IOException {
        return StatvecJson.MAPPER.readTree(text);
    }

    @Test
    public void testLegacyDatasetAggregates() throws Exception {
        JsonNode dataset = load("legacy-dataset.json");
        EnhancementResult result = engine.enhance(dataset);

        assertThat(result.format()).isEqualTo(DatasetFormat.LEGACY);
        assertThat(result.encoders()).hasSize(1);
        assertThat(result.encoders().get(0)).isInstanceOf(AggregatedEncoder.class);

        AggregatedEncoder aggregate = (AggregatedEncoder) result.encoders().get(0);
        assertThat(aggregate.data().values()).containsExactly(
                100L, 75L,
                10L, 18.0, 65.0, 35.5, 25.0, 35.0, 45.0,
                14L, 3L, 7L);
        assertThat(aggregate.type()).isEqualTo(WireType.MIXED);
        assertThat(aggregate.vectorLength()).isEqualTo(12);
        assertThat(aggregate.totalFeatures()).isEqualTo(3);
        assertThat(aggregate.supportedDataTypes()).containsExactly("BOOLEAN", "NUMERIC", "NOMINAL", "ORDINAL");

        assertThat(result.schema()).extracting(SchemaEntry::featureName).containsExactly(
                "med_everUsedBeforeHospitalAdmission_diuretics_any", "patient_demographics_age", "encounters_admissionYear");
        assertThat(result.schema()).extracting(SchemaEntry::offset).containsExactly(0, 2, 9);

        JsonNode features = result.enhancedDataset().get("entries").get(0).get("featureSet").get("features");
        JsonNode flag = features.get(0).get(FeatureRecord.VECTORIZED_STATISTICS);
        assertThat(flag.get("dataType").asText()).isEqualTo("BOOLEAN");
        assertThat(flag.get("encoder").get("type").asText()).isEqualTo("int");
        assertThat(flag.get("vectorized").size()).isEqualTo(2);
        assertThat(features.get(3).has(FeatureRecord.VECTORIZED_STATISTICS)).isFalse();
    }

    @Test
    public void testMetadataDatasetSkipsDatetimeAndUnknown() throws Exception {
        EnhancementResult result = engine.enhance(load("metadata-dataset.json"));

        assertThat(result.format()).isEqualTo(DatasetFormat.DIRECT);
        assertThat(result.encoders()).hasSize(1);
        assertThat(result.schema()).hasSize(3);

        JsonNode entries = result.enhancedDataset().get("entries");
        assertThat(entries.get("patient_demographics_gender").has(FeatureRecord.VECTORIZED_STATISTICS)).isTrue();
        assertThat(entries.get("patient_demographics_age").has(FeatureRecord.VECTORIZED_STATISTICS)).isTrue();
        assertThat(entries.get("encounters_admissionDate").has(FeatureRecord.VECTORIZED_STATISTICS)).isFalse();
        assertThat(entries.get("lab_results_unknown_feature").has(FeatureRecord.VECTORIZED_STATISTICS)).isFalse();

        SchemaEntry gender = result.schema().get(0);
        assertEquals("NOMINAL", gender.dataType());
        assertThat(gender.fields()).containsExactly("numOfNotNull", "numUniqueValues", "topValueCount");
        assertThat(result.schema()).extracting(SchemaEntry::offset).containsExactly(0, 3, 10);

        EncodedVector aggregate = result.firstEncoder();
        assertThat(aggregate.data().values()).containsExactly(
                14L, 4L, 7L,
                12L, 18.5, 89.2, 65.7, 45.8, 67.1, 78.9,
                14L, 11L);
    }

    @Test
    public void testQueryIsolatesOneFeature() throws Exception {
        EnhancementResult result = engine.enhance(load("metadata-dataset.json"), "patient_demographics_age");

        assertThat(result.encoders()).hasSize(1);
        assertThat(result.encoders().get(0)).isInstanceOf(EncoderObject.class);
        EncoderObject only = (EncoderObject) result.encoders().get(0);
        assertThat(only.type()).isEqualTo(WireType.FLOAT);
        assertThat(only.dataType()).isEqualTo("NUMERIC");
        assertThat(only.data().values()).containsExactly(12L, 18.5, 89.2, 65.7, 45.8, 67.1, 78.9);

        assertThat(result.schema()).hasSize(1);
        assertThat(result.schema().get(0).offset()).isZero();
        JsonNode entries = result.enhancedDataset().get("entries");
        assertThat(entries.get("patient_demographics_gender").has(FeatureRecord.VECTORIZED_STATISTICS)).isFalse();
    }

    @Test
    public void testQueryForSkippedOrMissingFeature() throws Exception {
        assertThat(engine.enhance(load("metadata-dataset.json"), "encounters_admissionDate").encoders()).isEmpty();
        EnhancementResult missing = engine.enhance(load("metadata-dataset.json"), "no_such_feature");
        assertThat(missing.encoders()).isEmpty();
        assertThat(missing.schema()).isEmpty();
        assertThat(missing.firstEncoder()).isEqualTo(EncoderObject.empty());
    }

    @Test
    public void testBlankQueryMeansAllFeatures() throws Exception {
        EnhancementResult result = engine.enhance(load("metadata-dataset.json"), "  ");
        assertThat(result.encoders().get(0)).isInstanceOf(AggregatedEncoder.class);
    }

    @Test
    public void testInferenceWithoutDeclaredTypes() throws Exception {
        JsonNode dataset = json("""
                {"entries": {
                    "smoker": {"numOfNotNull": 20, "numOfTrue": 6},
                    "weight": {"numOfNotNull": 20, "min": 50, "max": 120, "avg": 80.5}
                }}
                """);
        EnhancementResult result = engine.enhance(dataset);

        assertThat(result.schema()).extracting(SchemaEntry::dataType).containsExactly("BOOLEAN", "NUMERIC");
        assertThat(result.firstEncoder().data().values())
                .containsExactly(20L, 6L, 20L, 50.0, 120.0, 80.5, 0.0, 0.0, 0.0);
    }

    @Test
    public void testAggregateOfOneKindIsStillMixed() throws Exception {
        JsonNode dataset = json("""
                {"entries": {
                    "a": {"numOfNotNull": 100, "numOfTrue": 75},
                    "b": {"numOfNotNull": 95, "numOfTrue": 60}
                }}
                """);
        EncodedVector aggregate = engine.enhance(dataset).firstEncoder();

        assertThat(aggregate.type()).isEqualTo(WireType.MIXED);
        assertThat(aggregate.data().values()).containsExactly(100L, 75L, 95L, 60L);
        assertThat(StatvecJson.MAPPER.valueToTree(aggregate).get("type").asText()).isEqualTo("mixed");
    }

    @Test
    public void testUnrecognizedDeclaredTypeUsesCategoricalLayout() throws Exception {
        JsonNode dataset = json("""
                {"features": [{"name": "notes", "dataType": "text"}],
                 "entries": {"notes": {"numOfNotNull": 8, "valueSet": ["x", "y"], "cardinalityPerItem": {"x": 5, "y": 3}}}}
                """);
        EnhancementResult result = engine.enhance(dataset, "notes");

        EncoderObject encoded = (EncoderObject) result.firstEncoder();
        assertThat(encoded.dataType()).isEqualTo("TEXT");
        assertThat(encoded.type()).isEqualTo(WireType.INT);
        assertThat(encoded.data().values()).containsExactly(8L, 2L, 5L);
    }

    @Test
    public void testMalformedStatisticsUseFallbackVector() throws Exception {
        JsonNode dataset = json("""
                {"features": [{"name": "broken", "dataType": "NUMERIC"}, {"name": "garbled", "dataType": "NUMERIC"}],
                 "entries": {
                     "broken": {"numOfNotNull": 3, "min": "low", "max": 2, "avg": 1},
                     "garbled": "oops",
                     "fine": {"numOfNotNull": 4, "numOfTrue": 2}
                 }}
                """);
        EnhancementResult result = engine.enhance(dataset);

        assertThat(result.schema()).hasSize(3);
        SchemaEntry broken = result.schema().get(0);
        assertThat(broken.length()).isEqualTo(1);
        assertThat(broken.fields()).isEmpty();
        assertThat(result.schema()).extracting(SchemaEntry::offset).containsExactly(0, 1, 2);
        assertThat(result.firstEncoder().data().values()).containsExactly(0L, 0L, 4L, 2L);

        JsonNode entries = result.enhancedDataset().get("entries");
        assertThat(entries.get("broken").get("min").asText()).isEqualTo("low");
        assertThat(entries.get("broken").get(FeatureRecord.VECTORIZED_STATISTICS).get("vectorized").size()).isEqualTo(1);

        JsonNode garbled = entries.get("garbled");
        assertThat(garbled.get(FeatureRecord.ORIGINAL_STATISTICS).asText()).isEqualTo("oops");
        JsonNode attached = garbled.get(FeatureRecord.VECTORIZED_STATISTICS);
        assertThat(attached.get("dataType").asText()).isEqualTo("NUMERIC");
        assertThat(attached.get("encoder").get("vectorLength").asInt()).isEqualTo(1);
        assertThat(attached.get("vectorized").get(0).asLong()).isZero();

        assertThat(dataset.get("entries").get("garbled").asText()).isEqualTo("oops");
    }

    @Test
    public void testUnknownFormatReturnedUnchanged() throws Exception {
        JsonNode dataset = json("{\"rows\": [1, 2, 3]}");
        EnhancementResult result = engine.enhance(dataset);

        assertSame(dataset, result.enhancedDataset());
        assertThat(result.format()).isEqualTo(DatasetFormat.UNKNOWN);
        assertThat(result.encoders()).isEmpty();
        assertThat(result.schema()).isEmpty();

        assertThat(engine.enhance(null).enhancedDataset()).isEqualTo(NullNode.getInstance());
    }

    @Test
    public void testEmptyEntries() throws Exception {
        EnhancementResult result = engine.enhance(json("{\"entries\": {}}"));
        assertThat(result.encoders()).isEmpty();
        assertThat(result.schema()).isEmpty();
    }

    @Test
    public void testInputIsNotMutated() throws Exception {
        JsonNode dataset = load("legacy-dataset.json");
        JsonNode before = dataset.deepCopy();
        engine.enhance(dataset);
        assertEquals(before, dataset);
    }

    @Test
    public void testSchemaSplitsAggregateBackIntoFeatures() throws Exception {
        JsonNode dataset = load("metadata-dataset.json");
        EnhancementResult all = engine.enhance(dataset);
        Map<String, FeatureVector> split = SchemaDecoder.split(all.schema(), all.firstEncoder().data());

        for (SchemaEntry entry : all.schema()) {
            EncodedVector single = engine.enhance(dataset, entry.featureName()).firstEncoder();
            assertThat(split.get(entry.featureName())).isEqualTo(single.data());
        }
    }

    @Test
    public void testConcurrentEnhancement() throws Exception {
        JsonNode dataset = load("legacy-dataset.json");
        FeatureVector expected = engine.enhance(dataset).firstEncoder().data();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<FeatureVector>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> engine.enhance(dataset).firstEncoder().data()));
            }
            for (Future<FeatureVector> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testVectorSchemaAndSupportedTypes() {
        assertThat(engine.vectorSchema("BOOLEAN").vectorLength()).isEqualTo(2);
        assertThat(engine.supportedDataTypes()).contains("NUMERIC");
    }
}
