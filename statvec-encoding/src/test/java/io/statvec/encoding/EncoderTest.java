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
import io.statvec.encoding.vectorizers.BooleanVectorizer;
import io.statvec.encoding.vectorizers.CategoricalVectorizer;
import io.statvec.encoding.vectorizers.NumericVectorizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class EncoderTest {

    private final Encoder encoder = new Encoder();

    @Test
    public void testBooleanEncoderObject() {
        EncoderObject encoded = encoder.encode("BOOLEAN", FeatureVector.of(100L, 75L));

        assertThat(encoded.type()).isEqualTo(WireType.INT);
        assertThat(encoded.data().values()).containsExactly(100L, 75L);
        assertThat(encoded.dataType()).isEqualTo("BOOLEAN");
        assertThat(encoded.vectorLength()).isEqualTo(2);
    }

    @Test
    public void testNumericEncoderObjectIsFloat() {
        FeatureVector vector = FeatureVector.of(10L, 1.5, 98.7, 45.2, 25.0, 44.5, 65.8);
        EncoderObject encoded = encoder.encode("numeric", vector);

        assertThat(encoded.type()).isEqualTo(WireType.FLOAT);
        assertThat(encoded.data()).isEqualTo(vector);
        assertThat(encoded.dataType()).isEqualTo("NUMERIC");
        assertThat(encoded.vectorLength()).isEqualTo(7);
    }

    @Test
    public void testCategoricalAndUnrecognizedTypesAreInt() {
        assertThat(encoder.encode("NOMINAL", FeatureVector.of(14L, 4L, 7L)).type()).isEqualTo(WireType.INT);
        assertThat(encoder.encode("ORDINAL", FeatureVector.of(14L, 4L, 7L)).type()).isEqualTo(WireType.INT);
        EncoderObject text = encoder.encode("text", FeatureVector.of(1L, 1L, 1L));
        assertThat(text.type()).isEqualTo(WireType.INT);
        assertThat(text.dataType()).isEqualTo("TEXT");
    }

    @Test
    public void testRegistryFallsBackToCategorical() {
        assertThat(encoder.vectorizerFor("BOOLEAN")).isInstanceOf(BooleanVectorizer.class);
        assertThat(encoder.vectorizerFor("numeric")).isInstanceOf(NumericVectorizer.class);
        assertThat(encoder.vectorizerFor("ORDINAL")).isInstanceOf(CategoricalVectorizer.class);
        assertThat(encoder.vectorizerFor("GEOPOINT")).isInstanceOf(CategoricalVectorizer.class);
        assertThat(encoder.vectorizerFor(null)).isInstanceOf(CategoricalVectorizer.class);
    }

    @Test
    public void testVectorizeFeatureStatistics() throws Exception {
        JsonNode stats = StatvecJson.MAPPER.readTree(
                "{\"numOfNotNull\":14,\"valueSet\":[\"2014\",\"2020\",\"2024\"],"
                + "\"cardinalityPerItem\":{\"2014\":1,\"2020\":1,\"2024\":12}}");
        assertThat(encoder.vectorizeFeatureStatistics("NOMINAL", stats).values()).containsExactly(14L, 3L, 12L);
    }

    @Test
    public void testVectorizationFailureYieldsFallbackVector() throws Exception {
        JsonNode malformed = StatvecJson.MAPPER.readTree("{\"numOfNotNull\":5,\"min\":\"low\",\"max\":1,\"avg\":1}");
        assertThat(encoder.vectorizeFeatureStatistics("NUMERIC", malformed)).isEqualTo(Encoder.FALLBACK_VECTOR);
        assertThat(encoder.vectorizeFeatureStatistics("BOOLEAN", StatvecJson.MAPPER.readTree("\"yes\"")).values())
                .containsExactly(0L);
        JsonNode notFinite = StatvecJson.MAPPER.readTree("{\"numOfNotNull\":5,\"min\":1,\"max\":\"Infinity\",\"avg\":\"NaN\"}");
        assertThat(encoder.vectorizeFeatureStatistics("NUMERIC", notFinite)).isEqualTo(Encoder.FALLBACK_VECTOR);
    }

    @Test
    public void testVectorSchemas() {
        VectorSchema bool = encoder.vectorSchema("BOOLEAN");
        assertThat(bool.vectorLength()).isEqualTo(2);
        assertThat(bool.fields()).containsExactly("numOfNotNull", "numOfTrue");

        VectorSchema numeric = encoder.vectorSchema("NUMERIC");
        assertThat(numeric.vectorLength()).isEqualTo(7);
        assertThat(numeric.fields()).hasSize(7);

        VectorSchema nominal = encoder.vectorSchema("nominal");
        assertThat(nominal.dataType()).isEqualTo("NOMINAL");
        assertThat(nominal.fields()).containsExactly("numOfNotNull", "numUniqueValues", "topValueCount");
    }

    @Test
    public void testSupportedDataTypes() {
        assertThat(encoder.supportedDataTypes()).containsExactly("BOOLEAN", "NUMERIC", "NOMINAL", "ORDINAL");
    }

    @Test
    public void testEncoderObjectJson() throws Exception {
        String json = StatvecJson.MAPPER.writeValueAsString(encoder.encode("BOOLEAN", FeatureVector.of(100L, 75L)));
        JsonNode node = StatvecJson.MAPPER.readTree(json);
        assertThat(node.get("type").asText()).isEqualTo("int");
        assertThat(node.get("data").get(0).isIntegralNumber()).isTrue();
        assertThat(node.get("dataType").asText()).isEqualTo("BOOLEAN");
        assertThat(node.get("vectorLength").asInt()).isEqualTo(2);

        JsonNode empty = StatvecJson.MAPPER.valueToTree(EncoderObject.empty());
        assertThat(empty.has("dataType")).isFalse();
        assertThat(empty.get("data").size()).isZero();
    }
}
