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
import io.statvec.encoding.vectorizers.FeatureVectorizer;
import io.statvec.encoding.vectorizers.NumericVectorizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Registry of vectorizers by data type, and the wrapper that turns a raw vector into an
/// {@link EncoderObject}.
///
/// The registry is fixed at construction and read-only afterwards, so one instance can be
/// shared by any number of concurrent callers.
public class Encoder {

    private static final Logger logger = LogManager.getLogger(Encoder.class);

    /// returned in place of a vector when a statistics record cannot be vectorized
    public static final FeatureVector FALLBACK_VECTOR = FeatureVector.of(0L);

    private final Map<DataType, FeatureVectorizer> vectorizers;
    private final FeatureVectorizer defaultVectorizer;

    /// Create an encoder with the boolean, numeric and categorical vectorizers registered.
    public Encoder() {
        CategoricalVectorizer categorical = new CategoricalVectorizer();
        EnumMap<DataType, FeatureVectorizer> registry = new EnumMap<>(DataType.class);
        registry.put(DataType.BOOLEAN, new BooleanVectorizer());
        registry.put(DataType.NUMERIC, new NumericVectorizer());
        registry.put(DataType.NOMINAL, categorical);
        registry.put(DataType.ORDINAL, categorical);
        this.vectorizers = Collections.unmodifiableMap(registry);
        this.defaultVectorizer = categorical;
    }

    /// Find the vectorizer for a data type.
    ///
    /// Names without a registered vectorizer get the categorical one. This is a lenient
    /// default, not a validation step.
    /// @param dataType the data type name, in any case
    /// @return the vectorizer to use
    public FeatureVectorizer vectorizerFor(String dataType) {
        return DataType.lookup(dataType)
                .map(vectorizers::get)
                .orElse(defaultVectorizer);
    }

    /// Vectorize a statistics record with the vectorizer registered for its data type.
    ///
    /// A record that cannot be vectorized yields {@link #FALLBACK_VECTOR} instead of an error,
    /// so one bad feature never stops the rest of a dataset from being processed.
    /// @param dataType the data type name
    /// @param statistics the statistics record
    /// @return the vector
    public FeatureVector vectorizeFeatureStatistics(String dataType, JsonNode statistics) {
        try {
            return vectorizerFor(dataType).vectorize(statistics);
        } catch (RuntimeException e) {
            logger.warn("unable to vectorize {} statistics, using fallback vector: {}", dataType, e.getMessage());
            logger.debug("vectorization failure", e);
            return FALLBACK_VECTOR;
        }
    }

    /// @param dataType the data type name, in any case
    /// @param vector the vector produced for that data type
    /// @return the vector wrapped with its wire type, normalized data type and length
    public EncoderObject encode(String dataType, FeatureVector vector) {
        return new EncoderObject(
                WireType.forDataType(dataType),
                vector,
                DataType.normalize(dataType),
                vector.length()
        );
    }

    /// @param dataType the data type name, in any case
    /// @return the vector layout used for that data type
    public VectorSchema vectorSchema(String dataType) {
        FeatureVectorizer vectorizer = vectorizerFor(dataType);
        return new VectorSchema(DataType.normalize(dataType), vectorizer.vectorLength(), vectorizer.fieldNames());
    }

    /// @return the names of the data types with a registered vectorizer
    public List<String> supportedDataTypes() {
        return vectorizers.keySet().stream().map(DataType::name).toList();
    }
}
