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
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.statvec.encoding.dataset.DataTypeInference;
import io.statvec.encoding.dataset.DatasetFormat;
import io.statvec.encoding.dataset.FeatureRecord;
import io.statvec.encoding.schema.SchemaBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Vectorizes the feature statistics of a dataset.
///
/// Each call makes a single pass over its own copy of the dataset and keeps no state between
/// calls, so one engine may serve any number of threads at once. The input tree is never
/// modified.
public class VectorizationEngine {

    private static final Logger logger = LogManager.getLogger(VectorizationEngine.class);

    private final Encoder encoder;

    /// Create an engine with the default vectorizer registry.
    public VectorizationEngine() {
        this(new Encoder());
    }

    /// @param encoder the encoder and vectorizer registry to use
    public VectorizationEngine(Encoder encoder) {
        this.encoder = encoder;
    }

    /// Vectorize every feature of a dataset and aggregate the vectors.
    /// @param dataset a parsed dataset
    /// @return the result
    /// @see #enhance(JsonNode, String)
    public EnhancementResult enhance(JsonNode dataset) {
        return enhance(dataset, null);
    }

    /// Vectorize the features of a dataset.
    ///
    /// Features typed (or inferred) as {@link DataType#DATETIME} or {@link DataType#UNKNOWN} are
    /// kept as they are and left out of the encoders and schema. Without a query, all vectors are
    /// flattened into one {@link AggregatedEncoder}. With a query, only the feature of exactly
    /// that name is vectorized and its encoder is returned on its own.
    ///
    /// A dataset in neither the direct nor the legacy layout is returned as given, with no
    /// encoders and no schema.
    /// @param dataset a parsed dataset
    /// @param query a feature name to restrict processing to, or null for all features
    /// @return the enhanced dataset, encoders and schema
    public EnhancementResult enhance(JsonNode dataset, String query) {
        DatasetFormat format = DatasetFormat.detect(dataset);
        if (format == DatasetFormat.UNKNOWN) {
            logger.warn("dataset has no recognizable 'entries' field, nothing to vectorize");
            return new EnhancementResult(dataset == null ? NullNode.getInstance() : dataset, List.of(), List.of(), format);
        }
        boolean queried = query != null && !query.isBlank();

        JsonNode working = dataset.deepCopy();
        List<FeatureRecord> features = format.reader().read(working);
        logger.debug("read {} features from {} dataset", features.size(), format);

        SchemaBuilder schema = new SchemaBuilder();
        List<EncoderObject> encoders = new ArrayList<>();
        for (FeatureRecord feature : features) {
            if (queried && !query.equals(feature.name())) {
                continue;
            }
            String dataType = resolveDataType(feature);
            Optional<DataType> known = DataType.lookup(dataType);
            if (known.isPresent() && !known.get().isVectorizable()) {
                logger.debug("skipping feature '{}' of type {}", feature.name(), dataType);
            } else {
                FeatureVector vector = encoder.vectorizeFeatureStatistics(dataType, feature.statistics());
                EncoderObject encoded = encoder.encode(dataType, vector);
                feature.attach(vectorizedStatistics(vector, encoded));
                encoders.add(encoded);
                schema.append(feature.name(), dataType, vector, encoder.vectorizerFor(dataType).fieldNames());
            }
            if (queried) {
                break;
            }
        }

        logger.info("vectorized {} of {} features ({} elements)", encoders.size(), features.size(), schema.totalLength());
        if (queried || encoders.isEmpty()) {
            return new EnhancementResult(working, List.copyOf(encoders), schema.entries(), format);
        }
        AggregatedEncoder aggregate = AggregatedEncoder.of(encoders, encoder.supportedDataTypes());
        return new EnhancementResult(working, List.of(aggregate), schema.entries(), format);
    }

    /// @return the data types with a dedicated vectorizer
    public List<String> supportedDataTypes() {
        return encoder.supportedDataTypes();
    }

    /// @param dataType a data type name
    /// @return the vector layout for that type
    public VectorSchema vectorSchema(String dataType) {
        return encoder.vectorSchema(dataType);
    }

    private static String resolveDataType(FeatureRecord feature) {
        if (feature.hasDeclaredType()) {
            return DataType.normalize(feature.declaredType());
        }
        return DataTypeInference.infer(feature.statistics()).name();
    }

    private static ObjectNode vectorizedStatistics(FeatureVector vector, EncoderObject encoded) {
        ObjectNode node = StatvecJson.MAPPER.createObjectNode();
        node.set("vectorized", StatvecJson.MAPPER.valueToTree(vector));
        node.set("encoder", StatvecJson.MAPPER.valueToTree(encoded));
        node.put("dataType", encoded.dataType());
        return node;
    }
}
