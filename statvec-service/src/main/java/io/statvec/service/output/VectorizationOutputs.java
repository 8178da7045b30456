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

import com.fasterxml.jackson.databind.ObjectWriter;
import io.statvec.encoding.EnhancementResult;
import io.statvec.encoding.StatvecJson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Persists the result of a vectorization run as three independent JSON documents.
public final class VectorizationOutputs {
    private static final Logger logger = LogManager.getLogger(VectorizationOutputs.class);

    public static final String ENHANCED_DATASET = "enhanced_dataset.json";
    public static final String ENCODERS_ONLY = "encoders_only.json";
    public static final String SCHEMA = "schema.json";

    private VectorizationOutputs() {
    }

    /// Write the enhanced dataset, encoders and schema, creating the directory when needed.
    /// Existing files are replaced.
    /// @param outputDir the target directory
    /// @param result the run to persist
    /// @return the written paths
    /// @throws IOException if a document cannot be written
    public static OutputPaths write(Path outputDir, EnhancementResult result) throws IOException {
        Files.createDirectories(outputDir);
        OutputPaths paths = new OutputPaths(
            outputDir.resolve(ENHANCED_DATASET),
            outputDir.resolve(ENCODERS_ONLY),
            outputDir.resolve(SCHEMA)
        );
        ObjectWriter writer = StatvecJson.MAPPER.writerWithDefaultPrettyPrinter();
        writer.writeValue(paths.enhancedData().toFile(), result.enhancedDataset());
        writer.writeValue(paths.encodersOnly().toFile(), result.encoders());
        writer.writeValue(paths.schema().toFile(), result.schema());
        logger.info("wrote outputs to {}", outputDir.toAbsolutePath());
        return paths;
    }
}
