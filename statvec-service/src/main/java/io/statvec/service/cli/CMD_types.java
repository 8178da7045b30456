package io.statvec.service.cli;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import io.statvec.encoding.Encoder;
import io.statvec.encoding.StatvecJson;
import io.statvec.encoding.VectorSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Print the vector layout of every supported data type.
@CommandLine.Command(name = "types",
    header = "List supported data types and their vector layouts",
    description = "Prints a JSON array with the data type, vector length and field names of each\n" +
        "data type that has a dedicated vectorizer.",
    mixinStandardHelpOptions = true)
public class CMD_types implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_types.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Encoder encoder = new Encoder();
        List<VectorSchema> schemas = new ArrayList<>();
        for (String dataType : encoder.supportedDataTypes()) {
            schemas.add(encoder.vectorSchema(dataType));
        }
        try {
            spec.commandLine().getOut().println(StatvecJson.MAPPER.writeValueAsString(schemas));
            return 0;
        } catch (JsonProcessingException e) {
            logger.error("unable to render data types", e);
            return 1;
        }
    }
}
