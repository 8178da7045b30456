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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Vectorize feature statistics and relay them to SMPC and the orchestrator
@CommandLine.Command(name = "statvec",
    header = "Vectorize feature statistics and relay them to SMPC and the orchestrator",
    description = "Contains subcommands to vectorize a dataset once, run the HTTP service, and list the supported data types",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_vectorize.class,
        CMD_serve.class,
        CMD_types.class,
        CommandLine.HelpCommand.class
    })
public class CMD_statvec implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_statvec.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Create the CMD_statvec command
    public CMD_statvec() {}

    /// Run a statvec command
    /// @param args Command line arguments
    public static void main(String[] args) {
        CMD_statvec command = new CMD_statvec();
        logger.debug("instancing commandline");
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        logger.debug("exiting main with {}", exitCode);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
