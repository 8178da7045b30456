package io.statvec.service.cli.common;

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

import io.statvec.service.config.ServiceSettings;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared settings file option.
 * Settings are read from the environment first and then from the optional YAML file.
 */
public class SettingsOption {

    @CommandLine.Option(
        names = {"--config"},
        paramLabel = "SETTINGS_YAML",
        description = "YAML settings file applied over environment settings"
    )
    private Path configFile;

    /**
     * Gets the settings file, if one was given.
     *
     * @return the settings file or null
     */
    public Path getConfigFile() {
        return configFile;
    }

    /**
     * Loads the layered settings.
     *
     * @return environment settings overlaid with the settings file
     * @throws IOException if the settings file cannot be read
     */
    public ServiceSettings load() throws IOException {
        return ServiceSettings.load(configFile);
    }
}
