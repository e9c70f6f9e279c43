package io.arqsim.command.common;

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

import io.arqsim.core.config.LinkConfig;
import io.arqsim.core.config.LinkParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared link configuration option.
 *
 * <p>Loads a JSON {@link LinkConfig} overlay when {@code --config} is given and falls back
 * to {@link LinkParameters#defaults()} otherwise. {@code --file-size} overrides the
 * closed-form file size from either source.</p>
 */
public class LinkConfigOption {

    private static final Logger logger = LogManager.getLogger(LinkConfigOption.class);

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON link configuration file overlaying the default parameters"
    )
    private Path configPath;

    @CommandLine.Option(
        names = {"--file-size"},
        description = "Bytes transferred per closed-form run (default: from config, else 1000000)"
    )
    private Long fileSize;

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Resolves the link parameters.
     *
     * @return validated parameters
     * @throws IOException if the config file cannot be read
     * @throws IllegalArgumentException if the config is malformed or a value is out of range
     */
    public LinkParameters resolve() throws IOException {
        LinkParameters parameters;
        if (configPath != null) {
            if (!Files.isRegularFile(configPath)) {
                throw new IOException("Link config file not found: " + configPath);
            }
            parameters = LinkConfig.load(configPath).toParameters();
            logger.debug("link parameters loaded from {}", configPath);
        } else {
            parameters = LinkParameters.defaults();
        }
        if (fileSize != null) {
            parameters = parameters.withFileSizeBytes(fileSize);
        }
        return parameters;
    }
}
