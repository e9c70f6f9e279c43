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

import io.arqsim.core.channel.ErrorModelKind;
import picocli.CommandLine;

import java.util.Locale;

/**
 * Shared channel error model option accepting {@code jump-ahead} or {@code bit-loop}.
 */
public class ErrorModelOption {

    /**
     * Picocli type converter accepting hyphenated or underscored names in any case.
     */
    public static class ErrorModelConverter implements CommandLine.ITypeConverter<ErrorModelKind> {

        @Override
        public ErrorModelKind convert(String value) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return ErrorModelKind.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    "Unknown error model '" + value + "', expected jump-ahead or bit-loop");
            }
        }
    }

    @CommandLine.Option(
        names = {"--error-model"},
        description = "Channel error model: jump-ahead or bit-loop (default: jump-ahead)",
        converter = ErrorModelConverter.class
    )
    private ErrorModelKind errorModel = ErrorModelKind.JUMP_AHEAD;

    public ErrorModelKind getErrorModel() {
        return errorModel;
    }
}
