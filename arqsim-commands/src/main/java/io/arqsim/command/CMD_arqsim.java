package io.arqsim.command;

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

import io.arqsim.command.subcommands.CMD_arqsim_simulate;
import io.arqsim.command.subcommands.CMD_arqsim_sweep;
import io.arqsim.command.subcommands.CMD_arqsim_transfer;
import picocli.CommandLine;

/// Selective-Repeat ARQ simulator
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "arqsim",
    description = "Selective-Repeat ARQ simulator over a bursty Gilbert-Elliot channel",
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_arqsim_simulate.class,
        CMD_arqsim_sweep.class,
        CMD_arqsim_transfer.class
    })
public class CMD_arqsim {

    /// Builds the command line with the parsing conventions shared by every entry point.
    /// @return a configured command line
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_arqsim())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// run an arqsim command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
