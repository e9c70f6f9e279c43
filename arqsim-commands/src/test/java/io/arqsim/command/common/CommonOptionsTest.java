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
import io.arqsim.core.config.LinkConfig;
import io.arqsim.core.config.LinkParameters;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("Common options")
class CommonOptionsTest {

    @CommandLine.Command(name = "options")
    static class Options {
        @CommandLine.Mixin
        RandomSeedOption seed = new RandomSeedOption();

        @CommandLine.Mixin
        OutputFileOption output = new OutputFileOption();

        @CommandLine.Mixin
        ErrorModelOption errorModel = new ErrorModelOption();

        @CommandLine.Mixin
        LinkConfigOption linkConfig = new LinkConfigOption();

        @CommandLine.Mixin
        ParallelExecutionOption parallel = new ParallelExecutionOption();

        @CommandLine.Mixin
        VerbosityOption verbosity = new VerbosityOption();
    }

    private static Options parse(String... args) {
        Options options = new Options();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Nested
    @DisplayName("RandomSeedOption")
    class Seed {

        @Test
        @DisplayName("should derive consecutive run seeds from an explicit seed")
        void shouldDeriveRunSeeds() {
            Options options = parse("--seed", "42");
            assertThat(options.seed.isReproducible()).isTrue();
            assertThat(options.seed.baseSeed()).isEqualTo(42L);
            assertThat(options.seed.seedForRun(0)).isEqualTo(42L);
            assertThat(options.seed.seedForRun(3)).isEqualTo(45L);
            assertThat(options.seed).hasToString("42");
        }

        @Test
        @DisplayName("should fix a time-based seed once per invocation")
        void shouldResolveTimeBasedSeedOnce() throws InterruptedException {
            Options options = parse();
            long base = options.seed.baseSeed();
            Thread.sleep(5);

            assertThat(options.seed.isReproducible()).isFalse();
            assertThat(options.seed.baseSeed()).isEqualTo(base);
            assertThat(options.seed.seedForRun(2)).isEqualTo(base + 2);
            assertThat(options.seed.toString()).endsWith("(time-based)");
        }

        @Test
        @DisplayName("should reject a negative run index")
        void shouldRejectNegativeRun() {
            assertThatThrownBy(() -> RandomSeedOption.seedForRun(1L, -1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject a non-numeric seed")
        void shouldRejectGarbage() {
            assertThatThrownBy(() -> parse("--seed", "abc"))
                .isInstanceOf(CommandLine.ParameterException.class);
        }
    }

    @Nested
    @DisplayName("ErrorModelOption")
    class ErrorModel {

        @ParameterizedTest
        @ValueSource(strings = {"bit-loop", "BIT_LOOP", "Bit-Loop"})
        @DisplayName("should accept hyphenated and underscored names")
        void shouldAcceptNames(String name) {
            assertThat(parse("--error-model", name).errorModel.getErrorModel()).isEqualTo(ErrorModelKind.BIT_LOOP);
        }

        @Test
        @DisplayName("should default to jump-ahead")
        void shouldDefaultToJumpAhead() {
            assertThat(parse().errorModel.getErrorModel()).isEqualTo(ErrorModelKind.JUMP_AHEAD);
        }

        @Test
        @DisplayName("should reject unknown models")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> parse("--error-model", "markov"))
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("jump-ahead or bit-loop");
        }
    }

    @Nested
    @DisplayName("OutputFileOption")
    class Output {

        @Test
        @DisplayName("should refuse an existing file without --force")
        void shouldRefuseExistingFile(@TempDir Path tempDir) throws IOException {
            Path file = Files.createFile(tempDir.resolve("out.csv"));

            assertThatThrownBy(() -> parse("-o", file.toString()).output.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("--force");
            assertThatNoException().isThrownBy(() -> parse("-o", file.toString(), "-f").output.validate());
        }

        @Test
        @DisplayName("should be optional")
        void shouldBeOptional() {
            Options options = parse();
            assertThat(options.output.isSpecified()).isFalse();
            assertThatNoException().isThrownBy(options.output::validate);
        }
    }

    @Nested
    @DisplayName("LinkConfigOption")
    class Link {

        @Test
        @DisplayName("should use the defaults without a config file")
        void shouldUseDefaults() throws IOException {
            assertThat(parse().linkConfig.resolve()).isEqualTo(LinkParameters.defaults());
        }

        @Test
        @DisplayName("should overlay a config file and the file size override")
        void shouldOverlayConfig(@TempDir Path tempDir) throws IOException {
            Path file = tempDir.resolve("link.json");
            LinkConfig config = new LinkConfig();
            config.setBitRate(2_000_000.0);
            config.save(file);

            LinkParameters parameters = parse("--config", file.toString(), "--file-size", "5000").linkConfig.resolve();

            assertThat(parameters.bitRate()).isEqualTo(2_000_000.0);
            assertThat(parameters.fileSizeBytes()).isEqualTo(5000);
            assertThat(parameters.forwardPathDelay()).isEqualTo(LinkParameters.DEFAULT_FORWARD_PATH_DELAY);
        }

        @Test
        @DisplayName("should report a missing config file")
        void shouldReportMissingFile(@TempDir Path tempDir) {
            Options options = parse("--config", tempDir.resolve("missing.json").toString());
            assertThatThrownBy(options.linkConfig::resolve).isInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("ParallelExecutionOption")
    class Parallel {

        @Test
        @DisplayName("should run serially by default")
        void shouldDefaultToOneWorker() {
            assertThat(parse().parallel.requestedThreads()).isEqualTo(1);
            assertThat(parse().parallel.workersFor(36)).isEqualTo(1);
        }

        @Test
        @DisplayName("should cap the pool at the number of simulations")
        void shouldCapAtGridSize() {
            ParallelExecutionOption option = parse("--threads", "8").parallel;
            assertThat(option.requestedThreads()).isEqualTo(8);
            assertThat(option.workersFor(100)).isEqualTo(8);
            assertThat(option.workersFor(3)).isEqualTo(3);
            assertThat(option.workersFor(0)).isEqualTo(1);
        }

        @Test
        @DisplayName("should use at least one worker in parallel mode")
        void shouldAutoSize() {
            assertThat(parse("-p").parallel.requestedThreads()).isGreaterThanOrEqualTo(1);
        }

        @Test
        @DisplayName("should reject a non-positive thread count")
        void shouldRejectNonPositiveThreads() {
            assertThatThrownBy(() -> parse("--threads", "0").parallel.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("--threads");
            assertThatNoException().isThrownBy(() -> parse("--threads", "2").parallel.validate());
        }
    }

    @Test
    @DisplayName("VerbosityOption should map flags to log levels")
    void shouldMapVerbosity() {
        assertThat(parse().verbosity.level()).isEqualTo(Level.INFO);
        assertThat(parse("-v").verbosity.level()).isEqualTo(Level.DEBUG);
        assertThat(parse("-q").verbosity.level()).isEqualTo(Level.ERROR);
        assertThatThrownBy(() -> parse("-v", "-q").verbosity.validate()).isInstanceOf(IllegalStateException.class);
    }
}
