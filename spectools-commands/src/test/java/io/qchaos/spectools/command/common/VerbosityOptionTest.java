package io.qchaos.spectools.command.common;

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

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class VerbosityOptionTest {

    @Test
    void progressIsDebugByDefault() {
        DummyCommand command = parse();
        assertThat(command.verbosityOption.progressLevel()).isEqualTo(Level.DEBUG);
        assertThat(command.verbosityOption.printsTables()).isTrue();
    }

    @Test
    void verboseLogsProgressAtInfo() {
        DummyCommand command = parse("-v");
        assertThat(command.verbosityOption.progressLevel()).isEqualTo(Level.INFO);
        assertThat(command.verbosityOption.printsTables()).isTrue();
    }

    @Test
    void quietSuppressesTables() {
        DummyCommand command = parse("--quiet");
        assertThat(command.verbosityOption.printsTables()).isFalse();
        assertThat(command.verbosityOption.progressLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void verboseAndQuietConflict() {
        DummyCommand command = parse("-v", "-q");
        assertThatThrownBy(command.verbosityOption::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("--verbose");
    }

    private static DummyCommand parse(String... args) {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }

    @CommandLine.Command(name = "dummy")
    static class DummyCommand {
        @CommandLine.Mixin
        VerbosityOption verbosityOption = new VerbosityOption();
    }
}
