package io.qchaos.spectools.command;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CMD_spectools}.
 */
class CMD_spectoolsTest {

    @Test
    void testDispatchesToSubcommand(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("levels.txt");
        Files.writeString(input, "0.0 1.1 1.9 3.2 4.0 5.1 5.8 7.0 8.1 9.0 9.9 11.2\n");

        CommandLine commandLine = new CommandLine(new CMD_spectools());
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("spacing", input.toString(), "--bins", "6");

        assertEquals(0, exitCode);
        assertThat(out.toString()).contains("Spacings:      11");
    }

    @Test
    void testSubcommandsAreRegistered() {
        CommandLine commandLine = new CommandLine(new CMD_spectools());
        assertThat(commandLine.getSubcommands()).containsOnlyKeys("analyze", "rigidity", "spacing");
    }

    @Test
    void testUsageErrors() {
        assertEquals(2, new CommandLine(new CMD_spectools()).execute("unfold"));
        assertEquals(2, new CommandLine(new CMD_spectools()).execute("rigidity"));
    }
}
