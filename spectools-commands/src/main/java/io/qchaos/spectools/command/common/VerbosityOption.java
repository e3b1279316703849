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
import picocli.CommandLine;

/**
 * Output controls shared by the spectools commands.
 *
 * <ul>
 *   <li>{@code -v} logs progress (grid size, reference seeds, timings) at INFO on stderr</li>
 *   <li>{@code -q} suppresses tables and summaries on stdout</li>
 * </ul>
 *
 * JSON output requested explicitly ({@code --json}, or {@code analyze} without {@code -o})
 * is printed regardless of {@code -q}.
 */
public class VerbosityOption {

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log analysis progress and timings")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Print no tables or summaries")
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /// @return true when tables and summaries should be printed
    public boolean printsTables() {
        return !quiet;
    }

    /**
     * Level for progress messages. With {@code -v} they are logged at INFO and
     * reach the console; otherwise they stay at DEBUG.
     *
     * @return the level to log progress at
     */
    public Level progressLevel() {
        return verbose ? Level.INFO : Level.DEBUG;
    }

    /**
     * @throws IllegalStateException if both {@code -v} and {@code -q} are given
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("--verbose and --quiet cannot be combined");
        }
    }
}
