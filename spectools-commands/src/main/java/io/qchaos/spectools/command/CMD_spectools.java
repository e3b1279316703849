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

import io.qchaos.spectools.command.subcommands.CMD_spectools_analyze;
import io.qchaos.spectools.command.subcommands.CMD_spectools_rigidity;
import io.qchaos.spectools.command.subcommands.CMD_spectools_spacing;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The spectools command groups the spectral statistics subcommands.
///
/// ```bash
/// spectools analyze levels.h5 -o report.json --seed 7
/// spectools rigidity levels.h5 --lengths 0..20:41 --parallel
/// spectools spacing levels.txt --bins 24
/// ```
@CommandLine.Command(name = "spectools",
    header = "Spectral statistics for quantum chaos studies",
    description = "Unfolds energy spectra and computes level spacing distributions and spectral rigidity",
    mixinStandardHelpOptions = true,
    version = "spectools 0.1.0",
    subcommands = {
        CMD_spectools_analyze.class,
        CMD_spectools_rigidity.class,
        CMD_spectools_spacing.class
    })
public class CMD_spectools implements Callable<Integer> {

    /// Run spectools
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_spectools()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
