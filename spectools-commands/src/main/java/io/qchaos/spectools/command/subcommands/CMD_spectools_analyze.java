package io.qchaos.spectools.command.subcommands;

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

import com.google.gson.JsonParseException;
import io.qchaos.spectools.command.common.EnergyInputOption;
import io.qchaos.spectools.command.common.LengthGridOption;
import io.qchaos.spectools.command.common.OutputFileOption;
import io.qchaos.spectools.command.common.ParallelExecutionOption;
import io.qchaos.spectools.command.common.RandomSeedOption;
import io.qchaos.spectools.command.common.VerbosityOption;
import io.qchaos.spectools.command.common.WindowOption;
import io.qchaos.spectools.statistics.analysis.SpectralAnalysisConfig;
import io.qchaos.spectools.statistics.analysis.SpectralAnalysisReport;
import io.qchaos.spectools.statistics.analysis.SpectralAnalyzer;
import io.qchaos.spectools.statistics.exceptions.SpectralStatisticsException;
import io.qchaos.spectools.statistics.rigidity.RegimeClassification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Run the whole analysis on one energy file and emit the JSON report.
///
/// Settings come from `--config` when given; any option passed on the
/// command line overrides the value from the file.
///
/// ## Usage
///
/// ```bash
/// spectools analyze data/itp2d.h5 > report.json
/// spectools analyze data/itp2d.h5 --config analysis.json --seed 42 -o report.json
/// ```
@CommandLine.Command(name = "analyze",
    header = "Compute the full spectral statistics report",
    description = "Unfolds the spectrum and reports spacings, staircase, rigidity with references and the closest regime as JSON",
    exitCodeList = {"0: success", "1: error reading input or computing statistics", "2: invalid arguments"})
public class CMD_spectools_analyze implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_spectools_analyze.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private EnergyInputOption inputOption = new EnergyInputOption();

    @CommandLine.Mixin
    private WindowOption windowOption = new WindowOption();

    @CommandLine.Mixin
    private LengthGridOption lengthGridOption = new LengthGridOption();

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private OutputFileOption outputOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-c", "--config"}, description = "JSON analysis configuration file")
    private Path configFile;

    @CommandLine.Option(names = {"--no-references"}, description = "Skip the picket-fence and Poisson reference curves")
    private boolean noReferences = false;

    @CommandLine.Option(names = {"--reference-size"},
        description = "Number of levels in the reference spectra (default: same as the input)")
    private Integer referenceSize;

    @CommandLine.Option(names = {"--bins"}, description = "Spacing histogram bins (default: 300)")
    private Integer bins;

    @CommandLine.Option(names = {"--cutoff"}, description = "Largest spacing included in the histogram (default: 6)")
    private Double cutoff;

    @CommandLine.Option(names = {"--staircase-points"}, description = "Samples of the staircase function (default: 1000)")
    private Integer staircasePoints;

    @CommandLine.Option(names = {"--min-length"},
        description = "Smallest window length used for regime classification (default: 1)")
    private Double minLength;

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            parallelOption.validate();
            outputOption.validate();

            SpectralAnalysisConfig config = buildConfig();
            logger.log(verbosityOption.progressLevel(), "Analyzing {} with {}", inputOption.getInput(), config);

            double[] energies = inputOption.readEnergies();
            SpectralAnalysisReport report = new SpectralAnalyzer(config).analyze(energies);
            String json = report.toJson();

            PrintWriter out = spec.commandLine().getOut();
            if (outputOption.getOutputPath().isPresent()) {
                Path path = outputOption.getOutputPath().get();
                Files.writeString(path, json);
                if (verbosityOption.printsTables()) {
                    printSummary(out, report, path);
                }
            } else {
                out.println(json);
            }
            out.flush();
            return 0;
        } catch (IOException | SpectralStatisticsException | JsonParseException
                 | IllegalArgumentException | IllegalStateException e) {
            logger.error("Analysis of {} failed: {}", inputOption.getInput(), e.getMessage());
            return 1;
        }
    }

    SpectralAnalysisConfig buildConfig() throws IOException {
        SpectralAnalysisConfig config = configFile != null
            ? SpectralAnalysisConfig.loadFromFile(configFile)
            : new SpectralAnalysisConfig();

        CommandLine.ParseResult parsed = spec.commandLine().getParseResult();
        if (parsed.hasMatchedOption("--centers")) {
            config.setNumCenters(windowOption.getNumCenters());
        }
        if (parsed.hasMatchedOption("--points")) {
            config.setNumPoints(windowOption.getNumPoints());
        }
        if (lengthGridOption.getGrid() != null) {
            LengthGridOption.Grid grid = lengthGridOption.getGrid();
            config.setLengthGrid(grid.start(), grid.stop(), grid.count());
        }
        if (seedOption.isSeedSpecified()) {
            config.setPoissonSeed(seedOption.getExplicitSeed());
        }
        if (parsed.hasMatchedOption("--threads") || parsed.hasMatchedOption("--parallel")) {
            config.setParallelism(parallelOption.getThreadCount());
        }
        if (noReferences) {
            config.setIncludeReferences(false);
        }
        if (referenceSize != null) {
            config.setReferenceSize(referenceSize);
        }
        if (bins != null) {
            config.setSpacingBins(bins);
        }
        if (cutoff != null) {
            config.setSpacingCutoff(cutoff);
        }
        if (staircasePoints != null) {
            config.setStaircasePoints(staircasePoints);
        }
        if (minLength != null) {
            config.setMinClassificationLength(minLength);
        }
        return config.validate();
    }

    private void printSummary(PrintWriter out, SpectralAnalysisReport report, Path path) {
        out.printf("Levels:        %,d%n", report.levelCount());
        out.printf("Mean spacing:  %.6g (before unfolding)%n", report.unfoldingScale());
        out.printf("Rigidity:      %d lengths%n", report.rigidity().size());
        report.poissonSeed().ifPresent(seed -> out.printf("Poisson seed:  %d%n", seed));
        if (report.classification().isPresent()) {
            RegimeClassification classification = report.classification().get();
            out.printf("Regime:        %s (mean squared deviation %.4g)%n", classification.best().label(),
                classification.scoreOf(classification.best()).meanSquaredDeviation());
        } else {
            out.println("Regime:        n/a");
        }
        out.printf("Report:        %s%n", path);
    }
}
