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

import io.qchaos.spectools.command.common.EnergyInputOption;
import io.qchaos.spectools.command.common.VerbosityOption;
import io.qchaos.spectools.statistics.analysis.SpectoolsGsonConfig;
import io.qchaos.spectools.statistics.exceptions.SpectralStatisticsException;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import io.qchaos.spectools.statistics.unfold.NearestNeighborSpacings;
import io.qchaos.spectools.statistics.unfold.SpacingHistogram;
import io.qchaos.spectools.statistics.unfold.Unfolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Print the nearest-neighbour level spacing distribution of an energy file.
///
/// The spectrum is unfolded first, so spacings are in units of the mean
/// spacing. The histogram covers [0, cutoff]; larger spacings are counted
/// as excluded.
@CommandLine.Command(name = "spacing",
    header = "Show the nearest-neighbour level spacing distribution",
    description = "Unfolds the spectrum and prints spacing statistics with an ASCII histogram",
    exitCodeList = {"0: success", "1: error reading input or computing statistics", "2: invalid arguments"})
public class CMD_spectools_spacing implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_spectools_spacing.class);

    private static final String[] BLOCKS = {"▏", "▎", "▍", "▌", "▋", "▊", "▉", "█"};

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private EnergyInputOption inputOption = new EnergyInputOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-b", "--bins"}, description = "Number of histogram bins (default: ${DEFAULT-VALUE})")
    private int bins = 30;

    @CommandLine.Option(names = {"--cutoff"}, description = "Largest spacing in the histogram (default: ${DEFAULT-VALUE})")
    private double cutoff = SpacingHistogram.DEFAULT_CUTOFF;

    @CommandLine.Option(names = {"-w", "--width"}, description = "Width of histogram bars in characters (default: ${DEFAULT-VALUE})")
    private int width = 50;

    @CommandLine.Option(names = {"--json"}, description = "Print the histogram as JSON instead of a chart")
    private boolean json = false;

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            if (width < 1) {
                throw new IllegalArgumentException("--width must be positive: " + width);
            }

            EmpiricalSpectrum spectrum = Unfolder.unfold(inputOption.readEnergies());
            double[] spacings = NearestNeighborSpacings.of(spectrum);
            SpacingHistogram histogram = SpacingHistogram.of(spacings, cutoff, bins);

            PrintWriter out = spec.commandLine().getOut();
            if (json) {
                out.println(SpectoolsGsonConfig.gson().toJson(histogram));
            } else if (verbosityOption.printsTables()) {
                printSummary(out, spectrum, spacings, histogram);
                printHistogram(out, histogram);
            }
            out.flush();
            return 0;
        } catch (IOException | SpectralStatisticsException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Spacing distribution of {} failed: {}", inputOption.getInput(), e.getMessage());
            return 1;
        }
    }

    private void printSummary(PrintWriter out, EmpiricalSpectrum spectrum, double[] spacings, SpacingHistogram histogram) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sumSquares = 0.0;
        double mean = NearestNeighborSpacings.mean(spacings);
        for (double s : spacings) {
            min = Math.min(min, s);
            max = Math.max(max, s);
            sumSquares += (s - mean) * (s - mean);
        }
        out.printf("Levels:        %,d (mean raw spacing %.6g)%n", spectrum.length(), spectrum.unfoldingScale());
        out.printf("Spacings:      %,d, %,d above cutoff %.3g%n", spacings.length, histogram.excluded(), cutoff);
        out.printf("Mean:          %.6f%n", mean);
        out.printf("Variance:      %.6f%n", sumSquares / spacings.length);
        out.printf("Range:         [%.6f, %.6f]%n", min, max);
        out.println();
    }

    private void printHistogram(PrintWriter out, SpacingHistogram histogram) {
        int maxCount = 0;
        for (int count : histogram.counts()) {
            maxCount = Math.max(maxCount, count);
        }
        for (int i = 0; i < histogram.bins(); i++) {
            int count = histogram.count(i);
            out.printf("[%6.3f, %6.3f)  %7d  %8.4f  %s%n", histogram.binStart(i), histogram.binStart(i + 1),
                count, histogram.density(i), bar(count, maxCount));
        }
    }

    private String bar(int count, int maxCount) {
        if (maxCount == 0 || count == 0) {
            return "";
        }
        double scaled = (double) count / maxCount * width;
        int full = (int) scaled;
        int partial = (int) ((scaled - full) * BLOCKS.length);
        StringBuilder sb = new StringBuilder(BLOCKS[BLOCKS.length - 1].repeat(full));
        if (partial > 0) {
            sb.append(BLOCKS[partial - 1]);
        }
        return sb.toString();
    }
}
