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
import io.qchaos.spectools.command.common.LengthGridOption;
import io.qchaos.spectools.command.common.ParallelExecutionOption;
import io.qchaos.spectools.command.common.RandomSeedOption;
import io.qchaos.spectools.command.common.VerbosityOption;
import io.qchaos.spectools.command.common.WindowOption;
import io.qchaos.spectools.statistics.analysis.SpectoolsGsonConfig;
import io.qchaos.spectools.statistics.exceptions.SpectralStatisticsException;
import io.qchaos.spectools.statistics.random.RandomGenerators;
import io.qchaos.spectools.statistics.reference.ReferenceSpectrumGenerator;
import io.qchaos.spectools.statistics.rigidity.RegimeClassification;
import io.qchaos.spectools.statistics.rigidity.RegimeClassifier;
import io.qchaos.spectools.statistics.rigidity.RigidityCurve;
import io.qchaos.spectools.statistics.rigidity.RigidityEstimator;
import io.qchaos.spectools.statistics.rigidity.SpectralRegime;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import io.qchaos.spectools.statistics.unfold.Unfolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Print the spectral rigidity Δ3(L) of an energy file as a table.
///
/// Columns hold the data, the computed picket-fence and Poisson references
/// and the three theoretical curves. The GOE curve is blank at L = 0.
///
/// ```text
///         L          data  picket-fence       poisson   1/12 (pf)  L/15 (poi)         GOE
/// ```
///
/// The closest regime and its score follow the table.
@CommandLine.Command(name = "rigidity",
    header = "Tabulate the spectral rigidity of an energy spectrum",
    description = "Computes Delta3(L) for the unfolded spectrum and for picket-fence and Poisson references",
    exitCodeList = {"0: success", "1: error reading input or computing statistics", "2: invalid arguments"})
public class CMD_spectools_rigidity implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_spectools_rigidity.class);

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
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"--no-references"}, description = "Skip the picket-fence and Poisson reference curves")
    private boolean noReferences = false;

    @CommandLine.Option(names = {"--reference-size"},
        description = "Number of levels in the reference spectra (default: same as the input)")
    private Integer referenceSize;

    @CommandLine.Option(names = {"--min-length"},
        description = "Smallest window length used for regime classification (default: ${DEFAULT-VALUE})")
    private double minLength = RegimeClassifier.DEFAULT_MIN_LENGTH;

    @CommandLine.Option(names = {"--json"}, description = "Print the curves as JSON instead of a table")
    private boolean json = false;

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            parallelOption.validate();

            EmpiricalSpectrum spectrum = Unfolder.unfold(inputOption.readEnergies());
            double[] lengths = lengthGridOption.getEffectiveGrid().lengths();

            RigidityCurve data;
            List<RigidityCurve> references = new ArrayList<>();
            long start = System.nanoTime();
            try (RigidityEstimator estimator = RigidityEstimator.builder()
                .numCenters(windowOption.getNumCenters())
                .numPoints(windowOption.getNumPoints())
                .parallelism(parallelOption.getThreadCount())
                .build()) {

                data = estimator.curve(spectrum, lengths);
                if (!noReferences) {
                    int size = referenceSize != null ? referenceSize : spectrum.length();
                    long seed = seedOption.getSeed();
                    references.add(estimator.curve(ReferenceSpectrumGenerator.picketFence(size), lengths));
                    references.add(estimator.curve(
                        ReferenceSpectrumGenerator.poisson(size, RandomGenerators.create(seed)), lengths));
                    logger.log(verbosityOption.progressLevel(), "Reference spectra: {} levels, Poisson seed {}",
                        size, seed);
                }
            }
            logger.log(verbosityOption.progressLevel(), "Computed {} lengths for {} levels in {} ms",
                lengths.length, spectrum.length(), (System.nanoTime() - start) / 1_000_000);

            PrintWriter out = spec.commandLine().getOut();
            if (json) {
                List<RigidityCurve> curves = new ArrayList<>();
                curves.add(data);
                curves.addAll(references);
                out.println(SpectoolsGsonConfig.gson().toJson(curves));
            } else if (verbosityOption.printsTables()) {
                printTable(out, data, references);
                printClassification(out, data);
            }
            out.flush();
            return 0;
        } catch (IOException | SpectralStatisticsException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Rigidity of {} failed: {}", inputOption.getInput(), e.getMessage());
            return 1;
        }
    }

    private void printTable(PrintWriter out, RigidityCurve data, List<RigidityCurve> references) {
        out.printf("%9s  %12s", "L", "data");
        for (RigidityCurve reference : references) {
            out.printf("  %12s", reference.label());
        }
        out.printf("  %10s  %10s  %10s%n", "1/12 (pf)", "L/15 (poi)", "GOE");

        for (int i = 0; i < data.size(); i++) {
            double length = data.length(i);
            out.printf("%9.4f  %12.6f", length, data.value(i));
            for (RigidityCurve reference : references) {
                out.printf("  %12.6f", reference.value(i));
            }
            out.printf("  %10.6f  %10.6f", SpectralRegime.PICKET_FENCE.expectedRigidity(length),
                SpectralRegime.POISSON.expectedRigidity(length));
            if (SpectralRegime.GOE.isDefinedAt(length)) {
                out.printf("  %10.6f%n", SpectralRegime.GOE.expectedRigidity(length));
            } else {
                out.printf("  %10s%n", "-");
            }
        }
    }

    private void printClassification(PrintWriter out, RigidityCurve data) {
        boolean classifiable = false;
        for (int i = 0; i < data.size(); i++) {
            if (data.length(i) > 0 && data.length(i) >= minLength) {
                classifiable = true;
                break;
            }
        }
        if (!classifiable) {
            out.printf("%nRegime: n/a (no window length at or above %s)%n", minLength);
            return;
        }
        RegimeClassification classification = new RegimeClassifier(minLength).classify(data);
        out.println();
        out.printf("Regime: %s%n", classification.best().label());
        for (RegimeClassification.RegimeScore score : classification.scores()) {
            out.printf("  %-14s mean squared deviation %.6g over %d lengths%n",
                score.regime().label(), score.meanSquaredDeviation(), score.comparedLengths());
        }
    }
}
