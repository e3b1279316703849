package io.qchaos.spectools.statistics.analysis;

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

import io.qchaos.spectools.statistics.random.RandomGenerators;
import io.qchaos.spectools.statistics.reference.ReferenceSpectrumGenerator;
import io.qchaos.spectools.statistics.rigidity.LengthGrid;
import io.qchaos.spectools.statistics.rigidity.RegimeClassification;
import io.qchaos.spectools.statistics.rigidity.RegimeClassifier;
import io.qchaos.spectools.statistics.rigidity.RigidityCurve;
import io.qchaos.spectools.statistics.rigidity.RigidityEstimator;
import io.qchaos.spectools.statistics.rigidity.SpectralRegime;
import io.qchaos.spectools.statistics.spectrum.Bounds;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import io.qchaos.spectools.statistics.unfold.NearestNeighborSpacings;
import io.qchaos.spectools.statistics.unfold.SpacingHistogram;
import io.qchaos.spectools.statistics.unfold.Unfolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the complete spectral statistics pipeline on one set of raw energies.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * raw energies ──► Unfolder ──► EmpiricalSpectrum
 *                                  ├──► NearestNeighborSpacings ──► SpacingHistogram
 *                                  ├──► StaircaseFunction.sample
 *                                  └──► RigidityEstimator.curve ──► RegimeClassifier
 *      picket-fence(n), Poisson(n, seed) ──► RigidityEstimator.curve
 *      SpectralRegime.curve (theory)
 * }</pre>
 *
 * <p>Any failure aborts the run and reaches the caller unchanged; there are
 * no partial reports.
 */
public final class SpectralAnalyzer {

    private static final Logger logger = LogManager.getLogger(SpectralAnalyzer.class);

    private final SpectralAnalysisConfig config;

    public SpectralAnalyzer() {
        this(new SpectralAnalysisConfig());
    }

    /**
     * @param config the settings, validated here
     */
    public SpectralAnalyzer(SpectralAnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
    }

    public SpectralAnalysisConfig config() {
        return config;
    }

    /**
     * Analyzes raw energies.
     *
     * @param rawEnergies the energies in any order, at least two distinct values
     * @return the report
     */
    public SpectralAnalysisReport analyze(double[] rawEnergies) {
        long start = System.nanoTime();
        EmpiricalSpectrum spectrum = Unfolder.unfold(rawEnergies);
        SpectralAnalysisReport.Builder report = SpectralAnalysisReport.builder(spectrum);

        double[] spacings = NearestNeighborSpacings.of(spectrum);
        report.spacings(spacings, NearestNeighborSpacings.mean(spacings),
            SpacingHistogram.of(spacings, config.getSpacingCutoff(), config.getSpacingBins()));

        Bounds bounds = spectrum.bounds();
        double[] abscissae = LengthGrid.linspace(bounds.min(), bounds.max(), config.getStaircasePoints());
        report.staircase(abscissae, spectrum.staircase().sample(abscissae));

        double[] lengths = config.lengths();
        try (RigidityEstimator estimator = RigidityEstimator.builder()
            .numCenters(config.getNumCenters())
            .numPoints(config.getNumPoints())
            .parallelism(config.getParallelism())
            .build()) {

            RigidityCurve rigidity = estimator.curve(spectrum, lengths);
            report.rigidity(rigidity);

            if (config.isIncludeReferences()) {
                int size = config.getReferenceSize() != null ? config.getReferenceSize() : spectrum.length();
                long seed = config.getPoissonSeed() != null ? config.getPoissonSeed() : System.currentTimeMillis();
                List<RigidityCurve> references = new ArrayList<>();
                references.add(estimator.curve(ReferenceSpectrumGenerator.picketFence(size), lengths));
                references.add(estimator.curve(
                    ReferenceSpectrumGenerator.poisson(size, RandomGenerators.create(seed)), lengths));
                report.references(references, seed);
                logger.debug("Computed reference curves for {} levels with Poisson seed {}", size, seed);
            }

            List<RigidityCurve> theory = new ArrayList<>();
            for (SpectralRegime regime : SpectralRegime.values()) {
                theory.add(regime.curve(lengths));
            }
            report.theory(theory);

            if (hasClassifiableLength(lengths)) {
                RegimeClassification classification =
                    new RegimeClassifier(config.getMinClassificationLength()).classify(rigidity);
                report.classification(classification);
            } else {
                logger.info("No window length at or above {} with L > 0; skipping regime classification",
                    config.getMinClassificationLength());
            }
        }

        SpectralAnalysisReport result = report.build();
        logger.info("Analyzed {} levels (scale {}) in {} ms: {}", spectrum.length(), spectrum.unfoldingScale(),
            (System.nanoTime() - start) / 1_000_000, result);
        return result;
    }

    private boolean hasClassifiableLength(double[] lengths) {
        for (double length : lengths) {
            if (length > 0 && length >= config.getMinClassificationLength()) {
                return true;
            }
        }
        return false;
    }
}
