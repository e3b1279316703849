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

import com.google.gson.annotations.SerializedName;
import io.qchaos.spectools.statistics.rigidity.RegimeClassification;
import io.qchaos.spectools.statistics.rigidity.RigidityCurve;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import io.qchaos.spectools.statistics.unfold.SpacingHistogram;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a {@link SpectralAnalyzer} run produces for one spectrum.
 *
 * <ul>
 *   <li>the unfolded levels and the unfolding scale</li>
 *   <li>the nearest-neighbour spacings and their histogram</li>
 *   <li>the sampled staircase N(ε)</li>
 *   <li>Δ3(L) of the data and, when requested, of the picket-fence and Poisson references</li>
 *   <li>the theoretical curves and the closest regime</li>
 * </ul>
 *
 * <p>The report is immutable and serializes to JSON through
 * {@link SpectoolsGsonConfig}; the spectrum object itself is kept for Java
 * callers only.
 */
public final class SpectralAnalysisReport {

    private final transient EmpiricalSpectrum spectrum;

    @SerializedName("level_count")
    private final int levelCount;

    @SerializedName("unfolding_scale")
    private final double unfoldingScale;

    @SerializedName("unfolded_levels")
    private final double[] unfoldedLevels;

    @SerializedName("spacings")
    private final double[] spacings;

    @SerializedName("mean_spacing")
    private final double meanSpacing;

    @SerializedName("spacing_histogram")
    private final SpacingHistogram spacingHistogram;

    @SerializedName("staircase_abscissae")
    private final double[] staircaseAbscissae;

    @SerializedName("staircase_counts")
    private final int[] staircaseCounts;

    @SerializedName("rigidity")
    private final RigidityCurve rigidity;

    @SerializedName("references")
    private final List<RigidityCurve> references;

    @SerializedName("theory")
    private final List<RigidityCurve> theory;

    @SerializedName("poisson_seed")
    private final Long poissonSeed;

    @SerializedName("classification")
    private final RegimeClassification classification;

    SpectralAnalysisReport(Builder builder) {
        this.spectrum = Objects.requireNonNull(builder.spectrum, "spectrum cannot be null");
        this.levelCount = spectrum.length();
        this.unfoldingScale = spectrum.unfoldingScale();
        this.unfoldedLevels = spectrum.levels();
        this.spacings = Objects.requireNonNull(builder.spacings, "spacings cannot be null");
        this.meanSpacing = builder.meanSpacing;
        this.spacingHistogram = Objects.requireNonNull(builder.spacingHistogram, "histogram cannot be null");
        this.staircaseAbscissae = Objects.requireNonNull(builder.staircaseAbscissae, "staircase abscissae cannot be null");
        this.staircaseCounts = Objects.requireNonNull(builder.staircaseCounts, "staircase counts cannot be null");
        this.rigidity = Objects.requireNonNull(builder.rigidity, "rigidity curve cannot be null");
        this.references = List.copyOf(builder.references);
        this.theory = List.copyOf(builder.theory);
        this.poissonSeed = builder.poissonSeed;
        this.classification = builder.classification;
    }

    static Builder builder(EmpiricalSpectrum spectrum) {
        return new Builder(spectrum);
    }

    /**
     * Gets the unfolded spectrum. Not part of the JSON form.
     */
    public EmpiricalSpectrum spectrum() {
        return spectrum;
    }

    public int levelCount() {
        return levelCount;
    }

    public double unfoldingScale() {
        return unfoldingScale;
    }

    public double[] unfoldedLevels() {
        return Arrays.copyOf(unfoldedLevels, unfoldedLevels.length);
    }

    public double[] spacings() {
        return Arrays.copyOf(spacings, spacings.length);
    }

    public double meanSpacing() {
        return meanSpacing;
    }

    public SpacingHistogram spacingHistogram() {
        return spacingHistogram;
    }

    public double[] staircaseAbscissae() {
        return Arrays.copyOf(staircaseAbscissae, staircaseAbscissae.length);
    }

    public int[] staircaseCounts() {
        return Arrays.copyOf(staircaseCounts, staircaseCounts.length);
    }

    /**
     * Gets Δ3(L) of the data.
     */
    public RigidityCurve rigidity() {
        return rigidity;
    }

    /**
     * Gets the reference curves, empty when references were not requested.
     */
    public List<RigidityCurve> references() {
        return Collections.unmodifiableList(references);
    }

    /**
     * Finds a reference curve by label, e.g. "poisson".
     */
    public Optional<RigidityCurve> reference(String label) {
        return references.stream().filter(c -> c.label().equals(label)).findFirst();
    }

    public List<RigidityCurve> theory() {
        return Collections.unmodifiableList(theory);
    }

    /**
     * Gets the seed the Poisson reference was drawn with, empty without references.
     */
    public Optional<Long> poissonSeed() {
        return Optional.ofNullable(poissonSeed);
    }

    /**
     * Gets the closest regime, empty when the length grid has no point at or
     * above the classification minimum.
     */
    public Optional<RegimeClassification> classification() {
        return Optional.ofNullable(classification);
    }

    /**
     * Serializes the report to pretty-printed JSON.
     */
    public String toJson() {
        return SpectoolsGsonConfig.gson().toJson(this);
    }

    @Override
    public String toString() {
        return String.format("SpectralAnalysisReport{levels=%d, scale=%s, references=%d, regime=%s}",
            levelCount, unfoldingScale, references.size(),
            classification != null ? classification.best() : "n/a");
    }

    static final class Builder {
        private final EmpiricalSpectrum spectrum;
        private double[] spacings;
        private double meanSpacing;
        private SpacingHistogram spacingHistogram;
        private double[] staircaseAbscissae;
        private int[] staircaseCounts;
        private RigidityCurve rigidity;
        private List<RigidityCurve> references = List.of();
        private List<RigidityCurve> theory = List.of();
        private Long poissonSeed;
        private RegimeClassification classification;

        private Builder(EmpiricalSpectrum spectrum) {
            this.spectrum = spectrum;
        }

        Builder spacings(double[] spacings, double meanSpacing, SpacingHistogram histogram) {
            this.spacings = spacings;
            this.meanSpacing = meanSpacing;
            this.spacingHistogram = histogram;
            return this;
        }

        Builder staircase(double[] abscissae, int[] counts) {
            this.staircaseAbscissae = abscissae;
            this.staircaseCounts = counts;
            return this;
        }

        Builder rigidity(RigidityCurve rigidity) {
            this.rigidity = rigidity;
            return this;
        }

        Builder references(List<RigidityCurve> references, Long poissonSeed) {
            this.references = references;
            this.poissonSeed = poissonSeed;
            return this;
        }

        Builder theory(List<RigidityCurve> theory) {
            this.theory = theory;
            return this;
        }

        Builder classification(RegimeClassification classification) {
            this.classification = classification;
            return this;
        }

        SpectralAnalysisReport build() {
            return new SpectralAnalysisReport(this);
        }
    }
}
