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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.qchaos.spectools.statistics.exceptions.InvalidWindowCountException;
import io.qchaos.spectools.statistics.rigidity.LengthGrid;
import io.qchaos.spectools.statistics.rigidity.RegimeClassifier;
import io.qchaos.spectools.statistics.rigidity.RigidityEstimator;
import io.qchaos.spectools.statistics.unfold.SpacingHistogram;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable settings for a {@link SpectralAnalyzer} run.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every field is optional; missing fields keep their defaults.
 * <pre>{@code
 * {
 *   "num_centers": 500,
 *   "num_points": 50,
 *   "length_start": 0.0,
 *   "length_stop": 20.0,
 *   "length_count": 50,
 *   "include_references": true,
 *   "reference_size": 1000,        // optional, defaults to the data size
 *   "poisson_seed": 42,            // optional, defaults to a time-based seed
 *   "spacing_cutoff": 6.0,
 *   "spacing_bins": 300,
 *   "staircase_points": 1000,
 *   "parallelism": 1,
 *   "min_classification_length": 1.0
 * }
 * }</pre>
 *
 * @see SpectoolsGsonConfig
 */
public class SpectralAnalysisConfig {

    @SerializedName("num_centers")
    private int numCenters = RigidityEstimator.DEFAULT_NUM_CENTERS;

    @SerializedName("num_points")
    private int numPoints = RigidityEstimator.DEFAULT_NUM_POINTS;

    @SerializedName("length_start")
    private double lengthStart = 0.0;

    @SerializedName("length_stop")
    private double lengthStop = 20.0;

    @SerializedName("length_count")
    private int lengthCount = 50;

    /** Whether picket-fence and Poisson curves are computed alongside the data */
    @SerializedName("include_references")
    private boolean includeReferences = true;

    /** Size of the reference spectra; null matches the data */
    @SerializedName("reference_size")
    private Integer referenceSize;

    /** Seed of the Poisson reference; null picks one from the clock */
    @SerializedName("poisson_seed")
    private Long poissonSeed;

    @SerializedName("spacing_cutoff")
    private double spacingCutoff = SpacingHistogram.DEFAULT_CUTOFF;

    @SerializedName("spacing_bins")
    private int spacingBins = SpacingHistogram.DEFAULT_BINS;

    @SerializedName("staircase_points")
    private int staircasePoints = 1000;

    @SerializedName("parallelism")
    private int parallelism = 1;

    @SerializedName("min_classification_length")
    private double minClassificationLength = RegimeClassifier.DEFAULT_MIN_LENGTH;

    public SpectralAnalysisConfig() {
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON text
     * @return the validated configuration
     * @throws JsonParseException if the text is not valid JSON for this schema
     */
    public static SpectralAnalysisConfig fromJson(String json) {
        SpectralAnalysisConfig config = SpectoolsGsonConfig.gson().fromJson(json, SpectralAnalysisConfig.class);
        if (config == null) {
            throw new JsonParseException("Empty analysis configuration");
        }
        config.validate();
        return config;
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static SpectralAnalysisConfig loadFromFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path)) {
            SpectralAnalysisConfig config = SpectoolsGsonConfig.gson().fromJson(reader, SpectralAnalysisConfig.class);
            if (config == null) {
                throw new JsonParseException("Empty analysis configuration in " + path);
            }
            config.validate();
            return config;
        }
    }

    /**
     * Serializes this configuration to pretty-printed JSON.
     */
    public String toJson() {
        return SpectoolsGsonConfig.gson().toJson(this);
    }

    /**
     * Checks all settings.
     *
     * @return this configuration
     * @throws InvalidWindowCountException if a window count is below 2
     * @throws IllegalArgumentException for any other invalid setting
     */
    public SpectralAnalysisConfig validate() {
        if (numCenters < RigidityEstimator.MIN_WINDOW_COUNT) {
            throw new InvalidWindowCountException("num_centers", numCenters, RigidityEstimator.MIN_WINDOW_COUNT);
        }
        if (numPoints < RigidityEstimator.MIN_WINDOW_COUNT) {
            throw new InvalidWindowCountException("num_points", numPoints, RigidityEstimator.MIN_WINDOW_COUNT);
        }
        if (!Double.isFinite(lengthStart) || !Double.isFinite(lengthStop) || lengthStart < 0 || lengthStop < lengthStart) {
            throw new IllegalArgumentException("Length grid must satisfy 0 <= length_start <= length_stop, got ["
                + lengthStart + ", " + lengthStop + "]");
        }
        if (lengthCount < 1) {
            throw new IllegalArgumentException("length_count must be positive: " + lengthCount);
        }
        if (referenceSize != null && referenceSize < 2) {
            throw new IllegalArgumentException("reference_size must be at least 2: " + referenceSize);
        }
        if (!(spacingCutoff > 0) || Double.isInfinite(spacingCutoff)) {
            throw new IllegalArgumentException("spacing_cutoff must be positive and finite: " + spacingCutoff);
        }
        if (spacingBins < 1) {
            throw new IllegalArgumentException("spacing_bins must be positive: " + spacingBins);
        }
        if (staircasePoints < 2) {
            throw new IllegalArgumentException("staircase_points must be at least 2: " + staircasePoints);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (!Double.isFinite(minClassificationLength) || minClassificationLength < 0) {
            throw new IllegalArgumentException("min_classification_length must be finite and non-negative: "
                + minClassificationLength);
        }
        return this;
    }

    /**
     * Gets the window lengths L described by the grid settings.
     */
    public double[] lengths() {
        return LengthGrid.linspace(lengthStart, lengthStop, lengthCount);
    }

    public int getNumCenters() {
        return numCenters;
    }

    public SpectralAnalysisConfig setNumCenters(int numCenters) {
        this.numCenters = numCenters;
        return this;
    }

    public int getNumPoints() {
        return numPoints;
    }

    public SpectralAnalysisConfig setNumPoints(int numPoints) {
        this.numPoints = numPoints;
        return this;
    }

    public double getLengthStart() {
        return lengthStart;
    }

    public double getLengthStop() {
        return lengthStop;
    }

    public int getLengthCount() {
        return lengthCount;
    }

    /**
     * Sets the window length grid.
     */
    public SpectralAnalysisConfig setLengthGrid(double start, double stop, int count) {
        this.lengthStart = start;
        this.lengthStop = stop;
        this.lengthCount = count;
        return this;
    }

    public boolean isIncludeReferences() {
        return includeReferences;
    }

    public SpectralAnalysisConfig setIncludeReferences(boolean includeReferences) {
        this.includeReferences = includeReferences;
        return this;
    }

    public Integer getReferenceSize() {
        return referenceSize;
    }

    public SpectralAnalysisConfig setReferenceSize(Integer referenceSize) {
        this.referenceSize = referenceSize;
        return this;
    }

    public Long getPoissonSeed() {
        return poissonSeed;
    }

    public SpectralAnalysisConfig setPoissonSeed(Long poissonSeed) {
        this.poissonSeed = poissonSeed;
        return this;
    }

    public double getSpacingCutoff() {
        return spacingCutoff;
    }

    public SpectralAnalysisConfig setSpacingCutoff(double spacingCutoff) {
        this.spacingCutoff = spacingCutoff;
        return this;
    }

    public int getSpacingBins() {
        return spacingBins;
    }

    public SpectralAnalysisConfig setSpacingBins(int spacingBins) {
        this.spacingBins = spacingBins;
        return this;
    }

    public int getStaircasePoints() {
        return staircasePoints;
    }

    public SpectralAnalysisConfig setStaircasePoints(int staircasePoints) {
        this.staircasePoints = staircasePoints;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    public SpectralAnalysisConfig setParallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    public double getMinClassificationLength() {
        return minClassificationLength;
    }

    public SpectralAnalysisConfig setMinClassificationLength(double minClassificationLength) {
        this.minClassificationLength = minClassificationLength;
        return this;
    }

    @Override
    public String toString() {
        return String.format("SpectralAnalysisConfig{centers=%d, points=%d, L=[%s..%s]x%d, references=%s, seed=%s}",
            numCenters, numPoints, lengthStart, lengthStop, lengthCount, includeReferences, poissonSeed);
    }
}
