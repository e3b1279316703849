package io.qchaos.spectools.statistics.unfold;

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

import java.util.Arrays;
import java.util.Objects;

/**
 * Equal-width histogram of nearest-neighbour spacings over [0, cutoff].
 *
 * <p>Spacings above the cutoff are counted as excluded rather than binned,
 * so a few very large gaps do not stretch the range. The density of each bin
 * is normalized over the included spacings, which makes it comparable with a
 * probability density P(s).
 *
 * <pre>{@code
 * double[] nnd = NearestNeighborSpacings.of(spectrum);
 * SpacingHistogram histogram = SpacingHistogram.of(nnd, 6.0, 300);
 * }</pre>
 */
public final class SpacingHistogram {

    /** Default upper edge of the binned range */
    public static final double DEFAULT_CUTOFF = 6.0;

    /** Default number of bins */
    public static final int DEFAULT_BINS = 300;

    @SerializedName("cutoff")
    private final double cutoff;

    @SerializedName("bin_width")
    private final double binWidth;

    @SerializedName("counts")
    private final int[] counts;

    @SerializedName("density")
    private final double[] density;

    @SerializedName("included")
    private final int included;

    @SerializedName("excluded")
    private final int excluded;

    private SpacingHistogram(double cutoff, int[] counts, int included, int excluded) {
        this.cutoff = cutoff;
        this.binWidth = cutoff / counts.length;
        this.counts = counts;
        this.included = included;
        this.excluded = excluded;
        this.density = new double[counts.length];
        if (included > 0) {
            for (int i = 0; i < counts.length; i++) {
                density[i] = counts[i] / (included * binWidth);
            }
        }
    }

    /**
     * Bins spacings into equal-width bins over [0, cutoff].
     *
     * @param spacings the spacings to bin
     * @param cutoff the upper edge of the binned range, positive
     * @param bins the number of bins, positive
     * @return the histogram
     */
    public static SpacingHistogram of(double[] spacings, double cutoff, int bins) {
        Objects.requireNonNull(spacings, "spacings cannot be null");
        if (!(cutoff > 0) || Double.isInfinite(cutoff)) {
            throw new IllegalArgumentException("Cutoff must be positive and finite: " + cutoff);
        }
        if (bins < 1) {
            throw new IllegalArgumentException("Bin count must be positive: " + bins);
        }

        double binWidth = cutoff / bins;
        int[] counts = new int[bins];
        int included = 0;
        int excluded = 0;
        for (double s : spacings) {
            if (s < 0 || s > cutoff || Double.isNaN(s)) {
                excluded++;
                continue;
            }
            int bin = (int) (s / binWidth);
            if (bin >= bins) bin = bins - 1;
            counts[bin]++;
            included++;
        }
        return new SpacingHistogram(cutoff, counts, included, excluded);
    }

    public double cutoff() {
        return cutoff;
    }

    public double binWidth() {
        return binWidth;
    }

    public int bins() {
        return counts.length;
    }

    /**
     * Gets the lower edge of a bin.
     */
    public double binStart(int bin) {
        return bin * binWidth;
    }

    /**
     * Gets the center of a bin.
     */
    public double binCenter(int bin) {
        return (bin + 0.5) * binWidth;
    }

    public int count(int bin) {
        return counts[bin];
    }

    public double density(int bin) {
        return density[bin];
    }

    public int[] counts() {
        return Arrays.copyOf(counts, counts.length);
    }

    public double[] densities() {
        return Arrays.copyOf(density, density.length);
    }

    /**
     * Gets the number of spacings that fell inside [0, cutoff].
     */
    public int included() {
        return included;
    }

    /**
     * Gets the number of spacings outside [0, cutoff].
     */
    public int excluded() {
        return excluded;
    }

    @Override
    public String toString() {
        return String.format("SpacingHistogram{bins=%d, cutoff=%.3f, included=%d, excluded=%d}",
            counts.length, cutoff, included, excluded);
    }
}
