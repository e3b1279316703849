package io.qchaos.spectools.statistics.rigidity;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The spectral rigidity Δ3(L) of one spectrum over a grid of window lengths.
 *
 * <p>Lengths keep the order in which they were requested. A curve is built
 * once and never changes.
 */
public final class RigidityCurve {

    @SerializedName("label")
    private final String label;

    @SerializedName("lengths")
    private final double[] lengths;

    @SerializedName("values")
    private final double[] values;

    /**
     * Creates a curve from parallel arrays; both are copied.
     *
     * @param label what the curve describes, e.g. "empirical" or "poisson"
     * @param lengths the window lengths L, each finite and non-negative
     * @param values Δ3(L) for each length
     */
    public RigidityCurve(String label, double[] lengths, double[] values) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(lengths, "lengths cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (lengths.length != values.length) {
            throw new IllegalArgumentException("Curve has " + lengths.length + " lengths but "
                + values.length + " values");
        }
        for (double length : lengths) {
            if (!Double.isFinite(length) || length < 0) {
                throw new IllegalArgumentException("Window length must be finite and non-negative: " + length);
            }
        }
        this.lengths = Arrays.copyOf(lengths, lengths.length);
        this.values = Arrays.copyOf(values, values.length);
    }

    public String label() {
        return label;
    }

    /**
     * Gets the number of points on the curve.
     */
    public int size() {
        return lengths.length;
    }

    public double length(int index) {
        return lengths[index];
    }

    public double value(int index) {
        return values[index];
    }

    public double[] lengths() {
        return Arrays.copyOf(lengths, lengths.length);
    }

    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * Looks up Δ3 for a length that is on the grid.
     *
     * @param length a requested window length
     * @return Δ3 at that length
     * @throws IllegalArgumentException if the length was not part of the grid
     */
    public double valueAt(double length) {
        for (int i = 0; i < lengths.length; i++) {
            if (Double.compare(lengths[i], length) == 0) {
                return values[i];
            }
        }
        throw new IllegalArgumentException("Length " + length + " is not on the " + label + " curve");
    }

    /**
     * Gets the curve as an ordered map from L to Δ3(L).
     */
    public Map<Double, Double> asMap() {
        Map<Double, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < lengths.length; i++) {
            map.put(lengths[i], values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return String.format("RigidityCurve{label=%s, points=%d}", label, lengths.length);
    }
}
