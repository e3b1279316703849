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

import io.qchaos.spectools.statistics.spectrum.Spectrum;

import java.util.Objects;

/// Extracts the nearest-neighbour spacing (NND) sequence of a spectrum:
/// s_i = e_(i+1) - e_i for consecutive levels.
///
/// For an unfolded spectrum the spacings have mean 1, so their distribution
/// can be compared directly with the Poisson (exp(-s)) and Wigner-Dyson
/// shapes.
public final class NearestNeighborSpacings {

    private NearestNeighborSpacings() {
        // Utility class
    }

    /// @param spectrum an ascending spectrum
    /// @return the n - 1 consecutive differences, in level order
    public static double[] of(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        int n = spectrum.length();
        double[] spacings = new double[n - 1];
        double previous = spectrum.level(0);
        for (int i = 1; i < n; i++) {
            double current = spectrum.level(i);
            spacings[i - 1] = current - previous;
            previous = current;
        }
        return spacings;
    }

    /// @param spacings a spacing sequence
    /// @return the arithmetic mean, or NaN for an empty sequence
    public static double mean(double[] spacings) {
        Objects.requireNonNull(spacings, "spacings cannot be null");
        if (spacings.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double s : spacings) {
            sum += s;
        }
        return sum / spacings.length;
    }
}
