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

import io.qchaos.spectools.statistics.exceptions.ComputationException;

import java.util.Objects;

/**
 * Closed-form least-squares line y ≈ a + b·t.
 *
 * <p>Uses the centered sums
 * <pre>{@code
 *   b = Σ(t - t̄)(y - ȳ) / Σ(t - t̄)²
 *   a = ȳ - b·t̄
 * }</pre>
 * which need one pass for the means and one for the sums, O(n) with no
 * matrix algebra.
 *
 * @param intercept a
 * @param slope b
 */
public record LinearFit(double intercept, double slope) {

    /**
     * Fits a line through the first {@code count} points.
     *
     * @param t the abscissae
     * @param y the ordinates
     * @param count the number of points to use, at least 2
     * @return the fitted line
     * @throws ComputationException if the abscissae have no spread or the fit is not finite
     */
    public static LinearFit fit(double[] t, double[] y, int count) {
        Objects.requireNonNull(t, "abscissae cannot be null");
        Objects.requireNonNull(y, "ordinates cannot be null");
        if (count < 2 || count > t.length || count > y.length) {
            throw new IllegalArgumentException("Cannot fit " + count + " points from arrays of length "
                + t.length + " and " + y.length);
        }

        double sumT = 0.0;
        double sumY = 0.0;
        for (int i = 0; i < count; i++) {
            sumT += t[i];
            sumY += y[i];
        }
        double meanT = sumT / count;
        double meanY = sumY / count;

        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < count; i++) {
            double dt = t[i] - meanT;
            sxx += dt * dt;
            sxy += dt * (y[i] - meanY);
        }
        if (!(sxx > 0)) {
            throw new ComputationException("Cannot fit a line: abscissae have no spread (Sxx=" + sxx + ")");
        }

        double slope = sxy / sxx;
        double intercept = meanY - slope * meanT;
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            throw new ComputationException("Linear fit is not finite: a=" + intercept + ", b=" + slope);
        }
        return new LinearFit(intercept, slope);
    }

    /**
     * Fits a line through all points.
     */
    public static LinearFit fit(double[] t, double[] y) {
        Objects.requireNonNull(t, "abscissae cannot be null");
        Objects.requireNonNull(y, "ordinates cannot be null");
        if (t.length != y.length) {
            throw new IllegalArgumentException("Abscissae and ordinates differ in length: "
                + t.length + " vs " + y.length);
        }
        return fit(t, y, t.length);
    }

    /**
     * Evaluates the line.
     */
    public double valueAt(double t) {
        return intercept + slope * t;
    }
}
