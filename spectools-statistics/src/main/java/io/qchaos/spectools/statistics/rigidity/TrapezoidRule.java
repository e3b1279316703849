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

import java.util.Objects;

/// Composite trapezoidal integration over sampled points.
public final class TrapezoidRule {

    private TrapezoidRule() {
        // Utility class
    }

    /// Integrates y(t) over the sample points, which need not be evenly spaced.
    ///
    /// @param t the abscissae, ascending
    /// @param y the integrand at each abscissa
    /// @param count the number of leading points to use
    /// @return Σ (t[i+1] - t[i]) (y[i] + y[i+1]) / 2
    public static double integrate(double[] t, double[] y, int count) {
        Objects.requireNonNull(t, "abscissae cannot be null");
        Objects.requireNonNull(y, "integrand cannot be null");
        if (count > t.length || count > y.length) {
            throw new IllegalArgumentException("Cannot integrate " + count + " points from arrays of length "
                + t.length + " and " + y.length);
        }
        double sum = 0.0;
        for (int i = 1; i < count; i++) {
            sum += (t[i] - t[i - 1]) * (y[i] + y[i - 1]) * 0.5;
        }
        return sum;
    }

    /// Integrates over all points.
    public static double integrate(double[] t, double[] y) {
        Objects.requireNonNull(t, "abscissae cannot be null");
        Objects.requireNonNull(y, "integrand cannot be null");
        if (t.length != y.length) {
            throw new IllegalArgumentException("Abscissae and integrand differ in length: "
                + t.length + " vs " + y.length);
        }
        return integrate(t, y, t.length);
    }
}
