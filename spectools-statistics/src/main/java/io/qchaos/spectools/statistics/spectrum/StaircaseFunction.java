package io.qchaos.spectools.statistics.spectrum;

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

/// # StaircaseFunction
///
/// The cumulative level count N(ε) of a sorted sequence: the number of
/// levels at or below ε.
///
/// ```text
///  N(ε)
///   n ┤                 ┌────
///     │            ┌────┘
///     │       ┌────┘
///     │  ┌────┘
///   0 ┼──┘
///     └──s0───s1───s2───s3───► ε
/// ```
///
/// The function is right-continuous: a level exactly equal to ε is counted.
/// Below the lowest level it is 0, at or above the highest level it is n.
///
/// The backing array is referenced, not copied. It must be sorted ascending
/// and must not be modified afterwards; the spectrum types in this package
/// own their arrays and never expose them.
public final class StaircaseFunction {

    private final double[] sorted;

    /// Creates a staircase over an ascending sequence.
    ///
    /// @param sorted the ascending levels, referenced without copying
    public StaircaseFunction(double[] sorted) {
        this.sorted = Objects.requireNonNull(sorted, "sorted levels cannot be null");
    }

    /// Counts the levels that are less than or equal to epsilon.
    ///
    /// Runs a binary search for the first level strictly greater than
    /// epsilon, so the cost is O(log n).
    ///
    /// @param epsilon the energy to count up to
    /// @return the number of levels at or below epsilon
    /// @throws IllegalArgumentException if epsilon is NaN
    public int query(double epsilon) {
        if (Double.isNaN(epsilon)) {
            throw new IllegalArgumentException("Cannot count levels up to NaN");
        }
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] <= epsilon) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /// Evaluates the staircase at each of the given abscissae.
    ///
    /// @param abscissae the energies to evaluate at
    /// @return N(t) for every t, in the same order
    public int[] sample(double[] abscissae) {
        Objects.requireNonNull(abscissae, "abscissae cannot be null");
        int[] counts = new int[abscissae.length];
        for (int i = 0; i < abscissae.length; i++) {
            counts[i] = query(abscissae[i]);
        }
        return counts;
    }

    /// @return the number of levels, which is also the value of N at and above the highest level
    public int length() {
        return sorted.length;
    }
}
