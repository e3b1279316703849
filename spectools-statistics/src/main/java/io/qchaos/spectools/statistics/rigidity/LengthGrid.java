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

/// Evenly spaced grids with both endpoints included.
public final class LengthGrid {

    private LengthGrid() {
        // Utility class
    }

    /// Creates `count` evenly spaced values from `start` to `stop`.
    ///
    /// Both endpoints are part of the grid and the last value is exactly
    /// `stop`, so rounding in the step never pushes a sample past the end of
    /// a window. A single-point grid is `{start}`.
    ///
    /// @param start the first value
    /// @param stop the last value
    /// @param count the number of values, at least 1
    /// @return the grid
    public static double[] linspace(double start, double stop, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Grid count must be positive: " + count);
        }
        if (!Double.isFinite(start) || !Double.isFinite(stop)) {
            throw new IllegalArgumentException("Grid endpoints must be finite: [" + start + ", " + stop + "]");
        }
        double[] grid = new double[count];
        if (count == 1) {
            grid[0] = start;
            return grid;
        }
        double step = (stop - start) / (count - 1);
        for (int i = 0; i < count - 1; i++) {
            grid[i] = start + i * step;
        }
        grid[count - 1] = stop;
        return grid;
    }
}
