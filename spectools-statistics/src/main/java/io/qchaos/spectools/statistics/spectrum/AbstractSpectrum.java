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

import io.qchaos.spectools.statistics.exceptions.InsufficientDataException;

import java.util.Arrays;
import java.util.Objects;

/// Base implementation of [Spectrum] that owns a sorted level array and the
/// [StaircaseFunction] bound to it.
///
/// Subclasses hand over an array that nothing else references. The array is
/// never exposed; [#levels()] returns a copy.
public abstract class AbstractSpectrum implements Spectrum {

    /// The minimum number of levels a spectrum may hold.
    public static final int MIN_LEVELS = 2;

    private final double[] levels;
    private final StaircaseFunction staircase;
    private final Bounds bounds;

    /// Takes ownership of an ascending level array.
    ///
    /// @param sortedLevels ascending levels, not copied
    /// @throws InsufficientDataException if fewer than two levels are given
    protected AbstractSpectrum(double[] sortedLevels) {
        Objects.requireNonNull(sortedLevels, "levels cannot be null");
        if (sortedLevels.length < MIN_LEVELS) {
            throw new InsufficientDataException(MIN_LEVELS, sortedLevels.length);
        }
        this.levels = sortedLevels;
        this.staircase = new StaircaseFunction(sortedLevels);
        this.bounds = new Bounds(sortedLevels[0], sortedLevels[sortedLevels.length - 1]);
    }

    /// Shares the levels of another spectrum. Both are immutable, so no copy is needed.
    ///
    /// @param source the spectrum whose levels are shared
    protected AbstractSpectrum(AbstractSpectrum source) {
        Objects.requireNonNull(source, "source spectrum cannot be null");
        this.levels = source.levels;
        this.staircase = source.staircase;
        this.bounds = source.bounds;
    }

    /// Verifies that an array is sorted ascending and holds only finite values.
    ///
    /// @param levels the array to check
    /// @return the same array
    /// @throws IllegalArgumentException on the first out-of-order or non-finite value
    protected static double[] requireAscending(double[] levels) {
        Objects.requireNonNull(levels, "levels cannot be null");
        for (int i = 0; i < levels.length; i++) {
            if (!Double.isFinite(levels[i])) {
                throw new IllegalArgumentException("Level at index " + i + " is not finite: " + levels[i]);
            }
            if (i > 0 && levels[i] < levels[i - 1]) {
                throw new IllegalArgumentException(
                    "Levels must be ascending, but level " + i + " (" + levels[i]
                        + ") is below level " + (i - 1) + " (" + levels[i - 1] + ")");
            }
        }
        return levels;
    }

    @Override
    public int query(double epsilon) {
        return staircase.query(epsilon);
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public int length() {
        return levels.length;
    }

    @Override
    public double level(int index) {
        return levels[index];
    }

    @Override
    public double[] levels() {
        return Arrays.copyOf(levels, levels.length);
    }

    @Override
    public StaircaseFunction staircase() {
        return staircase;
    }

    /// Gets the mean spacing between consecutive levels.
    ///
    /// For an unfolded spectrum this is 1 up to rounding.
    ///
    /// @return (max - min) / (n - 1)
    public double meanSpacing() {
        return bounds.span() / (levels.length - 1);
    }

    /// @return a short name for the kind of spectrum, used in logs and reports
    public abstract String kind();

    @Override
    public String toString() {
        return String.format("%s{levels=%d, bounds=%s}", getClass().getSimpleName(), levels.length, bounds);
    }
}
