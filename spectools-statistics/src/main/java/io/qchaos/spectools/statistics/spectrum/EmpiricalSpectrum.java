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

/// An unfolded spectrum derived from measured or computed energy levels.
///
/// Instances normally come from `Unfolder`, which divides the sorted raw
/// energies by their mean spacing. The divisor is kept as the unfolding
/// scale so that results can be mapped back to raw energy units.
public final class EmpiricalSpectrum extends AbstractSpectrum {

    private final double unfoldingScale;

    /// Creates a spectrum from unfolded levels.
    ///
    /// @param sortedLevels ascending unfolded levels; the array is copied
    /// @param unfoldingScale the raw mean spacing the levels were divided by
    /// @throws IllegalArgumentException if the levels are not ascending and finite,
    ///     or the scale is not positive
    public EmpiricalSpectrum(double[] sortedLevels, double unfoldingScale) {
        super(requireAscending(sortedLevels).clone());
        if (!(unfoldingScale > 0) || Double.isInfinite(unfoldingScale)) {
            throw new IllegalArgumentException("Unfolding scale must be positive and finite: " + unfoldingScale);
        }
        this.unfoldingScale = unfoldingScale;
    }

    /// @return the raw mean level spacing that was divided out
    public double unfoldingScale() {
        return unfoldingScale;
    }

    @Override
    public String kind() {
        return "empirical";
    }
}
