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

/// A spectrum of uncorrelated levels: uniform random draws, sorted and
/// unfolded exactly like an empirical spectrum. Its rigidity grows as L/15.
///
/// Built by `ReferenceSpectrumGenerator.poisson` from an explicitly supplied
/// random source.
public final class PoissonSpectrum extends AbstractSpectrum {

    private final double unfoldingScale;

    /// Wraps the unfolded draws.
    ///
    /// @param unfolded the unfolded uniform draws, whose levels are shared
    public PoissonSpectrum(EmpiricalSpectrum unfolded) {
        super(unfolded);
        this.unfoldingScale = unfolded.unfoldingScale();
    }

    /// @return the mean spacing of the raw draws that was divided out
    public double unfoldingScale() {
        return unfoldingScale;
    }

    @Override
    public String kind() {
        return "poisson";
    }
}
