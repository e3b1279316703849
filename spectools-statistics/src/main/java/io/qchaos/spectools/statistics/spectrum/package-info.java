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

/// # Spectra and their staircase functions
///
/// Every spectrum in this package is an ascending, immutable sequence of
/// unfolded levels that answers three questions: how many levels lie at or
/// below ε ([io.qchaos.spectools.statistics.spectrum.Spectrum#query(double)]),
/// which interval the levels cover, and how many levels there are.
///
/// ```text
///                 Spectrum
///                    │
///             AbstractSpectrum ── owns double[] + StaircaseFunction
///        ┌───────────┼─────────────┐
/// EmpiricalSpectrum  PicketFence   PoissonSpectrum
///  (unfolded data)   (0..n-1)      (unfolded uniform draws)
/// ```
///
/// The rigidity estimator and the spacing extractor only depend on the
/// interface, so empirical and reference spectra are handled the same way.
package io.qchaos.spectools.statistics.spectrum;
