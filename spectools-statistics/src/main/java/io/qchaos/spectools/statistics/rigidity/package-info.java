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

/// # Spectral rigidity
///
/// Computes Δ3(L), the mean squared deviation of the staircase function from
/// its local straight-line trend over windows of length L, and compares it
/// with the theoretical regimes.
///
/// ```text
///  Δ3(L)
///   0.4 ┤                              ╱ Poisson  L/15
///       │                         ╱╱╱
///   0.2 ┤                  ╱╱╱╱          ___ GOE  ln(L)/π² - 0.007
///       │           ╱╱╱╱   ______-------
///       │     ╱╱╱ __---
///  1/12 ┤──╱─/──────────────────────────── picket-fence
///     0 ┼─┴──────────────────────────────────► L
///       0        5        10       15      20
/// ```
///
/// - [io.qchaos.spectools.statistics.rigidity.RigidityEstimator] - sampling, local fits and integration
/// - [io.qchaos.spectools.statistics.rigidity.RigidityCurve] - Δ3 over a grid of lengths
/// - [io.qchaos.spectools.statistics.rigidity.SpectralRegime] - theoretical curves
/// - [io.qchaos.spectools.statistics.rigidity.RegimeClassifier] - closest regime to a measured curve
package io.qchaos.spectools.statistics.rigidity;
