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

/// Unchecked failures of the spectral statistics core.
///
/// ```text
/// SpectralStatisticsException
///  ├── InsufficientDataException    fewer than two levels
///  ├── DegenerateSpectrumException  zero mean spacing
///  ├── WindowTooLargeException      L exceeds the spectrum span
///  ├── InvalidWindowCountException  numCenters or numPoints below 2
///  └── ComputationException         unexpected numerical failure
/// ```
package io.qchaos.spectools.statistics.exceptions;
