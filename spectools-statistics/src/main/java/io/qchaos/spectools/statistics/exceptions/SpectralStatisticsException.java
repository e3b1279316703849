package io.qchaos.spectools.statistics.exceptions;

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

/// Base type for failures raised while computing spectral statistics.
///
/// All failures are unchecked and reach the caller of the failing operation
/// unchanged; nothing in the statistics core catches and masks them.
public class SpectralStatisticsException extends RuntimeException {

    public SpectralStatisticsException(String message) {
        super(message);
    }

    public SpectralStatisticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
