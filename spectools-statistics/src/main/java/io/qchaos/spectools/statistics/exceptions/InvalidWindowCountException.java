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

/// Thrown when the number of window centers or the number of sample points
/// per window is too small to form a least-squares fit.
public class InvalidWindowCountException extends SpectralStatisticsException {

    private final String parameter;
    private final int value;

    public InvalidWindowCountException(String parameter, int value, int minimum) {
        super(String.format("%s must be at least %d, but was %d.", parameter, minimum, value));
        this.parameter = parameter;
        this.value = value;
    }

    public String getParameter() {
        return parameter;
    }

    public int getValue() {
        return value;
    }
}
