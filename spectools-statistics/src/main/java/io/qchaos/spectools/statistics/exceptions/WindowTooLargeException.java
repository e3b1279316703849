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

/// Thrown when a rigidity window of length L does not fit inside the span of
/// the spectrum it is evaluated on.
public class WindowTooLargeException extends SpectralStatisticsException {

    private final double length;
    private final double span;

    public WindowTooLargeException(double length, double span) {
        super(String.format("Window length L=%s exceeds the spectrum span %s.", length, span));
        this.length = length;
        this.span = span;
    }

    public double getLength() {
        return length;
    }

    public double getSpan() {
        return span;
    }
}
