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

/// Thrown when a spectrum cannot be unfolded because its mean level spacing
/// is zero, which happens when every level has the same energy.
public class DegenerateSpectrumException extends SpectralStatisticsException {

    private final int levelCount;

    public DegenerateSpectrumException(int levelCount, double value) {
        super(String.format("Cannot unfold %d levels which all have the energy %s: mean spacing is zero.",
            levelCount, value));
        this.levelCount = levelCount;
    }

    public int getLevelCount() {
        return levelCount;
    }
}
