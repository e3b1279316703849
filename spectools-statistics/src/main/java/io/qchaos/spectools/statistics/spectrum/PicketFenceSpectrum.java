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

/// The picket-fence spectrum 0, 1, ..., n-1: perfectly regular levels with
/// unit spacing, so it is already unfolded. Its rigidity saturates at 1/12.
public final class PicketFenceSpectrum extends AbstractSpectrum {

    /// @param size the number of levels, at least 2
    public PicketFenceSpectrum(int size) {
        super(fence(size));
    }

    private static double[] fence(int size) {
        if (size < MIN_LEVELS) {
            throw new InsufficientDataException(MIN_LEVELS, size);
        }
        double[] levels = new double[size];
        for (int i = 0; i < size; i++) {
            levels[i] = i;
        }
        return levels;
    }

    @Override
    public String kind() {
        return "picket-fence";
    }
}
