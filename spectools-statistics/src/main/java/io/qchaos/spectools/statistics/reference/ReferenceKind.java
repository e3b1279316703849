package io.qchaos.spectools.statistics.reference;

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

/// The synthetic baseline spectra an empirical spectrum is compared with.
public enum ReferenceKind {

    /// Evenly spaced levels 0..n-1, the most rigid spectrum possible.
    PICKET_FENCE("picket-fence"),

    /// Uncorrelated uniform draws, unfolded; maximal level fluctuation.
    POISSON("poisson");

    private final String label;

    ReferenceKind(String label) {
        this.label = label;
    }

    /// @return the lower-case name used in reports
    public String label() {
        return label;
    }
}
