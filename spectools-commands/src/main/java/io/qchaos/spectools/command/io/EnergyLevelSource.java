package io.qchaos.spectools.command.io;

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

import java.io.IOException;
import java.nio.file.Path;

/// A file that holds a list of raw energy eigenvalues.
///
/// Implementations read the whole list in one call; the energies are
/// returned in file order, unsorted.
public interface EnergyLevelSource {

    /// @return the file this source reads from
    Path path();

    /// Reads every energy level from the file.
    ///
    /// @return the raw energies in file order
    /// @throws IOException if the file cannot be read or does not hold numeric data
    double[] readEnergies() throws IOException;
}
