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

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// Picks an [EnergyLevelSource] for a file by its extension.
///
/// | Extension               | Source                    |
/// |-------------------------|---------------------------|
/// | `.h5`, `.hdf5`, `.he5`  | [Hdf5EnergyLevelSource]   |
/// | anything else           | [TextEnergyLevelSource]   |
public final class EnergyLevelSources {

    private static final Set<String> HDF5_EXTENSIONS = Set.of("h5", "hdf5", "he5");

    private EnergyLevelSources() {
        // Utility class
    }

    /// Opens a file with the default dataset path and `num_converged` truncation.
    ///
    /// @param path the file to read
    /// @return a source for the file
    public static EnergyLevelSource open(Path path) {
        return open(path, Hdf5EnergyLevelSource.DEFAULT_DATASET, true);
    }

    /// Opens a file.
    ///
    /// @param path the file to read
    /// @param dataset the HDF5 dataset path, ignored for text files
    /// @param truncateToConverged whether HDF5 energies are cut to the `num_converged` attribute
    /// @return a source for the file
    public static EnergyLevelSource open(Path path, String dataset, boolean truncateToConverged) {
        Objects.requireNonNull(path, "path cannot be null");
        if (isHdf5(path)) {
            return new Hdf5EnergyLevelSource(path, dataset, truncateToConverged);
        }
        return new TextEnergyLevelSource(path);
    }

    static boolean isHdf5(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && HDF5_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
