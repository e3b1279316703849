package io.qchaos.spectools.command.common;

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

import io.qchaos.spectools.command.io.EnergyLevelSource;
import io.qchaos.spectools.command.io.EnergyLevelSources;
import io.qchaos.spectools.command.io.Hdf5EnergyLevelSource;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared energy level input: a positional file plus the HDF5 dataset settings.
 */
public class EnergyInputOption {

    @CommandLine.Parameters(
        index = "0",
        arity = "1",
        description = "Energy level file: HDF5 (.h5, .hdf5) or text with one or more numbers per line"
    )
    private Path input;

    @CommandLine.Option(
        names = {"--dataset"},
        description = "HDF5 dataset holding the energies (default: ${DEFAULT-VALUE})"
    )
    private String dataset = Hdf5EnergyLevelSource.DEFAULT_DATASET;

    @CommandLine.Option(
        names = {"--all-levels"},
        description = "Use every stored level instead of only the first num_converged"
    )
    private boolean allLevels = false;

    public Path getInput() {
        return input;
    }

    public String getDataset() {
        return dataset;
    }

    /**
     * Validates that the input file exists.
     *
     * @throws IllegalStateException if the file is missing
     */
    public void validate() {
        if (input == null || !Files.isRegularFile(input)) {
            throw new IllegalStateException("Input file not found: " + input);
        }
    }

    public EnergyLevelSource open() {
        return EnergyLevelSources.open(input, dataset, !allLevels);
    }

    /**
     * Validates the input and reads its energies.
     *
     * @return the raw energies in file order
     * @throws IOException if the file cannot be read
     */
    public double[] readEnergies() throws IOException {
        validate();
        return open().readEnergies();
    }
}
