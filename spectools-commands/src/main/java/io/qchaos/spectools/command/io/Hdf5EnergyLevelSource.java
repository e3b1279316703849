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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.exceptions.HdfException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/// Reads energies from a one-dimensional numeric dataset of an HDF5 file.
///
/// Eigensolver output files keep all computed states in `/final_energies`,
/// but only the first `num_converged` (a root attribute) are trustworthy.
/// When truncation is on and the attribute is present, the energies are cut
/// to that count.
public final class Hdf5EnergyLevelSource implements EnergyLevelSource {

    private static final Logger logger = LogManager.getLogger(Hdf5EnergyLevelSource.class);

    /// The dataset holding the energies in eigensolver output files.
    public static final String DEFAULT_DATASET = "/final_energies";

    /// The root attribute with the number of converged states.
    public static final String CONVERGED_ATTRIBUTE = "num_converged";

    private final Path path;
    private final String dataset;
    private final boolean truncateToConverged;

    public Hdf5EnergyLevelSource(Path path) {
        this(path, DEFAULT_DATASET, true);
    }

    public Hdf5EnergyLevelSource(Path path, String dataset, boolean truncateToConverged) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.truncateToConverged = truncateToConverged;
    }

    @Override
    public Path path() {
        return path;
    }

    public String dataset() {
        return dataset;
    }

    @Override
    public double[] readEnergies() throws IOException {
        try (HdfFile hdfFile = new HdfFile(path)) {
            Dataset data = hdfFile.getDatasetByPath(dataset);
            double[] energies = toDoubles(data.getData(), dataset);

            if (truncateToConverged) {
                Attribute converged = hdfFile.getAttribute(CONVERGED_ATTRIBUTE);
                if (converged != null) {
                    int count = convergedCount(converged.getData(), energies.length);
                    logger.debug("Keeping {} of {} energies from {} ({}={})", count, energies.length, path,
                        CONVERGED_ATTRIBUTE, count);
                    energies = Arrays.copyOf(energies, count);
                }
            }
            return energies;
        } catch (HdfException e) {
            throw new IOException("Cannot read dataset " + dataset + " from " + path + ": " + e.getMessage(), e);
        }
    }

    static double[] toDoubles(Object data, String dataset) throws IOException {
        if (data instanceof double[]) {
            return (double[]) data;
        }
        if (data instanceof float[]) {
            float[] floats = (float[]) data;
            double[] values = new double[floats.length];
            for (int i = 0; i < floats.length; i++) {
                values[i] = floats[i];
            }
            return values;
        }
        if (data instanceof int[]) {
            return Arrays.stream((int[]) data).asDoubleStream().toArray();
        }
        if (data instanceof long[]) {
            return Arrays.stream((long[]) data).asDoubleStream().toArray();
        }
        String type = data == null ? "null" : data.getClass().getSimpleName();
        throw new IOException("Dataset " + dataset + " must be a one-dimensional numeric array, found " + type);
    }

    static int convergedCount(Object attributeValue, int available) throws IOException {
        long count;
        if (attributeValue instanceof Number) {
            count = ((Number) attributeValue).longValue();
        } else if (attributeValue instanceof int[] && ((int[]) attributeValue).length == 1) {
            count = ((int[]) attributeValue)[0];
        } else if (attributeValue instanceof long[] && ((long[]) attributeValue).length == 1) {
            count = ((long[]) attributeValue)[0];
        } else {
            throw new IOException("Attribute " + CONVERGED_ATTRIBUTE + " must be a single integer, found "
                + (attributeValue == null ? "null" : attributeValue.getClass().getSimpleName()));
        }
        if (count < 0) {
            throw new IOException("Attribute " + CONVERGED_ATTRIBUTE + " is negative: " + count);
        }
        if (count > available) {
            logger.warn("{}={} exceeds the {} stored energies; using all of them", CONVERGED_ATTRIBUTE, count,
                available);
            return available;
        }
        return (int) count;
    }

    @Override
    public String toString() {
        return "hdf5:" + path + dataset;
    }
}
