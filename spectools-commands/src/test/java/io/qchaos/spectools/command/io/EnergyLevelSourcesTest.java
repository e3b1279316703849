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
import io.jhdf.WritableHdfFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class EnergyLevelSourcesTest {

    @TempDir
    Path tempDir;

    @Test
    void testTextFileWithCommentsAndCommas() throws IOException {
        Path file = tempDir.resolve("levels.txt");
        Files.writeString(file, "# levels of a test billiard\n1.5 2.5\n\n3.0, 4.25 # trailing\n-1e-1\n");

        EnergyLevelSource source = EnergyLevelSources.open(file);

        assertThat(source).isInstanceOf(TextEnergyLevelSource.class);
        assertArrayEquals(new double[]{1.5, 2.5, 3.0, 4.25, -0.1}, source.readEnergies());
        assertEquals(file, source.path());
    }

    @Test
    void testTextFileGrowsPastInitialCapacity() throws IOException {
        Path file = tempDir.resolve("many.dat");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            sb.append(i * 0.5).append('\n');
        }
        Files.writeString(file, sb.toString());

        double[] energies = EnergyLevelSources.open(file).readEnergies();
        assertEquals(5000, energies.length);
        assertEquals(2499.5, energies[4999]);
    }

    @Test
    void testInvalidTextValue() throws IOException {
        Path file = tempDir.resolve("bad.txt");
        Files.writeString(file, "1.0\n2.0 abc\n");

        IOException e = assertThrows(IOException.class, () -> EnergyLevelSources.open(file).readEnergies());
        assertThat(e.getMessage()).contains("abc").contains("line 2");
    }

    @Test
    void testHdf5Detection() {
        assertTrue(EnergyLevelSources.isHdf5(Path.of("data/itp2d.h5")));
        assertTrue(EnergyLevelSources.isHdf5(Path.of("run.HDF5")));
        assertFalse(EnergyLevelSources.isHdf5(Path.of("levels.txt")));
        assertFalse(EnergyLevelSources.isHdf5(Path.of("h5")));
    }

    @Test
    void testHdf5Dataset() throws IOException {
        Path file = tempDir.resolve("itp2d.h5");
        double[] energies = {3.5, 1.25, 2.0, 7.75};
        try (WritableHdfFile writable = HdfFile.write(file)) {
            writable.putDataset("final_energies", energies);
            writable.putDataset("other", new double[]{9.0, 8.0});
        }

        EnergyLevelSource source = EnergyLevelSources.open(file);
        assertThat(source).isInstanceOf(Hdf5EnergyLevelSource.class);
        assertArrayEquals(energies, source.readEnergies());

        assertArrayEquals(new double[]{9.0, 8.0},
            EnergyLevelSources.open(file, "/other", true).readEnergies());
    }

    @Test
    void testMissingHdf5Dataset() throws IOException {
        Path file = tempDir.resolve("empty.h5");
        try (WritableHdfFile writable = HdfFile.write(file)) {
            writable.putDataset("something_else", new double[]{1.0, 2.0});
        }

        IOException e = assertThrows(IOException.class, () -> EnergyLevelSources.open(file).readEnergies());
        assertThat(e.getMessage()).contains("/final_energies");
    }

    @Test
    void testConvergedCount() throws IOException {
        assertEquals(3, Hdf5EnergyLevelSource.convergedCount(3, 10));
        assertEquals(4, Hdf5EnergyLevelSource.convergedCount(new int[]{4}, 10));
        assertEquals(10, Hdf5EnergyLevelSource.convergedCount(25L, 10));
        assertThrows(IOException.class, () -> Hdf5EnergyLevelSource.convergedCount(-1, 10));
        assertThrows(IOException.class, () -> Hdf5EnergyLevelSource.convergedCount("three", 10));
    }

    @Test
    void testNumericConversion() throws IOException {
        assertArrayEquals(new double[]{1.5, 2.0}, Hdf5EnergyLevelSource.toDoubles(new float[]{1.5f, 2.0f}, "/e"));
        assertArrayEquals(new double[]{1.0, 2.0}, Hdf5EnergyLevelSource.toDoubles(new int[]{1, 2}, "/e"));
        assertThrows(IOException.class, () -> Hdf5EnergyLevelSource.toDoubles(new double[][]{{1.0}}, "/e"));
    }
}
