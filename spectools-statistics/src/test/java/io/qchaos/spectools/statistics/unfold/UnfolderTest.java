package io.qchaos.spectools.statistics.unfold;

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

import io.qchaos.spectools.statistics.exceptions.DegenerateSpectrumException;
import io.qchaos.spectools.statistics.exceptions.InsufficientDataException;
import io.qchaos.spectools.statistics.random.RandomGenerators;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class UnfolderTest {

    @Test
    void testUnfoldSortsAndScales() {
        EmpiricalSpectrum spectrum = Unfolder.unfold(new double[]{3.0, 1.0, 2.0, 5.0});

        assertEquals(4.0 / 3.0, spectrum.unfoldingScale(), 1e-12);
        assertArrayEquals(new double[]{0.75, 1.5, 2.25, 3.75}, spectrum.levels(), 1e-12);
        assertEquals(1.0, spectrum.meanSpacing(), 1e-12);
    }

    @Test
    void testUnfoldDoesNotModifyInput() {
        double[] raw = {3.0, 1.0, 2.0};
        Unfolder.unfold(raw);
        assertArrayEquals(new double[]{3.0, 1.0, 2.0}, raw);
    }

    @Test
    void testUnitMeanSpacingForRandomLevels() {
        UniformRandomProvider random = RandomGenerators.create(42L);
        double[] raw = new double[1000];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = random.nextDouble() * 1e4 - 3e3;
        }

        EmpiricalSpectrum spectrum = Unfolder.unfold(raw);
        double[] spacings = NearestNeighborSpacings.of(spectrum);

        assertEquals(1.0, NearestNeighborSpacings.mean(spacings), 1e-9);
        for (int i = 1; i < spectrum.length(); i++) {
            assertTrue(spectrum.level(i) >= spectrum.level(i - 1));
        }
    }

    @Test
    void testPicketFenceIsUnchanged() {
        double[] raw = new double[20];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = i;
        }
        EmpiricalSpectrum spectrum = Unfolder.unfold(raw);
        assertEquals(1.0, spectrum.unfoldingScale());
        assertArrayEquals(raw, spectrum.levels());
    }

    @Test
    void testDuplicatesAreKept() {
        EmpiricalSpectrum spectrum = Unfolder.unfold(new double[]{1.0, 1.0, 2.0});
        assertArrayEquals(new double[]{2.0, 2.0, 4.0}, spectrum.levels(), 1e-12);
    }

    @Test
    void testTooFewLevels() {
        assertThrows(InsufficientDataException.class, () -> Unfolder.unfold(new double[]{1.0}));
        assertThrows(InsufficientDataException.class, () -> Unfolder.unfold(new double[0]));
    }

    @Test
    void testDegenerateSpectrum() {
        DegenerateSpectrumException e =
            assertThrows(DegenerateSpectrumException.class, () -> Unfolder.unfold(new double[]{4.0, 4.0, 4.0}));
        assertEquals(3, e.getLevelCount());
    }

    @Test
    void testInvalidInput() {
        assertThrows(NullPointerException.class, () -> Unfolder.unfold(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Unfolder.unfold(new double[]{1.0, Double.POSITIVE_INFINITY, 2.0}));
        assertTrue(e.getMessage().contains("index 1"));
    }
}
