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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpectrumTest {

    @Test
    void testEmpiricalSpectrumCopiesLevels() {
        double[] levels = {0.0, 1.0, 2.5};
        EmpiricalSpectrum spectrum = new EmpiricalSpectrum(levels, 2.0);
        levels[2] = 100.0;

        assertEquals(2.5, spectrum.level(2));
        assertEquals(2.0, spectrum.unfoldingScale());
        assertEquals("empirical", spectrum.kind());

        double[] exposed = spectrum.levels();
        exposed[0] = -5.0;
        assertEquals(0.0, spectrum.level(0));
    }

    @Test
    void testEmpiricalSpectrumRejectsUnsortedLevels() {
        assertThrows(IllegalArgumentException.class, () -> new EmpiricalSpectrum(new double[]{2.0, 1.0}, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new EmpiricalSpectrum(new double[]{0.0, Double.NaN}, 1.0));
    }

    @Test
    void testEmpiricalSpectrumRejectsBadScale() {
        assertThrows(IllegalArgumentException.class, () -> new EmpiricalSpectrum(new double[]{0.0, 1.0}, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new EmpiricalSpectrum(new double[]{0.0, 1.0}, Double.POSITIVE_INFINITY));
    }

    @Test
    void testTooFewLevels() {
        assertThrows(InsufficientDataException.class, () -> new EmpiricalSpectrum(new double[]{1.0}, 1.0));
        InsufficientDataException e = assertThrows(InsufficientDataException.class, () -> new PicketFenceSpectrum(1));
        assertEquals(2, e.getRequired());
        assertEquals(1, e.getActual());
    }

    @Test
    void testPicketFenceLevels() {
        PicketFenceSpectrum fence = new PicketFenceSpectrum(5);
        assertArrayEquals(new double[]{0, 1, 2, 3, 4}, fence.levels());
        assertEquals("picket-fence", fence.kind());
    }

    @Test
    void testBounds() {
        Bounds bounds = new Bounds(-1.0, 3.0);
        assertEquals(4.0, bounds.span());
        assertEquals(1.0, bounds.center());
        assertTrue(bounds.contains(3.0));
        assertFalse(bounds.contains(3.5));
        assertThrows(IllegalArgumentException.class, () -> new Bounds(2.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Bounds(Double.NaN, 1.0));
    }
}
