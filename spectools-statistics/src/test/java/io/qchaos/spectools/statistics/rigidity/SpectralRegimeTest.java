package io.qchaos.spectools.statistics.rigidity;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpectralRegimeTest {

    @Test
    void testTheoryValues() {
        assertEquals(1.0 / 12.0, SpectralRegime.PICKET_FENCE.expectedRigidity(7.0));
        assertEquals(1.0, SpectralRegime.POISSON.expectedRigidity(15.0), 1e-12);
        assertEquals(-0.007, SpectralRegime.GOE.expectedRigidity(1.0), 1e-12);
        assertEquals(Math.log(10.0) / (Math.PI * Math.PI) - 0.007, SpectralRegime.GOE.expectedRigidity(10.0), 1e-12);
    }

    @Test
    void testGoeUndefinedAtZero() {
        assertFalse(SpectralRegime.GOE.isDefinedAt(0.0));
        assertTrue(SpectralRegime.POISSON.isDefinedAt(0.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralRegime.GOE.expectedRigidity(0.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralRegime.POISSON.expectedRigidity(-1.0));
    }

    @Test
    void testCurveSkipsUndefinedLengths() {
        double[] lengths = {0.0, 1.0, 2.0};
        RigidityCurve goe = SpectralRegime.GOE.curve(lengths);
        assertEquals("goe", goe.label());
        assertArrayEquals(new double[]{1.0, 2.0}, goe.lengths());

        RigidityCurve poisson = SpectralRegime.POISSON.curve(lengths);
        assertArrayEquals(new double[]{0.0, 1.0 / 15.0, 2.0 / 15.0}, poisson.values(), 1e-12);
    }
}
