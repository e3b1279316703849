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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class StaircaseFunctionTest {

    private final StaircaseFunction staircase = new StaircaseFunction(new double[]{1.0, 2.0, 2.0, 3.0});

    @Test
    void testCountsLevelsAtOrBelow() {
        assertEquals(0, staircase.query(0.5));
        assertEquals(1, staircase.query(1.0));
        assertEquals(1, staircase.query(1.999));
        assertEquals(3, staircase.query(2.5));
        assertEquals(4, staircase.query(3.0));
        assertEquals(4, staircase.query(100.0));
    }

    @Test
    void testTiesAreCountedTogether() {
        assertEquals(1, staircase.query(Math.nextDown(2.0)));
        assertEquals(3, staircase.query(2.0));
    }

    @Test
    void testInfinities() {
        assertEquals(0, staircase.query(Double.NEGATIVE_INFINITY));
        assertEquals(4, staircase.query(Double.POSITIVE_INFINITY));
    }

    @Test
    void testNaNIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> staircase.query(Double.NaN));
    }

    @Test
    void testMonotone() {
        int previous = 0;
        for (double e = -1.0; e <= 4.0; e += 0.01) {
            int n = staircase.query(e);
            assertTrue(n >= previous, "N must not decrease at " + e);
            previous = n;
        }
    }

    @Test
    void testSample() {
        int[] counts = staircase.sample(new double[]{0.0, 1.0, 2.0, 3.0});
        assertArrayEquals(new int[]{0, 1, 3, 4}, counts);
        assertEquals(4, staircase.length());
    }

    @Test
    void testSpectrumDelegatesToStaircase() {
        PicketFenceSpectrum fence = new PicketFenceSpectrum(10);
        assertEquals(10, fence.length());
        assertEquals(new Bounds(0, 9), fence.bounds());
        assertEquals(6, fence.query(5.0));
        assertEquals(6, fence.staircase().query(5.5));
        assertEquals(1.0, fence.meanSpacing(), 1e-12);
    }
}
