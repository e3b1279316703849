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

import io.qchaos.spectools.statistics.reference.ReferenceSpectrumGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NearestNeighborSpacingsTest {

    @Test
    void testPicketFenceSpacings() {
        double[] spacings = NearestNeighborSpacings.of(ReferenceSpectrumGenerator.picketFence(5));
        assertArrayEquals(new double[]{1, 1, 1, 1}, spacings);
        assertEquals(1.0, NearestNeighborSpacings.mean(spacings));
    }

    @Test
    void testSpacingsOfUnfoldedSpectrum() {
        double[] spacings = NearestNeighborSpacings.of(Unfolder.unfold(new double[]{0.0, 1.0, 3.0}));
        assertEquals(2, spacings.length);
        assertArrayEquals(new double[]{2.0 / 3.0, 4.0 / 3.0}, spacings, 1e-12);
    }

    @Test
    void testMeanOfEmptySpacingsIsNaN() {
        assertTrue(Double.isNaN(NearestNeighborSpacings.mean(new double[0])));
    }
}
