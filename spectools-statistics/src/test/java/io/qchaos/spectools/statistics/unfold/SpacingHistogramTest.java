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

import io.qchaos.spectools.statistics.random.RandomGenerators;
import io.qchaos.spectools.statistics.reference.ReferenceSpectrumGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpacingHistogramTest {

    @Test
    void testBinning() {
        SpacingHistogram histogram = SpacingHistogram.of(new double[]{0.5, 1.5, 2.5, 7.0, -0.1}, 3.0, 3);

        assertEquals(1.0, histogram.binWidth());
        assertArrayEquals(new int[]{1, 1, 1}, histogram.counts());
        assertEquals(3, histogram.included());
        assertEquals(2, histogram.excluded());
        assertEquals(1.0 / 3.0, histogram.density(0), 1e-12);
        assertEquals(1.5, histogram.binCenter(1));
        assertEquals(2.0, histogram.binStart(2));
    }

    @Test
    void testCutoffFallsInLastBin() {
        SpacingHistogram histogram = SpacingHistogram.of(new double[]{3.0, 0.0}, 3.0, 3);
        assertEquals(1, histogram.count(0));
        assertEquals(1, histogram.count(2));
        assertEquals(0, histogram.excluded());
    }

    @Test
    void testPoissonDensityIntegratesToOne() {
        double[] spacings = NearestNeighborSpacings.of(
            ReferenceSpectrumGenerator.poisson(20_000, RandomGenerators.create(7L)));
        SpacingHistogram histogram = SpacingHistogram.of(spacings, SpacingHistogram.DEFAULT_CUTOFF,
            SpacingHistogram.DEFAULT_BINS);

        double integral = 0.0;
        for (double d : histogram.densities()) {
            integral += d * histogram.binWidth();
        }
        assertEquals(1.0, integral, 1e-9);
        assertThat(histogram.included() + histogram.excluded()).isEqualTo(spacings.length);
        // exponential law: P(s) = e^-s, so the first bin is close to 1
        assertEquals(1.0, histogram.density(0), 0.25);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> SpacingHistogram.of(new double[]{1.0}, 0.0, 10));
        assertThrows(IllegalArgumentException.class, () -> SpacingHistogram.of(new double[]{1.0}, 6.0, 0));
        assertThrows(NullPointerException.class, () -> SpacingHistogram.of(null, 6.0, 10));
    }
}
