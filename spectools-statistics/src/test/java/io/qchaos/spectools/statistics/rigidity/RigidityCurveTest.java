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

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RigidityCurveTest {

    @Test
    void testCopiesInput() {
        double[] lengths = {0.0, 1.0};
        double[] values = {0.0, 0.1};
        RigidityCurve curve = new RigidityCurve("data", lengths, values);
        lengths[1] = 5.0;
        values[1] = 5.0;

        assertEquals(1.0, curve.length(1));
        assertEquals(0.1, curve.value(1));
        assertEquals(0.1, curve.valueAt(1.0));
        assertEquals(2, curve.size());
    }

    @Test
    void testAsMapKeepsOrder() {
        RigidityCurve curve = new RigidityCurve("data", new double[]{2.0, 1.0}, new double[]{0.2, 0.1});
        Map<Double, Double> map = curve.asMap();
        assertThat(map.keySet()).containsExactly(2.0, 1.0);
        assertThrows(UnsupportedOperationException.class, () -> map.put(3.0, 0.3));
    }

    @Test
    void testInvalidCurves() {
        assertThrows(IllegalArgumentException.class,
            () -> new RigidityCurve("x", new double[]{1.0}, new double[]{0.1, 0.2}));
        assertThrows(IllegalArgumentException.class,
            () -> new RigidityCurve("x", new double[]{-1.0}, new double[]{0.1}));
        assertThrows(NullPointerException.class, () -> new RigidityCurve(null, new double[0], new double[0]));

        RigidityCurve curve = new RigidityCurve("x", new double[]{1.0}, new double[]{0.1});
        assertThrows(IllegalArgumentException.class, () -> curve.valueAt(2.0));
    }
}
