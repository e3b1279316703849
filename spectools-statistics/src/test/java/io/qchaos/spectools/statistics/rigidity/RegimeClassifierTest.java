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

import io.qchaos.spectools.statistics.random.RandomGenerators;
import io.qchaos.spectools.statistics.reference.ReferenceSpectrumGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class RegimeClassifierTest {

    private static final double[] LENGTHS = LengthGrid.linspace(0.0, 10.0, 11);

    @Tag("unit")
    @Test
    void testTheoryCurvesClassifyAsThemselves() {
        RegimeClassifier classifier = new RegimeClassifier();
        for (SpectralRegime regime : SpectralRegime.values()) {
            RegimeClassification classification = classifier.classify(regime.curve(LENGTHS));
            assertEquals(regime, classification.best());
            assertEquals(0.0, classification.scoreOf(regime).meanSquaredDeviation(), 1e-15);
        }
    }

    @Tag("unit")
    @Test
    void testScoresAreSortedAndRespectMinimumLength() {
        RegimeClassification classification = new RegimeClassifier(5.0)
            .classify(SpectralRegime.POISSON.curve(LENGTHS));

        assertThat(classification.scores()).hasSize(3);
        assertThat(classification.scores())
            .extracting(RegimeClassification.RegimeScore::meanSquaredDeviation)
            .isSorted();
        assertEquals(6, classification.scoreOf(SpectralRegime.GOE).comparedLengths());
    }

    @Tag("unit")
    @Test
    void testNoComparableLengths() {
        RigidityCurve shortCurve = new RigidityCurve("data", new double[]{0.0, 0.5}, new double[]{0.0, 0.03});
        assertThrows(IllegalArgumentException.class, () -> new RegimeClassifier().classify(shortCurve));
        assertThrows(IllegalArgumentException.class, () -> new RegimeClassifier(-1.0));
    }

    @Tag("accuracy")
    @Test
    void testReferenceSpectraAreRecognized() {
        double[] lengths = LengthGrid.linspace(1.0, 10.0, 10);
        RigidityEstimator estimator = new RigidityEstimator(100, 50);
        RegimeClassifier classifier = new RegimeClassifier();

        RigidityCurve fence = estimator.curve(ReferenceSpectrumGenerator.picketFence(500), lengths);
        assertEquals(SpectralRegime.PICKET_FENCE, classifier.classify(fence).best());

        RigidityCurve poisson = estimator.curve(
            ReferenceSpectrumGenerator.poisson(2000, RandomGenerators.create(31L)), lengths);
        assertEquals(SpectralRegime.POISSON, classifier.classify(poisson).best());
    }
}
