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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks the theoretical regime whose rigidity curve lies closest to an
 * empirical one.
 *
 * <p>Each regime is scored by the mean squared deviation between the
 * empirical Δ3(L) and the regime's formula, over the lengths L ≥ minLength
 * where the formula is defined. Small L are left out because every regime
 * starts near zero there and the asymptotic forms do not hold yet.
 *
 * <pre>{@code
 * RegimeClassification result = new RegimeClassifier().classify(curve);
 * if (result.best() == SpectralRegime.GOE) { ... }
 * }</pre>
 */
public final class RegimeClassifier {

    private static final Logger logger = LogManager.getLogger(RegimeClassifier.class);

    /** Default smallest length that is compared */
    public static final double DEFAULT_MIN_LENGTH = 1.0;

    private final double minLength;

    public RegimeClassifier() {
        this(DEFAULT_MIN_LENGTH);
    }

    /**
     * @param minLength the smallest window length taken into account, non-negative
     */
    public RegimeClassifier(double minLength) {
        if (!Double.isFinite(minLength) || minLength < 0) {
            throw new IllegalArgumentException("Minimum length must be finite and non-negative: " + minLength);
        }
        this.minLength = minLength;
    }

    public double minLength() {
        return minLength;
    }

    /**
     * Scores all regimes against an empirical curve.
     *
     * @param empirical the measured rigidity curve
     * @return the classification, best regime first
     * @throws IllegalArgumentException if no length of the curve can be compared
     */
    public RegimeClassification classify(RigidityCurve empirical) {
        Objects.requireNonNull(empirical, "curve cannot be null");
        List<RegimeClassification.RegimeScore> scores = new ArrayList<>();
        for (SpectralRegime regime : SpectralRegime.values()) {
            double sum = 0.0;
            int compared = 0;
            for (int i = 0; i < empirical.size(); i++) {
                double length = empirical.length(i);
                if (length < minLength || !regime.isDefinedAt(length)) {
                    continue;
                }
                double diff = empirical.value(i) - regime.expectedRigidity(length);
                sum += diff * diff;
                compared++;
            }
            if (compared == 0) {
                throw new IllegalArgumentException("Curve " + empirical.label()
                    + " has no lengths at or above " + minLength + " to compare with " + regime.label());
            }
            scores.add(new RegimeClassification.RegimeScore(regime, sum / compared, compared));
        }
        scores.sort(Comparator.comparingDouble(RegimeClassification.RegimeScore::meanSquaredDeviation));
        RegimeClassification classification = new RegimeClassification(scores.get(0).regime(), scores);
        logger.debug("Classified {} as {} (scores {})", empirical.label(), classification.best(), scores);
        return classification;
    }
}
