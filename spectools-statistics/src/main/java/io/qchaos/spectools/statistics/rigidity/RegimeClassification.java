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

import java.util.List;
import java.util.Objects;

/**
 * Outcome of comparing an empirical rigidity curve with the theoretical regimes.
 *
 * @param best the regime with the smallest deviation
 * @param scores every regime's score, best first
 */
public record RegimeClassification(SpectralRegime best, List<RegimeScore> scores) {

    /**
     * Compact constructor with validation.
     */
    public RegimeClassification {
        Objects.requireNonNull(best, "best regime cannot be null");
        scores = List.copyOf(Objects.requireNonNull(scores, "scores cannot be null"));
    }

    /**
     * Gets the score of one regime.
     *
     * @throws IllegalArgumentException if the regime was not scored
     */
    public RegimeScore scoreOf(SpectralRegime regime) {
        return scores.stream()
            .filter(s -> s.regime() == regime)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Regime was not scored: " + regime));
    }

    /**
     * Deviation of the empirical curve from one regime's theoretical curve.
     *
     * @param regime the regime
     * @param meanSquaredDeviation mean of (Δ3_empirical - Δ3_theory)² over the compared lengths
     * @param comparedLengths how many lengths entered the mean
     */
    public record RegimeScore(SpectralRegime regime, double meanSquaredDeviation, int comparedLengths) {
    }
}
