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

import java.util.Objects;

/**
 * Level-statistics regimes and their asymptotic rigidity curves.
 *
 * <table>
 *   <caption>Theoretical Δ3(L)</caption>
 *   <tr><th>Regime</th><th>Δ3(L)</th><th>Meaning</th></tr>
 *   <tr><td>picket-fence</td><td>1/12</td><td>perfectly regular, maximally rigid levels</td></tr>
 *   <tr><td>Poisson</td><td>L/15</td><td>uncorrelated levels, typical of integrable systems</td></tr>
 *   <tr><td>GOE</td><td>ln(L)/π² - 0.007, L ≫ 1</td><td>time-reversal invariant chaotic systems</td></tr>
 * </table>
 */
public enum SpectralRegime {

    PICKET_FENCE("picket-fence") {
        @Override
        public double expectedRigidity(double length) {
            requireDefined(length);
            return 1.0 / 12.0;
        }
    },

    POISSON("poisson") {
        @Override
        public double expectedRigidity(double length) {
            requireDefined(length);
            return length / 15.0;
        }
    },

    GOE("goe") {
        @Override
        public boolean isDefinedAt(double length) {
            return Double.isFinite(length) && length > 0;
        }

        @Override
        public double expectedRigidity(double length) {
            requireDefined(length);
            return Math.log(length) / (Math.PI * Math.PI) - GOE_OFFSET;
        }
    };

    /** Constant term of the large-L GOE approximation */
    public static final double GOE_OFFSET = 0.007;

    private final String label;

    SpectralRegime(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Gets the theoretical Δ3 at a window length.
     *
     * @param length the window length L
     * @return Δ3(L) for this regime
     * @throws IllegalArgumentException if the formula is not defined at L
     */
    public abstract double expectedRigidity(double length);

    /**
     * Checks whether the formula can be evaluated at a length. GOE needs L > 0,
     * the others L ≥ 0.
     */
    public boolean isDefinedAt(double length) {
        return Double.isFinite(length) && length >= 0;
    }

    /**
     * Evaluates the theoretical curve on a grid, skipping lengths where the
     * formula is undefined.
     *
     * @param lengths the window lengths
     * @return the theoretical curve, labelled with {@link #label()}
     */
    public RigidityCurve curve(double[] lengths) {
        Objects.requireNonNull(lengths, "lengths cannot be null");
        int defined = 0;
        for (double length : lengths) {
            if (isDefinedAt(length)) defined++;
        }
        double[] usable = new double[defined];
        double[] values = new double[defined];
        int k = 0;
        for (double length : lengths) {
            if (isDefinedAt(length)) {
                usable[k] = length;
                values[k] = expectedRigidity(length);
                k++;
            }
        }
        return new RigidityCurve(label, usable, values);
    }

    void requireDefined(double length) {
        if (!isDefinedAt(length)) {
            throw new IllegalArgumentException("The " + label + " rigidity is not defined at L=" + length);
        }
    }
}
