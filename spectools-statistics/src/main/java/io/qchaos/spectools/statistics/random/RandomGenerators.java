package io.qchaos.spectools.statistics.random;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Locale;

/**
 * Seeded random sources for the synthetic reference spectra.
 *
 * <p>Poisson reference spectra are drawn from a {@link UniformRandomProvider}
 * that the caller creates and passes in. For a given algorithm and seed the
 * sequence is the same on every JVM.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiRo256++ - 256-bit state, fast, excellent statistical properties.
         * Period: 2^256 - 1
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiRo128++ - 128-bit state, fast, good statistical properties.
         * Period: 2^128 - 1
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 - 64-bit state, acceptable statistical properties.
         * Period: 2^64
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister - 19937-bit state.
         * Period: 2^19937 - 1
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Resolves an algorithm by name, ignoring case and accepting dashes for underscores.
         *
         * @param name e.g. "xo_shi_ro_256_pp" or "mt"
         * @return the matching algorithm
         * @throws IllegalArgumentException if no algorithm has that name
         */
        public static Algorithm fromName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Algorithm name cannot be empty");
            }
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    /** The algorithm used when none is named */
    public static final Algorithm DEFAULT_ALGORITHM = Algorithm.XO_SHI_RO_256_PP;

    private RandomGenerators() {
        // Utility class
    }

    /**
     * Creates a generator with the specified algorithm and seed.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a generator with the default algorithm.
     *
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(DEFAULT_ALGORITHM, seed);
    }
}
