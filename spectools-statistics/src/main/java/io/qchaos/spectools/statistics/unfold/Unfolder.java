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

import io.qchaos.spectools.statistics.exceptions.ComputationException;
import io.qchaos.spectools.statistics.exceptions.DegenerateSpectrumException;
import io.qchaos.spectools.statistics.exceptions.InsufficientDataException;
import io.qchaos.spectools.statistics.spectrum.AbstractSpectrum;
import io.qchaos.spectools.statistics.spectrum.EmpiricalSpectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Rescales raw energy levels to unit mean spacing.
 *
 * <h2>Procedure</h2>
 *
 * <ol>
 *   <li>sort a copy of the raw energies ascending</li>
 *   <li>take the differences of consecutive levels</li>
 *   <li>d = arithmetic mean of those differences</li>
 *   <li>divide every sorted level by d</li>
 * </ol>
 *
 * <p>The result has mean nearest-neighbour spacing 1, which makes spectra of
 * different systems and energy ranges comparable. This is the simplest
 * (global, linear) unfolding; it does not correct for a varying level density.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * double[] energies = loader.read();          // unordered, n >= 2
 * EmpiricalSpectrum spectrum = Unfolder.unfold(energies);
 * double[] nnd = NearestNeighborSpacings.of(spectrum);
 * }</pre>
 */
public final class Unfolder {

    private static final Logger logger = LogManager.getLogger(Unfolder.class);

    private Unfolder() {
        // Utility class
    }

    /**
     * Sorts and unfolds raw energies.
     *
     * @param rawEnergies the energies in any order; not modified
     * @return the unfolded spectrum
     * @throws InsufficientDataException if fewer than two energies are given
     * @throws DegenerateSpectrumException if all energies are equal
     * @throws IllegalArgumentException if an energy is NaN or infinite
     */
    public static EmpiricalSpectrum unfold(double[] rawEnergies) {
        Objects.requireNonNull(rawEnergies, "raw energies cannot be null");
        if (rawEnergies.length < AbstractSpectrum.MIN_LEVELS) {
            throw new InsufficientDataException(AbstractSpectrum.MIN_LEVELS, rawEnergies.length);
        }
        for (int i = 0; i < rawEnergies.length; i++) {
            if (!Double.isFinite(rawEnergies[i])) {
                throw new IllegalArgumentException("Energy at index " + i + " is not finite: " + rawEnergies[i]);
            }
        }

        double[] sorted = Arrays.copyOf(rawEnergies, rawEnergies.length);
        Arrays.sort(sorted);

        double d = meanSpacing(sorted);
        if (d == 0.0) {
            throw new DegenerateSpectrumException(sorted.length, sorted[0]);
        }
        if (!Double.isFinite(d)) {
            throw new ComputationException("Mean level spacing is not finite (" + d + ") for "
                + sorted.length + " levels spanning [" + sorted[0] + ", " + sorted[sorted.length - 1] + "]");
        }

        for (int i = 0; i < sorted.length; i++) {
            sorted[i] /= d;
        }
        logger.debug("Unfolded {} levels with mean spacing {}", sorted.length, d);
        return new EmpiricalSpectrum(sorted, d);
    }

    /**
     * Computes the mean of the consecutive differences of an ascending array.
     *
     * @param sorted ascending values, at least two
     * @return the mean difference
     */
    public static double meanSpacing(double[] sorted) {
        Objects.requireNonNull(sorted, "sorted values cannot be null");
        if (sorted.length < AbstractSpectrum.MIN_LEVELS) {
            throw new InsufficientDataException(AbstractSpectrum.MIN_LEVELS, sorted.length);
        }
        double sum = 0.0;
        for (int i = 1; i < sorted.length; i++) {
            sum += sorted[i] - sorted[i - 1];
        }
        return sum / (sorted.length - 1);
    }
}
