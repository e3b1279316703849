package io.qchaos.spectools.statistics.reference;

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

import io.qchaos.spectools.statistics.exceptions.InsufficientDataException;
import io.qchaos.spectools.statistics.spectrum.AbstractSpectrum;
import io.qchaos.spectools.statistics.spectrum.PicketFenceSpectrum;
import io.qchaos.spectools.statistics.spectrum.PoissonSpectrum;
import io.qchaos.spectools.statistics.unfold.Unfolder;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/**
 * Builds the reference spectra that empirical rigidity curves are
 * benchmarked against.
 *
 * <ul>
 *   <li><b>picket-fence</b> - the integers 0..n-1, already unfolded; Δ3(L) saturates at 1/12</li>
 *   <li><b>Poisson</b> - n uniform(0,1) draws, sorted and unfolded like empirical data; Δ3(L) ≈ L/15</li>
 * </ul>
 *
 * <p>The Poisson generator never touches a global random generator: the
 * caller supplies the {@link UniformRandomProvider}, so a fixed seed gives
 * bit-identical spectra.
 *
 * <pre>{@code
 * PicketFenceSpectrum fence = ReferenceSpectrumGenerator.picketFence(1000);
 * PoissonSpectrum poisson = ReferenceSpectrumGenerator.poisson(1000, RandomGenerators.create(42L));
 * }</pre>
 */
public final class ReferenceSpectrumGenerator {

    private ReferenceSpectrumGenerator() {
        // Utility class
    }

    /**
     * Creates the picket-fence spectrum {0, 1, ..., n-1}.
     *
     * @param size the number of levels, at least 2
     * @return the spectrum
     */
    public static PicketFenceSpectrum picketFence(int size) {
        return new PicketFenceSpectrum(size);
    }

    /**
     * Draws an unfolded Poisson spectrum.
     *
     * @param size the number of levels, at least 2
     * @param random the source of the uniform draws; advanced by {@code size} doubles
     * @return the spectrum
     */
    public static PoissonSpectrum poisson(int size, UniformRandomProvider random) {
        Objects.requireNonNull(random, "random source cannot be null");
        if (size < AbstractSpectrum.MIN_LEVELS) {
            throw new InsufficientDataException(AbstractSpectrum.MIN_LEVELS, size);
        }
        double[] draws = new double[size];
        for (int i = 0; i < size; i++) {
            draws[i] = random.nextDouble();
        }
        return new PoissonSpectrum(Unfolder.unfold(draws));
    }

    /**
     * Creates a reference spectrum of the given kind.
     *
     * @param kind the reference to build
     * @param size the number of levels
     * @param random the random source, used only for {@link ReferenceKind#POISSON}
     * @return the spectrum
     */
    public static AbstractSpectrum create(ReferenceKind kind, int size, UniformRandomProvider random) {
        Objects.requireNonNull(kind, "reference kind cannot be null");
        switch (kind) {
            case PICKET_FENCE:
                return picketFence(size);
            case POISSON:
                return poisson(size, random);
            default:
                throw new IllegalArgumentException("Unknown reference kind: " + kind);
        }
    }
}
