package io.qchaos.spectools.statistics.spectrum;

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

/**
 * An ascending, immutable sequence of energy levels that can be queried
 * through its staircase function.
 *
 * <p>Empirical spectra and the synthetic reference spectra share this
 * contract, so every statistic in this library treats them alike.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link EmpiricalSpectrum} - unfolded levels of a measured or computed system</li>
 *   <li>{@link PicketFenceSpectrum} - evenly spaced levels 0, 1, ..., n-1</li>
 *   <li>{@link PoissonSpectrum} - unfolded, uncorrelated uniform draws</li>
 * </ul>
 *
 * @see StaircaseFunction
 */
public interface Spectrum {

    /**
     * Counts the levels at or below epsilon.
     *
     * @param epsilon the energy to count up to
     * @return N(epsilon)
     */
    int query(double epsilon);

    /**
     * Gets the interval from the lowest to the highest level.
     */
    Bounds bounds();

    /**
     * Gets the number of levels.
     */
    int length();

    /**
     * Gets a single level by its ascending rank.
     *
     * @param index the rank, from 0 to length() - 1
     * @return the level
     */
    double level(int index);

    /**
     * Gets a copy of all levels in ascending order.
     */
    double[] levels();

    /**
     * Gets the staircase function over these levels.
     */
    StaircaseFunction staircase();
}
