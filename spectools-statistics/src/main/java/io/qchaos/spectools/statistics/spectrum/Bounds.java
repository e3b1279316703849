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
 * The closed energy interval covered by a spectrum, from its lowest to its
 * highest level.
 *
 * @param min the lowest level
 * @param max the highest level
 */
public record Bounds(double min, double max) {

    /**
     * Compact constructor with validation.
     */
    public Bounds {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Bounds cannot be NaN: [" + min + ", " + max + "]");
        }
        if (max < min) {
            throw new IllegalArgumentException("Bounds max must not be below min: [" + min + ", " + max + "]");
        }
    }

    /**
     * Gets the width of the interval.
     */
    public double span() {
        return max - min;
    }

    /**
     * Gets the midpoint of the interval.
     */
    public double center() {
        return min + span() / 2.0;
    }

    /**
     * Checks if a value lies within the closed interval.
     */
    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
