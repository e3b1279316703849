package io.qchaos.spectools.command.common;

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

import io.qchaos.spectools.statistics.rigidity.LengthGrid;
import picocli.CommandLine;

/**
 * Shared window length grid option using {@link Grid} with automatic parsing.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class LengthGridOption {

    public static final int DEFAULT_COUNT = 50;

    /**
     * Immutable grid of window lengths, both ends included.
     *
     * @param start the first length, non-negative
     * @param stop  the last length, not below start
     * @param count the number of lengths
     */
    public record Grid(double start, double stop, int count) {

        public Grid {
            if (!Double.isFinite(start) || !Double.isFinite(stop) || start < 0 || stop < start) {
                throw new IllegalArgumentException(
                    "Length grid must satisfy 0 <= start <= stop, got [" + start + ", " + stop + "]");
            }
            if (count < 1) {
                throw new IllegalArgumentException("Length count must be positive: " + count);
            }
        }

        public double[] lengths() {
            return LengthGrid.linspace(start, stop, count);
        }

        @Override
        public String toString() {
            return start + ".." + stop + ":" + count;
        }
    }

    /**
     * Picocli type converter for {@link Grid} specifications.
     * Supports formats: {@code stop}, {@code start..stop}, {@code start..stop:count}
     */
    public static class GridConverter implements CommandLine.ITypeConverter<Grid> {

        @Override
        public Grid convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("Length grid cannot be empty");
            }
            String trimmed = value.trim();
            try {
                int count = DEFAULT_COUNT;
                int colon = trimmed.indexOf(':');
                if (colon >= 0) {
                    count = Integer.parseInt(trimmed.substring(colon + 1).trim());
                    trimmed = trimmed.substring(0, colon).trim();
                }
                if (trimmed.contains("..")) {
                    String[] parts = trimmed.split("\\.\\.");
                    if (parts.length != 2) {
                        throw new CommandLine.TypeConversionException(
                            "Invalid length grid: " + value + ". Expected: start..stop[:count]");
                    }
                    return new Grid(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()), count);
                }
                return new Grid(0.0, Double.parseDouble(trimmed), count);
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid length grid: " + value + ". Could not parse numbers: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"-L", "--lengths"},
        description = "Window lengths as stop, start..stop or start..stop:count (default: 0..20:50)",
        converter = GridConverter.class
    )
    private Grid grid;

    /**
     * Gets the grid, or null when the option was not given.
     */
    public Grid getGrid() {
        return grid;
    }

    public Grid getEffectiveGrid() {
        return grid != null ? grid : new Grid(0.0, 20.0, DEFAULT_COUNT);
    }

    @Override
    public String toString() {
        return getEffectiveGrid().toString();
    }
}
