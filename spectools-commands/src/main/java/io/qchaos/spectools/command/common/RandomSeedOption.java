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

import picocli.CommandLine;

/**
 * Shared seed option for the Poisson reference spectrum.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     * When no value is given, the current time is used and reported so the run can be repeated.
     *
     * @param value the seed value, or null for a time-based seed
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the effective seed value, generating one from current time if needed.
         */
        public long effective() {
            return value != null ? value : System.currentTimeMillis();
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "auto (time-based)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} values.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Seed for the Poisson reference spectrum (default: current time)",
        converter = SeedConverter.class
    )
    private Seed seed;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Gets the seed as given, or null when none was specified.
     */
    public Long getExplicitSeed() {
        return getSeedRecord().value();
    }

    /**
     * Gets the effective seed value, using current time if not specified.
     */
    public long getSeed() {
        return getSeedRecord().effective();
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
