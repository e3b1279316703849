package io.qchaos.spectools.command.subcommands;

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

import io.qchaos.spectools.statistics.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/// Writes energy level files for command tests.
final class CommandTestData {

    private CommandTestData() {
    }

    /// Writes uncorrelated levels, one per line, with a comment header.
    static Path writeLevels(Path dir, String name, int count, long seed) throws IOException {
        UniformRandomProvider random = RandomGenerators.create(seed);
        StringBuilder sb = new StringBuilder("# uncorrelated test levels\n");
        for (int i = 0; i < count; i++) {
            sb.append(String.format(Locale.ROOT, "%.12f%n", 50.0 * random.nextDouble()));
        }
        Path file = dir.resolve(name);
        Files.writeString(file, sb.toString());
        return file;
    }
}
