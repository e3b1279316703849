package io.qchaos.spectools.command.io;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/// Reads energies from a plain text file.
///
/// Values are separated by whitespace or commas, any number per line. A `#`
/// starts a comment that runs to the end of the line.
///
/// ```text
/// # first ten levels of a stadium billiard
/// 1.2031 2.9947 3.0012
/// 4.5521, 5.1189
/// ```
public final class TextEnergyLevelSource implements EnergyLevelSource {

    private static final Logger logger = LogManager.getLogger(TextEnergyLevelSource.class);

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private final Path path;

    public TextEnergyLevelSource(Path path) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public double[] readEnergies() throws IOException {
        double[] values = new double[1024];
        int count = 0;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                for (String token : SEPARATORS.split(line.trim())) {
                    if (token.isEmpty()) {
                        continue;
                    }
                    if (count == values.length) {
                        values = Arrays.copyOf(values, values.length * 2);
                    }
                    try {
                        values[count++] = Double.parseDouble(token);
                    } catch (NumberFormatException e) {
                        throw new IOException("Invalid energy '" + token + "' on line " + lineNumber + " of " + path, e);
                    }
                }
            }
        }
        logger.debug("Read {} energies from {} lines of {}", count, lineNumber, path);
        return Arrays.copyOf(values, count);
    }

    @Override
    public String toString() {
        return "text:" + path;
    }
}
