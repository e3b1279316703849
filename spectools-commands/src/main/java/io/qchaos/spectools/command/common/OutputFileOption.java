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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Optional output file with a force-overwrite flag. Without {@code --output}
 * a command writes to standard output.
 */
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the result to this file instead of standard output"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath);
    }

    public boolean isForce() {
        return force;
    }

    public boolean outputExistsWithoutForce() {
        return outputPath != null && Files.exists(outputPath) && !force;
    }

    /**
     * Validates the output file, checking for existence without force flag.
     *
     * @throws IllegalStateException if the file exists and {@code --force} was not given
     */
    public void validate() {
        if (outputExistsWithoutForce()) {
            throw new IllegalStateException("Output file already exists: " + outputPath + ". Use --force to overwrite.");
        }
    }

    @Override
    public String toString() {
        if (outputPath == null) {
            return "stdout";
        }
        return force ? outputPath + " (force)" : outputPath.toString();
    }
}
