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
 * Shared parallel execution options for the rigidity computation.
 * Provides {@code --parallel} for an automatically sized worker pool and
 * {@code --threads} for an explicit one.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Compute rigidity in parallel (uses all but one CPU core)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of worker threads for the rigidity computation"
    )
    private Integer explicitThreads;

    public boolean isParallel() {
        return parallel;
    }

    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Calculates the worker count. Auto-detection always leaves one core free.
     *
     * @return the thread count, 1 for sequential execution
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }

    /**
     * Validates the explicit thread count.
     *
     * @throws IllegalStateException if the thread count is not positive
     */
    public void validate() {
        if (explicitThreads != null && explicitThreads < 1) {
            throw new IllegalStateException("--threads must be positive, got " + explicitThreads);
        }
    }
}
