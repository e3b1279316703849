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

import io.qchaos.spectools.statistics.rigidity.RigidityEstimator;
import picocli.CommandLine;

/**
 * Shared rigidity window options: how many windows are averaged per length and
 * how many points sample the staircase in each window.
 */
public class WindowOption {

    @CommandLine.Option(
        names = {"--centers"},
        description = "Number of window centers averaged per length (default: ${DEFAULT-VALUE})"
    )
    private int numCenters = RigidityEstimator.DEFAULT_NUM_CENTERS;

    @CommandLine.Option(
        names = {"--points"},
        description = "Number of staircase samples per window (default: ${DEFAULT-VALUE})"
    )
    private int numPoints = RigidityEstimator.DEFAULT_NUM_POINTS;

    public int getNumCenters() {
        return numCenters;
    }

    public int getNumPoints() {
        return numPoints;
    }

    @Override
    public String toString() {
        return numCenters + " centers x " + numPoints + " points";
    }
}
