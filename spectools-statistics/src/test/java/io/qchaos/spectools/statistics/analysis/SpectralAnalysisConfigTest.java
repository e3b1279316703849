package io.qchaos.spectools.statistics.analysis;

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

import com.google.gson.JsonParseException;
import io.qchaos.spectools.statistics.exceptions.InvalidWindowCountException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpectralAnalysisConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        SpectralAnalysisConfig config = new SpectralAnalysisConfig();
        assertEquals(500, config.getNumCenters());
        assertEquals(50, config.getNumPoints());
        assertEquals(50, config.lengths().length);
        assertEquals(20.0, config.lengths()[49]);
        assertTrue(config.isIncludeReferences());
        assertNull(config.getPoissonSeed());
        assertNull(config.getReferenceSize());
        assertEquals(6.0, config.getSpacingCutoff());
        assertEquals(300, config.getSpacingBins());
    }

    @Test
    void testPartialJsonKeepsDefaults() {
        SpectralAnalysisConfig config = SpectralAnalysisConfig.fromJson(
            "{\"num_centers\": 120, \"poisson_seed\": 42, \"length_stop\": 8.0}");

        assertEquals(120, config.getNumCenters());
        assertEquals(50, config.getNumPoints());
        assertEquals(42L, config.getPoissonSeed().longValue());
        assertEquals(8.0, config.getLengthStop());
        assertEquals(1000, config.getStaircasePoints());
    }

    @Test
    void testJsonRoundTrip() {
        SpectralAnalysisConfig config = new SpectralAnalysisConfig()
            .setNumCenters(64)
            .setLengthGrid(0.5, 4.0, 8)
            .setReferenceSize(200)
            .setParallelism(3);

        String json = config.toJson();
        assertTrue(json.contains("\"num_centers\": 64"));

        SpectralAnalysisConfig restored = SpectralAnalysisConfig.fromJson(json);
        assertEquals(64, restored.getNumCenters());
        assertEquals(200, restored.getReferenceSize().intValue());
        assertEquals(3, restored.getParallelism());
        assertArrayEquals(config.lengths(), restored.lengths());
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("analysis.json");
        Files.writeString(file, "{\"num_points\": 25, \"include_references\": false}");

        SpectralAnalysisConfig config = SpectralAnalysisConfig.loadFromFile(file);
        assertEquals(25, config.getNumPoints());
        assertFalse(config.isIncludeReferences());
    }

    @Test
    void testEmptyFileIsRejected() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "");
        assertThrows(JsonParseException.class, () -> SpectralAnalysisConfig.loadFromFile(file));
    }

    @Test
    void testValidation() {
        InvalidWindowCountException e = assertThrows(InvalidWindowCountException.class,
            () -> SpectralAnalysisConfig.fromJson("{\"num_centers\": 1}"));
        assertEquals("num_centers", e.getParameter());

        assertThrows(InvalidWindowCountException.class, () -> new SpectralAnalysisConfig().setNumPoints(0).validate());
        assertThrows(IllegalArgumentException.class,
            () -> new SpectralAnalysisConfig().setLengthGrid(5.0, 1.0, 10).validate());
        assertThrows(IllegalArgumentException.class,
            () -> new SpectralAnalysisConfig().setReferenceSize(1).validate());
        assertThrows(IllegalArgumentException.class,
            () -> new SpectralAnalysisConfig().setParallelism(0).validate());
    }
}
