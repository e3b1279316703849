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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for spectools JSON documents.
///
/// ## Purpose
///
/// Provides a configured [Gson] instance for analysis configurations and
/// reports:
///
/// - [SpectralAnalysisConfig]
/// - [SpectralAnalysisReport], including its rigidity curves and histogram
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | Serialize nulls | Disabled | Compact output |
/// | HTML escaping | Disabled | Cleaner labels |
/// | Special floats | Allowed | NaN and infinities survive a round trip |
///
/// ## Thread Safety
///
/// The [Gson] instance is thread-safe and can be shared across threads.
public final class SpectoolsGsonConfig {

    private static final Gson INSTANCE = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private SpectoolsGsonConfig() {
        // Utility class
    }

    /// Returns the shared, pretty-printing Gson instance.
    ///
    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }
}
