package io.warehousetwin.api.config;

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
import com.google.gson.ToNumberPolicy;

/// Shared Gson setup for configuration files and calibration output.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable files |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floating point values | Allowed | NaN in calibration output |
/// | Untyped numbers | Long or double | `42` reads as a whole number, `4.2` as a double |
///
/// Untyped numbers matter because configuration files are read into a
/// `Map<String, Object>` and routed through [ConfigParameter], which refuses
/// fractional values for whole-number parameters.
///
/// The [Gson] instance is thread-safe and shared.
public final class TwinGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private TwinGsonConfig() {
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new builder with the twin defaults, for callers that need more adapters
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE);
    }
}
