package io.warehousetwin.engine.scenario;

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

import io.warehousetwin.engine.run.SimulationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// A what-if run and the overrides that produced it.
///
/// @param overrides parameter overrides applied on top of the baseline
/// @param result    the scenario's simulation result
public record ScenarioResult(Map<String, Object> overrides, SimulationResult result) {

    public ScenarioResult {
        overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public double throughputPerHour() {
        return result.metrics().throughputPerHour();
    }
}
