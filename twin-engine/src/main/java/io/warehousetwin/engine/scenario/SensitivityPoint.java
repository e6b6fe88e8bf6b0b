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

/// One point of a sensitivity sweep.
///
/// @param parameter the swept parameter
/// @param value     its value at this point
/// @param result    the run at this value
public record SensitivityPoint(String parameter, Object value, SimulationResult result) {

    public double throughputPerHour() {
        return result.metrics().throughputPerHour();
    }

    public double avgOrderTime() {
        return result.metrics().avgOrderTime();
    }
}
