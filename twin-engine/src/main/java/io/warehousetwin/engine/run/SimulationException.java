package io.warehousetwin.engine.run;

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

/// Thrown when a step of a simulation run fails. The run is abandoned as a
/// whole; partial results are not returned.
public class SimulationException extends RuntimeException {

    private final double simTime;

    public SimulationException(String message, double simTime, Throwable cause) {
        super(message, cause);
        this.simTime = simTime;
    }

    public SimulationException(String message, Throwable cause) {
        this(message, Double.NaN, cause);
    }

    /// @return simulated time of the failure, NaN when it happened outside a run
    public double simTime() {
        return simTime;
    }
}
