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

import io.warehousetwin.api.config.SimulationConfig;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.engine.run.SimulationResult;
import io.warehousetwin.engine.run.SimulationRun;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/// Runs one simulation for a scenario configuration.
@FunctionalInterface
public interface ScenarioExecutor {

    SimulationResult execute(SimulationConfig config);

    /**
     * An executor that builds a fresh {@link SimulationRun} for every call from
     * the current inventory and backlog.
     *
     * @param inventory supplies the starting stock, read once per call
     * @param backlog   supplies the pending orders, read once per call
     */
    static ScenarioExecutor fromState(Supplier<Map<String, InventoryItem>> inventory, Supplier<List<Order>> backlog) {
        Objects.requireNonNull(inventory, "inventory cannot be null");
        Objects.requireNonNull(backlog, "backlog cannot be null");
        return config -> SimulationRun.builder(config)
            .inventory(inventory.get())
            .backlog(backlog.get())
            .build()
            .execute();
    }
}
