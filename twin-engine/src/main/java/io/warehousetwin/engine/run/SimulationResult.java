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

import io.warehousetwin.api.config.SimulationConfig;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.engine.metrics.MetricsSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of one simulation run.
///
/// @param config              the configuration the run used
/// @param duration            simulated horizon
/// @param ordersStarted       backlog and generated orders that entered the lifecycle
/// @param ordersCompleted     orders that reached COMPLETED by the horizon
/// @param ordersInProgress    orders still in flight at the horizon, waiters included
/// @param arrivalsSkipped     arrivals dropped for lack of stock
/// @param linesShorted        lines marked short
/// @param eventsRecorded      events recorded during the run, evicted ones included
/// @param metrics             performance metrics of completed orders
/// @param finalInventory      stock at the horizon
/// @param completedOrders     completed orders, in completion order
/// @param events              events retained by the recorder, oldest first
/// @param workerUtilization   average busy fraction of the workers
/// @param forkliftUtilization average busy fraction of the forklifts
public record SimulationResult(
    SimulationConfig config,
    double duration,
    long ordersStarted,
    long ordersCompleted,
    long ordersInProgress,
    long arrivalsSkipped,
    long linesShorted,
    long eventsRecorded,
    MetricsSnapshot metrics,
    Map<String, InventoryItem> finalInventory,
    List<Order> completedOrders,
    List<WarehouseEvent> events,
    double workerUtilization,
    double forkliftUtilization
) {

    public SimulationResult {
        finalInventory = Collections.unmodifiableMap(new LinkedHashMap<>(finalInventory));
        completedOrders = List.copyOf(completedOrders);
        events = List.copyOf(events);
    }

    /// Run counters and metric aggregates keyed by their external names.
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("simulation_time", duration);
        summary.put("orders_started", ordersStarted);
        summary.put("orders_completed", ordersCompleted);
        summary.put("orders_in_progress", ordersInProgress);
        summary.put("arrivals_skipped", arrivalsSkipped);
        summary.put("lines_shorted", linesShorted);
        summary.put("events_recorded", eventsRecorded);
        summary.put("worker_utilization", workerUtilization);
        summary.put("forklift_utilization", forkliftUtilization);
        summary.putAll(metrics.summary());
        return summary;
    }
}
