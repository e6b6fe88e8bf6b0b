package io.warehousetwin.engine.metrics;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Performance metrics of one simulation run, in simulation time units.
///
/// The sample lists hold one entry per completed order, in completion order.
/// With no completed orders every aggregate is zero.
///
/// @param ordersCompleted   orders that reached COMPLETED
/// @param itemsPicked       units taken from stock by completed orders
/// @param itemsShort        units of completed orders that were marked short
/// @param orderTimes        arrival to completion
/// @param pickTimes         pick start to pick end, worker queueing included
/// @param packTimes         pack start to pack end, worker queueing included
/// @param shipTimes         ship handoff durations
/// @param itemsPerOrder     ordered units per completed order
/// @param throughputPerHour completed orders per hour, `unitsPerHour / avgOrderTime`
/// @param itemsPerHour      `throughputPerHour * avgItemsPerOrder`
public record MetricsSnapshot(
    int ordersCompleted,
    long itemsPicked,
    long itemsShort,
    List<Double> orderTimes,
    List<Double> pickTimes,
    List<Double> packTimes,
    List<Double> shipTimes,
    List<Integer> itemsPerOrder,
    double avgOrderTime,
    double stdOrderTime,
    double medianOrderTime,
    double minOrderTime,
    double maxOrderTime,
    double p90OrderTime,
    double p95OrderTime,
    double avgPickTime,
    double avgPackTime,
    double avgShipTime,
    double avgItemsPerOrder,
    double throughputPerHour,
    double itemsPerHour
) {

    public MetricsSnapshot {
        orderTimes = List.copyOf(orderTimes);
        pickTimes = List.copyOf(pickTimes);
        packTimes = List.copyOf(packTimes);
        shipTimes = List.copyOf(shipTimes);
        itemsPerOrder = List.copyOf(itemsPerOrder);
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0, List.of(), List.of(), List.of(), List.of(), List.of(),
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public boolean isEmpty() {
        return ordersCompleted == 0;
    }

    /// Scalar metrics keyed by their external names, in a stable order.
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("orders_completed", ordersCompleted);
        summary.put("items_picked", itemsPicked);
        summary.put("items_short", itemsShort);
        summary.put("avg_order_time", avgOrderTime);
        summary.put("std_order_time", stdOrderTime);
        summary.put("median_order_time", medianOrderTime);
        summary.put("min_order_time", minOrderTime);
        summary.put("max_order_time", maxOrderTime);
        summary.put("p90_order_time", p90OrderTime);
        summary.put("p95_order_time", p95OrderTime);
        summary.put("avg_pick_time", avgPickTime);
        summary.put("avg_pack_time", avgPackTime);
        summary.put("avg_ship_time", avgShipTime);
        summary.put("avg_items_per_order", avgItemsPerOrder);
        summary.put("throughput_per_hour", throughputPerHour);
        summary.put("items_per_hour", itemsPerHour);
        return summary;
    }
}
