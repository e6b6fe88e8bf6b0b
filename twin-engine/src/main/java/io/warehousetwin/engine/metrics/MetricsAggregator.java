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

import io.warehousetwin.api.config.SimTimeUnit;
import io.warehousetwin.api.model.Order;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Collects per-order timings of one run and turns them into a [MetricsSnapshot].
///
/// Only completed orders are recorded. Not thread-safe; a run owns one.
public final class MetricsAggregator {

    private final SimTimeUnit timeUnit;
    private final List<Double> orderTimes = new ArrayList<>();
    private final List<Double> pickTimes = new ArrayList<>();
    private final List<Double> packTimes = new ArrayList<>();
    private final List<Double> shipTimes = new ArrayList<>();
    private final List<Integer> itemsPerOrder = new ArrayList<>();
    private long itemsPicked;
    private long itemsShort;

    public MetricsAggregator(SimTimeUnit timeUnit) {
        this.timeUnit = Objects.requireNonNull(timeUnit, "timeUnit cannot be null");
    }

    /**
     * Records a completed order.
     *
     * @throws IllegalStateException if the order lacks an arrival or stage time
     */
    public void recordCompleted(Order order) {
        double arrival = time(order, order.arrivalTime(), "arrival");
        double shipEnd = time(order, order.shipEndTime(), "ship end");
        orderTimes.add(shipEnd - arrival);
        pickTimes.add(time(order, order.pickEndTime(), "pick end") - time(order, order.pickStartTime(), "pick start"));
        packTimes.add(time(order, order.packEndTime(), "pack end") - time(order, order.packStartTime(), "pack start"));
        shipTimes.add(shipEnd - time(order, order.shipStartTime(), "ship start"));
        itemsPerOrder.add(order.totalItems());
        itemsPicked += order.pickedItems();
        itemsShort += order.shortItems();
    }

    private static double time(Order order, OptionalDouble value, String what) {
        return value.orElseThrow(
            () -> new IllegalStateException("completed order " + order.orderId() + " has no " + what + " time"));
    }

    public int completed() {
        return orderTimes.size();
    }

    public MetricsSnapshot snapshot() {
        if (orderTimes.isEmpty()) {
            return MetricsSnapshot.empty();
        }
        DescriptiveStatistics orders = stats(orderTimes);
        double avgOrderTime = orders.getMean();
        double avgItems = 0.0;
        for (int items : itemsPerOrder) {
            avgItems += items;
        }
        avgItems /= itemsPerOrder.size();
        double throughput = avgOrderTime > 0.0 ? timeUnit.unitsPerHour() / avgOrderTime : 0.0;
        return new MetricsSnapshot(
            orderTimes.size(),
            itemsPicked,
            itemsShort,
            orderTimes,
            pickTimes,
            packTimes,
            shipTimes,
            itemsPerOrder,
            avgOrderTime,
            orders.getStandardDeviation(),
            orders.getPercentile(50),
            orders.getMin(),
            orders.getMax(),
            orders.getPercentile(90),
            orders.getPercentile(95),
            stats(pickTimes).getMean(),
            stats(packTimes).getMean(),
            stats(shipTimes).getMean(),
            avgItems,
            throughput,
            throughput * avgItems
        );
    }

    private static DescriptiveStatistics stats(List<Double> values) {
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        for (double value : values) {
            statistics.addValue(value);
        }
        return statistics;
    }
}
