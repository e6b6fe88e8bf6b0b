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
import io.warehousetwin.api.config.SimulationConfig;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderLine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class MetricsAggregatorTest {

    /// An order that arrived at 0, picked until pickEnd, packed one unit later and shipped one unit after that.
    private static Order finished(String id, int quantity, double pickEnd) {
        OrderLine line = new OrderLine("SKU-0001", quantity, "A-01-01");
        Order order = new Order(id, "CUST-0001", List.of(line), 1, SimulationConfig.DEFAULT_EPOCH);
        line.markPicked();
        order.markArrival(0.0);
        order.markPickStart(0.0);
        order.markPickEnd(pickEnd);
        order.markPackStart(pickEnd);
        order.markPackEnd(pickEnd + 1.0);
        order.markShipStart(pickEnd + 1.0);
        order.markShipEnd(pickEnd + 2.0);
        return order;
    }

    @Test
    void emptyRunHasZeroAggregates() {
        MetricsSnapshot snapshot = new MetricsAggregator(SimTimeUnit.MINUTES).snapshot();

        assertTrue(snapshot.isEmpty());
        assertEquals(0.0, snapshot.avgOrderTime());
        assertEquals(0.0, snapshot.throughputPerHour());
        assertThat(snapshot.orderTimes()).isEmpty();
    }

    @Test
    void aggregatesStageTimesAndThroughput() {
        MetricsAggregator aggregator = new MetricsAggregator(SimTimeUnit.MINUTES);
        aggregator.recordCompleted(finished("SIM-000001", 2, 2.0));
        aggregator.recordCompleted(finished("SIM-000002", 4, 4.0));

        MetricsSnapshot snapshot = aggregator.snapshot();

        assertEquals(2, snapshot.ordersCompleted());
        assertEquals(6, snapshot.itemsPicked());
        assertThat(snapshot.orderTimes()).containsExactly(4.0, 6.0);
        assertThat(snapshot.avgOrderTime()).isCloseTo(5.0, offset(1e-9));
        assertThat(snapshot.stdOrderTime()).isCloseTo(Math.sqrt(2.0), offset(1e-9));
        assertEquals(4.0, snapshot.minOrderTime());
        assertEquals(6.0, snapshot.maxOrderTime());
        assertThat(snapshot.avgPickTime()).isCloseTo(3.0, offset(1e-9));
        assertThat(snapshot.avgPackTime()).isCloseTo(1.0, offset(1e-9));
        assertThat(snapshot.avgShipTime()).isCloseTo(1.0, offset(1e-9));
        assertThat(snapshot.avgItemsPerOrder()).isCloseTo(3.0, offset(1e-9));
        assertThat(snapshot.throughputPerHour()).isCloseTo(12.0, offset(1e-9));
        assertThat(snapshot.itemsPerHour()).isCloseTo(36.0, offset(1e-9));
    }

    @Test
    void throughputUsesTheRunTimeUnit() {
        MetricsAggregator aggregator = new MetricsAggregator(SimTimeUnit.SECONDS);
        aggregator.recordCompleted(finished("SIM-000001", 1, 1.0));

        assertThat(aggregator.snapshot().throughputPerHour()).isCloseTo(1200.0, offset(1e-9));
    }

    @Test
    void percentilesAreOrdered() {
        MetricsAggregator aggregator = new MetricsAggregator(SimTimeUnit.MINUTES);
        for (int i = 1; i <= 40; i++) {
            aggregator.recordCompleted(finished(String.format("SIM-%06d", i), 1, i));
        }

        MetricsSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.medianOrderTime()).isBetween(snapshot.minOrderTime(), snapshot.p90OrderTime());
        assertThat(snapshot.p90OrderTime()).isLessThanOrEqualTo(snapshot.p95OrderTime());
        assertThat(snapshot.p95OrderTime()).isLessThanOrEqualTo(snapshot.maxOrderTime());
        assertThat(snapshot.medianOrderTime()).isCloseTo(22.5, offset(1e-9));
    }

    @Test
    void incompleteOrdersAreRejected() {
        Order order = new Order("SIM-000001", "CUST-0001", List.of(new OrderLine("SKU-0001", 1)), 1,
            SimulationConfig.DEFAULT_EPOCH);
        order.markArrival(0.0);

        assertThatThrownBy(() -> new MetricsAggregator(SimTimeUnit.MINUTES).recordCompleted(order))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("SIM-000001");
    }
}
