package io.warehousetwin.engine.lifecycle;

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
import io.warehousetwin.api.config.StockoutPolicy;
import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderLine;
import io.warehousetwin.api.model.OrderStatus;
import io.warehousetwin.engine.inventory.InventoryLedger;
import io.warehousetwin.engine.kernel.SimulationKernel;
import io.warehousetwin.engine.resources.ResourcePool;
import io.warehousetwin.engine.sampling.RandomStreams;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class OrderLifecycleTest {

    /// Zero spreads make every duration its mean: travel 1, pick 2 per unit, pack 1.5 per item, ship 0.5.
    private static SimulationConfig.Builder fixedTimings() {
        return SimulationConfig.builder()
            .transportTime(1.0, 0.0)
            .pickTime(2.0, 0.0)
            .packTime(1.5, 0.0)
            .shipTime(0.5, 0.0);
    }

    private final SimulationKernel kernel = new SimulationKernel();
    private final List<Order> completed = new ArrayList<>();
    private EventRecorder recorder;
    private InventoryLedger ledger;
    private ResourcePool workers;
    private ResourcePool forklifts;

    private OrderLifecycle lifecycle(SimulationConfig config, int stock, boolean autoReplenish) {
        return lifecycle(config, stock, autoReplenish, config::timestampAt);
    }

    private OrderLifecycle lifecycle(SimulationConfig config, int stock, boolean autoReplenish,
                                     DoubleFunction<Instant> recorderClock) {
        recorder = new EventRecorder(1000, recorderClock);
        Map<String, InventoryItem> items = new LinkedHashMap<>();
        items.put("SKU-0001", new InventoryItem("SKU-0001", "Widget", stock, "A-01-01", config.epoch()));
        ledger = new InventoryLedger(items, kernel, recorder, config::timestampAt, autoReplenish, 20.0);
        workers = new ResourcePool("workers", 1, ResourcePool.Discipline.FIFO, kernel);
        forklifts = new ResourcePool("forklifts", 1, ResourcePool.Discipline.FIFO, kernel);
        return new OrderLifecycle(config, kernel, recorder, ledger, workers, forklifts, new RandomStreams(1L),
            completed::add);
    }

    private static Order order(String id, int quantity) {
        return new Order(id, "CUST-0001", List.of(new OrderLine("SKU-0001", quantity, "A-01-01")), 3,
            SimulationConfig.DEFAULT_EPOCH);
    }

    private List<String> statuses(String orderId) {
        return recorder.ofType(EventType.ORDER_STATUS_CHANGED).stream()
            .filter(e -> e.orderId().filter(orderId::equals).isPresent())
            .map(e -> String.valueOf(e.payload().get(WarehouseEvent.STATUS)))
            .collect(Collectors.toList());
    }

    @Test
    void walksTheFulfillmentSequenceWithExpectedTimings() {
        SimulationConfig config = fixedTimings().build();
        OrderLifecycle lifecycle = lifecycle(config, 10, false);
        Order order = order("SIM-000001", 2);

        lifecycle.start(order);
        kernel.run(100.0);

        assertThat(statuses("SIM-000001"))
            .containsExactly("picking", "picked", "packing", "packed", "shipping", "completed");
        assertThat(completed).containsExactly(order);
        assertEquals(OrderStatus.COMPLETED, order.status());
        assertEquals(0.0, order.pickStartTime().getAsDouble());
        assertEquals(5.0, order.pickEndTime().getAsDouble(), 1e-9);
        assertEquals(8.0, order.packEndTime().getAsDouble(), 1e-9);
        assertEquals(8.5, order.shipEndTime().getAsDouble(), 1e-9);
        assertEquals(config.timestampAt(8.5), order.completedAt());
        assertEquals(8, ledger.quantity("SKU-0001"));

        WarehouseEvent done = recorder.ofType(EventType.ORDER_STATUS_CHANGED).get(5);
        assertThat((Double) done.payload().get(OrderLifecycle.TOTAL_TIME)).isCloseTo(8.5, offset(1e-9));
        assertEquals(0, workers.inUse());
        assertEquals(0, forklifts.inUse());
        assertEquals(0, lifecycle.inProgress());
    }

    @Test
    void secondOrderWaitsForTheOnlyWorker() {
        OrderLifecycle lifecycle = lifecycle(fixedTimings().build(), 10, false);
        Order first = order("SIM-000001", 1);
        Order second = order("SIM-000002", 1);

        lifecycle.start(first);
        lifecycle.start(second);
        kernel.run(100.0);

        assertThat(completed).containsExactly(first, second);
        assertThat(second.pickStartTime().getAsDouble()).isEqualTo(0.0);
        assertThat(second.pickEndTime().getAsDouble()).isGreaterThan(first.pickEndTime().getAsDouble());
        assertThat(second.shipEndTime().getAsDouble()).isGreaterThan(first.shipEndTime().getAsDouble());
    }

    @Test
    void failLinePolicyMarksTheLineShortAndContinues() {
        SimulationConfig config = fixedTimings().stockoutPolicy(StockoutPolicy.FAIL_LINE).build();
        OrderLifecycle lifecycle = lifecycle(config, 1, false);
        Order order = order("SIM-000001", 3);

        lifecycle.start(order);
        kernel.run(100.0);

        assertThat(completed).containsExactly(order);
        assertEquals(3, order.shortItems());
        assertEquals(0, order.pickedItems());
        assertEquals(1, ledger.quantity("SKU-0001"));
        assertEquals(1, lifecycle.linesShorted());
        assertThat(recorder.ofType(EventType.PICK_SHORTED)).singleElement()
            .satisfies(e -> assertThat(e.payload())
                .containsEntry("sku", "SKU-0001")
                .containsEntry("requested", 3)
                .containsEntry("available", 1));
    }

    @Test
    void blockingPolicyHoldsTheWorkerUntilStockArrives() {
        SimulationConfig config = fixedTimings().stockoutPolicy(StockoutPolicy.BLOCK_UNTIL_REPLENISHED).build();
        OrderLifecycle lifecycle = lifecycle(config, 1, false);
        Order order = order("SIM-000001", 3);

        lifecycle.start(order);
        kernel.run(50.0);

        assertThat(completed).isEmpty();
        assertEquals(OrderStatus.PICKING, order.status());
        assertEquals(1, workers.inUse());
        assertEquals(0, forklifts.inUse());
        assertEquals(1, ledger.waitingPickers());
        assertEquals(1, ledger.quantity("SKU-0001"));

        ledger.replenish("SKU-0001", 5);
        kernel.run(100.0);

        assertThat(completed).containsExactly(order);
        assertEquals(3, order.pickedItems());
        assertEquals(3, ledger.quantity("SKU-0001"));
        assertEquals(0, workers.inUse());
    }

    @Test
    void blockingPolicyWithReorderingCompletesOnItsOwn() {
        SimulationConfig config = fixedTimings().stockoutPolicy(StockoutPolicy.BLOCK_UNTIL_REPLENISHED).build();
        OrderLifecycle lifecycle = lifecycle(config, 1, true);
        Order order = order("SIM-000001", 3);

        lifecycle.start(order);
        kernel.run(100.0);

        assertThat(completed).containsExactly(order);
        assertThat(order.pickEndTime().getAsDouble()).isGreaterThanOrEqualTo(20.0);
    }

    @Test
    void failingStepReleasesHeldResources() {
        SimulationConfig config = fixedTimings().build();
        DoubleFunction<Instant> failsLate = t -> {
            if (t >= 5.0) {
                throw new IllegalStateException("recorder unavailable");
            }
            return config.timestampAt(t);
        };
        OrderLifecycle lifecycle = lifecycle(config, 10, false, failsLate);

        lifecycle.start(order("SIM-000001", 2));

        assertThatThrownBy(() -> kernel.run(100.0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("recorder unavailable");
        assertEquals(0, workers.inUse());
        assertEquals(0, forklifts.inUse());
    }

    @Test
    void onlyReceivedOrdersCanStart() {
        OrderLifecycle lifecycle = lifecycle(fixedTimings().build(), 10, false);
        Order order = order("SIM-000001", 1);
        order.advanceTo(OrderStatus.PICKING);

        assertThatThrownBy(() -> lifecycle.start(order)).isInstanceOf(IllegalStateException.class);
    }
}
