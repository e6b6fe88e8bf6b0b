package io.warehousetwin.engine.inventory;

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

import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.engine.kernel.SimulationKernel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleFunction;

/**
 * On-hand stock of one simulation run.
 *
 * <p>The ledger owns its own copy of the inventory; the map handed to the
 * constructor is never touched again. Every change records one
 * {@link EventType#INVENTORY_UPDATED} event with the signed change and the new
 * quantity. Quantities never go below zero: a pick that asks for more than is
 * on hand is refused and left to the caller's stockout policy.
 *
 * <h2>Stock waiters</h2>
 *
 * <p>Pickers that block on a SKU queue on that SKU in arrival order. When stock
 * arrives the queue head is served while the quantity covers it: the ledger
 * takes the stock on the waiter's behalf and schedules its continuation at the
 * current instant. While a SKU has waiters, {@link #tryPick} refuses it so that
 * later pickers cannot overtake them.
 *
 * <h2>Reordering</h2>
 *
 * <p>With reordering enabled, a pick that leaves a SKU below its minimum stock
 * places a reorder, and so does a picker that starts waiting on a SKU. At most
 * one reorder is outstanding per SKU. After the lead time the SKU is topped up
 * to its maximum stock, or to the queued demand when that is larger.
 */
public final class InventoryLedger {

    private static final Logger logger = LogManager.getLogger(InventoryLedger.class);

    private final Map<String, InventoryItem> items;
    private final Map<String, ArrayDeque<StockWaiter>> waiters = new HashMap<>();
    private final Set<String> reordersPending = new HashSet<>();
    private final SimulationKernel kernel;
    private final EventRecorder recorder;
    private final DoubleFunction<Instant> clock;
    private final boolean autoReplenish;
    private final double leadTime;

    private long reordersPlaced;

    public InventoryLedger(Map<String, InventoryItem> initial, SimulationKernel kernel, EventRecorder recorder,
                           DoubleFunction<Instant> clock) {
        this(initial, kernel, recorder, clock, false, 1.0);
    }

    /**
     * @param initial       starting stock, copied
     * @param clock         maps simulated time to the timestamp stored on items
     * @param autoReplenish whether low stock triggers reorders
     * @param leadTime      time from reorder to delivery, > 0
     */
    public InventoryLedger(Map<String, InventoryItem> initial, SimulationKernel kernel, EventRecorder recorder,
                           DoubleFunction<Instant> clock, boolean autoReplenish, double leadTime) {
        this.items = new LinkedHashMap<>(Objects.requireNonNull(initial, "initial inventory cannot be null"));
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (!(leadTime > 0.0)) {
            throw new IllegalArgumentException("lead time must be > 0, was " + leadTime);
        }
        this.autoReplenish = autoReplenish;
        this.leadTime = leadTime;
    }

    /**
     * Takes {@code quantity} units of a SKU if they are on hand and nobody is
     * waiting for the SKU.
     *
     * @return false for an unknown SKU, insufficient stock or a SKU with waiters
     */
    public boolean tryPick(String sku, int quantity, String orderId) {
        requirePositive(quantity);
        InventoryItem item = items.get(sku);
        if (item == null || item.quantity() < quantity || hasWaiters(sku)) {
            return false;
        }
        take(item, quantity, orderId);
        return true;
    }

    /**
     * Queues a picker until {@code quantity} units of the SKU can be taken. The
     * units are taken before {@code onTaken} runs.
     */
    public void awaitStock(String sku, int quantity, String orderId, Runnable onTaken) {
        requirePositive(quantity);
        Objects.requireNonNull(onTaken, "onTaken cannot be null");
        waiters.computeIfAbsent(sku, k -> new ArrayDeque<>()).addLast(new StockWaiter(quantity, orderId, onTaken));
        logger.debug("{} waits for {} x{} at t={}", orderId, sku, quantity, kernel.now());
        if (!items.containsKey(sku)) {
            logger.warn("{} waits for unknown SKU {}, which can never be replenished", orderId, sku);
            return;
        }
        serveWaiters(sku);
        if (hasWaiters(sku)) {
            placeReorder(items.get(sku));
        }
    }

    /**
     * Adds stock and serves waiting pickers.
     *
     * @throws IllegalArgumentException for an unknown SKU or a non-positive quantity
     */
    public void replenish(String sku, int quantity) {
        requirePositive(quantity);
        InventoryItem item = items.get(sku);
        if (item == null) {
            throw new IllegalArgumentException("cannot replenish unknown SKU " + sku);
        }
        InventoryItem updated = item.withQuantity(item.quantity() + quantity, clock.apply(kernel.now()));
        items.put(sku, updated);
        Map<String, Object> payload = changePayload(sku, quantity, updated.quantity());
        payload.put("reason", "replenishment");
        recorder.record(EventType.INVENTORY_UPDATED, kernel.now(), payload);
        serveWaiters(sku);
    }

    private void take(InventoryItem item, int quantity, String orderId) {
        int remaining = item.quantity() - quantity;
        if (remaining < 0) {
            throw new IllegalStateException("stock of " + item.sku() + " would become negative: " + remaining);
        }
        InventoryItem updated = item.withQuantity(remaining, clock.apply(kernel.now()));
        items.put(item.sku(), updated);
        Map<String, Object> payload = changePayload(item.sku(), -quantity, remaining);
        payload.put(WarehouseEvent.ORDER_ID, orderId);
        recorder.record(EventType.INVENTORY_UPDATED, kernel.now(), payload);
        placeReorderIfLow(updated);
    }

    private void serveWaiters(String sku) {
        ArrayDeque<StockWaiter> queue = waiters.get(sku);
        while (queue != null && !queue.isEmpty()) {
            StockWaiter head = queue.peekFirst();
            InventoryItem item = items.get(sku);
            if (item.quantity() < head.quantity) {
                return;
            }
            queue.removeFirst();
            if (queue.isEmpty()) {
                waiters.remove(sku);
            }
            take(item, head.quantity, head.orderId);
            kernel.scheduleNow(head.onTaken);
        }
    }

    private void placeReorderIfLow(InventoryItem item) {
        if (item.belowReorderPoint()) {
            placeReorder(item);
        }
    }

    private void placeReorder(InventoryItem item) {
        if (!autoReplenish || !reordersPending.add(item.sku())) {
            return;
        }
        reordersPlaced++;
        String sku = item.sku();
        logger.debug("reorder placed for {} at t={} ({} on hand)", sku, kernel.now(), item.quantity());
        kernel.schedule(leadTime, () -> {
            reordersPending.remove(sku);
            InventoryItem current = items.get(sku);
            int target = Math.max(current.maxStock(), queuedDemand(sku));
            int topUp = target - current.quantity();
            if (topUp > 0) {
                replenish(sku, topUp);
            }
        });
    }

    private static Map<String, Object> changePayload(String sku, int change, int newQuantity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sku", sku);
        payload.put("change", change);
        payload.put("new_quantity", newQuantity);
        return payload;
    }

    private static void requirePositive(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1, was " + quantity);
        }
    }

    public int quantity(String sku) {
        InventoryItem item = items.get(sku);
        return item == null ? 0 : item.quantity();
    }

    public Optional<InventoryItem> item(String sku) {
        return Optional.ofNullable(items.get(sku));
    }

    /// @return SKUs with stock on hand, in inventory order
    public List<String> skusInStock() {
        List<String> result = new ArrayList<>();
        for (InventoryItem item : items.values()) {
            if (item.quantity() > 0) {
                result.add(item.sku());
            }
        }
        return result;
    }

    private int queuedDemand(String sku) {
        int demand = 0;
        ArrayDeque<StockWaiter> queue = waiters.get(sku);
        if (queue != null) {
            for (StockWaiter waiter : queue) {
                demand += waiter.quantity;
            }
        }
        return demand;
    }

    public boolean hasWaiters(String sku) {
        ArrayDeque<StockWaiter> queue = waiters.get(sku);
        return queue != null && !queue.isEmpty();
    }

    /// @return pickers currently blocked on stock, over all SKUs
    public int waitingPickers() {
        int total = 0;
        for (ArrayDeque<StockWaiter> queue : waiters.values()) {
            total += queue.size();
        }
        return total;
    }

    public long reordersPlaced() {
        return reordersPlaced;
    }

    /// @return a copy of the current stock, in inventory order
    public Map<String, InventoryItem> snapshot() {
        return new LinkedHashMap<>(items);
    }

    private static final class StockWaiter {
        private final int quantity;
        private final String orderId;
        private final Runnable onTaken;

        private StockWaiter(int quantity, String orderId, Runnable onTaken) {
            this.quantity = quantity;
            this.orderId = orderId;
            this.onTaken = onTaken;
        }
    }
}
