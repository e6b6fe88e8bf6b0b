package io.warehousetwin.api.model;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A warehouse order moving through picking, packing and shipping.
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>{@link #advanceTo(OrderStatus)} only accepts the immediate successor of
 *       the current status; anything else is an {@link IllegalStateException}.</li>
 *   <li>Each stage start/end time is written once. A second write fails.</li>
 * </ul>
 *
 * <p>Orders are created by the arrival generator (or fetched from the ERP),
 * mutated only by the order lifecycle, and dropped once metrics are recorded.
 */
public final class Order {

    private final String orderId;
    private final String customerId;
    private final List<OrderLine> lines;
    private final int priority;
    private final Instant createdAt;

    private OrderStatus status;
    private Instant completedAt;
    private Double arrivalTime;

    private Double pickStartTime;
    private Double pickEndTime;
    private Double packStartTime;
    private Double packEndTime;
    private Double shipStartTime;
    private Double shipEndTime;

    public Order(String orderId, String customerId, List<OrderLine> lines, int priority, Instant createdAt) {
        this.orderId = Objects.requireNonNull(orderId, "orderId cannot be null");
        this.customerId = Objects.requireNonNull(customerId, "customerId cannot be null");
        this.lines = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(lines, "lines cannot be null")));
        if (priority < 1 || priority > 5) {
            throw new IllegalArgumentException("priority must be within [1, 5], was " + priority);
        }
        this.priority = priority;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.status = OrderStatus.RECEIVED;
    }

    /// Creates an order in an arbitrary status, as reported by an ERP system.
    public static Order withStatus(String orderId, String customerId, List<OrderLine> lines, int priority,
                                   Instant createdAt, OrderStatus status) {
        Order order = new Order(orderId, customerId, lines, priority, createdAt);
        order.status = Objects.requireNonNull(status, "status cannot be null");
        return order;
    }

    public String orderId() {
        return orderId;
    }

    public String customerId() {
        return customerId;
    }

    public List<OrderLine> lines() {
        return lines;
    }

    /// @return 1 (low) through 5 (high)
    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public OrderStatus status() {
        return status;
    }

    /**
     * Moves this order to the next status of the fulfillment sequence.
     *
     * @param next the requested status
     * @throws IllegalStateException if {@code next} is not the immediate successor
     */
    public void advanceTo(OrderStatus next) {
        Objects.requireNonNull(next, "next cannot be null");
        if (status.successor().filter(s -> s == next).isEmpty()) {
            throw new IllegalStateException("order " + orderId + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    /// Overwrites the status without sequence checks. ERP adapters mirror
    /// externally reported state through here; the simulation never does.
    public void assignReportedStatus(OrderStatus reported) {
        this.status = Objects.requireNonNull(reported, "reported cannot be null");
    }

    public Instant completedAt() {
        return completedAt;
    }

    public void markCompletedAt(Instant when) {
        if (completedAt != null) {
            throw new IllegalStateException("order " + orderId + " already has a completion time");
        }
        completedAt = Objects.requireNonNull(when, "when cannot be null");
    }

    public OptionalDouble arrivalTime() {
        return optional(arrivalTime);
    }

    public void markArrival(double simTime) {
        arrivalTime = setOnce(arrivalTime, simTime, "arrival");
    }

    public OptionalDouble pickStartTime() {
        return optional(pickStartTime);
    }

    public OptionalDouble pickEndTime() {
        return optional(pickEndTime);
    }

    public OptionalDouble packStartTime() {
        return optional(packStartTime);
    }

    public OptionalDouble packEndTime() {
        return optional(packEndTime);
    }

    public OptionalDouble shipStartTime() {
        return optional(shipStartTime);
    }

    public OptionalDouble shipEndTime() {
        return optional(shipEndTime);
    }

    public void markPickStart(double simTime) {
        pickStartTime = setOnce(pickStartTime, simTime, "pick start");
    }

    public void markPickEnd(double simTime) {
        pickEndTime = setOnce(pickEndTime, simTime, "pick end");
    }

    public void markPackStart(double simTime) {
        packStartTime = setOnce(packStartTime, simTime, "pack start");
    }

    public void markPackEnd(double simTime) {
        packEndTime = setOnce(packEndTime, simTime, "pack end");
    }

    public void markShipStart(double simTime) {
        shipStartTime = setOnce(shipStartTime, simTime, "ship start");
    }

    public void markShipEnd(double simTime) {
        shipEndTime = setOnce(shipEndTime, simTime, "ship end");
    }

    public int totalItems() {
        int total = 0;
        for (OrderLine line : lines) {
            total += line.quantity();
        }
        return total;
    }

    public int pickedItems() {
        int total = 0;
        for (OrderLine line : lines) {
            total += line.pickedQuantity();
        }
        return total;
    }

    public int shortItems() {
        int total = 0;
        for (OrderLine line : lines) {
            total += line.shortQuantity();
        }
        return total;
    }

    public boolean isFullyPicked() {
        for (OrderLine line : lines) {
            if (line.pickedQuantity() < line.quantity()) {
                return false;
            }
        }
        return true;
    }

    public boolean requiresTransport() {
        for (OrderLine line : lines) {
            if (line.requiresTransport()) {
                return true;
            }
        }
        return false;
    }

    /// @return a fresh RECEIVED copy with the same identity and lines but no progress
    public Order copyAsReceived() {
        List<OrderLine> copied = new ArrayList<>(lines.size());
        for (OrderLine line : lines) {
            copied.add(line.copyUnpicked());
        }
        return new Order(orderId, customerId, copied, priority, createdAt);
    }

    /// @return the order as an event payload
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("order_id", orderId);
        payload.put("customer_id", customerId);
        List<Map<String, Object>> linePayloads = new ArrayList<>(lines.size());
        for (OrderLine line : lines) {
            linePayloads.add(line.toPayload());
        }
        payload.put("lines", linePayloads);
        payload.put("status", status.value());
        payload.put("priority", priority);
        payload.put("total_items", totalItems());
        return payload;
    }

    private Double setOnce(Double current, double value, String what) {
        if (current != null) {
            throw new IllegalStateException("order " + orderId + " " + what + " time already set to " + current);
        }
        return value;
    }

    private static OptionalDouble optional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return "Order{" + orderId + ", " + status + ", customer=" + customerId + ", priority=" + priority
            + ", lines=" + lines.size() + '}';
    }
}
