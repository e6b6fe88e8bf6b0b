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
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderLine;
import io.warehousetwin.api.model.OrderStatus;
import io.warehousetwin.engine.inventory.InventoryLedger;
import io.warehousetwin.engine.kernel.SimulationKernel;
import io.warehousetwin.engine.resources.Lease;
import io.warehousetwin.engine.resources.ResourcePool;
import io.warehousetwin.engine.sampling.RandomStreams;
import io.warehousetwin.engine.sampling.TimeSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Drives orders through picking, packing and shipping.
 *
 * <h2>Sequence</h2>
 *
 * <pre>{@code
 *  RECEIVED ─▶ PICKING ─┬─ worker ─┬─ per line: [forklift] travel, pick, take stock ─┐
 *                       │          └──────────────────────────────────────────────────┘
 *                       └─ release worker ─▶ PICKED ─▶ PACKING ─ worker, pack ─▶ PACKED
 *                                                    ─▶ SHIPPING ─ handoff ─▶ COMPLETED
 * }</pre>
 *
 * <p>Every status change records an {@link EventType#ORDER_STATUS_CHANGED}
 * event with the new status; the completion event also carries the total time
 * since arrival. Lines with a storage location need a forklift for their
 * travel and pick. A line that cannot be filled follows the configured
 * {@link StockoutPolicy}: it is either marked short, or the picker waits for
 * stock while keeping its worker. The forklift is returned before waiting.
 *
 * <h2>Randomness</h2>
 *
 * <p>Each started order is numbered and draws all of its durations from its own
 * stream of {@link RandomStreams}, so the n-th order of a run sees the same
 * durations whatever the resource levels are.
 *
 * <h2>Failures</h2>
 *
 * <p>When a step of an order throws, the order's leases are released before the
 * exception leaves the kernel.
 */
public final class OrderLifecycle {

    private static final Logger logger = LogManager.getLogger(OrderLifecycle.class);

    public static final String TOTAL_TIME = "total_time";

    private final SimulationConfig config;
    private final SimulationKernel kernel;
    private final EventRecorder recorder;
    private final InventoryLedger ledger;
    private final ResourcePool workers;
    private final ResourcePool forklifts;
    private final RandomStreams streams;
    private final Consumer<Order> onCompleted;
    private final long sequenceOffset;

    private long started;
    private long completed;
    private long linesShorted;

    public OrderLifecycle(SimulationConfig config, SimulationKernel kernel, EventRecorder recorder,
                          InventoryLedger ledger, ResourcePool workers, ResourcePool forklifts,
                          RandomStreams streams, Consumer<Order> onCompleted) {
        this(config, kernel, recorder, ledger, workers, forklifts, streams, onCompleted, 0L);
    }

    /**
     * @param sequenceOffset orders started by earlier runs on the same timeline;
     *                       this run numbers its orders after them
     */
    public OrderLifecycle(SimulationConfig config, SimulationKernel kernel, EventRecorder recorder,
                          InventoryLedger ledger, ResourcePool workers, ResourcePool forklifts,
                          RandomStreams streams, Consumer<Order> onCompleted, long sequenceOffset) {
        if (sequenceOffset < 0) {
            throw new IllegalArgumentException("sequenceOffset must be >= 0, was " + sequenceOffset);
        }
        this.sequenceOffset = sequenceOffset;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger cannot be null");
        this.workers = Objects.requireNonNull(workers, "workers cannot be null");
        this.forklifts = Objects.requireNonNull(forklifts, "forklifts cannot be null");
        this.streams = Objects.requireNonNull(streams, "streams cannot be null");
        this.onCompleted = Objects.requireNonNull(onCompleted, "onCompleted cannot be null");
    }

    /**
     * Starts a RECEIVED order at the current instant.
     *
     * @throws IllegalStateException if the order is not RECEIVED
     */
    public void start(Order order) {
        Objects.requireNonNull(order, "order cannot be null");
        if (order.status() != OrderStatus.RECEIVED) {
            throw new IllegalStateException("order " + order.orderId() + " is " + order.status() + ", not RECEIVED");
        }
        long sequence = sequenceOffset + ++started;
        Activity activity = new Activity(order, new TimeSampler(streams.forOrder(sequence)));
        activity.step(activity::beginPicking);
    }

    public long started() {
        return started;
    }

    public long completed() {
        return completed;
    }

    /// @return orders started but not completed
    public long inProgress() {
        return started - completed;
    }

    public long linesShorted() {
        return linesShorted;
    }

    /// State of one order in flight.
    private final class Activity {

        private final Order order;
        private final TimeSampler sampler;
        private Lease worker;
        private Lease forklift;
        private int lineIndex;

        private Activity(Order order, TimeSampler sampler) {
            this.order = order;
            this.sampler = sampler;
        }

        private void beginPicking() {
            order.markArrival(kernel.now());
            advance(OrderStatus.PICKING);
            order.markPickStart(kernel.now());
            workers.acquire(order.orderId(), order.priority(), lease -> step(() -> {
                worker = lease;
                nextLine();
            }));
        }

        private void nextLine() {
            if (lineIndex == order.lines().size()) {
                finishPicking();
                return;
            }
            OrderLine line = order.lines().get(lineIndex);
            if (line.requiresTransport()) {
                forklifts.acquire(order.orderId(), order.priority(), lease -> step(() -> {
                    forklift = lease;
                    double travel = sampler.sample(config.transportTimeMean(), config.transportTimeStd());
                    kernel.schedule(travel, () -> step(() -> pick(line)));
                }));
            } else {
                pick(line);
            }
        }

        private void pick(OrderLine line) {
            double pickTime = sampler.sample(config.pickTimeMean(), config.pickTimeStd(), line.quantity());
            kernel.schedule(pickTime, () -> step(() -> takeStock(line)));
        }

        private void takeStock(OrderLine line) {
            if (ledger.tryPick(line.sku(), line.quantity(), order.orderId())) {
                line.markPicked();
                finishLine();
            } else if (config.stockoutPolicy() == StockoutPolicy.FAIL_LINE) {
                line.markShort();
                linesShorted++;
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(WarehouseEvent.ORDER_ID, order.orderId());
                payload.put("sku", line.sku());
                payload.put("requested", line.quantity());
                payload.put("available", ledger.quantity(line.sku()));
                recorder.record(EventType.PICK_SHORTED, kernel.now(), payload);
                logger.debug("{} short on {} x{} at t={}", order.orderId(), line.sku(), line.quantity(), kernel.now());
                finishLine();
            } else {
                releaseForklift();
                ledger.awaitStock(line.sku(), line.quantity(), order.orderId(), () -> step(() -> {
                    line.markPicked();
                    finishLine();
                }));
            }
        }

        private void finishLine() {
            releaseForklift();
            lineIndex++;
            nextLine();
        }

        private void finishPicking() {
            releaseWorker();
            order.markPickEnd(kernel.now());
            advance(OrderStatus.PICKED);
            advance(OrderStatus.PACKING);
            order.markPackStart(kernel.now());
            workers.acquire(order.orderId(), order.priority(), lease -> step(() -> {
                worker = lease;
                double packTime = sampler.sample(config.packTimeMean(), config.packTimeStd(),
                    Math.max(1, order.totalItems()));
                kernel.schedule(packTime, () -> step(this::finishPacking));
            }));
        }

        private void finishPacking() {
            releaseWorker();
            order.markPackEnd(kernel.now());
            advance(OrderStatus.PACKED);
            advance(OrderStatus.SHIPPING);
            order.markShipStart(kernel.now());
            double shipTime = sampler.sample(config.shipTimeMean(), config.shipTimeStd());
            kernel.schedule(shipTime, () -> step(this::complete));
        }

        private void complete() {
            order.markShipEnd(kernel.now());
            double totalTime = kernel.now() - order.arrivalTime().getAsDouble();
            order.advanceTo(OrderStatus.COMPLETED);
            order.markCompletedAt(config.timestampAt(kernel.now()));
            Map<String, Object> payload = statusPayload(OrderStatus.COMPLETED);
            payload.put(TOTAL_TIME, totalTime);
            recorder.record(EventType.ORDER_STATUS_CHANGED, kernel.now(), payload);
            completed++;
            logger.debug("{} completed at t={} after {}", order.orderId(), kernel.now(), totalTime);
            onCompleted.accept(order);
        }

        private void advance(OrderStatus next) {
            order.advanceTo(next);
            recorder.record(EventType.ORDER_STATUS_CHANGED, kernel.now(), statusPayload(next));
        }

        private Map<String, Object> statusPayload(OrderStatus status) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(WarehouseEvent.ORDER_ID, order.orderId());
            payload.put(WarehouseEvent.STATUS, status.value());
            return payload;
        }

        private void releaseForklift() {
            if (forklift != null) {
                Lease held = forklift;
                forklift = null;
                held.release();
            }
        }

        private void releaseWorker() {
            if (worker != null) {
                Lease held = worker;
                worker = null;
                held.release();
            }
        }

        /// Runs one step; if it throws, the order gives back what it holds.
        private void step(Runnable body) {
            try {
                body.run();
            } catch (RuntimeException e) {
                releaseForklift();
                releaseWorker();
                throw e;
            }
        }
    }
}
