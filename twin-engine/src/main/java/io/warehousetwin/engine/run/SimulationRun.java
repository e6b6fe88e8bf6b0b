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
import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderStatus;
import io.warehousetwin.engine.inventory.InventoryLedger;
import io.warehousetwin.engine.kernel.SimulationKernel;
import io.warehousetwin.engine.lifecycle.ArrivalGenerator;
import io.warehousetwin.engine.lifecycle.OrderLifecycle;
import io.warehousetwin.engine.metrics.MetricsAggregator;
import io.warehousetwin.engine.resources.Lease;
import io.warehousetwin.engine.resources.ResourcePool;
import io.warehousetwin.engine.sampling.RandomStreams;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One self-contained simulation run.
 *
 * <p>A run owns everything it touches: kernel, resource pools, inventory ledger,
 * metrics and, unless one is supplied, its event recorder. The inventory map and
 * backlog orders it is given are copied, so runs on separate threads never share
 * mutable state.
 *
 * <pre>{@code
 * SimulationResult result = SimulationRun.builder(config)
 *     .inventory(erp.fetchInventory())
 *     .backlog(erp.fetchOrders(Optional.of(OrderStatus.RECEIVED)))
 *     .build()
 *     .execute();
 * }</pre>
 *
 * <p>Backlog orders in RECEIVED status start at the run's start time, in list
 * order, ahead of generated arrivals. Orders in any other status are left out.
 * A run built with a {@link RunOrigin} continues the clock, order numbering
 * and random streams of the runs before it.
 */
public final class SimulationRun {

    private static final Logger logger = LogManager.getLogger(SimulationRun.class);

    private final SimulationConfig config;
    private final Map<String, InventoryItem> inventory;
    private final List<Order> backlog;
    private final EventRecorder recorder;
    private final RunOrigin origin;
    private boolean executed;
    private RunOrigin following;

    private SimulationRun(Builder builder) {
        this.config = builder.config;
        this.inventory = new LinkedHashMap<>(builder.inventory);
        this.backlog = new ArrayList<>(builder.backlog);
        this.recorder = builder.recorder != null
            ? builder.recorder
            : new EventRecorder(config.eventBufferSize(), config::timestampAt);
        this.origin = builder.origin;
    }

    public static Builder builder(SimulationConfig config) {
        return new Builder(config);
    }

    /**
     * Runs the simulation to the configured horizon.
     *
     * @throws SimulationException   if any step of the run fails
     * @throws IllegalStateException if this run was already executed
     */
    public SimulationResult execute() {
        if (executed) {
            throw new IllegalStateException("a simulation run can only be executed once");
        }
        executed = true;

        SimulationKernel kernel = new SimulationKernel(origin.startTime());
        double horizon = origin.startTime() + config.simulationTime();
        long recordedBefore = recorder.totalRecorded();
        RandomStreams streams = new RandomStreams(config.randomSeed());
        InventoryLedger ledger = new InventoryLedger(inventory, kernel, recorder, config::timestampAt,
            config.autoReplenish(), config.replenishmentLeadTime());
        ResourcePool.Discipline discipline = config.priorityQueueing()
            ? ResourcePool.Discipline.PRIORITY
            : ResourcePool.Discipline.FIFO;
        ResourcePool workers = new ResourcePool("workers", config.numWorkers(), discipline, kernel,
            tracing(kernel, EventType.WORKER_ASSIGNED, EventType.WORKER_RELEASED));
        ResourcePool forklifts = new ResourcePool("forklifts", config.numForklifts(), discipline, kernel,
            tracing(kernel, EventType.RESOURCE_ALLOCATED, EventType.RESOURCE_RELEASED));
        MetricsAggregator metrics = new MetricsAggregator(config.timeUnit());
        List<Order> completedOrders = new ArrayList<>();
        OrderLifecycle lifecycle = new OrderLifecycle(config, kernel, recorder, ledger, workers, forklifts, streams,
            order -> {
                metrics.recordCompleted(order);
                completedOrders.add(order);
            }, origin.ordersStarted());
        ArrivalGenerator arrivals = new ArrivalGenerator(config, kernel, recorder, ledger, lifecycle,
            streams.arrivals(origin.index()), origin.ordersGenerated());

        logger.info("starting simulation: t={} to {} {}, workers={}, forklifts={}, seed={}, backlog={}",
            origin.startTime(), horizon, config.timeUnit().label(), config.numWorkers(), config.numForklifts(),
            config.randomSeed(), backlog.size());
        try {
            for (Order order : backlog) {
                if (order.status() == OrderStatus.RECEIVED) {
                    Order copy = order.copyAsReceived();
                    recorder.record(EventType.ORDER_CREATED, kernel.now(), copy.toPayload());
                    lifecycle.start(copy);
                }
            }
            arrivals.start();
            kernel.run(horizon);
        } catch (RuntimeException e) {
            throw new SimulationException("simulation failed at t=" + kernel.now() + ": " + e.getMessage(),
                kernel.now(), e);
        }

        following = origin.next(config.simulationTime(), lifecycle.started(), arrivals.generated());
        SimulationResult result = new SimulationResult(
            config,
            config.simulationTime(),
            lifecycle.started(),
            lifecycle.completed(),
            lifecycle.inProgress(),
            arrivals.skipped(),
            lifecycle.linesShorted(),
            recorder.totalRecorded() - recordedBefore,
            metrics.snapshot(),
            ledger.snapshot(),
            completedOrders,
            recorder.snapshot(),
            workers.utilization(),
            forklifts.utilization());
        logger.info("simulation finished: {} started, {} completed, {} in progress, throughput {} orders/hour",
            result.ordersStarted(), result.ordersCompleted(), result.ordersInProgress(),
            String.format("%.2f", result.metrics().throughputPerHour()));
        return result;
    }

    public RunOrigin origin() {
        return origin;
    }

    /**
     * @return where a run continuing this one starts
     * @throws IllegalStateException if this run has not completed
     */
    public RunOrigin following() {
        if (following == null) {
            throw new IllegalStateException("run has not completed");
        }
        return following;
    }

    private ResourcePool.Listener tracing(SimulationKernel kernel, EventType grant, EventType release) {
        if (!config.detailedTracing()) {
            return new ResourcePool.Listener() {
            };
        }
        return new ResourcePool.Listener() {
            @Override
            public void granted(Lease lease) {
                recorder.record(grant, kernel.now(), leasePayload(lease));
            }

            @Override
            public void released(Lease lease) {
                recorder.record(release, kernel.now(), leasePayload(lease));
            }
        };
    }

    private static Map<String, Object> leasePayload(Lease lease) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(WarehouseEvent.ORDER_ID, lease.holder());
        payload.put("resource", lease.pool().name());
        payload.put("in_use", lease.pool().inUse());
        return payload;
    }

    public static final class Builder {
        private final SimulationConfig config;
        private Map<String, InventoryItem> inventory = Map.of();
        private List<Order> backlog = List.of();
        private EventRecorder recorder;
        private RunOrigin origin = RunOrigin.FIRST;

        private Builder(SimulationConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
        }

        public Builder inventory(Map<String, InventoryItem> inventory) {
            this.inventory = Objects.requireNonNull(inventory, "inventory cannot be null");
            return this;
        }

        public Builder backlog(List<Order> backlog) {
            this.backlog = Objects.requireNonNull(backlog, "backlog cannot be null");
            return this;
        }

        /// Records into an existing recorder instead of a fresh one.
        public Builder recorder(EventRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder, "recorder cannot be null");
            return this;
        }

        /// Continues the timeline of earlier runs instead of starting at time zero.
        public Builder origin(RunOrigin origin) {
            this.origin = Objects.requireNonNull(origin, "origin cannot be null");
            return this;
        }

        public SimulationRun build() {
            return new SimulationRun(this);
        }
    }
}
