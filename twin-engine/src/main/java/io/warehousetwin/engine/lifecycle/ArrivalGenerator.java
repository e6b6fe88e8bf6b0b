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
import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderLine;
import io.warehousetwin.engine.inventory.InventoryLedger;
import io.warehousetwin.engine.kernel.SimulationKernel;
import io.warehousetwin.engine.sampling.TimeSampler;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Poisson order arrivals.
///
/// Gaps between arrivals are exponential with mean `1 / arrivalRatePerUnit`,
/// the hourly rate converted to the run's time unit. Each arrival builds a
/// RECEIVED order from SKUs currently in stock, records
/// [EventType#ORDER_CREATED] and hands the order to the [OrderLifecycle].
/// When nothing at all is in stock the arrival is skipped.
///
/// All draws come from the arrival stream, never from an order's stream.
public final class ArrivalGenerator {

    private static final Logger logger = LogManager.getLogger(ArrivalGenerator.class);

    static final int CUSTOMER_COUNT = 100;
    static final int MAX_PRIORITY = 5;

    private final SimulationConfig config;
    private final SimulationKernel kernel;
    private final EventRecorder recorder;
    private final InventoryLedger ledger;
    private final OrderLifecycle lifecycle;
    private final UniformRandomProvider rng;
    private final ContinuousSampler gaps;
    private final TimeSampler sizes;
    private final double end;
    private final long numberOffset;

    private long generated;
    private long skipped;

    public ArrivalGenerator(SimulationConfig config, SimulationKernel kernel, EventRecorder recorder,
                            InventoryLedger ledger, OrderLifecycle lifecycle, UniformRandomProvider rng) {
        this(config, kernel, recorder, ledger, lifecycle, rng, 0L);
    }

    /// Arrivals run from the kernel's current time for `simulation_time` units.
    ///
    /// @param numberOffset orders generated by earlier runs on the same timeline; ids continue after them
    public ArrivalGenerator(SimulationConfig config, SimulationKernel kernel, EventRecorder recorder,
                            InventoryLedger ledger, OrderLifecycle lifecycle, UniformRandomProvider rng,
                            long numberOffset) {
        if (numberOffset < 0) {
            throw new IllegalArgumentException("numberOffset must be >= 0, was " + numberOffset);
        }
        this.numberOffset = numberOffset;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger cannot be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle cannot be null");
        this.rng = Objects.requireNonNull(rng, "rng cannot be null");
        this.gaps = ZigguratSampler.Exponential.of(rng, 1.0 / config.arrivalRatePerUnit());
        this.sizes = new TimeSampler(rng);
        this.end = kernel.now() + config.simulationTime();
    }

    /// Schedules the first arrival. Arrivals stop at the configured horizon.
    public void start() {
        scheduleNext();
    }

    private void scheduleNext() {
        double gap = gaps.sample();
        if (kernel.now() + gap < end) {
            kernel.schedule(gap, this::arrive);
        }
    }

    private void arrive() {
        List<String> inStock = ledger.skusInStock();
        if (inStock.isEmpty()) {
            skipped++;
            logger.debug("no stock on hand at t={}, arrival skipped", kernel.now());
        } else {
            Order order = createOrder(inStock);
            recorder.record(EventType.ORDER_CREATED, kernel.now(), order.toPayload());
            lifecycle.start(order);
        }
        scheduleNext();
    }

    private Order createOrder(List<String> inStock) {
        int itemCount = Math.max(1, (int) sizes.sample(config.itemsPerOrderMean(), config.itemsPerOrderStd()));
        List<String> skus = ListSampler.sample(rng, inStock, Math.min(itemCount, inStock.size()));
        List<OrderLine> lines = new ArrayList<>(skus.size());
        for (String sku : skus) {
            int quantity = 1 + rng.nextInt(config.maxLineQuantity());
            String location = ledger.item(sku).map(InventoryItem::location).orElse(null);
            lines.add(new OrderLine(sku, quantity, location));
        }
        String orderId = String.format("SIM-%06d", numberOffset + ++generated);
        String customerId = String.format("CUST-%04d", 1 + rng.nextInt(CUSTOMER_COUNT));
        int priority = 1 + rng.nextInt(MAX_PRIORITY);
        return new Order(orderId, customerId, lines, priority, config.timestampAt(kernel.now()));
    }

    public long generated() {
        return generated;
    }

    /// @return arrivals dropped because no SKU had stock
    public long skipped() {
        return skipped;
    }
}
