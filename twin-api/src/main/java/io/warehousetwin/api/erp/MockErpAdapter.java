package io.warehousetwin.api.erp;

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
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderLine;
import io.warehousetwin.api.model.OrderStatus;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory ERP used by tests and demonstrations.
 *
 * <p>Inventory is generated from the configuration seed: one SKU per storage
 * location, named {@code SKU-0000}, {@code SKU-0001}, ..., with 10 to 100 units
 * on hand and a location code of the form {@code A-aisle-slot}. Every change made
 * through the port is published to subscribers as an ERP event.
 *
 * <p>Timestamps come from the supplied {@link Clock}, so a test can control the
 * time between status changes.
 */
public class MockErpAdapter implements ErpAdapterPort {

    private static final Logger logger = LogManager.getLogger(MockErpAdapter.class);

    private final Clock clock;
    private final UniformRandomProvider rng;
    private final Map<String, InventoryItem> inventory = new LinkedHashMap<>();
    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final List<Consumer<WarehouseEvent>> subscribers = new CopyOnWriteArrayList<>();

    private boolean connected;
    private long eventCounter;

    public MockErpAdapter(SimulationConfig config) {
        this(config, Clock.systemUTC());
    }

    public MockErpAdapter(SimulationConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.rng = RandomSource.XO_SHI_RO_256_PP.create(config.randomSeed());
        Instant now = clock.instant();
        for (int i = 0; i < config.numStorageLocations(); i++) {
            String sku = String.format("SKU-%04d", i);
            inventory.put(sku, new InventoryItem(
                sku,
                "Product " + i,
                10 + rng.nextInt(91),
                String.format("A-%02d-%02d", i / 10, i % 10),
                InventoryItem.DEFAULT_MIN_STOCK,
                InventoryItem.DEFAULT_MAX_STOCK,
                5.0 + 45.0 * rng.nextDouble(),
                now));
        }
    }

    @Override
    public synchronized boolean connect() {
        connected = true;
        logger.info("mock ERP connected, {} SKUs", inventory.size());
        return true;
    }

    @Override
    public synchronized void disconnect() {
        connected = false;
        logger.info("mock ERP disconnected");
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized List<Order> fetchOrders(Optional<OrderStatus> status) {
        Objects.requireNonNull(status, "status cannot be null");
        List<Order> result = new ArrayList<>();
        for (Order order : orders.values()) {
            if (status.isEmpty() || order.status() == status.get()) {
                result.add(order);
            }
        }
        return result;
    }

    @Override
    public synchronized Map<String, InventoryItem> fetchInventory() {
        return new LinkedHashMap<>(inventory);
    }

    @Override
    public boolean updateOrderStatus(String orderId, OrderStatus status) {
        Objects.requireNonNull(status, "status cannot be null");
        WarehouseEvent event;
        synchronized (this) {
            Order order = orders.get(orderId);
            if (order == null) {
                return false;
            }
            order.assignReportedStatus(status);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(WarehouseEvent.ORDER_ID, orderId);
            payload.put(WarehouseEvent.NEW_STATUS, status.value());
            event = nextEvent(EventType.ORDER_STATUS_CHANGED, payload);
        }
        publish(event);
        return true;
    }

    /**
     * Applies a signed change to a SKU's on-hand quantity. A change that would
     * leave the quantity negative is rejected.
     */
    @Override
    public boolean updateInventory(String sku, int delta) {
        WarehouseEvent event;
        synchronized (this) {
            InventoryItem item = inventory.get(sku);
            if (item == null) {
                return false;
            }
            int updated = item.quantity() + delta;
            if (updated < 0) {
                logger.warn("rejected inventory change {} for {}: only {} on hand", delta, sku, item.quantity());
                return false;
            }
            inventory.put(sku, item.withQuantity(updated, clock.instant()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sku", sku);
            payload.put("change", delta);
            payload.put("new_quantity", updated);
            event = nextEvent(EventType.INVENTORY_UPDATED, payload);
        }
        publish(event);
        return true;
    }

    @Override
    public void subscribeToEvents(Consumer<WarehouseEvent> subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber cannot be null"));
    }

    /**
     * Creates a RECEIVED order. Lines for unknown SKUs are dropped; the others
     * take their location from inventory.
     *
     * @param items SKU to ordered quantity, in line order
     */
    public Order createOrder(String customerId, Map<String, Integer> items) {
        Objects.requireNonNull(items, "items cannot be null");
        Order order;
        WarehouseEvent event;
        synchronized (this) {
            List<OrderLine> lines = new ArrayList<>();
            for (Map.Entry<String, Integer> item : items.entrySet()) {
                InventoryItem stocked = inventory.get(item.getKey());
                if (stocked != null) {
                    lines.add(new OrderLine(item.getKey(), item.getValue(), stocked.location()));
                }
            }
            String orderId = String.format("ORD-%06d", orders.size() + 1);
            order = new Order(orderId, customerId, lines, 1 + rng.nextInt(5), clock.instant());
            orders.put(orderId, order);
            event = nextEvent(EventType.ORDER_CREATED, order.toPayload());
        }
        publish(event);
        return order;
    }

    /// Formats an ERP event id the way the ERP displays it, e.g. `ERP-000042`.
    public static String displayId(WarehouseEvent event) {
        return String.format("ERP-%06d", event.eventId());
    }

    private WarehouseEvent nextEvent(EventType type, Map<String, Object> payload) {
        return new WarehouseEvent(++eventCounter, type, Double.NaN, clock.instant(), WarehouseEvent.Source.ERP, payload);
    }

    private void publish(WarehouseEvent event) {
        for (Consumer<WarehouseEvent> subscriber : subscribers) {
            subscriber.accept(event);
        }
    }
}
