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
import io.warehousetwin.api.model.OrderStatus;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class MockErpAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private final SimulationConfig config = SimulationConfig.builder().numStorageLocations(25).randomSeed(11).build();

    @Test
    void inventoryIsGeneratedFromTheSeed() {
        Map<String, InventoryItem> first = new MockErpAdapter(config, CLOCK).fetchInventory();
        Map<String, InventoryItem> second = new MockErpAdapter(config, CLOCK).fetchInventory();

        assertEquals(first, second);
        assertThat(first).hasSize(25);
        InventoryItem item = first.get("SKU-0013");
        assertEquals("A-01-03", item.location());
        assertThat(first.values()).allSatisfy(i -> {
            assertThat(i.quantity()).isBetween(10, 100);
            assertThat(i.unitCost()).isBetween(5.0, 50.0);
        });
    }

    @Test
    void connectionStateIsTracked() {
        MockErpAdapter erp = new MockErpAdapter(config, CLOCK);
        assertFalse(erp.isConnected());
        assertTrue(erp.connect());
        assertTrue(erp.isConnected());
        erp.disconnect();
        assertFalse(erp.isConnected());
    }

    @Test
    void changesArePublishedToSubscribers() {
        MockErpAdapter erp = new MockErpAdapter(config, CLOCK);
        List<WarehouseEvent> seen = new ArrayList<>();
        erp.subscribeToEvents(seen::add);

        Map<String, Integer> items = new LinkedHashMap<>();
        items.put("SKU-0001", 2);
        items.put("SKU-9999", 1);
        Order order = erp.createOrder("CUST-0001", items);
        assertTrue(erp.updateOrderStatus(order.orderId(), OrderStatus.PICKING));
        assertTrue(erp.updateInventory("SKU-0001", -2));

        assertEquals("ORD-000001", order.orderId());
        assertThat(order.lines()).hasSize(1);
        assertThat(seen).extracting(WarehouseEvent::type)
            .containsExactly(EventType.ORDER_CREATED, EventType.ORDER_STATUS_CHANGED, EventType.INVENTORY_UPDATED);
        assertThat(seen).allSatisfy(e -> assertEquals(WarehouseEvent.Source.ERP, e.source()));
        assertEquals("picking", seen.get(1).payload().get(WarehouseEvent.NEW_STATUS));
        assertEquals("ERP-000003", MockErpAdapter.displayId(seen.get(2)));
    }

    @Test
    void fetchOrdersFiltersByStatus() {
        MockErpAdapter erp = new MockErpAdapter(config, CLOCK);
        Order a = erp.createOrder("CUST-0001", Map.of("SKU-0001", 1));
        Order b = erp.createOrder("CUST-0002", Map.of("SKU-0002", 1));
        erp.updateOrderStatus(b.orderId(), OrderStatus.COMPLETED);

        assertThat(erp.fetchOrders()).containsExactly(a, b);
        assertThat(erp.fetchOrders(Optional.of(OrderStatus.RECEIVED))).containsExactly(a);
        assertThat(erp.fetchOrders(Optional.of(OrderStatus.COMPLETED))).containsExactly(b);
    }

    @Test
    void unknownTargetsAndNegativeStockAreRejected() {
        MockErpAdapter erp = new MockErpAdapter(config, CLOCK);
        int onHand = erp.fetchInventory().get("SKU-0000").quantity();

        assertFalse(erp.updateOrderStatus("ORD-404", OrderStatus.PICKED));
        assertFalse(erp.updateInventory("SKU-404", 5));
        assertFalse(erp.updateInventory("SKU-0000", -(onHand + 1)));
        assertEquals(onHand, erp.fetchInventory().get("SKU-0000").quantity());
    }

    @Test
    void fetchedInventoryIsASnapshot() {
        MockErpAdapter erp = new MockErpAdapter(config, CLOCK);
        Map<String, InventoryItem> before = erp.fetchInventory();
        erp.updateInventory("SKU-0002", 10);

        assertEquals(before.get("SKU-0002").quantity() + 10, erp.fetchInventory().get("SKU-0002").quantity());
    }
}
