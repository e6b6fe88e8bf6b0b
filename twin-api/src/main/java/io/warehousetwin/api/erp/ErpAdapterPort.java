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

import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/// Boundary to an ERP system.
///
/// ## Purpose
///
/// The twin reads its starting state (inventory and order backlog) through this
/// port and mirrors externally reported changes by subscribing to its events. It
/// never assumes a particular backing system; transports and credentials belong
/// to implementations.
///
/// ## Contract
///
/// - [#fetchOrders(Optional)] returns orders in the ERP's own order.
/// - [#fetchInventory()] returns a snapshot keyed by SKU; callers may not assume
///   later changes show through.
/// - Update methods return `false` when the target does not exist or the change
///   is rejected, and never throw for those cases.
/// - Subscribers are called synchronously on the thread that produced the event.
public interface ErpAdapterPort {

    /// @return true when connected
    boolean connect();

    void disconnect();

    boolean isConnected();

    /// @param status when present, only orders in this status
    List<Order> fetchOrders(Optional<OrderStatus> status);

    default List<Order> fetchOrders() {
        return fetchOrders(Optional.empty());
    }

    Map<String, InventoryItem> fetchInventory();

    boolean updateOrderStatus(String orderId, OrderStatus status);

    /// @param delta signed change of the on-hand quantity
    boolean updateInventory(String sku, int delta);

    void subscribeToEvents(Consumer<WarehouseEvent> subscriber);
}
