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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Stock of one SKU at one storage location.
///
/// Immutable; quantity changes produce a new item through [#withQuantity(int, Instant)].
/// The quantity is never negative.
///
/// @param sku           stock keeping unit
/// @param name          display name
/// @param quantity      units on hand, >= 0
/// @param location      storage location code, e.g. `A-03-07`
/// @param minStock      reorder point
/// @param maxStock      reorder-up-to level
/// @param unitCost      cost per unit
/// @param lastUpdated   when the quantity last changed
public record InventoryItem(
    String sku,
    String name,
    int quantity,
    String location,
    int minStock,
    int maxStock,
    double unitCost,
    Instant lastUpdated
) {

    public static final int DEFAULT_MIN_STOCK = 10;
    public static final int DEFAULT_MAX_STOCK = 100;

    public InventoryItem {
        Objects.requireNonNull(sku, "sku cannot be null");
        Objects.requireNonNull(lastUpdated, "lastUpdated cannot be null");
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity of " + sku + " cannot be negative: " + quantity);
        }
        if (minStock < 0 || maxStock < minStock) {
            throw new IllegalArgumentException("invalid reorder levels for " + sku + ": min=" + minStock + ", max=" + maxStock);
        }
    }

    public InventoryItem(String sku, String name, int quantity, String location, Instant lastUpdated) {
        this(sku, name, quantity, location, DEFAULT_MIN_STOCK, DEFAULT_MAX_STOCK, 0.0, lastUpdated);
    }

    public InventoryItem withQuantity(int newQuantity, Instant when) {
        return new InventoryItem(sku, name, newQuantity, location, minStock, maxStock, unitCost, when);
    }

    /// @return true when stock is below the reorder point
    public boolean belowReorderPoint() {
        return quantity < minStock;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sku", sku);
        payload.put("name", name);
        payload.put("quantity", quantity);
        payload.put("location", location);
        payload.put("min_stock", minStock);
        payload.put("max_stock", maxStock);
        payload.put("unit_cost", unitCost);
        payload.put("last_updated", lastUpdated.toString());
        return payload;
    }
}
