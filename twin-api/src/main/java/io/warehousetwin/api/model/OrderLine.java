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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One SKU line of an order.
///
/// A line is either picked in full or marked short; partial picks do not happen.
public final class OrderLine {

    private final String sku;
    private final int quantity;
    private final String location;
    private int pickedQuantity;
    private int shortQuantity;

    public OrderLine(String sku, int quantity, String location) {
        this.sku = Objects.requireNonNull(sku, "sku cannot be null");
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1, was " + quantity);
        }
        this.quantity = quantity;
        this.location = location;
    }

    public OrderLine(String sku, int quantity) {
        this(sku, quantity, null);
    }

    public String sku() {
        return sku;
    }

    public int quantity() {
        return quantity;
    }

    /// @return the storage location, or null when the line is staged at the pack bench
    public String location() {
        return location;
    }

    /// Lines stored at a location need a forklift trip to pick.
    public boolean requiresTransport() {
        return location != null;
    }

    public int pickedQuantity() {
        return pickedQuantity;
    }

    public int shortQuantity() {
        return shortQuantity;
    }

    public boolean isResolved() {
        return pickedQuantity + shortQuantity == quantity;
    }

    public void markPicked() {
        requireUnresolved();
        pickedQuantity = quantity;
    }

    public void markShort() {
        requireUnresolved();
        shortQuantity = quantity;
    }

    /// @return a copy with no pick progress
    public OrderLine copyUnpicked() {
        return new OrderLine(sku, quantity, location);
    }

    Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sku", sku);
        payload.put("quantity", quantity);
        payload.put("picked", pickedQuantity);
        if (location != null) {
            payload.put("location", location);
        }
        return payload;
    }

    private void requireUnresolved() {
        if (isResolved()) {
            throw new IllegalStateException("line " + sku + " is already resolved");
        }
    }

    @Override
    public String toString() {
        return "OrderLine{" + sku + " x" + quantity + (location == null ? "" : " @" + location)
            + ", picked=" + pickedQuantity + ", short=" + shortQuantity + '}';
    }
}
