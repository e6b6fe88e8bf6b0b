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

import java.util.Locale;
import java.util.Optional;

/**
 * Processing status of a warehouse order.
 *
 * <p>Fulfillment follows one strict linear sequence:
 * <pre>
 *   RECEIVED → PICKING → PICKED → PACKING → PACKED → SHIPPING → COMPLETED
 * </pre>
 * No stage is skipped and no transition goes backward. {@link #CANCELLED} is
 * terminal and only ever reported by an ERP system; the simulation never
 * produces it.
 */
public enum OrderStatus {
    RECEIVED("received"),
    PICKING("picking"),
    PICKED("picked"),
    PACKING("packing"),
    PACKED("packed"),
    SHIPPING("shipping"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    /// @return the lower-case wire value carried in event payloads
    public String value() {
        return value;
    }

    /// @return the status that must follow this one, or empty for terminal states
    public Optional<OrderStatus> successor() {
        switch (this) {
            case RECEIVED: return Optional.of(PICKING);
            case PICKING: return Optional.of(PICKED);
            case PICKED: return Optional.of(PACKING);
            case PACKING: return Optional.of(PACKED);
            case PACKED: return Optional.of(SHIPPING);
            case SHIPPING: return Optional.of(COMPLETED);
            default: return Optional.empty();
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /// Parses a payload value such as `"picked"` or `"PICKED"`.
    ///
    /// @return the status, or empty if the value names none
    public static Optional<OrderStatus> fromValue(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.toString().trim().toLowerCase(Locale.ROOT);
        for (OrderStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
