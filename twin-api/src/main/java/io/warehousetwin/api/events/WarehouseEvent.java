package io.warehousetwin.api.events;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// An immutable record of one warehouse state transition.
///
/// Simulation events carry the simulated time at which they happened and a
/// timestamp derived from it (`epoch + simTime`), so two runs with the same
/// seed produce equal events. ERP events carry the reported timestamp and a
/// simulated time of `NaN`.
///
/// @param eventId   monotonically increasing within its source
/// @param type      event kind
/// @param simTime   simulated time, or NaN for events from outside a run
/// @param timestamp when the event happened
/// @param source    who produced it
/// @param payload   kind-specific fields, unmodifiable, insertion ordered
public record WarehouseEvent(
    long eventId,
    EventType type,
    double simTime,
    Instant timestamp,
    Source source,
    Map<String, Object> payload
) {

    public static final String ORDER_ID = "order_id";
    public static final String STATUS = "status";
    public static final String NEW_STATUS = "new_status";

    public WarehouseEvent {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(payload, "payload cannot be null")));
    }

    /// @return the order this event concerns, if any
    public Optional<String> orderId() {
        Object id = payload.get(ORDER_ID);
        return id == null ? Optional.empty() : Optional.of(id.toString());
    }

    /// @return the reported status value, from `status` or the ERP's `new_status`
    public Optional<Object> statusValue() {
        Object status = payload.get(STATUS);
        if (status == null) {
            status = payload.get(NEW_STATUS);
        }
        return Optional.ofNullable(status);
    }

    public boolean hasSimTime() {
        return !Double.isNaN(simTime);
    }

    /// Who produced an event.
    public enum Source {
        SIMULATION("simulation"),
        ERP("erp");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
