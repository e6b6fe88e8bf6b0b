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

import io.warehousetwin.api.config.SimulationConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class EventRecorderTest {

    private final SimulationConfig config = SimulationConfig.defaults();

    private EventRecorder recorder(int capacity) {
        return new EventRecorder(capacity, config::timestampAt);
    }

    @Test
    void assignsIncreasingIdsAndDerivedTimestamps() {
        EventRecorder recorder = recorder(10);

        WarehouseEvent first = recorder.record(EventType.ORDER_CREATED, 0.0, Map.of("order_id", "SIM-000001"));
        WarehouseEvent second = recorder.record(EventType.ORDER_STATUS_CHANGED, 2.5,
            Map.of("order_id", "SIM-000001", "status", "picking"));

        assertEquals(1L, first.eventId());
        assertEquals(2L, second.eventId());
        assertEquals(config.epoch(), first.timestamp());
        assertEquals(config.epoch().plusSeconds(150), second.timestamp());
        assertEquals(WarehouseEvent.Source.SIMULATION, second.source());
        assertThat(second.orderId()).contains("SIM-000001");
        assertThat(second.statusValue()).contains("picking");
    }

    @Test
    void evictsOldestFirstWhenFull() {
        EventRecorder recorder = recorder(3);
        for (int i = 0; i < 5; i++) {
            recorder.record(EventType.INVENTORY_UPDATED, i, Map.of("sku", "SKU-000" + i));
        }

        List<Long> ids = recorder.snapshot().stream().map(WarehouseEvent::eventId).collect(Collectors.toList());

        assertThat(ids).containsExactly(3L, 4L, 5L);
        assertEquals(3, recorder.size());
        assertEquals(5L, recorder.totalRecorded());
        assertEquals(2L, recorder.evictedCount());
    }

    @Test
    void latestReturnsTheNewestEventsInOrder() {
        EventRecorder recorder = recorder(10);
        for (int i = 0; i < 6; i++) {
            recorder.record(EventType.ORDER_CREATED, i, Map.of());
        }

        assertThat(recorder.latest(2)).extracting(WarehouseEvent::eventId).containsExactly(5L, 6L);
        assertThat(recorder.latest(50)).hasSize(6);
        assertThat(recorder.latest(0)).isEmpty();
    }

    @Test
    void externalEventsKeepTheirIdentity() {
        EventRecorder recorder = recorder(4);
        WarehouseEvent external = new WarehouseEvent(41L, EventType.ORDER_STATUS_CHANGED, Double.NaN,
            Instant.parse("2024-02-02T10:00:00Z"), WarehouseEvent.Source.ERP,
            Map.of("order_id", "ORD-000001", "new_status", "picked"));

        recorder.append(external);
        WarehouseEvent own = recorder.record(EventType.CALIBRATION_TRIGGER, 1.0, Map.of("drift", 0.2));

        assertThat(recorder.snapshot()).containsExactly(external, own);
        assertEquals(1L, own.eventId());
        assertThat(external.hasSimTime()).isFalse();
        assertThat(external.statusValue()).contains("picked");
        assertThat(recorder.ofType(EventType.CALIBRATION_TRIGGER)).containsExactly(own);
    }

    @Test
    void payloadIsCopiedAndUnmodifiable() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("sku", "SKU-0001");
        WarehouseEvent event = recorder(2).record(EventType.INVENTORY_UPDATED, 0.0, payload);

        payload.put("sku", "changed");

        assertEquals("SKU-0001", event.payload().get("sku"));
        assertThatThrownBy(() -> event.payload().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> recorder(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
