package io.warehousetwin.calibration;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class DriftDetectorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T08:00:00Z");

    private static Map<String, InventoryItem> items(Object... skuAndQuantity) {
        Map<String, InventoryItem> items = new LinkedHashMap<>();
        for (int i = 0; i < skuAndQuantity.length; i += 2) {
            String sku = (String) skuAndQuantity[i];
            items.put(sku, new InventoryItem(sku, sku, (Integer) skuAndQuantity[i + 1], "A-00-00", T0));
        }
        return items;
    }

    @Test
    void identicalInventoriesHaveNoDrift() {
        Map<String, InventoryItem> inventory = items("SKU-0001", 10, "SKU-0002", 0, "SKU-0003", 7);
        assertEquals(0.0, DriftDetector.driftOfItems(inventory, items("SKU-0001", 10, "SKU-0002", 0, "SKU-0003", 7)));
        assertEquals(0.0, DriftDetector.drift(Map.of(), Map.of()));
    }

    @Test
    void disjointInventoriesClampToOne() {
        assertEquals(1.0, DriftDetector.driftOfItems(items("SKU-0001", 5), items("SKU-0002", 50)));
        assertEquals(1.0, DriftDetector.drift(Map.of("A", 1), Map.of()));
        assertEquals(1.0, DriftDetector.drift(Map.of("A", 3), Map.of("A", 0)));
    }

    @Test
    void partialDriftIsNormalizedByReportedStock() {
        Map<String, Integer> simulated = Map.of("A", 90, "B", 50);
        Map<String, Integer> reported = Map.of("A", 100, "B", 100);

        assertEquals(60.0 / 200.0, DriftDetector.drift(simulated, reported), 1e-12);
    }

    @Test
    void exceedingTheThresholdRecordsATrigger() {
        SimulationConfig config = SimulationConfig.defaults();
        EventRecorder recorder = new EventRecorder(10, config::timestampAt);
        DriftDetector detector = new DriftDetector(0.05);
        Map<String, InventoryItem> simulated = items("A", 80);
        Map<String, InventoryItem> reported = items("A", 100);

        DriftDetector.DriftReport report = detector.check(simulated, reported, recorder, 12.0);

        assertTrue(report.triggered());
        assertEquals(0.2, report.drift(), 1e-12);
        assertThat(recorder.ofType(EventType.CALIBRATION_TRIGGER)).hasSize(1);
        WarehouseEvent trigger = recorder.snapshot().get(0);
        assertEquals(0.2, (Double) trigger.payload().get("drift"), 1e-12);
        assertEquals(0.05, (Double) trigger.payload().get("threshold"), 1e-12);
        assertEquals(12.0, trigger.simTime());
        assertEquals(80, simulated.get("A").quantity());
        assertEquals(100, reported.get("A").quantity());
    }

    @Test
    void driftAtOrBelowTheThresholdIsQuiet() {
        EventRecorder recorder = new EventRecorder(10, SimulationConfig.defaults()::timestampAt);

        DriftDetector.DriftReport report = new DriftDetector(0.2).check(items("A", 80), items("A", 100), recorder, 0.0);

        assertFalse(report.triggered());
        assertEquals(0, recorder.size());
    }

    @Test
    void thresholdMustBeARatio() {
        assertThrows(IllegalArgumentException.class, () -> new DriftDetector(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new DriftDetector(1.1));
    }
}
