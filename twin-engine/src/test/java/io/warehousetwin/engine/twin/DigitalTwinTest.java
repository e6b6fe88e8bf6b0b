package io.warehousetwin.engine.twin;

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
import io.warehousetwin.api.erp.MockErpAdapter;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.calibration.CalibratedParameters;
import io.warehousetwin.calibration.DriftDetector;
import io.warehousetwin.engine.run.SimulationResult;
import io.warehousetwin.engine.scenario.ScenarioResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class DigitalTwinTest {

    private static SimulationConfig.Builder shift() {
        return SimulationConfig.builder()
            .simulationTime(120.0)
            .numStorageLocations(20)
            .randomSeed(11L);
    }

    private static long totalUnits(Map<String, InventoryItem> inventory) {
        return inventory.values().stream().mapToLong(InventoryItem::quantity).sum();
    }

    @Test
    void baselineRunConsumesTheBacklogAndUpdatesLiveStock() {
        SimulationConfig config = shift().build();
        MockErpAdapter erp = new MockErpAdapter(config);
        erp.createOrder("CUST-0001", Map.of("SKU-0001", 2));
        DigitalTwin twin = new DigitalTwin(config, erp);
        assertThat(twin.backlog()).hasSize(1);

        SimulationResult result = twin.runSimulation();

        assertThat(result.completedOrders()).anyMatch(o -> o.orderId().equals("ORD-000001"));
        assertThat(twin.backlog()).isEmpty();
        assertThat(totalUnits(twin.inventory())).isLessThan(totalUnits(erp.fetchInventory()));
        assertEquals(result.finalInventory(), twin.inventory());
        assertEquals(120.0, twin.simulatedTime());
        assertThat(twin.recorder().ofType(EventType.ORDER_CREATED)).isNotEmpty();
    }

    @Test
    void whatIfRunsLeaveTheTwinUntouched() {
        SimulationConfig config = shift().build();
        MockErpAdapter erp = new MockErpAdapter(config);
        erp.createOrder("CUST-0001", Map.of("SKU-0001", 2));
        DigitalTwin twin = new DigitalTwin(config, erp);
        Map<String, InventoryItem> before = twin.inventory();
        int recorded = twin.recorder().size();

        ScenarioResult scenario = twin.runWhatIf(Map.of("num_workers", 10));

        assertEquals(10, scenario.result().config().numWorkers());
        assertThat(scenario.result().completedOrders()).anyMatch(o -> o.orderId().equals("ORD-000001"));
        assertEquals(before, twin.inventory());
        assertThat(twin.backlog()).hasSize(1);
        assertEquals(recorded, twin.recorder().size());
        assertSame(config, twin.config());
    }

    @Test
    void driftAboveThresholdRecordsACalibrationTrigger() {
        SimulationConfig config = shift().syncThreshold(0.0).build();
        DigitalTwin twin = new DigitalTwin(config, new MockErpAdapter(config));

        DriftDetector.DriftReport inSync = twin.calculateSyncDrift();
        assertEquals(0.0, inSync.drift());
        assertFalse(inSync.triggered());

        twin.runSimulation();
        DriftDetector.DriftReport drifted = twin.calculateSyncDrift();

        assertThat(drifted.drift()).isGreaterThan(0.0);
        assertTrue(drifted.triggered());
        WarehouseEvent trigger = twin.recorder().ofType(EventType.CALIBRATION_TRIGGER).get(0);
        assertEquals(drifted.drift(), (Double) trigger.payload().get("drift"), 1e-12);
        assertEquals(120.0, trigger.simTime());
    }

    @Test
    void disconnectedErpCountsAsFullDrift() {
        SimulationConfig config = shift().build();
        MockErpAdapter erp = new MockErpAdapter(config);
        DigitalTwin twin = new DigitalTwin(config, erp);
        erp.disconnect();

        DriftDetector.DriftReport report = twin.calculateSyncDrift();

        assertEquals(1.0, report.drift());
        assertTrue(report.triggered());
    }

    @Test
    void erpEventsLandInTheTwinRecorder() {
        SimulationConfig config = shift().build();
        MockErpAdapter erp = new MockErpAdapter(config);
        DigitalTwin twin = new DigitalTwin(config, erp);

        erp.updateInventory("SKU-0002", -1);

        List<WarehouseEvent> updates = twin.recorder().ofType(EventType.INVENTORY_UPDATED);
        assertThat(updates).hasSize(1);
        assertEquals(WarehouseEvent.Source.ERP, updates.get(0).source());
        assertEquals("SKU-0002", updates.get(0).payload().get("sku"));
        assertTrue(Double.isNaN(updates.get(0).simTime()));
    }

    @Test
    void calibrationFromHistoryBecomesTheNewBaseline() {
        SimulationConfig config = shift()
            .simulationTime(480.0)
            .eventBufferSize(10_000)
            .calibrationWindow(10_000)
            .build();
        DigitalTwin twin = new DigitalTwin(config, new MockErpAdapter(config));
        twin.runSimulation();

        CalibratedParameters calibrated = twin.calibrateFromHistory();
        assertFalse(calibrated.isEmpty());
        assertFalse(calibrated.evictionGapDetected());

        SimulationConfig updated = twin.applyCalibration(calibrated);

        assertSame(updated, twin.config());
        assertSame(updated, twin.scenarios().baseline());
        assertEquals(calibrated.get("pick_time_mean").getAsDouble(), updated.pickTimeMean());
        assertEquals(calibrated.get("ship_time_mean").getAsDouble(), updated.shipTimeMean());
        assertEquals(config.numWorkers(), updated.numWorkers());
    }

    @Test
    void successiveBaselineRunsContinueOneTimeline() {
        SimulationConfig config = shift()
            .eventBufferSize(10_000)
            .calibrationWindow(10_000)
            .build();
        DigitalTwin twin = new DigitalTwin(config, new MockErpAdapter(config));

        SimulationResult first = twin.runSimulation();
        SimulationResult second = twin.runSimulation();

        assertEquals(240.0, twin.simulatedTime());
        assertThat(first.completedOrders()).isNotEmpty();
        assertThat(second.completedOrders()).isNotEmpty();
        for (Order order : second.completedOrders()) {
            assertThat(order.arrivalTime().getAsDouble()).isGreaterThanOrEqualTo(120.0);
        }

        List<WarehouseEvent> created = twin.recorder().ofType(EventType.ORDER_CREATED);
        Set<String> ids = created.stream().map(e -> e.orderId().orElseThrow()).collect(Collectors.toSet());
        assertEquals(created.size(), ids.size());

        CalibratedParameters calibrated = twin.calibrateFromHistory();
        assertEquals(created.size(), calibrated.ordersObserved());
        assertEquals(0, calibrated.truncatedOrders());
        assertFalse(calibrated.evictionGapDetected());
    }
}
