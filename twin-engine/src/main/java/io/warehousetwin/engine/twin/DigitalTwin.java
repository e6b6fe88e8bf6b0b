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
import io.warehousetwin.api.erp.ErpAdapterPort;
import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.InventoryItem;
import io.warehousetwin.api.model.Order;
import io.warehousetwin.api.model.OrderStatus;
import io.warehousetwin.calibration.CalibratedParameters;
import io.warehousetwin.calibration.CalibrationEngine;
import io.warehousetwin.calibration.DriftDetector;
import io.warehousetwin.engine.run.RunOrigin;
import io.warehousetwin.engine.run.SimulationException;
import io.warehousetwin.engine.run.SimulationResult;
import io.warehousetwin.engine.run.SimulationRun;
import io.warehousetwin.engine.scenario.ScenarioComparison;
import io.warehousetwin.engine.scenario.ScenarioExecutor;
import io.warehousetwin.engine.scenario.ScenarioResult;
import io.warehousetwin.engine.scenario.ScenarioRunner;
import io.warehousetwin.engine.scenario.SensitivityPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A simulated mirror of one warehouse, kept in step with its ERP.
 *
 * <h2>Lifecycle</h2>
 *
 * <ol>
 *   <li>On construction the twin connects to the ERP, copies its inventory and
 *       RECEIVED backlog, and subscribes to ERP events, which land in the twin's
 *       recorder next to its own simulation events.</li>
 *   <li>{@link #runSimulation()} simulates the baseline on the live inventory.
 *       The backlog is consumed by the first run and the final stock becomes the
 *       twin's live inventory. Each run picks up the clock, order numbering and
 *       random streams where the previous one stopped, so the twin's history
 *       reads as one continuous timeline.</li>
 *   <li>{@link #runWhatIf(Map)}, {@link #sweep(String, List)} and
 *       {@link #compare(Map)} run on copies and leave the twin untouched.</li>
 *   <li>Calibration fits timing parameters from ERP logs or the twin's recent
 *       history; {@link #applyCalibration(CalibratedParameters)} makes them the
 *       new baseline.</li>
 *   <li>{@link #calculateSyncDrift()} compares live inventory with the ERP's.</li>
 * </ol>
 *
 * <p>Baseline runs and calibration are serialized on the twin.
 */
public final class DigitalTwin {

    private static final Logger logger = LogManager.getLogger(DigitalTwin.class);

    private final ErpAdapterPort erp;
    private final EventRecorder recorder;
    private final ScenarioRunner scenarios;

    private SimulationConfig config;
    private Map<String, InventoryItem> inventory;
    private List<Order> backlog;
    private RunOrigin origin = RunOrigin.FIRST;

    public DigitalTwin(SimulationConfig config, ErpAdapterPort erp) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.erp = Objects.requireNonNull(erp, "erp cannot be null");
        this.recorder = new EventRecorder(config.eventBufferSize(), config::timestampAt);
        if (!erp.isConnected() && !erp.connect()) {
            throw new IllegalStateException("could not connect to the ERP");
        }
        this.inventory = new LinkedHashMap<>(erp.fetchInventory());
        this.backlog = new ArrayList<>(erp.fetchOrders(Optional.of(OrderStatus.RECEIVED)));
        erp.subscribeToEvents(recorder::append);
        this.scenarios = new ScenarioRunner(config, ScenarioExecutor.fromState(this::inventory, this::backlog));
        logger.info("digital twin synced from ERP: {} SKUs, {} backlog orders", inventory.size(), backlog.size());
    }

    /**
     * Simulates the baseline configuration on the live inventory.
     *
     * @throws SimulationException if the run fails; live state is then unchanged
     */
    public synchronized SimulationResult runSimulation() {
        SimulationRun run = SimulationRun.builder(config)
            .inventory(inventory)
            .backlog(backlog)
            .recorder(recorder)
            .origin(origin)
            .build();
        SimulationResult result = run.execute();
        inventory = new LinkedHashMap<>(result.finalInventory());
        backlog = new ArrayList<>();
        origin = run.following();
        return result;
    }

    public ScenarioResult runWhatIf(Map<String, ?> overrides) {
        return scenarios.runWhatIf(overrides);
    }

    public List<SensitivityPoint> sweep(String parameter, List<?> values) {
        return scenarios.sweep(parameter, values);
    }

    public ScenarioComparison compare(Map<String, ? extends Map<String, ?>> named) {
        return scenarios.compare(named);
    }

    public ScenarioRunner scenarios() {
        return scenarios;
    }

    /// Fits timing parameters from ERP transaction events. The configuration is not changed.
    public CalibratedParameters calibrateFromErpLogs(List<WarehouseEvent> erpEvents) {
        return new CalibrationEngine(config().timeUnit()).calibrate(erpEvents);
    }

    /// Fits timing parameters from the most recent `calibration_window` events the twin holds.
    public synchronized CalibratedParameters calibrateFromHistory() {
        return new CalibrationEngine(config.timeUnit()).calibrate(recorder.latest(config.calibrationWindow()));
    }

    /**
     * Makes calibrated parameters part of the baseline.
     *
     * @return the new baseline configuration
     */
    public synchronized SimulationConfig applyCalibration(CalibratedParameters calibrated) {
        SimulationConfig updated = calibrated.applyTo(config);
        config = updated;
        scenarios.rebase(updated);
        logger.info("applied calibrated parameters {}", calibrated.parameters());
        return updated;
    }

    /**
     * Compares the live inventory with the ERP's. A drift above the
     * configured threshold records a calibration trigger. A disconnected ERP
     * counts as full drift.
     */
    public synchronized DriftDetector.DriftReport calculateSyncDrift() {
        DriftDetector detector = new DriftDetector(config.syncThreshold());
        if (!erp.isConnected()) {
            logger.warn("ERP is disconnected, treating inventory as fully drifted");
            return new DriftDetector.DriftReport(1.0, detector.threshold(), true);
        }
        return detector.check(inventory, erp.fetchInventory(), recorder, origin.startTime());
    }

    public synchronized SimulationConfig config() {
        return config;
    }

    /// @return a copy of the live inventory
    public synchronized Map<String, InventoryItem> inventory() {
        return new LinkedHashMap<>(inventory);
    }

    /// @return a copy of the orders waiting for the next baseline run
    public synchronized List<Order> backlog() {
        return new ArrayList<>(backlog);
    }

    public EventRecorder recorder() {
        return recorder;
    }

    /// @return simulated time covered by baseline runs so far
    public synchronized double simulatedTime() {
        return origin.startTime();
    }
}
