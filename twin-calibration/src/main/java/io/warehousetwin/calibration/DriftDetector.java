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

import io.warehousetwin.api.events.EventRecorder;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.model.InventoryItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Measures how far simulated inventory has drifted from what the ERP reports.
///
/// ## Ratio
///
/// ```text
///           Σ over the union of SKUs of |simulated - reported|
///  drift = ─────────────────────────────────────────────────── , clamped to [0, 1]
///                        Σ reported quantities
/// ```
///
/// A SKU missing on one side counts as zero there. Identical or both-empty
/// inventories give exactly 0.0. When nothing is reported on hand but the
/// simulation holds stock, the drift is 1.0.
///
/// ## Trigger
///
/// [#check] compares the ratio with the threshold and, when exceeded, records a
/// `CALIBRATION_TRIGGER` event. The detector is advisory: it never touches
/// inventory.
public final class DriftDetector {

    private static final Logger logger = LogManager.getLogger(DriftDetector.class);

    private final double threshold;

    /// @param threshold ratio above which a calibration trigger is recorded, in [0, 1]
    public DriftDetector(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be within [0, 1], was " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /// @return the drift ratio between two SKU to quantity maps
    public static double drift(Map<String, Integer> simulated, Map<String, Integer> reported) {
        Objects.requireNonNull(simulated, "simulated cannot be null");
        Objects.requireNonNull(reported, "reported cannot be null");

        Set<String> skus = new LinkedHashSet<>(reported.keySet());
        skus.addAll(simulated.keySet());

        long difference = 0;
        long reportedTotal = 0;
        for (String sku : skus) {
            int sim = simulated.getOrDefault(sku, 0);
            int rep = reported.getOrDefault(sku, 0);
            difference += Math.abs((long) sim - rep);
            reportedTotal += rep;
        }
        if (difference == 0) {
            return 0.0;
        }
        if (reportedTotal <= 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) difference / reportedTotal);
    }

    /// Convenience form of [#drift(Map, Map)] for item snapshots.
    public static double driftOfItems(Map<String, InventoryItem> simulated, Map<String, InventoryItem> reported) {
        return drift(quantities(simulated), quantities(reported));
    }

    public static Map<String, Integer> quantities(Map<String, InventoryItem> items) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, InventoryItem> entry : items.entrySet()) {
            result.put(entry.getKey(), entry.getValue().quantity());
        }
        return result;
    }

    /**
     * Computes the drift and records a calibration trigger when it exceeds the threshold.
     *
     * @param recorder receives the trigger event
     * @param simTime  simulated time to stamp the trigger with
     */
    public DriftReport check(Map<String, InventoryItem> simulated, Map<String, InventoryItem> reported,
                             EventRecorder recorder, double simTime) {
        Objects.requireNonNull(recorder, "recorder cannot be null");
        double ratio = driftOfItems(simulated, reported);
        boolean exceeded = ratio > threshold;
        if (exceeded) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("drift", ratio);
            payload.put("threshold", threshold);
            recorder.record(EventType.CALIBRATION_TRIGGER, simTime, payload);
            logger.warn("inventory drift {} exceeds threshold {}, calibration suggested",
                String.format("%.4f", ratio), threshold);
        } else {
            logger.debug("inventory drift {} within threshold {}", ratio, threshold);
        }
        return new DriftReport(ratio, threshold, exceeded);
    }

    /// Outcome of one drift check.
    public record DriftReport(double drift, double threshold, boolean triggered) {
    }
}
