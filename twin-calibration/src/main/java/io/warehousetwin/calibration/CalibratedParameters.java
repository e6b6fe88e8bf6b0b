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

import io.warehousetwin.api.config.ConfigException;
import io.warehousetwin.api.config.SimulationConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Timing estimates produced by {@link CalibrationEngine#calibrate(java.util.List)}.
 *
 * <h2>Applying</h2>
 *
 * <p>Estimates are never applied implicitly. A caller inspects them (sample
 * counts, confidence widths, the eviction flag) and then commits with
 * {@link #applyTo(SimulationConfig)}, which returns a new configuration and
 * leaves the given one untouched:
 *
 * <pre>{@code
 * CalibratedParameters estimates = engine.calibrate(events);
 * if (estimates.meetsRecommendedSampleSize() && !estimates.evictionGapDetected()) {
 *     config = estimates.applyTo(config);
 * }
 * }</pre>
 *
 * <p>Parameter names are {@link io.warehousetwin.api.config.ConfigParameter}
 * names, so applying goes through the same closed schema as any override.
 */
public final class CalibratedParameters {

    private final Map<String, Double> parameters;
    private final Map<CalibrationStage, StageFit> fits;
    private final int ordersObserved;
    private final int truncatedOrders;
    private final long missingEventIds;

    CalibratedParameters(Map<String, Double> parameters, Map<CalibrationStage, StageFit> fits,
                         int ordersObserved, int truncatedOrders, long missingEventIds) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        EnumMap<CalibrationStage, StageFit> copy = new EnumMap<>(CalibrationStage.class);
        copy.putAll(fits);
        this.fits = Collections.unmodifiableMap(copy);
        this.ordersObserved = ordersObserved;
        this.truncatedOrders = truncatedOrders;
        this.missingEventIds = missingEventIds;
    }

    /// @return parameter name to estimate, in stage order (mean before std)
    public Map<String, Double> parameters() {
        return parameters;
    }

    public OptionalDouble get(String parameter) {
        Double value = parameters.get(parameter);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    public Map<CalibrationStage, StageFit> fits() {
        return fits;
    }

    public Optional<StageFit> fit(CalibrationStage stage) {
        return Optional.ofNullable(fits.get(stage));
    }

    /// @return durations observed for a stage, 0 when none
    public long sampleCount(CalibrationStage stage) {
        StageFit fit = fits.get(stage);
        return fit == null ? 0 : fit.sampleCount();
    }

    /// @return orders whose creation event was seen
    public int ordersObserved() {
        return ordersObserved;
    }

    public boolean meetsRecommendedSampleSize() {
        return ordersObserved >= CalibrationEngine.MIN_RECOMMENDED_ORDERS;
    }

    /// @return orders with status events but no creation event, typically lost to buffer eviction
    public int truncatedOrders() {
        return truncatedOrders;
    }

    /// @return simulation event ids missing between the first and last id seen
    public long missingEventIds() {
        return missingEventIds;
    }

    public boolean evictionGapDetected() {
        return truncatedOrders > 0 || missingEventIds > 0;
    }

    /**
     * Returns a copy of {@code config} with every estimate applied.
     *
     * @throws ConfigException if an estimate makes the configuration invalid
     */
    public SimulationConfig applyTo(SimulationConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return config.withOverrides(parameters);
    }

    @Override
    public String toString() {
        return "CalibratedParameters" + parameters + "[orders=" + ordersObserved
            + (evictionGapDetected() ? ", eviction gaps" : "") + ']';
    }
}
