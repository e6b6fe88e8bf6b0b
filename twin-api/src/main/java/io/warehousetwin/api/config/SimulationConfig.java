package io.warehousetwin.api.config;

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

/**
 * Immutable parameters for one warehouse simulation run.
 *
 * <h2>Purpose</h2>
 *
 * <p>Holds the simulation horizon, resource capacities, arrival rate,
 * per-stage timing distributions, random seed, drift threshold and event
 * buffer capacity. All time values are in {@link #timeUnit()}.
 *
 * <h2>Value Semantics</h2>
 *
 * <p>Instances never change. What-if scenarios derive a new instance with
 * {@link #withOverrides(Map)}; the baseline is untouched, so there is nothing
 * to restore. Overrides go through the closed {@link ConfigParameter} schema:
 * a misspelled name fails with {@link ConfigException} instead of being
 * ignored.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SimulationConfig base = SimulationConfig.builder()
 *     .simulationTime(480)
 *     .numWorkers(5)
 *     .orderArrivalRate(10.0)
 *     .build();
 *
 * SimulationConfig moreStaff = base.withOverrides(Map.of("num_workers", 7));
 * }</pre>
 *
 * <h2>Validation</h2>
 *
 * <p>{@link Builder#build()} rejects non-positive horizons, capacities and
 * means, negative standard deviations, and a drift threshold outside
 * {@code [0, 1]}.
 *
 * @see ConfigParameter
 * @see SimulationConfigs
 */
public final class SimulationConfig {

    public static final Instant DEFAULT_EPOCH = Instant.parse("2024-01-01T08:00:00Z");

    private final double simulationTime;
    private final SimTimeUnit timeUnit;
    private final long randomSeed;

    private final int numStorageLocations;
    private final int numWorkers;
    private final int numForklifts;

    private final double pickTimeMean;
    private final double pickTimeStd;
    private final double packTimeMean;
    private final double packTimeStd;
    private final double transportTimeMean;
    private final double transportTimeStd;
    private final double shipTimeMean;
    private final double shipTimeStd;

    private final double orderArrivalRate;
    private final double itemsPerOrderMean;
    private final double itemsPerOrderStd;
    private final int maxLineQuantity;

    private final int eventBufferSize;
    private final double syncThreshold;
    private final int calibrationWindow;

    private final boolean detailedTracing;
    private final boolean priorityQueueing;
    private final StockoutPolicy stockoutPolicy;
    private final boolean autoReplenish;
    private final double replenishmentLeadTime;
    private final Instant epoch;

    private SimulationConfig(Builder b) {
        this.simulationTime = b.simulationTime;
        this.timeUnit = b.timeUnit;
        this.randomSeed = b.randomSeed;
        this.numStorageLocations = b.numStorageLocations;
        this.numWorkers = b.numWorkers;
        this.numForklifts = b.numForklifts;
        this.pickTimeMean = b.pickTimeMean;
        this.pickTimeStd = b.pickTimeStd;
        this.packTimeMean = b.packTimeMean;
        this.packTimeStd = b.packTimeStd;
        this.transportTimeMean = b.transportTimeMean;
        this.transportTimeStd = b.transportTimeStd;
        this.shipTimeMean = b.shipTimeMean;
        this.shipTimeStd = b.shipTimeStd;
        this.orderArrivalRate = b.orderArrivalRate;
        this.itemsPerOrderMean = b.itemsPerOrderMean;
        this.itemsPerOrderStd = b.itemsPerOrderStd;
        this.maxLineQuantity = b.maxLineQuantity;
        this.eventBufferSize = b.eventBufferSize;
        this.syncThreshold = b.syncThreshold;
        this.calibrationWindow = b.calibrationWindow;
        this.detailedTracing = b.detailedTracing;
        this.priorityQueueing = b.priorityQueueing;
        this.stockoutPolicy = b.stockoutPolicy;
        this.autoReplenish = b.autoReplenish;
        this.replenishmentLeadTime = b.replenishmentLeadTime;
        this.epoch = b.epoch;
    }

    /// @return a builder populated with the default shift configuration
    public static Builder builder() {
        return new Builder();
    }

    /// @return the default configuration: an 8-hour shift in minutes
    public static SimulationConfig defaults() {
        return builder().build();
    }

    /// @return a builder pre-populated with this configuration's values
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns a new configuration with the given named parameters replaced.
     *
     * <p>Names are the snake_case {@link ConfigParameter} names. The result is
     * validated as a whole, so an override that makes the configuration
     * invalid fails here.
     *
     * @param overrides parameter name to new value
     * @return a new, validated configuration; {@code this} if overrides is empty
     * @throws ConfigException for unknown names, wrongly typed values, or an invalid result
     */
    public SimulationConfig withOverrides(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides cannot be null");
        if (overrides.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            ConfigParameter.forName(entry.getKey()).apply(builder, entry.getValue());
        }
        return builder.build();
    }

    /// Single-parameter form of [#withOverrides(Map)].
    public SimulationConfig with(String parameter, Object value) {
        return withOverrides(Map.of(parameter, value));
    }

    /// Reads a parameter by its snake_case name.
    public Object get(String parameter) {
        return ConfigParameter.forName(parameter).read(this);
    }

    /// @return every parameter in schema order, with enum and instant values as strings
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (ConfigParameter parameter : ConfigParameter.values()) {
            map.put(parameter.parameterName(), parameter.external(this));
        }
        return map;
    }

    public double simulationTime() {
        return simulationTime;
    }

    public SimTimeUnit timeUnit() {
        return timeUnit;
    }

    public long randomSeed() {
        return randomSeed;
    }

    public int numStorageLocations() {
        return numStorageLocations;
    }

    public int numWorkers() {
        return numWorkers;
    }

    public int numForklifts() {
        return numForklifts;
    }

    public double pickTimeMean() {
        return pickTimeMean;
    }

    public double pickTimeStd() {
        return pickTimeStd;
    }

    public double packTimeMean() {
        return packTimeMean;
    }

    public double packTimeStd() {
        return packTimeStd;
    }

    public double transportTimeMean() {
        return transportTimeMean;
    }

    public double transportTimeStd() {
        return transportTimeStd;
    }

    public double shipTimeMean() {
        return shipTimeMean;
    }

    public double shipTimeStd() {
        return shipTimeStd;
    }

    /// @return orders per hour, independent of [#timeUnit()]
    public double orderArrivalRate() {
        return orderArrivalRate;
    }

    /// @return the arrival rate in orders per native time unit
    public double arrivalRatePerUnit() {
        return orderArrivalRate / timeUnit.unitsPerHour();
    }

    public double itemsPerOrderMean() {
        return itemsPerOrderMean;
    }

    public double itemsPerOrderStd() {
        return itemsPerOrderStd;
    }

    public int maxLineQuantity() {
        return maxLineQuantity;
    }

    public int eventBufferSize() {
        return eventBufferSize;
    }

    public double syncThreshold() {
        return syncThreshold;
    }

    public int calibrationWindow() {
        return calibrationWindow;
    }

    public boolean detailedTracing() {
        return detailedTracing;
    }

    public boolean priorityQueueing() {
        return priorityQueueing;
    }

    public StockoutPolicy stockoutPolicy() {
        return stockoutPolicy;
    }

    public boolean autoReplenish() {
        return autoReplenish;
    }

    public double replenishmentLeadTime() {
        return replenishmentLeadTime;
    }

    /// @return the wall-clock instant that simulated time zero maps to
    public Instant epoch() {
        return epoch;
    }

    /// Maps a simulated time to its timestamp.
    public Instant timestampAt(double simTime) {
        return epoch.plus(timeUnit.toDuration(simTime));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationConfig)) return false;
        return toMap().equals(((SimulationConfig) o).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return "SimulationConfig" + toMap();
    }

    /**
     * Builder for {@link SimulationConfig}. Defaults mirror a single 8-hour
     * shift measured in minutes.
     */
    public static final class Builder {
        private double simulationTime = 480.0;
        private SimTimeUnit timeUnit = SimTimeUnit.MINUTES;
        private long randomSeed = 42L;
        private int numStorageLocations = 100;
        private int numWorkers = 5;
        private int numForklifts = 2;
        private double pickTimeMean = 2.0;
        private double pickTimeStd = 0.5;
        private double packTimeMean = 3.0;
        private double packTimeStd = 0.8;
        private double transportTimeMean = 1.5;
        private double transportTimeStd = 0.3;
        private double shipTimeMean = 1.0;
        private double shipTimeStd = 0.2;
        private double orderArrivalRate = 5.0;
        private double itemsPerOrderMean = 3.0;
        private double itemsPerOrderStd = 1.5;
        private int maxLineQuantity = 3;
        private int eventBufferSize = 1000;
        private double syncThreshold = 0.05;
        private int calibrationWindow = 100;
        private boolean detailedTracing = false;
        private boolean priorityQueueing = false;
        private StockoutPolicy stockoutPolicy = StockoutPolicy.FAIL_LINE;
        private boolean autoReplenish = false;
        private double replenishmentLeadTime = 60.0;
        private Instant epoch = DEFAULT_EPOCH;

        private Builder() {
        }

        private Builder(SimulationConfig c) {
            this.simulationTime = c.simulationTime;
            this.timeUnit = c.timeUnit;
            this.randomSeed = c.randomSeed;
            this.numStorageLocations = c.numStorageLocations;
            this.numWorkers = c.numWorkers;
            this.numForklifts = c.numForklifts;
            this.pickTimeMean = c.pickTimeMean;
            this.pickTimeStd = c.pickTimeStd;
            this.packTimeMean = c.packTimeMean;
            this.packTimeStd = c.packTimeStd;
            this.transportTimeMean = c.transportTimeMean;
            this.transportTimeStd = c.transportTimeStd;
            this.shipTimeMean = c.shipTimeMean;
            this.shipTimeStd = c.shipTimeStd;
            this.orderArrivalRate = c.orderArrivalRate;
            this.itemsPerOrderMean = c.itemsPerOrderMean;
            this.itemsPerOrderStd = c.itemsPerOrderStd;
            this.maxLineQuantity = c.maxLineQuantity;
            this.eventBufferSize = c.eventBufferSize;
            this.syncThreshold = c.syncThreshold;
            this.calibrationWindow = c.calibrationWindow;
            this.detailedTracing = c.detailedTracing;
            this.priorityQueueing = c.priorityQueueing;
            this.stockoutPolicy = c.stockoutPolicy;
            this.autoReplenish = c.autoReplenish;
            this.replenishmentLeadTime = c.replenishmentLeadTime;
            this.epoch = c.epoch;
        }

        public Builder simulationTime(double simulationTime) {
            this.simulationTime = simulationTime;
            return this;
        }

        public Builder timeUnit(SimTimeUnit timeUnit) {
            this.timeUnit = timeUnit;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder numStorageLocations(int numStorageLocations) {
            this.numStorageLocations = numStorageLocations;
            return this;
        }

        public Builder numWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
            return this;
        }

        public Builder numForklifts(int numForklifts) {
            this.numForklifts = numForklifts;
            return this;
        }

        public Builder pickTime(double mean, double std) {
            this.pickTimeMean = mean;
            this.pickTimeStd = std;
            return this;
        }

        public Builder pickTimeMean(double pickTimeMean) {
            this.pickTimeMean = pickTimeMean;
            return this;
        }

        public Builder pickTimeStd(double pickTimeStd) {
            this.pickTimeStd = pickTimeStd;
            return this;
        }

        public Builder packTime(double mean, double std) {
            this.packTimeMean = mean;
            this.packTimeStd = std;
            return this;
        }

        public Builder packTimeMean(double packTimeMean) {
            this.packTimeMean = packTimeMean;
            return this;
        }

        public Builder packTimeStd(double packTimeStd) {
            this.packTimeStd = packTimeStd;
            return this;
        }

        public Builder transportTime(double mean, double std) {
            this.transportTimeMean = mean;
            this.transportTimeStd = std;
            return this;
        }

        public Builder transportTimeMean(double transportTimeMean) {
            this.transportTimeMean = transportTimeMean;
            return this;
        }

        public Builder transportTimeStd(double transportTimeStd) {
            this.transportTimeStd = transportTimeStd;
            return this;
        }

        public Builder shipTime(double mean, double std) {
            this.shipTimeMean = mean;
            this.shipTimeStd = std;
            return this;
        }

        public Builder shipTimeMean(double shipTimeMean) {
            this.shipTimeMean = shipTimeMean;
            return this;
        }

        public Builder shipTimeStd(double shipTimeStd) {
            this.shipTimeStd = shipTimeStd;
            return this;
        }

        public Builder orderArrivalRate(double orderArrivalRate) {
            this.orderArrivalRate = orderArrivalRate;
            return this;
        }

        public Builder itemsPerOrder(double mean, double std) {
            this.itemsPerOrderMean = mean;
            this.itemsPerOrderStd = std;
            return this;
        }

        public Builder itemsPerOrderMean(double itemsPerOrderMean) {
            this.itemsPerOrderMean = itemsPerOrderMean;
            return this;
        }

        public Builder itemsPerOrderStd(double itemsPerOrderStd) {
            this.itemsPerOrderStd = itemsPerOrderStd;
            return this;
        }

        public Builder maxLineQuantity(int maxLineQuantity) {
            this.maxLineQuantity = maxLineQuantity;
            return this;
        }

        public Builder eventBufferSize(int eventBufferSize) {
            this.eventBufferSize = eventBufferSize;
            return this;
        }

        public Builder syncThreshold(double syncThreshold) {
            this.syncThreshold = syncThreshold;
            return this;
        }

        public Builder calibrationWindow(int calibrationWindow) {
            this.calibrationWindow = calibrationWindow;
            return this;
        }

        public Builder detailedTracing(boolean detailedTracing) {
            this.detailedTracing = detailedTracing;
            return this;
        }

        public Builder priorityQueueing(boolean priorityQueueing) {
            this.priorityQueueing = priorityQueueing;
            return this;
        }

        public Builder stockoutPolicy(StockoutPolicy stockoutPolicy) {
            this.stockoutPolicy = stockoutPolicy;
            return this;
        }

        public Builder autoReplenish(boolean autoReplenish) {
            this.autoReplenish = autoReplenish;
            return this;
        }

        public Builder replenishmentLeadTime(double replenishmentLeadTime) {
            this.replenishmentLeadTime = replenishmentLeadTime;
            return this;
        }

        public Builder epoch(Instant epoch) {
            this.epoch = epoch;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the immutable configuration
         * @throws ConfigException naming the first invalid field
         */
        public SimulationConfig build() {
            requirePositive("simulation_time", simulationTime);
            if (timeUnit == null) {
                throw new ConfigException("time_unit cannot be null");
            }
            requireAtLeastOne("num_storage_locations", numStorageLocations);
            requireAtLeastOne("num_workers", numWorkers);
            requireAtLeastOne("num_forklifts", numForklifts);
            requireTiming("pick_time", pickTimeMean, pickTimeStd);
            requireTiming("pack_time", packTimeMean, packTimeStd);
            requireTiming("transport_time", transportTimeMean, transportTimeStd);
            requireTiming("ship_time", shipTimeMean, shipTimeStd);
            requirePositive("order_arrival_rate", orderArrivalRate);
            requireTiming("items_per_order", itemsPerOrderMean, itemsPerOrderStd);
            requireAtLeastOne("max_line_quantity", maxLineQuantity);
            requireAtLeastOne("event_buffer_size", eventBufferSize);
            if (!(syncThreshold >= 0.0 && syncThreshold <= 1.0)) {
                throw new ConfigException("sync_threshold must be within [0, 1], was " + syncThreshold);
            }
            requireAtLeastOne("calibration_window", calibrationWindow);
            if (stockoutPolicy == null) {
                throw new ConfigException("stockout_policy cannot be null");
            }
            requirePositive("replenishment_lead_time", replenishmentLeadTime);
            if (epoch == null) {
                throw new ConfigException("epoch cannot be null");
            }
            return new SimulationConfig(this);
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                throw new ConfigException(name + " must be a finite value > 0, was " + value);
            }
        }

        private static void requireAtLeastOne(String name, int value) {
            if (value < 1) {
                throw new ConfigException(name + " must be >= 1, was " + value);
            }
        }

        private static void requireTiming(String prefix, double mean, double std) {
            requirePositive(prefix + "_mean", mean);
            if (!(std >= 0.0) || Double.isInfinite(std)) {
                throw new ConfigException(prefix + "_std must be a finite value >= 0, was " + std);
            }
        }
    }
}
