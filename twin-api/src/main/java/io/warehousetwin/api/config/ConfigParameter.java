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
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The closed set of named configuration parameters.
///
/// ## Purpose
///
/// Every way of changing a [SimulationConfig] by name goes through this
/// schema: what-if overrides, JSON configuration files, and calibrated
/// parameters. Each constant binds one snake_case name to a value kind, a
/// reader and a builder setter.
///
/// ```text
///   "num_workers" ──► NUM_WORKERS ──► ValueKind.INTEGER.coerce(7) ──► builder.numWorkers(7)
///   "num_wrokers" ──► ConfigException("Unknown configuration parameter ...")
/// ```
///
/// Unknown names and values of the wrong kind fail loudly; there is no
/// reflective "set whatever field matches" fallback.
public enum ConfigParameter {

    SIMULATION_TIME("simulation_time", ValueKind.DOUBLE,
        SimulationConfig::simulationTime, (b, v) -> b.simulationTime((Double) v)),
    TIME_UNIT("time_unit", ValueKind.TIME_UNIT,
        SimulationConfig::timeUnit, (b, v) -> b.timeUnit((SimTimeUnit) v)),
    RANDOM_SEED("random_seed", ValueKind.LONG,
        SimulationConfig::randomSeed, (b, v) -> b.randomSeed((Long) v)),
    NUM_STORAGE_LOCATIONS("num_storage_locations", ValueKind.INTEGER,
        SimulationConfig::numStorageLocations, (b, v) -> b.numStorageLocations((Integer) v)),
    NUM_WORKERS("num_workers", ValueKind.INTEGER,
        SimulationConfig::numWorkers, (b, v) -> b.numWorkers((Integer) v)),
    NUM_FORKLIFTS("num_forklifts", ValueKind.INTEGER,
        SimulationConfig::numForklifts, (b, v) -> b.numForklifts((Integer) v)),
    PICK_TIME_MEAN("pick_time_mean", ValueKind.DOUBLE,
        SimulationConfig::pickTimeMean, (b, v) -> b.pickTimeMean((Double) v)),
    PICK_TIME_STD("pick_time_std", ValueKind.DOUBLE,
        SimulationConfig::pickTimeStd, (b, v) -> b.pickTimeStd((Double) v)),
    PACK_TIME_MEAN("pack_time_mean", ValueKind.DOUBLE,
        SimulationConfig::packTimeMean, (b, v) -> b.packTimeMean((Double) v)),
    PACK_TIME_STD("pack_time_std", ValueKind.DOUBLE,
        SimulationConfig::packTimeStd, (b, v) -> b.packTimeStd((Double) v)),
    TRANSPORT_TIME_MEAN("transport_time_mean", ValueKind.DOUBLE,
        SimulationConfig::transportTimeMean, (b, v) -> b.transportTimeMean((Double) v)),
    TRANSPORT_TIME_STD("transport_time_std", ValueKind.DOUBLE,
        SimulationConfig::transportTimeStd, (b, v) -> b.transportTimeStd((Double) v)),
    SHIP_TIME_MEAN("ship_time_mean", ValueKind.DOUBLE,
        SimulationConfig::shipTimeMean, (b, v) -> b.shipTimeMean((Double) v)),
    SHIP_TIME_STD("ship_time_std", ValueKind.DOUBLE,
        SimulationConfig::shipTimeStd, (b, v) -> b.shipTimeStd((Double) v)),
    ORDER_ARRIVAL_RATE("order_arrival_rate", ValueKind.DOUBLE,
        SimulationConfig::orderArrivalRate, (b, v) -> b.orderArrivalRate((Double) v)),
    ITEMS_PER_ORDER_MEAN("items_per_order_mean", ValueKind.DOUBLE,
        SimulationConfig::itemsPerOrderMean, (b, v) -> b.itemsPerOrderMean((Double) v)),
    ITEMS_PER_ORDER_STD("items_per_order_std", ValueKind.DOUBLE,
        SimulationConfig::itemsPerOrderStd, (b, v) -> b.itemsPerOrderStd((Double) v)),
    MAX_LINE_QUANTITY("max_line_quantity", ValueKind.INTEGER,
        SimulationConfig::maxLineQuantity, (b, v) -> b.maxLineQuantity((Integer) v)),
    EVENT_BUFFER_SIZE("event_buffer_size", ValueKind.INTEGER,
        SimulationConfig::eventBufferSize, (b, v) -> b.eventBufferSize((Integer) v)),
    SYNC_THRESHOLD("sync_threshold", ValueKind.DOUBLE,
        SimulationConfig::syncThreshold, (b, v) -> b.syncThreshold((Double) v)),
    CALIBRATION_WINDOW("calibration_window", ValueKind.INTEGER,
        SimulationConfig::calibrationWindow, (b, v) -> b.calibrationWindow((Integer) v)),
    DETAILED_TRACING("detailed_tracing", ValueKind.BOOLEAN,
        SimulationConfig::detailedTracing, (b, v) -> b.detailedTracing((Boolean) v)),
    PRIORITY_QUEUEING("priority_queueing", ValueKind.BOOLEAN,
        SimulationConfig::priorityQueueing, (b, v) -> b.priorityQueueing((Boolean) v)),
    STOCKOUT_POLICY("stockout_policy", ValueKind.STOCKOUT_POLICY,
        SimulationConfig::stockoutPolicy, (b, v) -> b.stockoutPolicy((StockoutPolicy) v)),
    AUTO_REPLENISH("auto_replenish", ValueKind.BOOLEAN,
        SimulationConfig::autoReplenish, (b, v) -> b.autoReplenish((Boolean) v)),
    REPLENISHMENT_LEAD_TIME("replenishment_lead_time", ValueKind.DOUBLE,
        SimulationConfig::replenishmentLeadTime, (b, v) -> b.replenishmentLeadTime((Double) v)),
    EPOCH("epoch", ValueKind.INSTANT,
        SimulationConfig::epoch, (b, v) -> b.epoch((Instant) v));

    private static final Map<String, ConfigParameter> BY_NAME;

    static {
        Map<String, ConfigParameter> byName = new LinkedHashMap<>();
        for (ConfigParameter parameter : values()) {
            byName.put(parameter.parameterName, parameter);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String parameterName;
    private final ValueKind kind;
    private final Function<SimulationConfig, Object> reader;
    private final BiConsumer<SimulationConfig.Builder, Object> writer;

    ConfigParameter(String parameterName, ValueKind kind,
                    Function<SimulationConfig, Object> reader,
                    BiConsumer<SimulationConfig.Builder, Object> writer) {
        this.parameterName = parameterName;
        this.kind = kind;
        this.reader = reader;
        this.writer = writer;
    }

    /// @return the snake_case name used in overrides, files and calibration output
    public String parameterName() {
        return parameterName;
    }

    public ValueKind kind() {
        return kind;
    }

    /// Reads this parameter's typed value from a configuration.
    public Object read(SimulationConfig config) {
        return reader.apply(config);
    }

    /// Reads this parameter in its external form: labels for enums, ISO-8601 for instants.
    public Object external(SimulationConfig config) {
        return kind.toExternal(read(config));
    }

    /**
     * Coerces and writes a raw value into a builder.
     *
     * @throws ConfigException if the value does not fit this parameter's kind
     */
    public void apply(SimulationConfig.Builder builder, Object rawValue) {
        writer.accept(builder, kind.coerce(parameterName, rawValue));
    }

    /**
     * Looks up a parameter by name.
     *
     * @throws ConfigException if no parameter has this name
     */
    public static ConfigParameter forName(String name) {
        ConfigParameter parameter = BY_NAME.get(name);
        if (parameter == null) {
            throw new ConfigException("Unknown configuration parameter '" + name + "' (known: "
                + knownNames() + ")");
        }
        return parameter;
    }

    public static Optional<ConfigParameter> find(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static String knownNames() {
        return Arrays.stream(values()).map(ConfigParameter::parameterName).collect(Collectors.joining(", "));
    }

    /// Value kinds a parameter may hold, with strict coercion from loosely typed input.
    public enum ValueKind {
        INTEGER {
            @Override
            Object coerce(String name, Object raw) {
                long value = integral(name, raw);
                if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    throw new ConfigException(name + " is out of integer range: " + raw);
                }
                return (int) value;
            }
        },
        LONG {
            @Override
            Object coerce(String name, Object raw) {
                return integral(name, raw);
            }
        },
        DOUBLE {
            @Override
            Object coerce(String name, Object raw) {
                if (raw instanceof Number) {
                    return ((Number) raw).doubleValue();
                }
                throw mismatch(name, raw, "a number");
            }
        },
        BOOLEAN {
            @Override
            Object coerce(String name, Object raw) {
                if (raw instanceof Boolean) {
                    return raw;
                }
                if (raw instanceof String) {
                    String s = ((String) raw).trim();
                    if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
                    if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
                }
                throw mismatch(name, raw, "a boolean");
            }
        },
        TIME_UNIT {
            @Override
            Object coerce(String name, Object raw) {
                if (raw instanceof SimTimeUnit) {
                    return raw;
                }
                if (raw instanceof String) {
                    return SimTimeUnit.fromLabel((String) raw);
                }
                throw mismatch(name, raw, "a time unit label");
            }

            @Override
            Object toExternal(Object value) {
                return ((SimTimeUnit) value).label();
            }
        },
        STOCKOUT_POLICY {
            @Override
            Object coerce(String name, Object raw) {
                if (raw instanceof StockoutPolicy) {
                    return raw;
                }
                if (raw instanceof String) {
                    return StockoutPolicy.fromLabel((String) raw);
                }
                throw mismatch(name, raw, "a stockout policy label");
            }

            @Override
            Object toExternal(Object value) {
                return ((StockoutPolicy) value).label();
            }
        },
        INSTANT {
            @Override
            Object coerce(String name, Object raw) {
                if (raw instanceof Instant) {
                    return raw;
                }
                if (raw instanceof String) {
                    try {
                        return Instant.parse(((String) raw).trim());
                    } catch (DateTimeParseException e) {
                        throw new ConfigException(name + " is not an ISO-8601 instant: " + raw, e);
                    }
                }
                throw mismatch(name, raw, "an ISO-8601 instant");
            }

            @Override
            Object toExternal(Object value) {
                return value.toString();
            }
        };

        abstract Object coerce(String name, Object raw);

        Object toExternal(Object value) {
            return value;
        }

        private static long integral(String name, Object raw) {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof Number) {
                double d = ((Number) raw).doubleValue();
                if (d == Math.rint(d) && !Double.isInfinite(d)) {
                    if (d < -0x1p63 || d >= 0x1p63) {
                        throw new ConfigException(name + " is out of long range: " + raw);
                    }
                    return (long) d;
                }
            }
            throw mismatch(name, raw, "a whole number");
        }

        private static ConfigException mismatch(String name, Object raw, String expected) {
            String type = raw == null ? "null" : raw.getClass().getSimpleName();
            return new ConfigException(name + " expects " + expected + ", got " + type + " '" + raw + "'");
        }
    }
}
