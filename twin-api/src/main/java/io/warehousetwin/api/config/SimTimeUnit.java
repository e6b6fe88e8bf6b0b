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

import java.time.Duration;
import java.util.Locale;

/// The native unit of the simulated clock.
///
/// All durations in a [SimulationConfig] (horizon, stage timings, lead times)
/// are expressed in this unit. Rates given per hour are converted with
/// [#unitsPerHour()], and only there.
public enum SimTimeUnit {
    SECONDS("seconds", 3600.0),
    MINUTES("minutes", 60.0),
    HOURS("hours", 1.0);

    private final String label;
    private final double unitsPerHour;

    SimTimeUnit(String label, double unitsPerHour) {
        this.label = label;
        this.unitsPerHour = unitsPerHour;
    }

    /// @return the lower-case name used in configuration files
    public String label() {
        return label;
    }

    /// @return how many of this unit fit in one hour
    public double unitsPerHour() {
        return unitsPerHour;
    }

    /// Converts an amount of this unit to a [Duration], rounded to the nanosecond.
    public Duration toDuration(double amount) {
        double seconds = amount * 3600.0 / unitsPerHour;
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    /// Converts a [Duration] to a fractional amount of this unit.
    public double fromDuration(Duration duration) {
        double seconds = duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
        return seconds * unitsPerHour / 3600.0;
    }

    /// Parses a unit label, case-insensitively.
    ///
    /// @throws ConfigException if the label names no known unit
    public static SimTimeUnit fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (SimTimeUnit unit : values()) {
                if (unit.label.equals(normalized)) {
                    return unit;
                }
            }
        }
        throw new ConfigException("Unknown time unit: " + label);
    }
}
