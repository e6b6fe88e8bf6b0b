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

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON loading and saving of {@link SimulationConfig}.
 *
 * <p>A file is a flat JSON object keyed by snake_case parameter names:
 *
 * <pre>{@code
 * {
 *   "simulation_time": 480.0,
 *   "time_unit": "minutes",
 *   "num_workers": 5,
 *   "stockout_policy": "fail_line"
 * }
 * }</pre>
 *
 * <p>Parameters missing from the file keep their defaults. Every present key
 * goes through {@link ConfigParameter}, so unknown names and mistyped values
 * fail with a {@link ConfigException} instead of being ignored.
 */
public final class SimulationConfigs {

    private static final Logger logger = LogManager.getLogger(SimulationConfigs.class);
    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

    private SimulationConfigs() {
    }

    public static SimulationConfig fromJson(String json) {
        return fromJson(new StringReader(Objects.requireNonNull(json, "json cannot be null")));
    }

    /**
     * Reads a configuration, starting from the defaults.
     *
     * @throws ConfigException if the JSON is malformed, not an object, or names an invalid parameter
     */
    public static SimulationConfig fromJson(Reader reader) {
        Map<String, Object> values;
        try {
            values = TwinGsonConfig.gson().fromJson(reader, MAP_TYPE);
        } catch (JsonParseException e) {
            throw new ConfigException("Malformed configuration JSON: " + e.getMessage(), e);
        }
        if (values == null) {
            throw new ConfigException("Configuration JSON is empty");
        }
        return SimulationConfig.defaults().withOverrides(values);
    }

    public static String toJson(SimulationConfig config) {
        return TwinGsonConfig.gson().toJson(config.toMap());
    }

    public static void toJson(SimulationConfig config, Writer writer) {
        TwinGsonConfig.gson().toJson(config.toMap(), writer);
    }

    public static SimulationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            SimulationConfig config = fromJson(reader);
            logger.debug("loaded configuration from {}", path);
            return config;
        }
    }

    public static void save(SimulationConfig config, Path path) throws IOException {
        Objects.requireNonNull(config, "config cannot be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(config, writer);
        }
        logger.debug("saved configuration to {}", path);
    }
}
