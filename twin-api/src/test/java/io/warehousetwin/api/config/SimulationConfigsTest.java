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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class SimulationConfigsTest {

    @Test
    void partialFileKeepsDefaultsForMissingParameters() {
        String json = "{\n"
            + "  \"simulation_time\": 120,\n"
            + "  \"num_workers\": 4,\n"
            + "  \"random_seed\": 7,\n"
            + "  \"stockout_policy\": \"block_until_replenished\"\n"
            + "}";

        SimulationConfig config = SimulationConfigs.fromJson(json);

        assertEquals(120.0, config.simulationTime());
        assertEquals(4, config.numWorkers());
        assertEquals(7L, config.randomSeed());
        assertEquals(StockoutPolicy.BLOCK_UNTIL_REPLENISHED, config.stockoutPolicy());
        assertEquals(SimulationConfig.defaults().numForklifts(), config.numForklifts());
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path tempDir) throws Exception {
        SimulationConfig original = SimulationConfig.builder()
            .simulationTime(240)
            .timeUnit(SimTimeUnit.SECONDS)
            .randomSeed(Long.MAX_VALUE - 3)
            .numWorkers(6)
            .shipTime(1.5, 0.25)
            .autoReplenish(true)
            .build();

        Path file = tempDir.resolve("configs/twin.json");
        SimulationConfigs.save(original, file);

        assertTrue(Files.exists(file));
        assertThat(Files.readString(file)).contains("\"num_workers\": 6").contains("\"time_unit\": \"seconds\"");
        assertEquals(original, SimulationConfigs.load(file));
    }

    @Test
    void unknownKeysAndBadJsonFail() {
        assertThatThrownBy(() -> SimulationConfigs.fromJson("{\"workers\": 3}"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("workers");
        assertThatThrownBy(() -> SimulationConfigs.fromJson("{\"num_workers\": "))
            .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> SimulationConfigs.fromJson(""))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void fractionalValueForWholeNumberParameterFails() {
        assertThatThrownBy(() -> SimulationConfigs.fromJson("{\"num_forklifts\": 1.5}"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("num_forklifts");
    }
}
