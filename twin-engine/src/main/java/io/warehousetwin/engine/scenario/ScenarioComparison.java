package io.warehousetwin.engine.scenario;

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

import io.warehousetwin.engine.run.SimulationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Baseline run plus a set of named what-if runs.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ScenarioComparison comparison = runner.compare(Map.of(
 *     "more_workers", Map.of("num_workers", 8),
 *     "faster_picks", Map.of("pick_time_mean", 2.0)));
 *
 * comparison.improvementPercent("more_workers")
 *     .ifPresent(p -> logger.info("throughput change {}%", p));
 *
 * if (comparison.hasErrors()) {
 *     comparison.errors().forEach((name, error) ->
 *         logger.warn("{} failed: {}", name, error.getMessage()));
 * }
 * }</pre>
 *
 * <p>A scenario that failed has an error entry instead of a result. Names keep
 * the order they were given in.
 */
public final class ScenarioComparison {

    private final SimulationResult baseline;
    private final Map<String, ScenarioResult> results;
    private final Map<String, Throwable> errors;

    /**
     * @param baseline the run at the baseline configuration
     * @param results  scenario name to its result
     * @param errors   scenario name to its failure
     */
    public ScenarioComparison(SimulationResult baseline, Map<String, ScenarioResult> results,
                              Map<String, Throwable> errors) {
        this.baseline = Objects.requireNonNull(baseline, "baseline cannot be null");
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public SimulationResult baseline() {
        return baseline;
    }

    public Optional<ScenarioResult> result(String scenario) {
        return Optional.ofNullable(results.get(scenario));
    }

    public Map<String, ScenarioResult> results() {
        return results;
    }

    public Set<String> successfulScenarios() {
        return results.keySet();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Map<String, Throwable> errors() {
        return errors;
    }

    /**
     * Throughput change of a scenario relative to the baseline, in percent.
     *
     * @return empty if the scenario has no result or the baseline completed nothing
     */
    public OptionalDouble improvementPercent(String scenario) {
        ScenarioResult result = results.get(scenario);
        double base = baseline.metrics().throughputPerHour();
        if (result == null || base <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((result.throughputPerHour() - base) / base * 100.0);
    }

    /// @return the scenario with the highest throughput, if any succeeded
    public Optional<String> best() {
        String best = null;
        double bestThroughput = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, ScenarioResult> entry : results.entrySet()) {
            if (entry.getValue().throughputPerHour() > bestThroughput) {
                best = entry.getKey();
                bestThroughput = entry.getValue().throughputPerHour();
            }
        }
        return Optional.ofNullable(best);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("ScenarioComparison:\n");
        sb.append(String.format(Locale.ROOT, "  baseline: %.2f orders/hour, %d completed\n",
            baseline.metrics().throughputPerHour(), baseline.ordersCompleted()));
        for (Map.Entry<String, ScenarioResult> entry : results.entrySet()) {
            OptionalDouble change = improvementPercent(entry.getKey());
            sb.append(String.format(Locale.ROOT, "  %s: %.2f orders/hour", entry.getKey(),
                entry.getValue().throughputPerHour()));
            if (change.isPresent()) {
                sb.append(String.format(Locale.ROOT, " (%+.1f%%)", change.getAsDouble()));
            }
            sb.append('\n');
        }
        for (Map.Entry<String, Throwable> entry : errors.entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": FAILED ").append(entry.getValue().getMessage()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return summary();
    }
}
