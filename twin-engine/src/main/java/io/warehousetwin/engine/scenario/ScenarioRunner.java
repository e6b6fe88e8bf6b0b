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

import io.warehousetwin.api.config.ConfigException;
import io.warehousetwin.api.config.ConfigParameter;
import io.warehousetwin.api.config.SimulationConfig;
import io.warehousetwin.engine.run.SimulationException;
import io.warehousetwin.engine.run.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs what-if scenarios against a baseline configuration.
 *
 * <h2>Isolation</h2>
 *
 * <p>Every scenario runs on a working copy of the baseline with its overrides
 * applied. While it runs, that copy is the runner's active configuration;
 * afterwards, whether the run succeeded or failed, the active configuration is
 * set back to the baseline snapshot taken before the run and checked against
 * the runner's baseline field by field. A mismatch raises
 * {@link ScenarioRestorationException}, which is distinct from the
 * {@link SimulationException} a failed run raises.
 *
 * <pre>{@code
 *   baseline ──snapshot──▶ working = baseline + overrides ──run──▶ result
 *       ▲                                                    │
 *       └────────────── restore + verify (finally) ◀─────────┘
 * }</pre>
 *
 * <p>Overrides are applied through the closed parameter schema, so an unknown
 * name or a mistyped value fails with {@link ConfigException} before anything
 * runs. Sequential scenarios are serialized on the runner; parallel sweeps
 * never touch the active configuration.
 */
public final class ScenarioRunner {

    private static final Logger logger = LogManager.getLogger(ScenarioRunner.class);

    private final ScenarioExecutor executor;
    private SimulationConfig baseline;
    private SimulationConfig active;

    public ScenarioRunner(SimulationConfig baseline, ScenarioExecutor executor) {
        this.baseline = Objects.requireNonNull(baseline, "baseline cannot be null");
        this.active = baseline;
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    public synchronized SimulationConfig baseline() {
        return baseline;
    }

    /// @return the configuration of the scenario in progress, or the baseline between scenarios
    public synchronized SimulationConfig active() {
        return active;
    }

    /// Replaces the baseline, e.g. after applying calibrated parameters.
    public synchronized void rebase(SimulationConfig newBaseline) {
        this.baseline = Objects.requireNonNull(newBaseline, "newBaseline cannot be null");
        this.active = newBaseline;
        logger.info("scenario baseline replaced");
    }

    /**
     * Runs the baseline with the given overrides.
     *
     * @param overrides parameter name to value
     * @throws ConfigException              for invalid overrides, before the run
     * @throws SimulationException          if the run fails
     * @throws ScenarioRestorationException if the baseline could not be restored
     */
    public synchronized ScenarioResult runWhatIf(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides cannot be null");
        SimulationConfig snapshot = baseline;
        SimulationConfig working = snapshot.withOverrides(overrides);
        logger.info("running what-if scenario {}", overrides);

        active = working;
        SimulationResult result = null;
        SimulationException failure = null;
        try {
            result = executor.execute(working);
        } catch (SimulationException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new SimulationException("scenario " + overrides + " failed: " + e.getMessage(), e);
        } finally {
            restore(snapshot, failure);
        }
        if (failure != null) {
            throw failure;
        }
        return new ScenarioResult(new LinkedHashMap<>(overrides), result);
    }

    private void restore(SimulationConfig snapshot, SimulationException failure) {
        active = snapshot;
        if (!active.equals(baseline)) {
            ScenarioRestorationException restoration = new ScenarioRestorationException(
                "baseline configuration changed during a scenario run; expected " + snapshot + " but found " + baseline);
            if (failure != null) {
                restoration.addSuppressed(failure);
            }
            throw restoration;
        }
    }

    /**
     * Runs one scenario per value of a parameter, each from fresh state.
     *
     * @return one point per value, in input order
     * @throws ConfigException if the parameter is unknown
     */
    public List<SensitivityPoint> sweep(String parameter, List<?> values) {
        ConfigParameter.forName(parameter);
        Objects.requireNonNull(values, "values cannot be null");
        List<SensitivityPoint> points = new ArrayList<>(values.size());
        for (Object value : values) {
            ScenarioResult scenario = runWhatIf(Map.of(parameter, value));
            points.add(new SensitivityPoint(parameter, value, scenario.result()));
        }
        logger.info("sensitivity sweep of {} finished: {} points", parameter, points.size());
        return points;
    }

    /**
     * Like {@link #sweep(String, List)} with the points run on an executor
     * service. Every working configuration is built before the first run, so
     * invalid values fail without running anything.
     *
     * @return one point per value, in input order
     * @throws SimulationException          if any point fails
     * @throws ScenarioRestorationException if the baseline changed while the sweep ran
     */
    public List<SensitivityPoint> sweepParallel(String parameter, List<?> values, ExecutorService pool) {
        ConfigParameter.forName(parameter);
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        SimulationConfig snapshot = baseline();
        List<SimulationConfig> configs = new ArrayList<>(values.size());
        for (Object value : values) {
            configs.add(snapshot.with(parameter, value));
        }

        List<Future<SimulationResult>> futures = new ArrayList<>(configs.size());
        for (SimulationConfig config : configs) {
            futures.add(pool.submit(() -> executor.execute(config)));
        }
        List<SensitivityPoint> points = new ArrayList<>(values.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                points.add(new SensitivityPoint(parameter, values.get(i), await(futures.get(i), parameter, values.get(i))));
            }
        } finally {
            for (Future<SimulationResult> future : futures) {
                future.cancel(true);
            }
        }
        synchronized (this) {
            if (!snapshot.equals(baseline)) {
                throw new ScenarioRestorationException("baseline configuration changed during a parallel sweep of "
                    + parameter);
            }
        }
        logger.info("parallel sensitivity sweep of {} finished: {} points", parameter, points.size());
        return points;
    }

    private static SimulationResult await(Future<SimulationResult> future, String parameter, Object value) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("interrupted while sweeping " + parameter + "=" + value, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SimulationException) {
                throw (SimulationException) cause;
            }
            throw new SimulationException("sweep of " + parameter + "=" + value + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Runs the baseline and each named scenario. A scenario with invalid
     * overrides or a failed run is reported as an error; the others still run.
     *
     * @param scenarios scenario name to its overrides
     * @throws SimulationException          if the baseline run itself fails
     * @throws ScenarioRestorationException if the baseline could not be restored
     */
    public ScenarioComparison compare(Map<String, ? extends Map<String, ?>> scenarios) {
        Objects.requireNonNull(scenarios, "scenarios cannot be null");
        ScenarioResult baselineRun = runWhatIf(Map.of());
        Map<String, ScenarioResult> results = new LinkedHashMap<>();
        Map<String, Throwable> errors = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, ?>> scenario : scenarios.entrySet()) {
            try {
                results.put(scenario.getKey(), runWhatIf(scenario.getValue()));
            } catch (ConfigException | SimulationException e) {
                logger.warn("scenario {} failed: {}", scenario.getKey(), e.getMessage());
                errors.put(scenario.getKey(), e);
            }
        }
        return new ScenarioComparison(baselineRun.result(), results, errors);
    }
}
