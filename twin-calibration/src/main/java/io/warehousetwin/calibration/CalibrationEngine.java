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

import io.warehousetwin.api.config.SimTimeUnit;
import io.warehousetwin.api.events.EventType;
import io.warehousetwin.api.events.WarehouseEvent;
import io.warehousetwin.api.model.OrderStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Estimates stage timing parameters from a recorded event history.
 *
 * <h2>Algorithm</h2>
 *
 * <ol>
 *   <li>Group events by source and {@code order_id}. Simulation and ERP events
 *       are kept apart since the same order may appear in both.</li>
 *   <li>Per order, take the timestamp of the first {@code ORDER_CREATED} event
 *       and of the first {@code ORDER_STATUS_CHANGED} event reaching each of
 *       PICKED, PACKED and COMPLETED. The status is read from {@code status},
 *       or {@code new_status} for ERP events.</li>
 *   <li>For each {@link CalibrationStage}, the duration between its two
 *       boundaries becomes one sample per order, in the configured time unit.
 *       Negative durations (clock skew in external logs) are skipped.</li>
 *   <li>Each stage with samples is fitted by {@link StageTimingFitter}.</li>
 * </ol>
 *
 * <h2>Eviction Gaps</h2>
 *
 * <p>The event recorder evicts its oldest events when full, so a history may
 * start in the middle of some orders. Calibration still proceeds, but it warns
 * and flags the result when it sees orders without a creation event or gaps in
 * the simulation event ids. Gap detection assumes an unfiltered window of the
 * recorder.
 *
 * <p>Small histories are not refused; fewer than {@link #MIN_RECOMMENDED_ORDERS}
 * orders only produce a warning.
 */
public final class CalibrationEngine {

    private static final Logger logger = LogManager.getLogger(CalibrationEngine.class);

    /// Orders below which estimates are considered statistically weak.
    public static final int MIN_RECOMMENDED_ORDERS = 30;

    private final SimTimeUnit timeUnit;
    private final StageTimingFitter fitter;

    public CalibrationEngine(SimTimeUnit timeUnit) {
        this(timeUnit, new StageTimingFitter());
    }

    public CalibrationEngine(SimTimeUnit timeUnit, StageTimingFitter fitter) {
        this.timeUnit = Objects.requireNonNull(timeUnit, "timeUnit cannot be null");
        this.fitter = Objects.requireNonNull(fitter, "fitter cannot be null");
    }

    /**
     * @param events history, in any order
     * @return estimates for every stage with at least one sample
     */
    public CalibratedParameters calibrate(List<WarehouseEvent> events) {
        Objects.requireNonNull(events, "events cannot be null");

        Map<String, OrderTimeline> timelines = new LinkedHashMap<>();
        TreeSet<Long> simulationIds = new TreeSet<>();
        for (WarehouseEvent event : events) {
            if (event.source() == WarehouseEvent.Source.SIMULATION) {
                simulationIds.add(event.eventId());
            }
            Optional<String> orderId = event.orderId();
            if (orderId.isEmpty()) {
                continue;
            }
            String key = event.source().label() + ':' + orderId.get();
            if (event.type() == EventType.ORDER_CREATED) {
                timelines.computeIfAbsent(key, k -> new OrderTimeline()).created(event.timestamp());
            } else if (event.type() == EventType.ORDER_STATUS_CHANGED) {
                Optional<OrderStatus> status = event.statusValue().flatMap(OrderStatus::fromValue);
                if (status.isPresent() && isBoundary(status.get())) {
                    timelines.computeIfAbsent(key, k -> new OrderTimeline()).reached(status.get(), event.timestamp());
                }
            }
        }

        int ordersObserved = 0;
        int truncated = 0;
        for (OrderTimeline timeline : timelines.values()) {
            if (timeline.created != null) {
                ordersObserved++;
            } else {
                truncated++;
            }
        }
        long missingIds = missingIds(simulationIds);

        Map<CalibrationStage, StageFit> fits = new EnumMap<>(CalibrationStage.class);
        Map<String, Double> parameters = new LinkedHashMap<>();
        for (CalibrationStage stage : CalibrationStage.values()) {
            double[] durations = durations(stage, timelines.values());
            if (durations.length == 0) {
                continue;
            }
            StageFit fit = fitter.fit(stage, durations);
            fits.put(stage, fit);
            stage.meanParameter().ifPresent(p -> parameters.put(p.parameterName(), fit.mean()));
            stage.stdParameter().ifPresent(p -> parameters.put(p.parameterName(), fit.stdDev()));
            if (fit.stdDefaulted()) {
                logger.warn("{} stage has {} sample(s), using default std {}", stage, fit.sampleCount(), fit.stdDev());
            }
        }

        if (ordersObserved < MIN_RECOMMENDED_ORDERS) {
            logger.warn("calibrating from {} orders, fewer than the recommended {}", ordersObserved,
                MIN_RECOMMENDED_ORDERS);
        }
        if (truncated > 0 || missingIds > 0) {
            logger.warn("event history has eviction gaps: {} order(s) without creation event, {} missing event id(s)",
                truncated, missingIds);
        }

        CalibratedParameters result = new CalibratedParameters(parameters, fits, ordersObserved, truncated, missingIds);
        logger.info("calibrated {} parameter(s) from {} events", parameters.size(), events.size());
        logger.debug("calibration result: {}", result);
        return result;
    }

    private double[] durations(CalibrationStage stage, Iterable<OrderTimeline> timelines) {
        List<Double> values = new ArrayList<>();
        int skipped = 0;
        for (OrderTimeline timeline : timelines) {
            Instant start = stage.from().isPresent() ? timeline.reached.get(stage.from().get()) : timeline.created;
            Instant end = timeline.reached.get(stage.to());
            if (start == null || end == null) {
                continue;
            }
            Duration elapsed = Duration.between(start, end);
            if (elapsed.isNegative()) {
                skipped++;
                continue;
            }
            values.add(timeUnit.fromDuration(elapsed));
        }
        if (skipped > 0) {
            logger.debug("skipped {} negative {} duration(s)", skipped, stage);
        }
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    private static boolean isBoundary(OrderStatus status) {
        return status == OrderStatus.PICKED || status == OrderStatus.PACKED || status == OrderStatus.COMPLETED;
    }

    private static long missingIds(TreeSet<Long> ids) {
        if (ids.size() < 2) {
            return 0;
        }
        return ids.last() - ids.first() + 1 - ids.size();
    }

    private static final class OrderTimeline {
        private Instant created;
        private final Map<OrderStatus, Instant> reached = new EnumMap<>(OrderStatus.class);

        void created(Instant when) {
            if (created == null) {
                created = when;
            }
        }

        void reached(OrderStatus status, Instant when) {
            reached.putIfAbsent(status, when);
        }
    }
}
