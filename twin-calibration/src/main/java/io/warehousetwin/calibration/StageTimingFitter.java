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

import org.apache.commons.math3.distribution.TDistribution;

import java.util.Locale;
import java.util.Objects;

/**
 * Fits a normal timing model to observed stage durations.
 *
 * <h2>Algorithm</h2>
 *
 * <ul>
 *   <li>mean = sample mean</li>
 *   <li>std = bias-corrected sample standard deviation</li>
 * </ul>
 *
 * <h2>Small Samples</h2>
 *
 * <p>With fewer than two durations the standard deviation is undefined, so the
 * fit falls back to {@link #DEFAULT_STD} and flags it. Nothing is refused: a
 * single observation still yields a mean. Whether an estimate from few orders
 * is trustworthy is the caller's decision; the 95% confidence half width of
 * the mean (Student's t) is reported to help with that.
 */
public final class StageTimingFitter {

    /// Standard deviation assumed when fewer than two durations were observed.
    public static final double DEFAULT_STD = 0.5;

    private static final double CONFIDENCE = 0.95;

    private final double defaultStd;

    public StageTimingFitter() {
        this(DEFAULT_STD);
    }

    /**
     * @param defaultStd standard deviation used below two samples, >= 0
     */
    public StageTimingFitter(double defaultStd) {
        if (!(defaultStd >= 0.0) || Double.isInfinite(defaultStd)) {
            throw new IllegalArgumentException("defaultStd must be a finite value >= 0, was " + defaultStd);
        }
        this.defaultStd = defaultStd;
    }

    /**
     * @param stage     the stage the durations belong to
     * @param durations observed durations, at least one
     * @throws IllegalArgumentException if durations is empty
     */
    public StageFit fit(CalibrationStage stage, double[] durations) {
        Objects.requireNonNull(stage, "stage cannot be null");
        SampleStatistics stats = SampleStatistics.compute(stage.name().toLowerCase(Locale.ROOT), durations);
        return fit(stage, stats);
    }

    public StageFit fit(CalibrationStage stage, SampleStatistics stats) {
        Objects.requireNonNull(stats, "stats cannot be null");
        if (!stats.hasSpread()) {
            return new StageFit(stage, stats.count(), stats.mean(), defaultStd, true,
                stats.min(), stats.max(), Double.NaN);
        }
        double std = stats.sampleStdDev();
        return new StageFit(stage, stats.count(), stats.mean(), std, false,
            stats.min(), stats.max(), halfWidth(stats.count(), std));
    }

    private static double halfWidth(long n, double std) {
        TDistribution t = new TDistribution(n - 1);
        double critical = t.inverseCumulativeProbability(1.0 - (1.0 - CONFIDENCE) / 2.0);
        return critical * std / Math.sqrt(n);
    }
}
