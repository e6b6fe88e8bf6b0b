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

import java.util.Objects;

/**
 * Descriptive statistics of one series of observed durations.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>count</b> - number of observations</li>
 *   <li><b>min/max</b> - observed range</li>
 *   <li><b>mean</b> - arithmetic mean</li>
 *   <li><b>sampleVariance/sampleStdDev</b> - bias-corrected spread (n - 1 denominator)</li>
 * </ul>
 *
 * <p>The sample variance is undefined for fewer than two observations and is
 * reported as {@code NaN}; {@link #hasSpread()} tells the two cases apart.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SampleStatistics pick = SampleStatistics.compute("pick", pickDurations);
 * if (pick.hasSpread()) {
 *     double sigma = pick.sampleStdDev();
 * }
 * }</pre>
 */
public final class SampleStatistics {

    private final String label;
    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    /// Sum of squared deviations from the mean.
    private final double m2;

    private SampleStatistics(String label, long count, double min, double max, double mean, double m2) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.m2 = m2;
    }

    /**
     * Computes statistics with two passes over the values.
     *
     * @param label  what the values measure
     * @param values the observations
     * @return computed statistics
     * @throws IllegalArgumentException if values is empty
     */
    public static SampleStatistics compute(String label, double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        double min = values[0];
        double max = values[0];
        double sum = 0;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double mean = sum / values.length;

        double m2 = 0;
        for (double v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }

        return new SampleStatistics(label, values.length, min, max, mean, m2);
    }

    public String label() {
        return label;
    }

    public long count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public double mean() {
        return mean;
    }

    /// @return true when at least two observations exist, so the sample variance is defined
    public boolean hasSpread() {
        return count >= 2;
    }

    /// @return sum of squared deviations divided by `count - 1`, or NaN below two observations
    public double sampleVariance() {
        return hasSpread() ? m2 / (count - 1) : Double.NaN;
    }

    public double sampleStdDev() {
        return Math.sqrt(sampleVariance());
    }

    public double populationVariance() {
        return m2 / count;
    }

    @Override
    public String toString() {
        return String.format("SampleStatistics[%s, n=%d, range=[%.4f, %.4f], mean=%.4f, sd=%.4f]",
            label, count, min, max, mean, sampleStdDev());
    }
}
