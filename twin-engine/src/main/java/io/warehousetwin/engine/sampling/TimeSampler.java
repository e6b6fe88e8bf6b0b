package io.warehousetwin.engine.sampling;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

import java.util.Objects;

/// Draws activity durations from a truncated normal model.
///
/// ## Model
///
/// For a batch of `q` units the draw is normal with mean `mean * q` and spread
/// `std * sqrt(q)`: variance grows linearly with the batch, so the spread grows
/// sub-linearly. The draw is then raised to [#MIN_DURATION], so the event clock
/// always advances.
///
/// ```text
///   duration = max(0.1, mean*q + std*sqrt(q) * Z),  Z ~ N(0, 1)
/// ```
///
/// A sampler wraps one random stream and is not thread-safe.
public final class TimeSampler {

    /// Floor applied to every draw, in simulation time units.
    public static final double MIN_DURATION = 0.1;

    private final NormalizedGaussianSampler gaussian;

    public TimeSampler(UniformRandomProvider rng) {
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(Objects.requireNonNull(rng, "rng cannot be null"));
    }

    public double sample(double mean, double std) {
        return sample(mean, std, 1);
    }

    /**
     * @param mean     per-unit mean, finite and > 0
     * @param std      per-unit standard deviation, finite and >= 0
     * @param quantity batch size, >= 1
     * @return a duration >= {@link #MIN_DURATION}
     * @throws IllegalArgumentException for a malformed distribution
     */
    public double sample(double mean, double std, int quantity) {
        if (!(mean > 0.0) || Double.isInfinite(mean)) {
            throw new IllegalArgumentException("mean must be a finite value > 0, was " + mean);
        }
        if (!(std >= 0.0) || Double.isInfinite(std)) {
            throw new IllegalArgumentException("std must be a finite value >= 0, was " + std);
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1, was " + quantity);
        }
        double center = mean * quantity;
        double spread = std * Math.sqrt(quantity);
        return Math.max(MIN_DURATION, center + spread * gaussian.sample());
    }
}
