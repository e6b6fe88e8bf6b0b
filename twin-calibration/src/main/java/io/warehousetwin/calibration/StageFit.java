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

/// Normal timing estimate for one stage.
///
/// @param stage            the measured stage
/// @param sampleCount      durations observed
/// @param mean             estimated mean duration
/// @param stdDev           estimated standard deviation, the default when fewer than two samples
/// @param stdDefaulted     true when `stdDev` is the fallback rather than an estimate
/// @param min              shortest observed duration
/// @param max              longest observed duration
/// @param meanHalfWidth95  half width of the 95% confidence interval of the mean, NaN when undefined
public record StageFit(
    CalibrationStage stage,
    long sampleCount,
    double mean,
    double stdDev,
    boolean stdDefaulted,
    double min,
    double max,
    double meanHalfWidth95
) {
}
