package io.warehousetwin.engine.run;

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

/// Where a run starts on a timeline shared with the runs before it.
///
/// Successive baseline runs of one warehouse continue the same clock, order
/// numbering and random streams, so their events never collide in a shared
/// recorder.
///
/// @param index           0 for the first run, one more for each run after it
/// @param startTime       simulated time the run starts at
/// @param ordersStarted   orders started by earlier runs, backlog included
/// @param ordersGenerated orders generated by earlier runs
public record RunOrigin(long index, double startTime, long ordersStarted, long ordersGenerated) {

    public static final RunOrigin FIRST = new RunOrigin(0, 0.0, 0, 0);

    public RunOrigin {
        if (index < 0 || ordersStarted < 0 || ordersGenerated < 0) {
            throw new IllegalArgumentException("run origin counters cannot be negative: index=" + index
                + ", ordersStarted=" + ordersStarted + ", ordersGenerated=" + ordersGenerated);
        }
        if (!(startTime >= 0.0) || Double.isInfinite(startTime)) {
            throw new IllegalArgumentException("startTime must be a finite value >= 0, was " + startTime);
        }
    }

    /// @return the origin of the run that follows one starting here
    public RunOrigin next(double duration, long started, long generated) {
        return new RunOrigin(index + 1, startTime + duration, ordersStarted + started, ordersGenerated + generated);
    }
}
