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
import org.apache.commons.rng.simple.RandomSource;

/**
 * Independent, reproducible random streams derived from one seed.
 *
 * <h2>Layout</h2>
 *
 * <pre>{@code
 * seed ──┬── stream -1  arrivals of the second run on a timeline
 *        ├── stream 0   arrivals (inter-arrival gaps, order contents)
 *        ├── stream 1   order #1 (travel, pick, pack, ship durations)
 *        ├── stream 2   order #2
 *        └── ...
 * }</pre>
 *
 * <p>Runs that continue one another number their orders along one sequence,
 * so each order keeps a stream of its own across runs.
 *
 * <p>Each stream is an {@link RandomSource#XO_SHI_RO_256_PP} generator whose
 * 256-bit state is expanded from {@code (seed, streamId)} with SplitMix64. An
 * order draws only from its own stream, so the n-th order sees the same
 * durations no matter how many workers or forklifts a scenario has (common
 * random numbers). Nothing here touches global random state, so concurrent
 * runs never share draws.
 */
public final class RandomStreams {

    /// Stream id reserved for the arrival process.
    public static final long ARRIVALS = 0L;

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;

    public RandomStreams(long seed) {
        this.seed = seed;
    }

    public long seed() {
        return seed;
    }

    public UniformRandomProvider arrivals() {
        return stream(ARRIVALS);
    }

    /// @param run 0-based index of a run on a shared timeline
    public UniformRandomProvider arrivals(long run) {
        if (run < 0) {
            throw new IllegalArgumentException("run index must be >= 0, was " + run);
        }
        return stream(ARRIVALS - run);
    }

    /// @param sequence 1-based order sequence number on the run's timeline
    public UniformRandomProvider forOrder(long sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("order sequence must be >= 1, was " + sequence);
        }
        return stream(sequence);
    }

    /**
     * Creates a fresh generator for a stream. Two calls with the same id return
     * generators that produce the same sequence.
     */
    public UniformRandomProvider stream(long streamId) {
        UniformRandomProvider mixer = RandomSource.SPLIT_MIX_64.create(seed + GOLDEN_GAMMA * (streamId + 1));
        long[] state = new long[4];
        for (int i = 0; i < state.length; i++) {
            state[i] = mixer.nextLong();
        }
        return RandomSource.XO_SHI_RO_256_PP.create(state);
    }
}
