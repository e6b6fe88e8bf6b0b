package io.warehousetwin.engine.kernel;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Single-threaded discrete-event scheduler.
 *
 * <h2>Model</h2>
 *
 * <p>Activities are chains of callbacks. A callback runs at one instant of
 * simulated time and suspends its activity by scheduling the continuation,
 * either after a delay (a timeout) or from a resource grant. The clock jumps
 * from one scheduled instant to the next:
 *
 * <pre>{@code
 *   queue: (t=0.0 #1) (t=0.0 #2) (t=2.7 #3) (t=4.1 #4)
 *          ──run #1──▶ schedules (t=1.3 #5)
 *          ──run #2──▶ ...
 *          clock 0.0 → 1.3 → 2.7 → 4.1
 * }</pre>
 *
 * <h2>Ordering</h2>
 *
 * <p>Callbacks run in order of time, then of scheduling sequence, so callbacks
 * due at the same instant run in the order they were scheduled. With the same
 * inputs a run replays exactly.
 *
 * <h2>Failures</h2>
 *
 * <p>A callback that throws aborts {@link #run(double)}; the exception
 * propagates unchanged and the remaining queue is left as it was.
 */
public final class SimulationKernel {

    private static final Logger logger = LogManager.getLogger(SimulationKernel.class);

    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>(
        Comparator.comparingDouble(Scheduled::time).thenComparingLong(Scheduled::sequence));

    private double now;
    private long nextSequence;
    private long processed;
    private boolean running;

    public SimulationKernel() {
        this(0.0);
    }

    /// @param start simulated time the clock starts at, for a run that continues an earlier one
    public SimulationKernel(double start) {
        if (!(start >= 0.0) || Double.isInfinite(start)) {
            throw new IllegalArgumentException("start must be a finite value >= 0, was " + start);
        }
        this.now = start;
    }

    /// @return the current simulated time
    public double now() {
        return now;
    }

    /**
     * Schedules an action after a delay.
     *
     * @param delay non-negative delay in simulation time units
     * @throws IllegalArgumentException if the delay is negative or not finite
     */
    public void schedule(double delay, Runnable action) {
        if (!(delay >= 0.0) || Double.isInfinite(delay)) {
            throw new IllegalArgumentException("delay must be a finite value >= 0, was " + delay);
        }
        Objects.requireNonNull(action, "action cannot be null");
        queue.add(new Scheduled(now + delay, nextSequence++, action));
    }

    /// Schedules an action at the current instant, after everything already due now.
    public void scheduleNow(Runnable action) {
        schedule(0.0, action);
    }

    /**
     * Runs callbacks due strictly before {@code until}, then sets the clock to
     * {@code until}. Callbacks due at or after it stay queued.
     *
     * @throws IllegalStateException when called re-entrantly or with a time in the past
     */
    public void run(double until) {
        if (running) {
            throw new IllegalStateException("kernel is already running");
        }
        if (until < now) {
            throw new IllegalStateException("cannot run backwards from " + now + " to " + until);
        }
        running = true;
        try {
            while (!queue.isEmpty() && queue.peek().time() < until) {
                Scheduled next = queue.poll();
                now = next.time();
                processed++;
                next.action().run();
            }
            now = until;
        } finally {
            running = false;
        }
        logger.debug("kernel reached t={} after {} callbacks, {} pending", now, processed, queue.size());
    }

    /// @return callbacks still queued
    public int pending() {
        return queue.size();
    }

    /// @return callbacks run so far
    public long processed() {
        return processed;
    }

    private record Scheduled(double time, long sequence, Runnable action) {
    }
}
