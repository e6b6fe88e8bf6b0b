package io.warehousetwin.engine.resources;

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

import io.warehousetwin.engine.kernel.SimulationKernel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * A fixed number of interchangeable units (workers, forklifts) shared by
 * concurrent activities of one simulation run.
 *
 * <h2>Acquisition</h2>
 *
 * <p>{@link #acquire(String, int, Consumer)} either takes a free unit at once or
 * joins the wait queue. In both cases the grant callback is delivered through
 * the kernel, at the current instant for a free unit or at the instant a unit is
 * handed over. A unit handed to a waiter is never visible as free in between.
 *
 * <h2>Queue Discipline</h2>
 *
 * <ul>
 *   <li>{@link Discipline#FIFO}: waiters are served in request order. Order
 *       priority is ignored.</li>
 *   <li>{@link Discipline#PRIORITY}: higher priority first, request order among
 *       equal priorities.</li>
 * </ul>
 *
 * <p>Waiting is not an error: requests still queued when a run ends are
 * reported as pending.
 *
 * <h2>Utilization</h2>
 *
 * <p>The pool integrates units-in-use over simulated time, so
 * {@link #utilization()} is the average fraction of capacity busy since the
 * pool was created.
 */
public final class ResourcePool {

    private static final Logger logger = LogManager.getLogger(ResourcePool.class);

    /// Order in which waiting requests are served.
    public enum Discipline {
        FIFO,
        PRIORITY
    }

    /// Observes grants and releases, e.g. for tracing. Both callbacks default to no-ops.
    public interface Listener {
        default void granted(Lease lease) {
        }

        default void released(Lease lease) {
        }
    }

    private static final Listener SILENT = new Listener() {
    };

    private final String name;
    private final int capacity;
    private final Discipline discipline;
    private final SimulationKernel kernel;
    private final Listener listener;
    private final PriorityQueue<Waiter> waiters;
    private final double openedAt;

    private int inUse;
    private long requestSequence;
    private long grants;
    private double busyIntegral;
    private double lastChange;
    private double totalWait;

    public ResourcePool(String name, int capacity, Discipline discipline, SimulationKernel kernel) {
        this(name, capacity, discipline, kernel, SILENT);
    }

    public ResourcePool(String name, int capacity, Discipline discipline, SimulationKernel kernel, Listener listener) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (capacity < 1) {
            throw new IllegalArgumentException(name + " capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
        this.discipline = Objects.requireNonNull(discipline, "discipline cannot be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        Comparator<Waiter> order = discipline == Discipline.PRIORITY
            ? Comparator.comparingInt((Waiter w) -> -w.priority).thenComparingLong(w -> w.sequence)
            : Comparator.comparingLong(w -> w.sequence);
        this.waiters = new PriorityQueue<>(order);
        this.openedAt = kernel.now();
        this.lastChange = openedAt;
    }

    /**
     * Requests one unit.
     *
     * @param holder   who is asking, used in traces
     * @param priority request priority, only consulted under {@link Discipline#PRIORITY}
     * @param onGrant  continuation that receives the lease
     */
    public void acquire(String holder, int priority, Consumer<Lease> onGrant) {
        Objects.requireNonNull(holder, "holder cannot be null");
        Objects.requireNonNull(onGrant, "onGrant cannot be null");
        Waiter waiter = new Waiter(holder, priority, requestSequence++, kernel.now(), onGrant);
        if (inUse < capacity && waiters.isEmpty()) {
            accrue();
            inUse++;
            deliver(waiter);
        } else {
            waiters.add(waiter);
            logger.trace("{} queued for {} ({} waiting)", holder, name, waiters.size());
        }
    }

    void giveBack(Lease lease) {
        listener.released(lease);
        Waiter next = waiters.poll();
        if (next != null) {
            deliver(next);
        } else {
            accrue();
            inUse--;
        }
    }

    private void deliver(Waiter waiter) {
        grants++;
        totalWait += kernel.now() - waiter.requestedAt;
        kernel.scheduleNow(() -> {
            Lease lease = new Lease(this, waiter.holder, kernel.now());
            listener.granted(lease);
            waiter.onGrant.accept(lease);
        });
    }

    private void accrue() {
        double now = kernel.now();
        busyIntegral += inUse * (now - lastChange);
        lastChange = now;
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public Discipline discipline() {
        return discipline;
    }

    public int inUse() {
        return inUse;
    }

    public int available() {
        return capacity - inUse;
    }

    /// @return requests waiting for a unit
    public int queueLength() {
        return waiters.size();
    }

    public long grants() {
        return grants;
    }

    /// @return mean time a granted request waited, 0 before the first grant
    public double meanWait() {
        return grants == 0 ? 0.0 : totalWait / grants;
    }

    /// @return average busy fraction of capacity from the pool's creation to now
    public double utilization() {
        double now = kernel.now();
        double elapsed = now - openedAt;
        if (elapsed <= 0.0) {
            return 0.0;
        }
        double busy = busyIntegral + inUse * (now - lastChange);
        return busy / (capacity * elapsed);
    }

    @Override
    public String toString() {
        return "ResourcePool{" + name + ", " + inUse + '/' + capacity + " in use, " + waiters.size() + " waiting}";
    }

    private static final class Waiter {
        private final String holder;
        private final int priority;
        private final long sequence;
        private final double requestedAt;
        private final Consumer<Lease> onGrant;

        private Waiter(String holder, int priority, long sequence, double requestedAt, Consumer<Lease> onGrant) {
            this.holder = holder;
            this.priority = priority;
            this.sequence = sequence;
            this.requestedAt = requestedAt;
            this.onGrant = onGrant;
        }
    }
}
