package io.warehousetwin.api.events;

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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleFunction;

/**
 * Bounded, append-only log of warehouse events.
 *
 * <h2>Eviction</h2>
 *
 * <p>The recorder holds at most {@code capacity} events. Appending to a full
 * recorder drops the oldest event first (ring buffer). Evictions are counted so
 * consumers can tell a complete history from a sampled one:
 *
 * <pre>{@code
 * capacity = 3
 *
 *   record e1 e2 e3     [e1 e2 e3]       evicted = 0
 *   record e4           [e2 e3 e4]       evicted = 1
 * }</pre>
 *
 * <h2>Identifiers</h2>
 *
 * <p>{@link #record(EventType, double, Map)} assigns ids 1, 2, 3, ... and stamps
 * the event with the timestamp the clock function maps its simulated time to.
 * Events produced elsewhere (an ERP feed) enter through {@link #append(WarehouseEvent)}
 * and keep their own ids.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods lock a single {@link ReentrantLock}. A simulation run appends
 * from one thread, but ERP subscriptions may deliver from another.
 */
public final class EventRecorder {

    private static final Logger logger = LogManager.getLogger(EventRecorder.class);

    private final int capacity;
    private final DoubleFunction<Instant> clock;
    private final ArrayDeque<WarehouseEvent> buffer;
    private final ReentrantLock lock = new ReentrantLock();

    private long nextId = 1;
    private long totalRecorded;
    private long evicted;

    /**
     * @param capacity maximum retained events, at least 1
     * @param clock    maps simulated time to a timestamp
     */
    public EventRecorder(int capacity, DoubleFunction<Instant> clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.buffer = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    /**
     * Records a simulation event at the given simulated time.
     *
     * @return the stored event
     */
    public WarehouseEvent record(EventType type, double simTime, Map<String, Object> payload) {
        lock.lock();
        try {
            WarehouseEvent event = new WarehouseEvent(nextId++, type, simTime, clock.apply(simTime),
                WarehouseEvent.Source.SIMULATION, payload);
            store(event);
            return event;
        } finally {
            lock.unlock();
        }
    }

    /// Appends an externally produced event as is.
    public void append(WarehouseEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        lock.lock();
        try {
            store(event);
        } finally {
            lock.unlock();
        }
    }

    private void store(WarehouseEvent event) {
        if (buffer.size() == capacity) {
            buffer.removeFirst();
            evicted++;
            if (evicted == 1) {
                logger.debug("event buffer reached capacity {}, evicting oldest events", capacity);
            }
        }
        buffer.addLast(event);
        totalRecorded++;
    }

    /// @return a copy of the retained events, oldest first
    public List<WarehouseEvent> snapshot() {
        lock.lock();
        try {
            return List.copyOf(buffer);
        } finally {
            lock.unlock();
        }
    }

    /// @return up to `count` of the most recent events, oldest first
    public List<WarehouseEvent> latest(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        lock.lock();
        try {
            int skip = Math.max(0, buffer.size() - count);
            List<WarehouseEvent> result = new ArrayList<>(buffer.size() - skip);
            Iterator<WarehouseEvent> it = buffer.iterator();
            for (int i = 0; it.hasNext(); i++) {
                WarehouseEvent event = it.next();
                if (i >= skip) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<WarehouseEvent> ofType(EventType type) {
        Objects.requireNonNull(type, "type cannot be null");
        lock.lock();
        try {
            List<WarehouseEvent> result = new ArrayList<>();
            for (WarehouseEvent event : buffer) {
                if (event.type() == type) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /// @return events ever stored, including evicted ones
    public long totalRecorded() {
        lock.lock();
        try {
            return totalRecorded;
        } finally {
            lock.unlock();
        }
    }

    public long evictedCount() {
        lock.lock();
        try {
            return evicted;
        } finally {
            lock.unlock();
        }
    }
}
