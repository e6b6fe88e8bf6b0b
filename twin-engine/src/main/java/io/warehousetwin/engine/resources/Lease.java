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

/// One granted unit of a [ResourcePool].
///
/// Releasing is idempotent: the first call returns the unit, later calls do
/// nothing. [#close()] releases, so a lease can be scoped with
/// try-with-resources inside a single callback.
public final class Lease implements AutoCloseable {

    private final ResourcePool pool;
    private final String holder;
    private final double grantedAt;
    private boolean released;

    Lease(ResourcePool pool, String holder, double grantedAt) {
        this.pool = pool;
        this.holder = holder;
        this.grantedAt = grantedAt;
    }

    public ResourcePool pool() {
        return pool;
    }

    public String holder() {
        return holder;
    }

    /// @return simulated time of the grant
    public double grantedAt() {
        return grantedAt;
    }

    public boolean isReleased() {
        return released;
    }

    public void release() {
        if (released) {
            return;
        }
        released = true;
        pool.giveBack(this);
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "Lease{" + pool.name() + " -> " + holder + (released ? ", released" : "") + '}';
    }
}
