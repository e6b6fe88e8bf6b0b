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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class ResourcePoolTest {

    private final SimulationKernel kernel = new SimulationKernel();

    /// Requests one unit per holder at time 0; each holder keeps it for one time unit.
    private List<String> grantOrder(ResourcePool pool, String[] holders, int[] priorities) {
        List<String> granted = new ArrayList<>();
        for (int i = 0; i < holders.length; i++) {
            pool.acquire(holders[i], priorities[i], lease -> {
                granted.add(lease.holder() + "@" + kernel.now());
                kernel.schedule(1.0, lease::release);
            });
        }
        kernel.run(100.0);
        return granted;
    }

    @Test
    void fifoServesWaitersInRequestOrder() {
        ResourcePool pool = new ResourcePool("workers", 1, ResourcePool.Discipline.FIFO, kernel);

        List<String> order = grantOrder(pool, new String[]{"a", "b", "c"}, new int[]{1, 1, 5});

        assertThat(order).containsExactly("a@0.0", "b@1.0", "c@2.0");
        assertEquals(0, pool.inUse());
        assertEquals(3, pool.grants());
        assertThat(pool.meanWait()).isCloseTo(1.0, offset(1e-9));
    }

    @Test
    void priorityServesHigherPriorityFirstAndFifoAmongEquals() {
        ResourcePool pool = new ResourcePool("workers", 1, ResourcePool.Discipline.PRIORITY, kernel);

        List<String> order = grantOrder(pool, new String[]{"a", "b", "c", "d"}, new int[]{1, 2, 5, 2});

        assertThat(order).containsExactly("a@0.0", "c@1.0", "b@2.0", "d@3.0");
    }

    @Test
    void grantsUpToCapacityAtOnce() {
        ResourcePool pool = new ResourcePool("forklifts", 2, ResourcePool.Discipline.FIFO, kernel);

        List<String> order = grantOrder(pool, new String[]{"a", "b", "c"}, new int[]{1, 1, 1});

        assertThat(order).containsExactly("a@0.0", "b@0.0", "c@1.0");
    }

    @Test
    void unitHandedToWaiterIsNeverFreeInBetween() {
        ResourcePool pool = new ResourcePool("workers", 1, ResourcePool.Discipline.FIFO, kernel);
        List<Lease> held = new ArrayList<>();
        pool.acquire("a", 1, held::add);
        pool.acquire("b", 1, held::add);
        kernel.run(1.0);
        assertEquals(1, held.size());
        assertEquals(1, pool.queueLength());

        held.get(0).release();

        assertEquals(1, pool.inUse());
        assertEquals(0, pool.queueLength());
        assertEquals(0, pool.available());
    }

    @Test
    void releaseIsIdempotent() {
        ResourcePool pool = new ResourcePool("workers", 2, ResourcePool.Discipline.FIFO, kernel);
        List<Lease> held = new ArrayList<>();
        pool.acquire("a", 1, held::add);
        kernel.run(1.0);

        Lease lease = held.get(0);
        lease.close();
        lease.release();

        assertTrue(lease.isReleased());
        assertEquals(0, pool.inUse());
        assertEquals(2, pool.available());
    }

    @Test
    void utilizationIntegratesBusyUnitsOverTime() {
        ResourcePool pool = new ResourcePool("workers", 2, ResourcePool.Discipline.FIFO, kernel);
        pool.acquire("a", 1, lease -> kernel.schedule(5.0, lease::release));

        kernel.run(10.0);

        assertThat(pool.utilization()).isCloseTo(0.25, offset(1e-9));
    }

    @Test
    void notifiesListenerOfGrantsAndReleases() {
        List<String> trace = new ArrayList<>();
        ResourcePool pool = new ResourcePool("workers", 1, ResourcePool.Discipline.FIFO, kernel,
            new ResourcePool.Listener() {
                @Override
                public void granted(Lease lease) {
                    trace.add("+" + lease.holder());
                }

                @Override
                public void released(Lease lease) {
                    trace.add("-" + lease.holder());
                }
            });

        grantOrder(pool, new String[]{"a", "b"}, new int[]{1, 1});

        assertThat(trace).containsExactly("+a", "-a", "+b", "-b");
    }

    @Test
    void rejectsEmptyPools() {
        assertThatThrownBy(() -> new ResourcePool("workers", 0, ResourcePool.Discipline.FIFO, kernel))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void utilizationCountsFromThePoolsCreation() {
        SimulationKernel late = new SimulationKernel(100.0);
        ResourcePool pool = new ResourcePool("forklifts", 1, ResourcePool.Discipline.FIFO, late);
        pool.acquire("a", 1, lease -> late.schedule(5.0, lease::release));

        late.run(110.0);

        assertThat(pool.utilization()).isCloseTo(0.5, offset(1e-9));
    }
}
