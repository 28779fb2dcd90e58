/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OffsetPoolTest {

    @Test
    void acquiresSmallestFreeOffsetFromBase() {
        OffsetPool pool = new OffsetPool(1);
        assertEquals(1, pool.acquire());
        assertEquals(2, pool.acquire());
        assertEquals(3, pool.acquire());
        assertEquals(Set.of(1, 2, 3), pool.snapshot());
    }

    @Test
    void releasedOffsetIsReusedFirst() {
        OffsetPool pool = new OffsetPool(1);
        pool.acquire();
        pool.acquire();
        pool.acquire();

        pool.release(2);
        assertFalse(pool.isInUse(2));
        assertEquals(2, pool.acquire());

        pool.release(1);
        pool.release(3);
        assertEquals(1, pool.acquire());
        assertEquals(3, pool.acquire());
        assertEquals(4, pool.acquire());
    }

    @Test
    void highWaterTracksLargestOffsetEverAcquired() {
        OffsetPool pool = new OffsetPool(1);
        assertEquals(0, pool.getHighWater());
        pool.acquire();
        pool.acquire();
        pool.release(1);
        pool.release(2);
        assertEquals(0, pool.size());
        assertEquals(2, pool.getHighWater());
        pool.acquire();
        assertEquals(2, pool.getHighWater());
    }

    @Test
    void releasingUnusedOffsetFails() {
        OffsetPool pool = new OffsetPool(1);
        assertThrows(IllegalStateException.class, () -> pool.release(1));
        assertThrows(IllegalStateException.class, () -> pool.release(0));
        assertThrows(IllegalArgumentException.class, () -> new OffsetPool(-1));
    }
}
