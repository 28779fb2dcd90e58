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

import java.util.BitSet;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Allocates terminal line offsets to bars, always handing out the smallest free offset at or
 * above a base. A released offset is the next one handed out, so the number of lines in use is
 * bounded by the number of bars active at the same time.
 *
 * <p>Not thread-safe. Owned by a coordinator's consumer loop.
 */
final class OffsetPool {

    private final int base;
    private final BitSet inUse = new BitSet();
    private int highWater;

    /**
     * @param base the smallest offset this pool hands out
     */
    OffsetPool(int base) {
        if (base < 0) {
            throw new IllegalArgumentException("Offset base must be non-negative, got " + base);
        }
        this.base = base;
    }

    /**
     * @return the smallest offset not currently in use, now marked in use
     */
    int acquire() {
        int offset = inUse.nextClearBit(base);
        inUse.set(offset);
        highWater = Math.max(highWater, offset);
        return offset;
    }

    /**
     * @param offset an offset previously returned by {@link #acquire()}
     * @throws IllegalStateException if the offset is not in use
     */
    void release(int offset) {
        if (offset < base || !inUse.get(offset)) {
            throw new IllegalStateException("Offset " + offset + " is not in use");
        }
        inUse.clear(offset);
    }

    boolean isInUse(int offset) {
        return offset >= 0 && inUse.get(offset);
    }

    int size() {
        return inUse.cardinality();
    }

    /**
     * @return the largest offset ever acquired, or 0 if none was
     */
    int getHighWater() {
        return highWater;
    }

    SortedSet<Integer> snapshot() {
        SortedSet<Integer> offsets = new TreeSet<>();
        inUse.stream().forEach(offsets::add);
        return offsets;
    }

    @Override
    public String toString() {
        return "OffsetPool{inUse=" + inUse + ", highWater=" + highWater + "}";
    }
}
