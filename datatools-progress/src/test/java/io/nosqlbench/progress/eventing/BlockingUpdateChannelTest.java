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

package io.nosqlbench.progress.eventing;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BlockingUpdateChannelTest {

    @Test
    void preservesOrderPerProducer() throws Exception {
        int producers = 4;
        int perProducer = 2000;
        BlockingUpdateChannel<WorkerMessage> channel = new BlockingUpdateChannel<>(32);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        try {
            List<CompletableFuture<Void>> sends = new ArrayList<>();
            for (int p = 1; p <= producers; p++) {
                int producer = p;
                sends.add(CompletableFuture.runAsync(() -> {
                    try {
                        for (int i = 0; i < perProducer; i++) {
                            assertTrue(channel.send(new WorkerMessage(producer, UpdateMessage.setValue(i))));
                        }
                    } catch (InterruptedException e) {
                        throw new RuntimeException(e);
                    }
                }, pool));
            }

            Map<Integer, Long> lastSeen = new HashMap<>();
            for (int received = 0; received < producers * perProducer; received++) {
                WorkerMessage message = channel.receive();
                long value = message.getUpdate().getValue();
                Long previous = lastSeen.put(message.getWorkerId(), value);
                assertEquals(previous == null ? 0L : previous + 1, value,
                    "out of order for producer " + message.getWorkerId());
            }
            CompletableFuture.allOf(sends.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
            assertEquals(0, channel.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fullChannelBlocksTheSender() throws Exception {
        BlockingUpdateChannel<UpdateMessage> channel = new BlockingUpdateChannel<>(1);
        assertTrue(channel.send(UpdateMessage.next()));

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.send(UpdateMessage.finish());
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });
        Thread.sleep(200);
        assertFalse(blocked.isDone(), "second send should wait for room");

        assertEquals(UpdateMessage.next(), channel.receive());
        assertTrue(blocked.get(10, TimeUnit.SECONDS));
        assertEquals(UpdateMessage.finish(), channel.receive());
    }

    @Test
    void closedChannelDrainsThenSignals() throws Exception {
        BlockingUpdateChannel<UpdateMessage> channel = new BlockingUpdateChannel<>(8);
        channel.send(UpdateMessage.setValue(1));
        channel.send(UpdateMessage.setValue(2));
        channel.close();

        assertTrue(channel.isClosed());
        assertFalse(channel.send(UpdateMessage.next()));
        assertEquals(2, channel.size());
        assertEquals(1, channel.receive().getValue());
        assertEquals(2, channel.receive().getValue());
        assertThrows(ChannelClosedException.class, channel::receive);
    }

    @Test
    void closeReleasesABlockedSender() throws Exception {
        BlockingUpdateChannel<UpdateMessage> channel = new BlockingUpdateChannel<>(1);
        channel.send(UpdateMessage.next());
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.send(UpdateMessage.next());
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });
        Thread.sleep(100);
        channel.close();
        assertFalse(blocked.get(10, TimeUnit.SECONDS));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BlockingUpdateChannel<UpdateMessage>(0));
        assertEquals(Integer.MAX_VALUE, new BlockingUpdateChannel<UpdateMessage>().getCapacity());
        assertThrows(NullPointerException.class, () -> new BlockingUpdateChannel<UpdateMessage>(2).send(null));
    }
}
