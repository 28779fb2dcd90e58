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

import io.nosqlbench.progress.RecordingProgressRenderer.RecordingTracker;
import io.nosqlbench.progress.eventing.BlockingUpdateChannel;
import io.nosqlbench.progress.eventing.UpdateMessage;
import io.nosqlbench.progress.eventing.WorkerMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class MultiProgressCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final RecordingProgressRenderer renderer = new RecordingProgressRenderer();

    private static void awaitCondition(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(5);
        }
    }

    @Test
    void concurrentNextCallsAreAllCounted() throws Exception {
        int workers = 8;
        int steps = 500;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(uniform(workers, steps))
            .renderer(renderer)
            .build()) {

            List<Future<?>> futures = new ArrayList<>();
            for (int id = 1; id <= workers; id++) {
                WorkerHandle handle = progress.worker(id);
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < steps; i++) {
                        handle.next();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }

            assertTrue(progress.awaitCompletion(TIMEOUT));
            assertEquals((long) workers * steps, progress.getAggregate().getCount());
            assertEquals(progress.getTotal(), progress.getAggregate().getCount());
            assertEquals(workers, renderer.workerTrackers().size());
            for (RecordingTracker tracker : renderer.workerTrackers()) {
                assertEquals(steps, tracker.getCount());
                assertTrue(tracker.getLineOffset() >= 1 && tracker.getLineOffset() <= workers);
            }
            assertEquals(1, renderer.reservations.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void singleProducerSeesOffsetReuse() {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(1, 1, 1)
            .renderer(renderer)
            .build()) {
            progress.worker(1).next();
            progress.worker(2).next();
            progress.worker(3).next();

            progress.awaitCompletion();
            for (RecordingTracker tracker : renderer.workerTrackers()) {
                assertEquals(1, tracker.getLineOffset(), "each worker finished before the next one started");
            }
            assertEquals(List.of(1), renderer.reservations);
        }
    }

    @Test
    void cancelledWorkerReleasesLineWhileOthersContinue() throws Exception {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(3, 2)
            .renderer(renderer)
            .build()) {
            progress.worker(1).next();
            progress.worker(2).next();
            progress.worker(2).cancel();

            awaitCondition(() -> renderer.trackers.size() == 3
                && renderer.workerTrackers().get(1).isCancelled(), "worker 2 to be cancelled");

            assertEquals(2, progress.getAggregate().getCount());
            assertFalse(progress.awaitCompletion(Duration.ofMillis(100)), "worker 1 is still at 1/3");
            assertFalse(progress.isComplete());

            progress.worker(1).next();
            progress.worker(1).next();
            assertTrue(progress.awaitCompletion(TIMEOUT));

            assertEquals(4, progress.getAggregate().getCount());
            assertTrue(renderer.aggregate().isCancelled());
            assertTrue(progress.state().getOffsetsInUse().isEmpty());
        }
    }

    @Test
    void messageForUndeclaredWorkerFailsLoudly() {
        BlockingUpdateChannel<WorkerMessage> channel = new BlockingUpdateChannel<>(16);
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(2, 2)
            .renderer(renderer)
            .channel(channel)
            .build();

        assertDoesNotThrow(() -> channel.send(new WorkerMessage(7, UpdateMessage.next())));

        ProtocolViolationException failure = assertThrows(ProtocolViolationException.class, progress::awaitCompletion);
        assertTrue(failure.getMessage().contains("7"));
        assertTrue(progress.isComplete());
        assertTrue(channel.isClosed());
    }

    @Test
    void handlesExistOnlyForDeclaredWorkers() {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(2, 2)
            .renderer(renderer)
            .build()) {
            assertThrows(IndexOutOfBoundsException.class, () -> progress.worker(0));
            assertThrows(IndexOutOfBoundsException.class, () -> progress.worker(3));
            assertEquals(2, progress.workers().size());
            assertEquals(1, progress.worker(1).getWorkerId());
            assertEquals(2, progress.worker(2).getLength());
        }
    }

    @Test
    void misconfigurationIsRejectedBeforeAnythingIsDrawn() {
        assertThrows(IllegalArgumentException.class, () -> MultiProgressCoordinator.builder(1, 2, 3)
            .perWorker(List.of(ProgressConfig.empty(), ProgressConfig.empty()))
            .renderer(renderer)
            .build());
        assertThrows(IllegalArgumentException.class, () -> MultiProgressCoordinator.builder(1, -2)
            .renderer(renderer)
            .build());
        assertThrows(IllegalArgumentException.class, () -> MultiProgressCoordinator.create(-1, 3, ProgressConfig.empty()));
        assertTrue(renderer.trackers.isEmpty());
    }

    @Test
    void uniformFormExpandsToEqualLengths() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(uniform(3, 4))
            .renderer(renderer)
            .shared(ProgressConfig.builder().enabled(false).build())
            .build();
        assertEquals(3, progress.getAmount());
        assertEquals(12, progress.getTotal());
        assertEquals(4, progress.getLength(2));
        progress.finish();
        progress.awaitCompletion();
        assertEquals(12, progress.getAggregate().getCount());
    }

    @Test
    void createUsesSharedConfigForEveryBar() {
        System.setProperty(ProgressDisplayMode.PROPERTY, "off");
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.create(3, 4,
            ProgressConfig.builder().description("all ").build())) {
            assertEquals(3, progress.getAmount());
            assertEquals(12, progress.getTotal());
            assertEquals(4, progress.getLength(3));
            progress.finish();
            progress.awaitCompletion();
            assertEquals(12, progress.getAggregate().getCount());
        } finally {
            System.clearProperty(ProgressDisplayMode.PROPERTY);
        }
    }

    @Test
    void finishCompletesEveryWorker() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(5, 7, 9)
            .renderer(renderer)
            .build();
        progress.worker(2).next();
        progress.finish();

        assertTrue(progress.awaitCompletion(TIMEOUT));
        assertEquals(21, progress.getAggregate().getCount());
        assertTrue(renderer.aggregate().isComplete());
        assertFalse(renderer.aggregate().isCancelled());
    }

    @Test
    void closeCancelsUnfinishedWorkers() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(5, 5)
            .renderer(renderer)
            .build();
        progress.worker(1).setValue(5);
        progress.worker(2).setValue(2);

        progress.close();

        assertTrue(progress.isComplete());
        assertEquals(7, progress.getAggregate().getCount());
        assertTrue(renderer.aggregate().isCancelled());
    }

    @Test
    void updatesAfterCompletionAreDropped() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(1)
            .renderer(renderer)
            .build();
        WorkerHandle handle = progress.worker(1);
        handle.next();
        progress.awaitCompletion();

        assertDoesNotThrow(handle::next);
        assertDoesNotThrow(handle::finish);
        assertDoesNotThrow(progress::cancel);
        assertEquals(1, progress.getAggregate().getCount());
        assertEquals(1, renderer.reservations.size());
    }

    @Test
    void zeroLengthWorkersAreFinishedFromTheStart() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(0, 2, 0)
            .renderer(renderer)
            .build();
        progress.worker(1).next();
        progress.worker(2).next();
        progress.worker(2).next();

        assertTrue(progress.awaitCompletion(TIMEOUT));
        assertEquals(1, renderer.workerTrackers().size());
        assertEquals(2, progress.getAggregate().getCount());
    }

    @Test
    void noWorkToDisplayCompletesImmediately() {
        MultiProgressCoordinator empty = MultiProgressCoordinator.builder()
            .renderer(renderer)
            .build();
        assertTrue(empty.isComplete());
        empty.awaitCompletion();

        MultiProgressCoordinator zeros = MultiProgressCoordinator.builder(0, 0)
            .renderer(renderer)
            .build();
        assertTrue(zeros.isComplete());
        zeros.worker(1).next();
        assertTrue(renderer.reservations.isEmpty());
    }

    @Test
    void negativeValuesAreRejectedAtTheCallSite() {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(3)
            .renderer(renderer)
            .build()) {
            assertThrows(IllegalArgumentException.class, () -> progress.worker(1).setValue(-1));
        }
    }

    @Test
    void trackerFailureEndsTheDisplay() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(2, 2)
            .renderer(new FailingProgressRenderer(1, new IllegalStateException("render failed")))
            .build();
        progress.worker(1).next();

        ProgressException failure = assertThrows(ProgressException.class, progress::awaitCompletion);
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertTrue(progress.isComplete());
        assertThrows(ProgressException.class, progress::close);
    }

    @Test
    void trackerErrorEndsTheDisplay() {
        MultiProgressCoordinator progress = MultiProgressCoordinator.builder(2, 2)
            .renderer(new FailingProgressRenderer(1, new AssertionError("render failed")))
            .build();
        progress.worker(1).next();

        ProgressException failure = assertThrows(ProgressException.class,
            () -> progress.awaitCompletion(TIMEOUT));
        assertInstanceOf(AssertionError.class, failure.getCause());
        assertTrue(progress.isComplete());
    }

    @Test
    void interruptedSenderKeepsItsInterruptFlag() {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(3)
            .renderer(renderer)
            .build()) {
            Thread.currentThread().interrupt();
            try {
                ProgressException failure = assertThrows(ProgressException.class, () -> progress.worker(1).next());
                assertInstanceOf(InterruptedException.class, failure.getCause());
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Test
    void interruptedWaiterKeepsItsInterruptFlag() {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(3)
            .renderer(renderer)
            .build()) {
            Thread.currentThread().interrupt();
            try {
                assertThrows(ProgressException.class, progress::awaitCompletion);
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
            assertFalse(progress.isComplete());
        }
    }

    @Test
    void workersCanRenameTheirBars() throws Exception {
        try (MultiProgressCoordinator progress = MultiProgressCoordinator.builder(2)
            .renderer(renderer)
            .build()) {
            WorkerHandle handle = progress.worker(1);
            handle.describe("download ");
            handle.next();
            handle.describe("verify ");
            handle.recolor(ProgressColor.GREEN);

            awaitCondition(() -> renderer.trackers.size() == 2
                && renderer.workerTrackers().get(0).getConfig().getColor().isPresent(), "the color change");
            RecordingTracker bar = renderer.workerTrackers().get(0);
            assertEquals("verify ", bar.getConfig().getDescription().orElseThrow());
            assertEquals(1, bar.getCount());
            assertThrows(NullPointerException.class, () -> handle.describe(null));

            handle.next();
            assertTrue(progress.awaitCompletion(TIMEOUT));
        }
    }

    private static long[] uniform(int count, long length) {
        long[] lengths = new long[count];
        for (int i = 0; i < count; i++) {
            lengths[i] = length;
        }
        return lengths;
    }
}
