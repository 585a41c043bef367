package org.foxesworld.kalibridge.engine.registry;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;
import org.junit.jupiter.api.Test;

final class RegistrationQueueTest {

    private final HostEngine host = new HostEngine();
    private final HandleAllocator handles = new HandleAllocator();
    private final CallbackDispatchTable dispatch = new CallbackDispatchTable();
    private final BlockRegistrar blocks = new BlockRegistrar(host, handles, dispatch);
    private final ItemRegistrar items = new ItemRegistrar(host, handles, dispatch);
    private final RegistrationQueue queue = new RegistrationQueue(host, handles);

    @Test
    void flushRegistersInArrivalOrder() {
        long a = queue.enqueue(items, ItemSettings.simple(1), "demo", "a");
        long b = queue.enqueue(blocks, BlockSettings.builder().build(), "demo", "b");
        long c = queue.enqueue(items, ItemSettings.simple(1), "demo", "c");

        assertThat(queue.size()).isEqualTo(3);
        assertThat(queue.flush()).isEqualTo(3);

        assertThat(queue.isEmpty()).isTrue();
        assertThat(new long[] {a, b, c}).containsExactly(1L, 2L, 3L);
        assertThat(host.items().keys()).extracting(ResourceKey::path).containsExactly("a", "b", "c");
    }

    @Test
    void concurrentProducersGetHandlesInQueueOrder() throws Exception {
        int producers = 6;
        int perProducer = 200;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger names = new AtomicInteger();
        try {
            for (int p = 0; p < producers; p++) {
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perProducer; i++) {
                        queue.enqueue(items, ItemSettings.simple(1), "demo", "item_" + names.getAndIncrement());
                    }
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(queue.flush()).isEqualTo(producers * perProducer);

        List<Long> order = items.handles();
        List<Long> sorted = new ArrayList<>(order);
        sorted.sort(null);
        assertThat(order).hasSize(producers * perProducer).isEqualTo(sorted);
    }

    @Test
    void failedEntriesAreDroppedAndCounted() {
        queue.enqueue(items, ItemSettings.simple(1), "demo", "gem");
        queue.enqueue(items, ItemSettings.simple(1), "demo", "gem");
        queue.enqueue(items, ItemSettings.simple(1), "demo", "Bad Key");

        assertThat(queue.flush()).isEqualTo(1);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void flushOffTheRegistrationThreadLeavesQueueAlone() throws InterruptedException {
        queue.enqueue(items, ItemSettings.simple(1), "demo", "gem");
        AtomicInteger flushed = new AtomicInteger(-1);

        Thread t = new Thread(() -> flushed.set(queue.flush()));
        t.start();
        t.join();

        assertThat(flushed).hasValue(0);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void flushAfterFreezeRegistersNothing() {
        queue.enqueue(items, ItemSettings.simple(1), "demo", "gem");
        host.freeze();

        assertThat(queue.flush()).isZero();
        assertThat(host.items().size()).isZero();
    }

    @Test
    void awaitCompleteTimesOutUntilMarked() throws InterruptedException {
        assertThat(queue.awaitComplete(10)).isFalse();

        Thread t = new Thread(queue::markComplete);
        t.start();

        assertThat(queue.awaitComplete(5_000)).isTrue();
        assertThat(queue.isComplete()).isTrue();
        t.join();
    }

    @Test
    void interruptedWaitRestoresFlag() {
        Thread.currentThread().interrupt();
        try {
            assertThat(queue.awaitComplete(1_000)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
