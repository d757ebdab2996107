package com.ai.bookingbot.conversation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionLockRegistry")
class SessionLockRegistryTest {

    private static final String PHONE = "32470000001";

    private final SessionLockRegistry registry = new SessionLockRegistry();
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("turns of the same pair never overlap")
    void samePairRunsOneAtATime() throws Exception {
        // given
        int turns = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(turns);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < turns; i++) {
            int turn = i;
            futures.add(executor.submit(() -> {
                ready.countDown();
                start.await();
                return registry.withLock(1L, PHONE, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(20);
                    inside.decrementAndGet();
                    return turn;
                });
            }));
        }

        // when
        ready.await(5, TimeUnit.SECONDS);
        start.countDown();
        List<Integer> done = new ArrayList<>();
        for (Future<Integer> future : futures) {
            done.add(future.get(10, TimeUnit.SECONDS));
        }

        // then
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(done).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(registry.trackedPairs()).isZero();
    }

    @Test
    @DisplayName("a held pair does not stall another pair")
    void otherPairIsNotBlocked() throws Exception {
        // given
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = executor.submit(() -> registry.withLock(1L, PHONE, () -> {
            held.countDown();
            await(release);
            return "first";
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        Future<String> other = executor.submit(() -> registry.withLock(1L, "32470000002", () -> "second"));
        Future<String> otherProvider = executor.submit(() -> registry.withLock(2L, PHONE, () -> "third"));

        // then
        assertThat(other.get(5, TimeUnit.SECONDS)).isEqualTo("second");
        assertThat(otherProvider.get(5, TimeUnit.SECONDS)).isEqualTo("third");
        assertThat(holder.isDone()).isFalse();
        assertThat(registry.trackedPairs()).isEqualTo(1);

        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(registry.trackedPairs()).isZero();
    }

    @Test
    @DisplayName("a pair waiting behind a holder keeps its lock entry")
    void waiterKeepsEntry() throws Exception {
        // given
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger order = new AtomicInteger();
        Future<Integer> holder = executor.submit(() -> registry.withLock(1L, PHONE, () -> {
            held.countDown();
            await(release);
            return order.incrementAndGet();
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Integer> waiter = executor.submit(() -> registry.withLock(1L, PHONE, order::incrementAndGet));

        // when
        sleep(50);
        release.countDown();

        // then
        assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(2);
        assertThat(registry.trackedPairs()).isZero();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
