package com.libragraph.stash.core.quota;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class OwnerLocksTest {

    private final OwnerLocks locks = new OwnerLocks();

    @Test
    void shouldSerializeWorkForOneOwner() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 64; i++) {
                pool.submit(() -> locks.withLock(1L, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.onSpinWait();
                    inside.decrementAndGet();
                    return null;
                }));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void shouldNotBlockOtherOwners() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> locks.withLock(1L, () -> {
                holding.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(holding.await(10, TimeUnit.SECONDS)).isTrue();

            assertThat(locks.withLock(2L, () -> "other owner")).isEqualTo("other owner");

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldBeReentrant() {
        String result = locks.withLock(5L, () -> {
            assertThat(locks.isHeldByCurrentThread(5L)).isTrue();
            return locks.withLock(5L, () -> "nested");
        });
        assertThat(result).isEqualTo("nested");
        assertThat(locks.isHeldByCurrentThread(5L)).isFalse();
    }

    @Test
    void shouldForgetOwnersOnceIdle() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (long owner = 0; owner < 500; owner++) {
                long id = owner % 50;
                pool.submit(() -> locks.withLock(id, () -> locks.withLock(id, () -> id)));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(locks.trackedOwners()).isZero();

        locks.withLock(9L, () -> {
            assertThat(locks.trackedOwners()).isEqualTo(1);
            return null;
        });
        assertThat(locks.trackedOwners()).isZero();
    }
}
