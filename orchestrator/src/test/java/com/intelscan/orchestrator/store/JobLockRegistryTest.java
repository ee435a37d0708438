package com.intelscan.orchestrator.store;

import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class JobLockRegistryTest {

    private final JobLockRegistry locks = new JobLockRegistry();

    @Test
    void sameJob_neverRunsConcurrently() throws Exception {
        UUID id = UUID.randomUUID();
        AtomicInteger inside  = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> locks.withLock(id, () -> {
                    maxSeen.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    inside.decrementAndGet();
                    return null;
                }));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(maxSeen.get()).isEqualTo(1);
    }

    @Test
    void differentJobs_doNotBlockEachOther() throws Exception {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        CountDownLatch holdingA = new CountDownLatch(1);
        CountDownLatch releaseA = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> locks.withLock(a, () -> {
                holdingA.countDown();
                try {
                    releaseA.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(holdingA.await(5, TimeUnit.SECONDS)).isTrue();

            String result = locks.withLock(b, () -> "ran");

            assertThat(result).isEqualTo("ran");
            releaseA.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void release_dropsEntry() {
        UUID id = UUID.randomUUID();
        locks.withLock(id, () -> null);
        assertThat(locks.size()).isEqualTo(1);

        locks.release(id);

        assertThat(locks.size()).isZero();
    }
}
