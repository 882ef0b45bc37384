package com.ai.studyengine.service;

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

class SessionLockRegistryTest {

    private final SessionLockRegistry registry = new SessionLockRegistry();

    @Test
    void serializesWorkOnTheSameSession() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.withLock("s1", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return inside.decrementAndGet();
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void forgetDropsTheLockOfADeletedSession() {
        assertThat(registry.withLock("s1", () -> "done")).isEqualTo("done");
        registry.withLock("s2", () -> null);
        assertThat(registry.size()).isEqualTo(2);

        registry.forget("s1");

        assertThat(registry.size()).isEqualTo(1);
    }
}
