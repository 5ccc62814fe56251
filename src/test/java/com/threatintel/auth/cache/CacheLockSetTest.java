package com.threatintel.auth.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CacheLockSetTest {

    @TempDir
    Path dir;

    @Test
    void onlyOneProcessIsDesignatedAtATime() {
        CacheLockSet first = new CacheLockSet(dir);
        CacheLockSet second = new CacheLockSet(dir);

        assertThat(first.designateLoadingAndPicklingJob()).isTrue();
        assertThat(second.designateLoadingAndPicklingJob()).isFalse();

        first.getJobLock().unlock();
        assertThat(second.designateLoadingAndPicklingJob()).isTrue();
        second.getJobLock().unlock();
    }

    @Test
    void concurrentContendersDesignateExactlyOneRebuilder() throws Exception {
        CyclicBarrier start = new CyclicBarrier(2);
        CountDownLatch rebuildDone = new CountDownLatch(1);
        AtomicReference<Thread> waiterThread = new AtomicReference<>();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<String>> roles = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                CacheLockSet locks = new CacheLockSet(dir);
                roles.add(executor.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    if (locks.designateLoadingAndPicklingJob()) {
                        rebuildDone.await(5, TimeUnit.SECONDS);
                        locks.getJobLock().unlock();
                        return "rebuilder";
                    }
                    waiterThread.set(Thread.currentThread());
                    locks.getJobLock().lockShared();
                    locks.getJobLock().unlock();
                    return "waiter";
                }));
            }

            awaitBlocked(waiterThread);
            assertThat(roles).noneMatch(Future::isDone);

            rebuildDone.countDown();
            List<String> results = new ArrayList<>();
            for (Future<String> role : roles) {
                results.add(role.get(5, TimeUnit.SECONDS));
            }
            assertThat(results).containsExactlyInAnyOrder("rebuilder", "waiter");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void loneProcessRebuilds() {
        CacheLockSet locks = new CacheLockSet(dir);
        AtomicInteger loads = new AtomicInteger();

        String result = locks.coordinate(() -> "rebuilt", () -> {
            loads.incrementAndGet();
            return "loaded";
        });

        assertThat(result).isEqualTo("rebuilt");
        assertThat(loads).hasValue(0);
        assertThat(locks.getJobLock().isHeld()).isFalse();
    }

    @Test
    void locksAreReleasedWhenRebuildFails() {
        CacheLockSet locks = new CacheLockSet(dir);

        try {
            locks.coordinate(() -> {
                throw new IllegalStateException("backend down");
            }, () -> "loaded");
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("backend down");
        }

        assertThat(locks.getJobLock().isHeld()).isFalse();
        assertThat(new CacheLockSet(dir).coordinate(() -> "rebuilt", () -> "loaded")).isEqualTo("rebuilt");
    }

    @Test
    void otherProcessWaitsForRebuilderAndLoadsItsResult() throws Exception {
        CacheLockSet rebuilder = new CacheLockSet(dir);
        CacheLockSet waiter = new CacheLockSet(dir);
        assertThat(rebuilder.designateLoadingAndPicklingJob()).isTrue();

        AtomicReference<Thread> waiterThread = new AtomicReference<>();
        AtomicInteger rebuilds = new AtomicInteger();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> result = executor.submit(() -> {
                waiterThread.set(Thread.currentThread());
                return waiter.coordinate(() -> {
                    rebuilds.incrementAndGet();
                    return "rebuilt";
                }, () -> "loaded");
            });

            awaitBlocked(waiterThread);
            assertThat(result.isDone()).isFalse();

            rebuilder.getJobLock().unlock();
            assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("loaded");
            assertThat(rebuilds).hasValue(0);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitBlocked(AtomicReference<Thread> thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            Thread current = thread.get();
            if (current != null && current.getState() == Thread.State.WAITING) {
                return;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Waiting process never blocked on the job lock");
    }
}
