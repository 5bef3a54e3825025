package io.linchmind.daemon.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InstanceLockTableTest {

    private final InstanceLockTable locks = new InstanceLockTable();

    @Test
    void sameKeyIsSerialised() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 20; i++) {
                pool.submit(() -> locks.withLock("fs_1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(Duration.ofMillis(2));
                    inside.decrementAndGet();
                }));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentKeysDoNotBlockEachOther() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            pool.submit(() -> locks.withLock("fs_1", () -> {
                held.countDown();
                await(release);
            }));
            assertThat(held.await(2, TimeUnit.SECONDS)).isTrue();

            Future<String> other = pool.submit(() -> locks.withLock("fs_2", () -> "done"));

            assertThat(other.get(2, TimeUnit.SECONDS)).isEqualTo("done");
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void locksAreReentrantAndForgettable() {
        String result = locks.withLock("fs_1", () -> locks.withLock("fs_1", () -> {
            locks.forget("fs_1");
            return "nested";
        }));

        assertThat(result).isEqualTo("nested");
        assertThat(locks.size()).isZero();
        assertThat(InstanceLockTable.typeKey("filesystem")).isEqualTo("type:filesystem");
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
