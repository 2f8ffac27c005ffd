package com.vigil.correlation.engine.routing;

import com.vigil.correlation.infra.config.EngineConfig.PoolSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(5));
        }
    }

    private static PoolSettings settings(int concurrency, Duration timeout) {
        return new PoolSettings(concurrency, timeout, 1000, Duration.ofMillis(500));
    }

    @Test
    void shouldRunSubmittedTasks() throws Exception {
        pool = new WorkerPool("test", settings(2, Duration.ofSeconds(5)));
        AtomicInteger runs = new AtomicInteger();

        CompletableFuture<Void> first = pool.submit(runs::incrementAndGet);
        CompletableFuture<Void> second = pool.submit(runs::incrementAndGet);

        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);
        assertThat(runs.get()).isEqualTo(2);
        assertThat(pool.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(pool.inFlight()).isZero();
    }

    @Test
    void shouldDropTasksThatWaitedPastTheTimeout() throws Exception {
        pool = new WorkerPool("test", settings(1, Duration.ofMillis(50)));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean lateTaskRan = new AtomicBoolean();

        pool.submit(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Void> late = pool.submit(() -> lateTaskRan.set(true));
        assertThat(pool.queued()).isEqualTo(1);

        Thread.sleep(150);
        release.countDown();

        late.get(5, TimeUnit.SECONDS);
        assertThat(lateTaskRan).isFalse();
        assertThat(pool.expired()).isEqualTo(1);
    }

    @Test
    void completionShouldNotWaitForTasksPastTheTimeout() throws Exception {
        pool = new WorkerPool("test", settings(1, Duration.ofMillis(50)));
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> slow = pool.submit(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        slow.get(2, TimeUnit.SECONDS);
        assertThat(pool.active()).isEqualTo(1);
        release.countDown();
        assertThat(pool.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void failingTaskShouldStillComplete() throws Exception {
        pool = new WorkerPool("test", settings(1, Duration.ofSeconds(5)));

        CompletableFuture<Void> failing = pool.submit(() -> {
            throw new IllegalStateException("boom");
        });

        failing.get(5, TimeUnit.SECONDS);
        assertThat(failing).isCompleted().isNotCompletedExceptionally();
    }

    @Test
    void submitAfterShutdownShouldReturnCompletedFuture() {
        pool = new WorkerPool("test", settings(1, Duration.ofSeconds(5)));
        assertThat(pool.shutdown(Duration.ofSeconds(1))).isTrue();
        AtomicBoolean ran = new AtomicBoolean();

        CompletableFuture<Void> future = pool.submit(() -> ran.set(true));

        assertThat(future).isCompleted();
        assertThat(ran).isFalse();
        assertThat(pool.inFlight()).isZero();
    }
}
