/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.routing;

import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vigil.correlation.infra.config.EngineConfig.PoolSettings;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size worker pool for one priority lane.
 *
 * <p>Work is never refused while the pool is running: tasks queue without
 * bound and the admission controller keeps the queue in check. Two limits
 * apply on top of the concurrency:
 * <ul>
 *   <li>task starts are rate-limited to the configured interval cap</li>
 *   <li>a task that waited in the queue longer than the pool timeout is
 *       dropped without running and counted as expired</li>
 * </ul>
 * The completion future of a started task finishes when the task does, or
 * at the pool timeout, whichever comes first. A timed-out task keeps running
 * in the background; it is abandoned, not interrupted.
 */
public final class WorkerPool {

    private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

    private final String name;
    private final long timeoutNanos;
    private final ThreadPoolExecutor executor;
    private final RateLimiter startLimiter;

    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong expired = new AtomicLong();
    private final Object idleLock = new Object();
    private int pending;

    public WorkerPool(String name, PoolSettings settings) {
        this.name = name;
        this.timeoutNanos = settings.timeout().toNanos();
        this.startLimiter = RateLimiter.create(settings.startsPerSecond());
        this.executor = new ThreadPoolExecutor(
                settings.concurrency(),
                settings.concurrency(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat(name + "-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Queues a task. Never throws; once the pool is shut down the returned
     * future is already complete and the task is not run.
     */
    public CompletableFuture<Void> submit(Runnable task) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        long enqueuedAt = System.nanoTime();
        queued.incrementAndGet();
        markPending();
        try {
            executor.execute(new PoolTask(task, enqueuedAt, completion));
        } catch (RejectedExecutionException e) {
            queued.decrementAndGet();
            markDone();
            logger.fine(() -> String.format("Pool %s is shut down, task not run", name));
            completion.complete(null);
        }
        return completion;
    }

    private void runTask(Runnable task, long enqueuedAt, CompletableFuture<Void> completion) {
        queued.decrementAndGet();
        try {
            if (System.nanoTime() - enqueuedAt > timeoutNanos) {
                expired.incrementAndGet();
                completion.complete(null);
                return;
            }
            startLimiter.acquire();
            completion.completeOnTimeout(null, timeoutNanos, TimeUnit.NANOSECONDS);
            active.incrementAndGet();
            try {
                task.run();
            } finally {
                active.decrementAndGet();
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format("Task failed in pool %s", name), e);
        } finally {
            completion.complete(null);
            markDone();
        }
    }

    private void markPending() {
        synchronized (idleLock) {
            pending++;
        }
    }

    private void markDone() {
        synchronized (idleLock) {
            pending--;
            if (pending == 0) {
                idleLock.notifyAll();
            }
        }
    }

    /**
     * Blocks until every submitted task has finished or the timeout elapses.
     *
     * @return true if the pool became idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleLock) {
            while (pending > 0) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                idleLock.wait(remainingMillis);
            }
            return true;
        }
    }

    /**
     * Stops accepting work and waits for queued tasks to drain.
     *
     * @return true if the pool terminated within the timeout
     */
    public boolean shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            List<Runnable> abandoned = executor.shutdownNow();
            abandon(abandoned);
            logger.warning(String.format("Pool %s did not drain within %d ms, abandoned %d queued tasks",
                    name, timeout.toMillis(), abandoned.size()));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(executor.shutdownNow());
            return false;
        }
    }

    private void abandon(List<Runnable> tasks) {
        for (Runnable task : tasks) {
            if (task instanceof PoolTask poolTask) {
                queued.decrementAndGet();
                poolTask.completion.complete(null);
                markDone();
            }
        }
    }

    public int queued() {
        return queued.get();
    }

    public int active() {
        return active.get();
    }

    public int inFlight() {
        return queued.get() + active.get();
    }

    public long expired() {
        return expired.get();
    }

    public String name() {
        return name;
    }

    private final class PoolTask implements Runnable {
        private final Runnable task;
        private final long enqueuedAt;
        private final CompletableFuture<Void> completion;

        PoolTask(Runnable task, long enqueuedAt, CompletableFuture<Void> completion) {
            this.task = task;
            this.enqueuedAt = enqueuedAt;
            this.completion = completion;
        }

        @Override
        public void run() {
            runTask(task, enqueuedAt, completion);
        }
    }
}
