package com.vigil.correlation.engine.batch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vigil.correlation.api.model.Event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates events into batches.
 *
 * <p>A batch is flushed when it reaches the batch size given with the event
 * that fills it, or when the max delay has passed since its first event,
 * whichever comes first. A size-triggered flush cancels the pending timer.
 * Flushes are handed to the timer thread so callers of {@link #add} never
 * run the batch themselves.
 *
 * <p>Every event added to a batch receives that batch's completion future,
 * which completes once the batch handler returns (normally, even if the
 * handler threw).
 *
 * <p>{@link #backlog()} counts every event accepted but not yet through the
 * handler, so callers can bound admission on it.
 */
public final class BatchAggregator {

    private static final Logger logger = Logger.getLogger(BatchAggregator.class.getName());

    private final Duration maxDelay;
    private final Consumer<List<Event>> handler;
    private final ScheduledExecutorService timer;
    private final AtomicInteger handedOff = new AtomicInteger();

    private List<Event> pending = new ArrayList<>();
    private CompletableFuture<Void> pendingCompletion = new CompletableFuture<>();
    private ScheduledFuture<?> pendingTimer;
    private long generation;
    private boolean stopped;

    public BatchAggregator(Duration maxDelay, Consumer<List<Event>> handler) {
        this.maxDelay = maxDelay;
        this.handler = handler;
        this.timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("batch-timer")
                .setDaemon(true)
                .build());
    }

    /**
     * Adds an event to the current batch.
     *
     * @param batchSize size that triggers an immediate flush, read per call
     * @return completion of the batch the event joined
     */
    public CompletableFuture<Void> add(Event event, int batchSize) {
        Batch ready = null;
        CompletableFuture<Void> completion;
        synchronized (this) {
            if (stopped) {
                return CompletableFuture.completedFuture(null);
            }
            pending.add(event);
            completion = pendingCompletion;
            if (pending.size() >= batchSize) {
                ready = takePending();
            } else if (pendingTimer == null) {
                long scheduledFor = generation;
                pendingTimer = timer.schedule(() -> flushOnTimer(scheduledFor),
                        maxDelay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        if (ready != null) {
            Batch batch = ready;
            timer.execute(() -> run(batch));
        }
        return completion;
    }

    private void flushOnTimer(long scheduledFor) {
        Batch batch;
        synchronized (this) {
            // a size-triggered flush already took this batch
            if (scheduledFor != generation || pending.isEmpty()) {
                return;
            }
            batch = takePending();
        }
        run(batch);
    }

    private Batch takePending() {
        if (pendingTimer != null) {
            pendingTimer.cancel(false);
            pendingTimer = null;
        }
        Batch batch = new Batch(pending, pendingCompletion);
        handedOff.addAndGet(batch.events.size());
        generation++;
        pending = new ArrayList<>();
        pendingCompletion = new CompletableFuture<>();
        return batch;
    }

    private void run(Batch batch) {
        try {
            handler.accept(batch.events);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, String.format("Batch of %d events failed", batch.events.size()), e);
        } finally {
            handedOff.addAndGet(-batch.events.size());
            batch.completion.complete(null);
        }
    }

    /**
     * Flushes the current partial batch on the calling thread.
     */
    public void flush() {
        Batch batch;
        synchronized (this) {
            if (pending.isEmpty()) {
                return;
            }
            batch = takePending();
        }
        run(batch);
    }

    /**
     * Flushes what is pending, then stops the timer thread after it has
     * finished any flush already handed to it. Later adds are ignored.
     */
    public void stop(Duration timeout) {
        synchronized (this) {
            stopped = true;
        }
        flush();
        timer.shutdown();
        try {
            if (!timer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Batch timer did not stop in time");
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timer.shutdownNow();
        }
    }

    public synchronized boolean hasPendingTimer() {
        return pendingTimer != null;
    }

    public synchronized int pending() {
        return pending.size();
    }

    /**
     * Events in the current batch plus events of flushed batches still
     * queued on or running in the handler.
     */
    public synchronized int backlog() {
        return pending.size() + handedOff.get();
    }

    private static final class Batch {
        private final List<Event> events;
        private final CompletableFuture<Void> completion;

        Batch(List<Event> events, CompletableFuture<Void> completion) {
            this.events = events;
            this.completion = completion;
        }
    }
}
