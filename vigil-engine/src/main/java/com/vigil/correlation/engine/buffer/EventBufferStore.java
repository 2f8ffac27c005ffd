/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.buffer;

import com.vigil.correlation.api.EventBufferView;
import com.vigil.correlation.api.model.Event;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recent events per {@code source:eventType}, kept for the pattern matcher.
 *
 * <p>Each buffer is trimmed opportunistically on append once it grows past
 * the trim threshold: events older than the retention are dropped and the
 * most recent {@code trimCap} are kept. {@link #sweep()} applies the same
 * age cutoff to every buffer with the larger sweep cap and removes buffers
 * that end up empty.
 *
 * <p>An event's age is measured from its own timestamp, or from the time it
 * was buffered when it has none.
 */
public final class EventBufferStore implements EventBufferView {

    private static final Logger logger = Logger.getLogger(EventBufferStore.class.getName());

    private final ConcurrentMap<String, Deque<Entry>> buffers = new ConcurrentHashMap<>();
    private final Duration retention;
    private final int trimThreshold;
    private final int trimCap;
    private final int sweepCap;
    private final Clock clock;

    public EventBufferStore(Duration retention, int trimThreshold, int trimCap, int sweepCap, Clock clock) {
        this.retention = retention;
        this.trimThreshold = trimThreshold;
        this.trimCap = trimCap;
        this.sweepCap = sweepCap;
        this.clock = clock;
    }

    static String key(String source, String eventType) {
        return source + ":" + eventType;
    }

    public void append(Event event) {
        Instant now = clock.instant();
        Entry entry = new Entry(event, event.timestamp() != null ? event.timestamp() : now);
        buffers.compute(key(event.source(), event.eventType()), (key, deque) -> {
            Deque<Entry> target = deque != null ? deque : new ArrayDeque<>();
            synchronized (target) {
                target.addLast(entry);
                if (target.size() > trimThreshold) {
                    trim(target, now.minus(retention), trimCap);
                }
            }
            return target;
        });
    }

    private static int trim(Deque<Entry> deque, Instant cutoff, int cap) {
        int before = deque.size();
        deque.removeIf(e -> e.effectiveTime.isBefore(cutoff));
        while (deque.size() > cap) {
            deque.removeFirst();
        }
        return before - deque.size();
    }

    /**
     * Trims every buffer and removes the empty ones.
     *
     * @return number of events removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int[] removed = {0};
        for (String key : buffers.keySet()) {
            buffers.computeIfPresent(key, (k, deque) -> {
                synchronized (deque) {
                    removed[0] += trim(deque, cutoff, sweepCap);
                    return deque.isEmpty() ? null : deque;
                }
            });
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Buffer sweep removed %d events, %d buffers remain",
                    removed[0], buffers.size()));
        }
        return removed[0];
    }

    @Override
    public List<Event> recentEvents(String source, String eventType) {
        Deque<Entry> deque = buffers.get(key(source, eventType));
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            List<Event> events = new ArrayList<>(deque.size());
            for (Entry entry : deque) {
                events.add(entry.event);
            }
            return events;
        }
    }

    @Override
    public Set<String> bufferKeys() {
        return new TreeSet<>(buffers.keySet());
    }

    @Override
    public int totalEvents() {
        int total = 0;
        for (Deque<Entry> deque : buffers.values()) {
            synchronized (deque) {
                total += deque.size();
            }
        }
        return total;
    }

    public int keyCount() {
        return buffers.size();
    }

    public void clear() {
        buffers.clear();
    }

    private static final class Entry {
        private final Event event;
        private final Instant effectiveTime;

        Entry(Event event, Instant effectiveTime) {
            this.event = event;
            this.effectiveTime = effectiveTime;
        }
    }
}
