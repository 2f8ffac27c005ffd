package com.vigil.correlation.api;

import com.vigil.correlation.api.model.Event;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of the recent-event buffers maintained by the engine,
 * keyed by (source, event type).
 */
public interface EventBufferView {

    /**
     * Snapshot of the buffered events for one (source, event type) pair,
     * oldest first. Empty when nothing is buffered.
     */
    List<Event> recentEvents(String source, String eventType);

    /**
     * Snapshot of the buffer keys currently held, as {@code source:eventType}.
     */
    Set<String> bufferKeys();

    int totalEvents();
}
