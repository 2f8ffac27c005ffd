package com.vigil.correlation.api;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.PatternMatch;

import java.util.List;

/**
 * Cross-event heuristic detection (brute force, lateral movement, ...)
 * over the engine's recent-event buffers.
 */
public interface PatternMatcher {

    PatternMatcher NONE = (event, buffer) -> List.of();

    List<PatternMatch> findMatches(Event event, EventBufferView buffer);
}
