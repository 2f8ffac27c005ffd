package com.vigil.correlation.api.model;

/**
 * Routing class assigned to an event by the priority classifier.
 */
public enum EventPriority {
    HIGH,
    NORMAL
}
