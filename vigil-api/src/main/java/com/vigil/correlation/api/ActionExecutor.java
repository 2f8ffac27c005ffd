package com.vigil.correlation.api;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Incident;
import com.vigil.correlation.api.model.Rule;

/**
 * Notification and response side effects for an incident.
 */
@FunctionalInterface
public interface ActionExecutor {

    ActionExecutor NONE = (rule, incident, event) -> { };

    void executeActions(Rule rule, Incident incident, Event event);
}
