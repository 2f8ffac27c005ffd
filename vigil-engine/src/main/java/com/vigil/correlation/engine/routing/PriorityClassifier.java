package com.vigil.correlation.engine.routing;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.EventPriority;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits incoming events into the high and normal priority lanes.
 *
 * <p>An event is high priority when any of the following holds:
 * <ul>
 *   <li>its type is a critical Windows security event id</li>
 *   <li>its source is one of the critical log sources</li>
 *   <li>metadata or event severity is "critical", or metadata priority is "high"</li>
 *   <li>its user name contains a privileged-account marker</li>
 * </ul>
 * Stateless and thread-safe.
 */
public final class PriorityClassifier {

    static final Set<String> CRITICAL_EVENT_TYPES = Set.of(
            "4624", "4625", "4648", "4778", "4779", "1102", "4720", "4732",
            "4728", "4756", "4768", "4769", "4771", "5140", "5145", "5156");

    static final Set<String> CRITICAL_SOURCES = Set.of("security", "system", "application");

    static final List<String> PRIVILEGED_ACCOUNT_MARKERS = List.of("administrator", "admin", "root");

    public EventPriority classify(Event event) {
        if (event.eventType() != null && CRITICAL_EVENT_TYPES.contains(event.eventType())) {
            return EventPriority.HIGH;
        }
        if (event.source() != null && CRITICAL_SOURCES.contains(event.source().toLowerCase(Locale.ROOT))) {
            return EventPriority.HIGH;
        }
        if (isCriticalSeverity(event)) {
            return EventPriority.HIGH;
        }
        if (isPrivilegedUser(event.userName())) {
            return EventPriority.HIGH;
        }
        return EventPriority.NORMAL;
    }

    private static boolean isCriticalSeverity(Event event) {
        boolean metadataCritical = event.metadataString("severity")
                .map(s -> s.equalsIgnoreCase("critical"))
                .orElse(false);
        boolean metadataHigh = event.metadataString("priority")
                .map(p -> p.equalsIgnoreCase("high"))
                .orElse(false);
        return metadataCritical || metadataHigh || "critical".equalsIgnoreCase(event.severity());
    }

    private static boolean isPrivilegedUser(String userName) {
        if (userName == null || userName.isEmpty()) {
            return false;
        }
        String lower = userName.toLowerCase(Locale.ROOT);
        for (String marker : PRIVILEGED_ACCOUNT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
