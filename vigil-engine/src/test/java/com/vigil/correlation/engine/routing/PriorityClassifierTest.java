package com.vigil.correlation.engine.routing;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.EventPriority;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityClassifierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final PriorityClassifier classifier = new PriorityClassifier();

    private static Event event(String type, String source, String severity, String user, Map<String, Object> metadata) {
        return new Event("e1", type, source, severity, NOW, "host-1", user, "10.0.0.1", metadata);
    }

    @Test
    void failedLogonFromSecurityShouldBeHigh() {
        assertThat(classifier.classify(Event.of("e1", "4625", "security", NOW))).isEqualTo(EventPriority.HIGH);
    }

    @Test
    void uncorrelatedEventShouldBeNormal() {
        assertThat(classifier.classify(event("7045", "firewall", "low", "svc-backup", Map.of())))
                .isEqualTo(EventPriority.NORMAL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1102", "4720", "5156"})
    void criticalEventTypesShouldBeHigh(String type) {
        assertThat(classifier.classify(event(type, "firewall", null, null, Map.of()))).isEqualTo(EventPriority.HIGH);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Security", "SYSTEM", "application"})
    void criticalSourcesShouldBeHighRegardlessOfCase(String source) {
        assertThat(classifier.classify(event("9999", source, null, null, Map.of()))).isEqualTo(EventPriority.HIGH);
    }

    @Test
    void criticalSeverityOrHighPriorityMetadataShouldBeHigh() {
        assertThat(classifier.classify(event("9999", "firewall", "critical", null, Map.of())))
                .isEqualTo(EventPriority.HIGH);
        assertThat(classifier.classify(event("9999", "firewall", null, null, Map.of("severity", "CRITICAL"))))
                .isEqualTo(EventPriority.HIGH);
        assertThat(classifier.classify(event("9999", "firewall", null, null, Map.of("priority", "high"))))
                .isEqualTo(EventPriority.HIGH);
        assertThat(classifier.classify(event("9999", "firewall", "high", null, Map.of())))
                .isEqualTo(EventPriority.NORMAL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Administrator", "domain-admin", "root"})
    void privilegedUsersShouldBeHigh(String user) {
        assertThat(classifier.classify(event("9999", "firewall", null, user, Map.of()))).isEqualTo(EventPriority.HIGH);
    }
}
