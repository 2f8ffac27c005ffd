package com.vigil.correlation.engine.dispatch;

import com.vigil.correlation.api.ActionExecutor;
import com.vigil.correlation.api.IncidentManager;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Incident;
import com.vigil.correlation.api.model.IncidentDraft;
import com.vigil.correlation.api.model.PatternMatch;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.api.model.Severity;
import com.vigil.correlation.engine.MutableClock;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.engine.metrics.RuleMetricsAggregator;
import com.vigil.correlation.infra.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatchDispatcherTest {

    private static final Instant TS = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private IncidentManager incidentManager;

    @Mock
    private ActionExecutor actionExecutor;

    private EngineMetrics metrics;
    private RuleMetricsAggregator ruleMetrics;
    private MatchDispatcher dispatcher;

    private final Rule rule = Rule.builder("r1").name("Failed logons").timeWindowMinutes(15).build();
    private final Event event = Event.of("evt-1", "4625", "security", TS);
    private final EvaluationResult result = EvaluationResult.match("r1", 0.9);

    @BeforeEach
    void setUp() {
        metrics = new EngineMetrics(MetricsRegistry.noop());
        ruleMetrics = new RuleMetricsAggregator();
        dispatcher = new MatchDispatcher(incidentManager, actionExecutor,
                new IncidentFactory(MutableClock.at("2025-03-01T12:00:00Z")), metrics, ruleMetrics, 2, 100);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown(Duration.ofSeconds(5));
    }

    private static Incident incident(String id) {
        return new Incident(id, "r1", "simple", Severity.MEDIUM, "t", "open", 1, TS, TS, Map.of());
    }

    @Test
    void shouldCreateIncidentWhenNoneOpenAndRunActions() {
        Incident created = incident("inc-1");
        when(incidentManager.findOpenIncident("r1", event, 15)).thenReturn(Optional.empty());
        when(incidentManager.createIncident(any(IncidentDraft.class))).thenReturn(created);

        assertThat(dispatcher.dispatch(rule, event, result)).isTrue();

        verify(actionExecutor, timeout(2000)).executeActions(rule, created, event);
        ArgumentCaptor<IncidentDraft> draft = ArgumentCaptor.forClass(IncidentDraft.class);
        verify(incidentManager).createIncident(draft.capture());
        assertThat(draft.getValue().title()).isEqualTo("Security: Failed logons");
        verify(incidentManager, never()).updateIncident(anyString(), any(), any());
    }

    @Test
    void shouldUpdateOpenIncident() {
        Incident open = incident("inc-7");
        when(incidentManager.findOpenIncident("r1", event, 15)).thenReturn(Optional.of(open));
        when(incidentManager.updateIncident("inc-7", event, result)).thenReturn(open);

        dispatcher.dispatch(rule, event, result);

        verify(actionExecutor, timeout(2000)).executeActions(rule, open, event);
        verify(incidentManager, never()).createIncident(any());
    }

    @Test
    void incidentFailureShouldBeCountedAndSkipActions() throws Exception {
        when(incidentManager.findOpenIncident(anyString(), any(), anyInt()))
                .thenThrow(new IllegalStateException("db down"));

        dispatcher.dispatch(rule, event, result);
        dispatcher.shutdown(Duration.ofSeconds(5));

        assertThat(ruleMetrics.getRuleStats("r1")).isEmpty();
        assertThat(ruleMetrics.getSummary().matchHandlingFailures()).isEqualTo(1);
        verifyNoInteractions(actionExecutor);
    }

    @Test
    void actionFailureShouldNotAffectIncidentHandling() throws Exception {
        Incident created = incident("inc-1");
        when(incidentManager.findOpenIncident("r1", event, 15)).thenReturn(Optional.empty());
        when(incidentManager.createIncident(any(IncidentDraft.class))).thenReturn(created);
        lenient().doThrow(new IllegalStateException("webhook down")).when(actionExecutor).executeActions(any(), any(), any());

        dispatcher.dispatch(rule, event, result);
        dispatcher.shutdown(Duration.ofSeconds(5));

        assertThat(ruleMetrics.getSummary().matchesHandled()).isEqualTo(1);
    }

    @Test
    void fullQueueShouldRejectWithoutBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        when(incidentManager.findOpenIncident(anyString(), any(), anyInt())).thenAnswer(invocation -> {
            busy.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.empty();
        });
        lenient().when(incidentManager.createIncident(any())).thenReturn(null);
        MatchDispatcher small = new MatchDispatcher(incidentManager, actionExecutor,
                new IncidentFactory(MutableClock.at("2025-03-01T12:00:00Z")), metrics, ruleMetrics, 1, 1);
        try {
            assertThat(small.dispatch(rule, event, result)).isTrue();
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(small.dispatch(rule, event, result)).isTrue();
            assertThat(small.dispatch(rule, event, result)).isFalse();
            assertThat(metrics.dispatchRejectedCount()).isEqualTo(1);
            assertThat(small.queued()).isEqualTo(1);
        } finally {
            release.countDown();
            small.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    void patternShouldCreateIncidentAndLinkEachEvent() {
        Event other = Event.of("evt-0", "4625", "security", TS.minusSeconds(30));
        PatternMatch pattern = new PatternMatch("p1", "Brute force", "brute_force", "desc",
                Severity.HIGH, 0.8, List.of(other, event));
        when(incidentManager.createIncident(any(IncidentDraft.class))).thenReturn(incident("inc-9"));

        assertThat(dispatcher.dispatchPattern(pattern, event)).isTrue();

        verify(incidentManager, timeout(2000)).addCorrelatedEvent("inc-9", "evt-0", TS.minusSeconds(30), 0.8);
        verify(incidentManager, timeout(2000)).addCorrelatedEvent(eq("inc-9"), eq("evt-1"), eq(TS), eq(0.8));
    }

    @Test
    void shutdownShouldRunActionsOfMatchesHandledDuringDrain() {
        Incident created = incident("inc-1");
        when(incidentManager.findOpenIncident("r1", event, 15)).thenReturn(Optional.empty());
        when(incidentManager.createIncident(any(IncidentDraft.class))).thenAnswer(invocation -> {
            Thread.sleep(300);
            return created;
        });

        dispatcher.dispatch(rule, event, result);
        boolean drained = dispatcher.shutdown(Duration.ofSeconds(5));

        assertThat(drained).isTrue();
        verify(actionExecutor).executeActions(rule, created, event);
        assertThat(metrics.dispatchRejectedCount()).isZero();
    }

    @Test
    void dispatchAfterShutdownShouldBeRejected() {
        dispatcher.shutdown(Duration.ofSeconds(1));

        assertThat(dispatcher.dispatch(rule, event, result)).isFalse();
        assertThat(metrics.dispatchRejectedCount()).isEqualTo(1);
    }
}
