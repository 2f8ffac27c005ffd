package com.vigil.correlation.engine.index;

import com.vigil.correlation.api.RuleStore;
import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.api.model.RuleCondition;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RuleIndexManagerTest {

    @Mock
    private RuleStore ruleStore;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private RuleIndexManager manager;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);

        manager = new RuleIndexManager(ruleStore, tracer);
    }

    private static List<Rule> rules(String... ids) {
        List<Rule> rules = new ArrayList<>();
        for (String id : ids) {
            rules.add(Rule.builder(id).condition(RuleCondition.equalsCondition("event_id", id)).build());
        }
        return rules;
    }

    @Test
    void shouldStartWithEmptyIndex() {
        assertThat(manager.current().activeRules()).isZero();
    }

    @Test
    void shouldSwapInNewIndexOnReload() throws Exception {
        when(ruleStore.loadEnabledRules()).thenReturn(rules("4624", "4625"));

        RuleIndex index = manager.reload();

        assertThat(manager.current()).isSameAs(index);
        assertThat(index.activeRules()).isEqualTo(2);
        verify(tracer).spanBuilder("load-rule-index");
        verify(span, atLeastOnce()).end();
    }

    @Test
    void failedReloadShouldKeepPreviousIndex() throws Exception {
        when(ruleStore.loadEnabledRules())
                .thenReturn(rules("4624"))
                .thenThrow(new RuleLoadException("table missing"));
        RuleIndex first = manager.reload();

        assertThatThrownBy(() -> manager.reload())
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("table missing");
        assertThat(manager.current()).isSameAs(first);
        verify(span).recordException(any(RuleLoadException.class));
    }

    @Test
    void unexpectedStoreFailureShouldBeWrapped() throws Exception {
        when(ruleStore.loadEnabledRules()).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> manager.reload())
                .isInstanceOf(RuleLoadException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(manager.current().activeRules()).isZero();
    }

    @Test
    void nullRuleListShouldFailReload() throws Exception {
        when(ruleStore.loadEnabledRules()).thenReturn(null);

        assertThatThrownBy(() -> manager.reload()).isInstanceOf(RuleLoadException.class);
    }

    @Test
    void shouldRunSwapListenersBeforeWarmup() throws Exception {
        when(ruleStore.loadEnabledRules()).thenReturn(rules("4625"));
        List<String> calls = new ArrayList<>();
        manager.addSwapListener(index -> calls.add("swap:" + index.activeRules()));
        manager.setWarmupCallback(index -> calls.add("warmup:" + index.activeRules()));

        manager.reload();

        assertThat(calls).containsExactly("swap:1", "warmup:1");
        verify(tracer).spanBuilder("cache-warmup");
    }

    @Test
    void warmupFailureShouldNotFailReload() throws Exception {
        when(ruleStore.loadEnabledRules()).thenReturn(rules("4625"));
        AtomicInteger attempts = new AtomicInteger();
        manager.setWarmupCallback(index -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("cold");
        });

        RuleIndex index = manager.reload();

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(manager.current()).isSameAs(index);
    }
}
