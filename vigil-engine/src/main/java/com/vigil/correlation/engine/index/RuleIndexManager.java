package com.vigil.correlation.engine.index;

import com.vigil.correlation.api.RuleStore;
import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.Rule;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active {@link RuleIndex} and rebuilds it from the rule store.
 *
 * <p>Reloads are serialized; readers call {@link #current()} without locking
 * and always see a complete index. A failed reload leaves the previous index
 * active.
 */
public class RuleIndexManager {
    private static final Logger logger = Logger.getLogger(RuleIndexManager.class.getName());

    private final RuleStore ruleStore;
    private final Tracer tracer;
    private final MembershipFilter.Factory filterFactory;

    /**
     * Holds the currently active index. Swapped atomically on reload.
     */
    private final AtomicReference<RuleIndex> activeIndex = new AtomicReference<>(RuleIndex.empty());

    private final List<Consumer<RuleIndex>> swapListeners = new CopyOnWriteArrayList<>();
    private volatile Consumer<RuleIndex> warmupCallback;

    private final Object reloadLock = new Object();

    public RuleIndexManager(RuleStore ruleStore, Tracer tracer) {
        this(ruleStore, tracer, ExactMembershipFilter.FACTORY);
    }

    public RuleIndexManager(RuleStore ruleStore, Tracer tracer, MembershipFilter.Factory filterFactory) {
        this.ruleStore = Objects.requireNonNull(ruleStore, "ruleStore must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.filterFactory = Objects.requireNonNull(filterFactory, "filterFactory must not be null");
    }

    public RuleIndex current() {
        return activeIndex.get();
    }

    /**
     * Registers a callback run synchronously right after each swap, before
     * warm-up. Used to invalidate caches tied to the previous generation.
     */
    public void addSwapListener(Consumer<RuleIndex> listener) {
        swapListeners.add(listener);
    }

    /**
     * Sets the callback run after each swap to pre-compute lookups for common
     * traffic. Failures are logged and do not fail the reload.
     */
    public void setWarmupCallback(Consumer<RuleIndex> callback) {
        this.warmupCallback = callback;
    }

    /**
     * Loads enabled rules, builds a new index and swaps it in.
     *
     * @return the new active index
     * @throws RuleLoadException if the store fails or the rules cannot be indexed
     */
    public RuleIndex reload() throws RuleLoadException {
        synchronized (reloadLock) {
            RuleIndex newIndex;
            Span span = tracer.spanBuilder("load-rule-index").startSpan();
            try (Scope scope = span.makeCurrent()) {
                long start = System.nanoTime();
                List<Rule> rules = ruleStore.loadEnabledRules();
                if (rules == null) {
                    throw new RuleLoadException("Rule store returned no rule list");
                }
                newIndex = RuleIndex.build(rules, filterFactory);
                activeIndex.set(newIndex);

                double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
                span.setAttribute("rules.active", newIndex.activeRules());
                span.setAttribute("index.keys", newIndex.indexedKeyCount());
                span.setAttribute("index.entries", newIndex.totalIndexEntries());
                logger.info(String.format("Rule index loaded: %d rules, %d keys, %d entries in %.2f ms",
                        newIndex.activeRules(), newIndex.indexedKeyCount(),
                        newIndex.totalIndexEntries(), elapsedMs));
            } catch (RuleLoadException e) {
                span.recordException(e);
                throw e;
            } catch (RuntimeException e) {
                span.recordException(e);
                throw new RuleLoadException("Failed to build rule index: " + e.getMessage(), e);
            } finally {
                span.end();
            }

            for (Consumer<RuleIndex> listener : swapListeners) {
                listener.accept(newIndex);
            }
            warmUp(newIndex);
            return newIndex;
        }
    }

    private void warmUp(RuleIndex index) {
        Consumer<RuleIndex> callback = warmupCallback;
        if (callback == null) {
            return;
        }
        Span warmupSpan = tracer.spanBuilder("cache-warmup").startSpan();
        try (Scope warmupScope = warmupSpan.makeCurrent()) {
            long warmupStart = System.nanoTime();
            callback.accept(index);
            double warmupMs = (System.nanoTime() - warmupStart) / 1_000_000.0;
            warmupSpan.setAttribute("warmupDurationMs", warmupMs);
            logger.info(String.format("Cache warmup completed in %.2f ms", warmupMs));
        } catch (Exception e) {
            warmupSpan.recordException(e);
            logger.log(Level.WARNING, "Cache warmup failed, continuing with cold cache", e);
        } finally {
            warmupSpan.end();
        }
    }
}
