package com.koni.querytags.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Component for tracking query tagging metrics.
 * Provides counters for tagged statements, comment cache usage and component failures.
 */
@Slf4j
public class QueryTagsMetrics {

    private final MeterRegistry registry;
    private final Counter statementsTagged;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public QueryTagsMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.statementsTagged = Counter.builder("query_tags.statements.tagged.total")
                .description("Total SQL statements rewritten with a query tags comment")
                .register(registry);

        this.cacheHits = Counter.builder("query_tags.cache.hits.total")
                .description("Total comments served from the per-context cache")
                .register(registry);

        this.cacheMisses = Counter.builder("query_tags.cache.misses.total")
                .description("Total comments rendered because the cache was empty")
                .register(registry);
    }

    /**
     * Increment the counter for statements that received a comment.
     */
    public void recordStatementTagged() {
        statementsTagged.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    /**
     * Increment the failure counter of the given component.
     *
     * @param component name of the component that threw while rendering
     */
    public void recordComponentFailure(String component) {
        Counter.builder("query_tags.component.failures.total")
                .description("Total component renders that failed and were skipped")
                .tag("component", component)
                .register(registry)
                .increment();
        log.debug("Component failure counter incremented: component={}", component);
    }
}
