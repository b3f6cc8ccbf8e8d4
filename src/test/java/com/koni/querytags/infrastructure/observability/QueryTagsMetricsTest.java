package com.koni.querytags.infrastructure.observability;

import com.koni.querytags.tags.UnitTest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for QueryTagsMetrics.
 */
@UnitTest
class QueryTagsMetricsTest {

    private MeterRegistry meterRegistry;
    private QueryTagsMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new QueryTagsMetrics(meterRegistry);
    }

    @Test
    void shouldRegisterCountersAtZero() {
        assertThat(meterRegistry.find("query_tags.statements.tagged.total").counter().count()).isZero();
        assertThat(meterRegistry.find("query_tags.cache.hits.total").counter().count()).isZero();
        assertThat(meterRegistry.find("query_tags.cache.misses.total").counter().count()).isZero();
    }

    @Test
    void shouldIncrementCounters() {
        metrics.recordStatementTagged();
        metrics.recordStatementTagged();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();

        assertThat(meterRegistry.find("query_tags.statements.tagged.total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.find("query_tags.cache.hits.total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("query_tags.cache.misses.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountFailuresPerComponent() {
        metrics.recordComponentFailure("db_host");
        metrics.recordComponentFailure("db_host");
        metrics.recordComponentFailure("line");

        assertThat(meterRegistry.find("query_tags.component.failures.total")
                .tag("component", "db_host").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.find("query_tags.component.failures.total")
                .tag("component", "line").counter().count()).isEqualTo(1.0);
    }
}
