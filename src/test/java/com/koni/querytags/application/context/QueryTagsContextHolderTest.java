package com.koni.querytags.application.context;

import com.koni.querytags.domain.model.QueryTagsContext;
import com.koni.querytags.tags.UnitTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for QueryTagsContextHolder and QueryTagsScope.
 */
@UnitTest
class QueryTagsContextHolderTest {

    @AfterEach
    void tearDown() {
        QueryTagsContextHolder.reset();
    }

    @Test
    void shouldCreateRootContextLazily() {
        QueryTagsContext first = QueryTagsContextHolder.current();
        QueryTagsContext second = QueryTagsContextHolder.current();

        assertThat(first).isSameAs(second);
    }

    @Test
    void shouldBindForkedContextUntilScopeCloses() {
        QueryTagsContext root = QueryTagsContextHolder.current();
        root.update("application_name", "billing");

        try (QueryTagsScope scope = QueryTagsContextHolder.openScope()) {
            assertThat(QueryTagsContextHolder.current()).isSameAs(scope.getContext()).isNotSameAs(root);
            assertThat(scope.getContext().get("application_name")).contains("billing");

            scope.getContext().update("controller", "dashboard");
        }

        assertThat(QueryTagsContextHolder.current()).isSameAs(root);
        assertThat(root.get("controller")).isEmpty();
    }

    @Test
    void shouldRestoreNestedScopesInOrder() {
        QueryTagsScope outer = QueryTagsContextHolder.openScope();
        QueryTagsScope inner = QueryTagsContextHolder.openScope();

        inner.close();
        assertThat(QueryTagsContextHolder.current()).isSameAs(outer.getContext());

        outer.close();
        assertThat(QueryTagsContextHolder.current()).isNotSameAs(outer.getContext());
    }

    @Test
    void shouldIgnoreSecondClose() {
        QueryTagsContext root = QueryTagsContextHolder.current();
        QueryTagsScope scope = QueryTagsContextHolder.openScope();

        scope.close();
        QueryTagsScope next = QueryTagsContextHolder.openScope();
        scope.close();

        assertThat(QueryTagsContextHolder.current()).isSameAs(next.getContext());
        next.close();
        assertThat(QueryTagsContextHolder.current()).isSameAs(root);
    }

    @Test
    void shouldIsolateContextsBetweenThreads() throws Exception {
        QueryTagsContextHolder.current().update("controller", "dashboard");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Optional<Object> seenByOtherThread = CompletableFuture
                    .supplyAsync(() -> QueryTagsContextHolder.current().get("controller"), executor)
                    .get(5, TimeUnit.SECONDS);

            assertThat(seenByOtherThread).isEmpty();
        } finally {
            executor.shutdownNow();
        }
        assertThat(QueryTagsContextHolder.current().get("controller")).contains("dashboard");
    }
}
