package com.koni.querytags.infrastructure.job;

import com.koni.querytags.application.context.QueryTagsContextHolder;
import com.koni.querytags.domain.model.QueryTagsContext;
import com.koni.querytags.tags.UnitTest;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.Signature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the job aspects.
 * Tests that the job class is visible while the job runs and removed afterwards.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class QueryTagsJobAspectTest {

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private Signature signature;

    private final ScheduledJobAspect aspect = new ScheduledJobAspect();

    @BeforeEach
    void setUp() {
        when(joinPoint.getSignature()).thenReturn(signature);
        lenient().when(signature.getDeclaringType()).thenReturn(CleanupJob.class);
        lenient().when(signature.getName()).thenReturn("perform");
        lenient().when(joinPoint.getTarget()).thenReturn(new CleanupJob());
    }

    @AfterEach
    void tearDown() {
        QueryTagsContextHolder.reset();
    }

    @Test
    void shouldExposeJobWhileProceeding() throws Throwable {
        QueryTagsContext outer = QueryTagsContextHolder.current();
        AtomicReference<Optional<Object>> seen = new AtomicReference<>();
        when(joinPoint.proceed()).thenAnswer(invocation -> {
            seen.set(QueryTagsContextHolder.current().get("job"));
            return "done";
        });

        Object result = aspect.aroundScheduled(joinPoint);

        assertThat(result).isEqualTo("done");
        assertThat(seen.get()).contains(CleanupJob.class);
        assertThat(QueryTagsContextHolder.current()).isSameAs(outer);
        assertThat(outer.get("job")).isEmpty();
    }

    @Test
    void shouldRestoreContextWhenJobFails() throws Throwable {
        QueryTagsContext outer = QueryTagsContextHolder.current();
        outer.update("application_name", "worker");
        when(joinPoint.proceed()).thenThrow(new IllegalStateException("job failed"));

        assertThatThrownBy(() -> aspect.aroundScheduled(joinPoint))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("job failed");

        assertThat(QueryTagsContextHolder.current()).isSameAs(outer);
        assertThat(outer.get("job")).isEmpty();
        assertThat(outer.get("application_name")).contains("worker");
    }

    @Test
    void shouldFallBackToDeclaringTypeWithoutTarget() throws Throwable {
        AtomicReference<Optional<Object>> seen = new AtomicReference<>();
        when(joinPoint.getTarget()).thenReturn(null);
        when(joinPoint.proceed()).thenAnswer(invocation -> {
            seen.set(QueryTagsContextHolder.current().get("job"));
            return null;
        });

        aspect.aroundScheduled(joinPoint);

        assertThat(seen.get()).contains(CleanupJob.class);
    }

    @Test
    void shouldExposeJobWhileKafkaListenerRuns() throws Throwable {
        AtomicReference<Optional<Object>> seen = new AtomicReference<>();
        when(joinPoint.proceed()).thenAnswer(invocation -> {
            seen.set(QueryTagsContextHolder.current().get("job"));
            return null;
        });

        new KafkaListenerJobAspect().aroundListener(joinPoint);

        assertThat(seen.get()).contains(CleanupJob.class);
        assertThat(QueryTagsContextHolder.current().get("job")).isEmpty();
    }

    static class CleanupJob {
    }
}
