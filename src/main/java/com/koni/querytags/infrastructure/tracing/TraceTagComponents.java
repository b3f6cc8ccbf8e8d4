package com.koni.querytags.infrastructure.tracing;

import com.koni.querytags.application.component.TagComponentRegistrar;
import com.koni.querytags.application.component.TagComponentRegistry;
import com.koni.querytags.domain.model.TagComponent;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.TraceContext;
import io.micrometer.tracing.Tracer;
import lombok.RequiredArgsConstructor;

import java.util.Optional;
import java.util.function.Function;

/**
 * Registers {@code trace_id} and {@code span_id} components reading the current span,
 * so statements can be joined with distributed traces.
 * Both change on every span and therefore disable comment caching when configured.
 */
@RequiredArgsConstructor
public class TraceTagComponents implements TagComponentRegistrar {

    public static final String TRACE_ID = "trace_id";
    public static final String SPAN_ID = "span_id";

    private final Tracer tracer;

    @Override
    public void register(TagComponentRegistry registry) {
        registry.register(TRACE_ID, currentSpan(TraceContext::traceId))
                .register(SPAN_ID, currentSpan(TraceContext::spanId));
    }

    private TagComponent currentSpan(Function<TraceContext, String> id) {
        return TagComponent.volatileComponent(context -> {
            Span span = tracer.currentSpan();
            if (span == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(id.apply(span.context()));
        });
    }
}
