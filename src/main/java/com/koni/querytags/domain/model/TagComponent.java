package com.koni.querytags.domain.model;

import java.util.Optional;

/**
 * Renders one fragment of the query comment from the current context.
 */
@FunctionalInterface
public interface TagComponent {

    /**
     * @param context the context of the running request or job
     * @return the fragment value, or empty when the component has nothing to report
     */
    Optional<String> render(QueryTagsContext context);

    /**
     * Whether the rendered value only depends on the context. Components whose value
     * changes on every call (call site, current span) return {@code false}, which turns
     * off comment caching while they are active.
     */
    default boolean cacheable() {
        return true;
    }

    /**
     * Wraps a renderer whose value changes between calls.
     */
    static TagComponent volatileComponent(TagComponent delegate) {
        return new TagComponent() {
            @Override
            public Optional<String> render(QueryTagsContext context) {
                return delegate.render(context);
            }

            @Override
            public boolean cacheable() {
                return false;
            }
        };
    }
}
