package com.koni.querytags.application.comment;

import com.koni.querytags.domain.model.NamedTagComponent;
import com.koni.querytags.domain.model.QueryTagsContext;
import com.koni.querytags.domain.model.SqlComments;
import com.koni.querytags.infrastructure.observability.QueryTagsMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Renders the query comments of a context.
 *
 * The regular comment joins the configured components as {@code name:value} pairs
 * separated by commas, for example {@code /*application:billing,action:index*}{@code /}.
 * The inline comment concatenates the active {@code withAnnotation} texts.
 * Both go through {@link SqlComments#wrap(String)}.
 */
@Slf4j
public class QueryCommentComposer {

    private final List<NamedTagComponent> components;
    private final boolean cacheEnabled;
    private final QueryTagsMetrics metrics;

    public QueryCommentComposer(List<NamedTagComponent> components, boolean cacheEnabled, QueryTagsMetrics metrics) {
        this.components = List.copyOf(components);
        this.cacheEnabled = cacheEnabled && components.stream().allMatch(c -> c.getComponent().cacheable());
        this.metrics = metrics;
        if (cacheEnabled && !this.cacheEnabled) {
            log.info("Query tags comment caching disabled: components {} change on every statement", components);
        }
    }

    public List<NamedTagComponent> getComponents() {
        return components;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    /**
     * Returns the component comment, from the context's cache when caching is enabled.
     *
     * @param context the current context
     * @return the comment, or an empty string when no component has a value
     */
    public String comment(QueryTagsContext context) {
        if (!cacheEnabled) {
            return uncachedComment(context);
        }
        Optional<String> cached = context.getCachedComment();
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();
        String comment = uncachedComment(context);
        context.setCachedComment(comment);
        return comment;
    }

    public String uncachedComment(QueryTagsContext context) {
        return SqlComments.wrap(tagContent(context));
    }

    /**
     * Returns the comment built from inline annotations. Never cached.
     *
     * @param context the current context
     * @return the comment, or an empty string when no annotation is active
     */
    public String inlineComment(QueryTagsContext context) {
        if (!context.hasInlineAnnotations()) {
            return "";
        }
        return SqlComments.wrap(String.join("", context.inlineAnnotations()));
    }

    public boolean tagsAvailable(QueryTagsContext context) {
        return !components.isEmpty() || context.hasInlineAnnotations();
    }

    private String tagContent(QueryTagsContext context) {
        StringJoiner content = new StringJoiner(",");
        for (NamedTagComponent component : components) {
            render(component, context)
                    .filter(value -> !value.isEmpty())
                    .ifPresent(value -> content.add(component.getName() + ":" + value));
        }
        return content.toString();
    }

    private Optional<String> render(NamedTagComponent component, QueryTagsContext context) {
        try {
            Optional<String> value = component.getComponent().render(context);
            return value == null ? Optional.empty() : value;
        } catch (RuntimeException e) {
            log.debug("Query tag component '{}' failed, leaving it out: {}", component.getName(), e.getMessage(), e);
            metrics.recordComponentFailure(component.getName());
            return Optional.empty();
        }
    }
}
