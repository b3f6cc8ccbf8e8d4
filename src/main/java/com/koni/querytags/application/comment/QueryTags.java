package com.koni.querytags.application.comment;

import com.koni.querytags.application.context.QueryTagsContextHolder;
import com.koni.querytags.domain.model.QueryTagsContext;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for application code: updates the current context, renders its comments,
 * and scopes inline annotations.
 *
 * <pre>
 * queryTags.update(Map.of("tenant", tenantId));
 * queryTags.withAnnotation("export", () -&gt; reportRepository.findAll());
 * </pre>
 */
public class QueryTags {

    private final QueryCommentComposer composer;
    private final SqlCommentInjector injector;

    public QueryTags(QueryCommentComposer composer, SqlCommentInjector injector) {
        this.composer = composer;
        this.injector = injector;
    }

    /**
     * Merges the entries into the current context and resets the cached comment.
     */
    public void update(Map<String, ?> entries) {
        context().update(entries);
    }

    public void update(String key, Object value) {
        context().update(key, value);
    }

    /**
     * Returns the component comment of the current context.
     * Sets and returns a cached comment when caching is enabled.
     */
    public String comment() {
        return composer.comment(context());
    }

    /**
     * Returns the comment built from active inline annotations.
     */
    public String inlineComment() {
        return composer.inlineComment(context());
    }

    public Optional<String> cachedComment() {
        return context().getCachedComment();
    }

    public void clearCommentCache() {
        context().clearCachedComment();
    }

    public boolean tagsAvailable() {
        return composer.tagsAvailable(context());
    }

    /**
     * Annotates every statement executed by the action. Can be nested.
     */
    public void withAnnotation(String annotation, Runnable action) {
        QueryTagsContext context = context();
        context.pushAnnotation(annotation);
        try {
            action.run();
        } finally {
            context.popAnnotation();
        }
    }

    /**
     * Annotates every statement executed by the operation and returns its result. Can be nested.
     */
    public <T> T withAnnotation(String annotation, Supplier<T> operation) {
        QueryTagsContext context = context();
        context.pushAnnotation(annotation);
        try {
            return operation.get();
        } finally {
            context.popAnnotation();
        }
    }

    /**
     * Adds the regular and inline comments of the current context to the statement.
     *
     * @param sql the statement about to be executed
     * @return the statement with comments, or unchanged when no tags are available
     */
    public String addTagsToSql(String sql) {
        QueryTagsContext context = context();
        if (!composer.tagsAvailable(context)) {
            return sql;
        }
        return injector.inject(sql, composer.comment(context), composer.inlineComment(context));
    }

    private QueryTagsContext context() {
        return QueryTagsContextHolder.current();
    }
}
