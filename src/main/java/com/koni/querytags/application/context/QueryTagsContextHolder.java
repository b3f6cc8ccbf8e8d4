package com.koni.querytags.application.context;

import com.koni.querytags.domain.model.QueryTagsContext;

/**
 * Binds the {@link QueryTagsContext} of the running unit of work to the current thread.
 *
 * Request and job hooks call {@link #openScope()} when the unit starts and close the
 * returned scope when it ends. Code running outside any scope shares a root context per
 * thread, created on first access.
 */
public final class QueryTagsContextHolder {

    private static final ThreadLocal<QueryTagsContext> CURRENT = new ThreadLocal<>();

    private QueryTagsContextHolder() {
    }

    public static QueryTagsContext current() {
        QueryTagsContext context = CURRENT.get();
        if (context == null) {
            context = new QueryTagsContext();
            CURRENT.set(context);
        }
        return context;
    }

    /**
     * Binds a context forked from the current one until the returned scope is closed.
     *
     * @return the scope to close when the unit of work ends
     */
    public static QueryTagsScope openScope() {
        QueryTagsContext previous = CURRENT.get();
        QueryTagsContext scoped = previous == null ? new QueryTagsContext() : previous.fork();
        CURRENT.set(scoped);
        return new QueryTagsScope(scoped, previous);
    }

    /**
     * Drops the context bound to the current thread.
     */
    public static void reset() {
        CURRENT.remove();
    }

    static void restore(QueryTagsContext previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    static boolean isBound(QueryTagsContext context) {
        return CURRENT.get() == context;
    }
}
