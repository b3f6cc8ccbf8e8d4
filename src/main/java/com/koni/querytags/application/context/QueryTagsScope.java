package com.koni.querytags.application.context;

import com.koni.querytags.domain.model.QueryTagsContext;
import lombok.extern.slf4j.Slf4j;

/**
 * A context bound to the current thread for the duration of one request or job.
 * Closing the scope restores the context that was bound before it was opened.
 */
@Slf4j
public class QueryTagsScope implements AutoCloseable {

    private final QueryTagsContext context;
    private final QueryTagsContext previous;
    private boolean closed;

    QueryTagsScope(QueryTagsContext context, QueryTagsContext previous) {
        this.context = context;
        this.previous = previous;
    }

    public QueryTagsContext getContext() {
        return context;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!QueryTagsContextHolder.isBound(context)) {
            // an inner scope was left open; restoring still unwinds past it
            log.debug("Closing query tags scope that is not the innermost one");
        }
        QueryTagsContextHolder.restore(previous);
    }
}
