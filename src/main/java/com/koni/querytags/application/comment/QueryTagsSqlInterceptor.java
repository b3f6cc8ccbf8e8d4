package com.koni.querytags.application.comment;

import com.koni.querytags.application.port.SqlInterceptor;
import com.koni.querytags.infrastructure.observability.QueryTagsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites outgoing statements with the comments of the current context.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryTagsSqlInterceptor implements SqlInterceptor {

    private final QueryTags queryTags;
    private final QueryTagsMetrics metrics;

    @Override
    public String intercept(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        String tagged = queryTags.addTagsToSql(sql);
        if (!tagged.equals(sql)) {
            metrics.recordStatementTagged();
            log.trace("Tagged statement: {}", tagged);
        }
        return tagged;
    }
}
