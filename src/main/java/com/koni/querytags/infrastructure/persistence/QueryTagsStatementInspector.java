package com.koni.querytags.infrastructure.persistence;

import com.koni.querytags.application.port.SqlInterceptor;
import lombok.RequiredArgsConstructor;
import org.hibernate.resource.jdbc.spi.StatementInspector;

/**
 * Hibernate hook that passes every statement prepared by the session factory through the
 * {@link SqlInterceptor}, so entity operations, JPQL and native queries are all tagged.
 *
 * Installed by {@code QueryTagsAutoConfiguration} through a {@code HibernatePropertiesCustomizer}.
 */
@RequiredArgsConstructor
public class QueryTagsStatementInspector implements StatementInspector {

    private final SqlInterceptor sqlInterceptor;

    @Override
    public String inspect(String sql) {
        return sqlInterceptor.intercept(sql);
    }
}
