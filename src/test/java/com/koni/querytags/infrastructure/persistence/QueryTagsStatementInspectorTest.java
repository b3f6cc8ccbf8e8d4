package com.koni.querytags.infrastructure.persistence;

import com.koni.querytags.application.port.SqlInterceptor;
import com.koni.querytags.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueryTagsStatementInspector.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class QueryTagsStatementInspectorTest {

    @Mock
    private SqlInterceptor sqlInterceptor;

    @Test
    void shouldReturnInterceptedStatement() {
        when(sqlInterceptor.intercept("select id from dashboards"))
                .thenReturn("select id from dashboards /*application:billing*/");

        QueryTagsStatementInspector inspector = new QueryTagsStatementInspector(sqlInterceptor);

        assertThat(inspector.inspect("select id from dashboards"))
                .isEqualTo("select id from dashboards /*application:billing*/");
    }
}
