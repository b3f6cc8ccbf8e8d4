package com.koni.querytags.infrastructure.config;

import com.koni.querytags.application.comment.QueryCommentComposer;
import com.koni.querytags.application.comment.QueryTags;
import com.koni.querytags.application.comment.QueryTagsSqlInterceptor;
import com.koni.querytags.application.comment.SqlCommentInjector;
import com.koni.querytags.application.component.BuiltInTagComponents;
import com.koni.querytags.application.component.TagComponentRegistrar;
import com.koni.querytags.application.component.TagComponentRegistry;
import com.koni.querytags.application.port.CallSiteLocator;
import com.koni.querytags.application.port.ConnectionDescriptor;
import com.koni.querytags.application.port.SqlInterceptor;
import com.koni.querytags.domain.model.NamedTagComponent;
import com.koni.querytags.infrastructure.diagnostics.StackTraceCallSiteLocator;
import com.koni.querytags.infrastructure.job.KafkaListenerJobAspect;
import com.koni.querytags.infrastructure.job.ScheduledJobAspect;
import com.koni.querytags.infrastructure.observability.QueryTagsMetrics;
import com.koni.querytags.infrastructure.persistence.JdbcUrlConnectionDescriptor;
import com.koni.querytags.infrastructure.persistence.QueryTagsStatementInspector;
import com.koni.querytags.infrastructure.tracing.TraceTagComponents;
import com.koni.querytags.infrastructure.web.QueryTagsHandlerInterceptor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.cfg.AvailableSettings;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;
import java.util.List;

/**
 * Auto-configuration for SQL query tags.
 *
 * Installs the Hibernate statement inspector that comments every statement, plus the
 * request and job hooks that record controller, action and job in the context.
 * Nothing is installed unless {@code query-tags.enabled=true}.
 */
@Slf4j
@AutoConfiguration(before = HibernateJpaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "query-tags", name = "enabled", havingValue = "true")
public class QueryTagsAutoConfiguration {

    @Value("${query-tags.components:application,controller,action,job}")
    private String[] components;

    @Value("${query-tags.cache-comment:true}")
    private boolean cacheComment;

    @Value("${query-tags.prepend-comment:false}")
    private boolean prependComment;

    @Value("${query-tags.application-name:${spring.application.name:}}")
    private String applicationName;

    @Value("${query-tags.line.ignored-packages:}")
    private String[] ignoredPackages;

    @Value("${query-tags.database.socket:}")
    private String socket;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @Bean
    @ConditionalOnMissingBean
    public QueryTagsMetrics queryTagsMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new QueryTagsMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionDescriptor queryTagsConnectionDescriptor() {
        return JdbcUrlConnectionDescriptor.parse(datasourceUrl, socket);
    }

    @Bean
    @ConditionalOnMissingBean
    public CallSiteLocator queryTagsCallSiteLocator() {
        return new StackTraceCallSiteLocator(Arrays.asList(ignoredPackages));
    }

    /**
     * Creates the registry with the built-in components, trace components when a tracer
     * is available, and every {@link TagComponentRegistrar} bean.
     */
    @Bean
    public TagComponentRegistry tagComponentRegistry(ConnectionDescriptor connectionDescriptor,
                                                     CallSiteLocator callSiteLocator,
                                                     ObjectProvider<Tracer> tracer,
                                                     ObjectProvider<TagComponentRegistrar> registrars) {
        TagComponentRegistry registry = new TagComponentRegistry();
        BuiltInTagComponents.registerAll(registry, applicationName, connectionDescriptor, callSiteLocator);
        tracer.ifAvailable(t -> new TraceTagComponents(t).register(registry));
        registrars.orderedStream().forEach(registrar -> registrar.register(registry));
        return registry;
    }

    /**
     * Resolves the configured component list. Fails startup on an unknown component name.
     */
    @Bean
    public QueryCommentComposer queryCommentComposer(TagComponentRegistry registry, QueryTagsMetrics metrics) {
        List<NamedTagComponent> resolved = registry.resolve(Arrays.asList(components));
        return new QueryCommentComposer(resolved, cacheComment, metrics);
    }

    @Bean
    public SqlCommentInjector sqlCommentInjector() {
        return new SqlCommentInjector(prependComment);
    }

    @Bean
    public QueryTags queryTags(QueryCommentComposer composer, SqlCommentInjector injector) {
        return new QueryTags(composer, injector);
    }

    @Bean
    public SqlInterceptor queryTagsSqlInterceptor(QueryTags queryTags, QueryTagsMetrics metrics) {
        return new QueryTagsSqlInterceptor(queryTags, metrics);
    }

    /**
     * Hands the statement inspector to Hibernate when the session factory is built.
     */
    @Bean
    public HibernatePropertiesCustomizer queryTagsHibernatePropertiesCustomizer(SqlInterceptor queryTagsSqlInterceptor,
                                                                                QueryCommentComposer composer) {
        return properties -> {
            if (properties.containsKey(AvailableSettings.STATEMENT_INSPECTOR)) {
                log.warn("Replacing configured statement inspector {} with query tags",
                        properties.get(AvailableSettings.STATEMENT_INSPECTOR));
            }
            properties.put(AvailableSettings.STATEMENT_INSPECTOR, new QueryTagsStatementInspector(queryTagsSqlInterceptor));
            log.info("Query tags enabled: components={}, cache={}, prepend={}",
                    composer.getComponents(), composer.isCacheEnabled(), prependComment);
        };
    }

    /**
     * Request hook, on by default. Disable with {@code query-tags.action-filter-enabled=false}.
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(WebMvcConfigurer.class)
    @ConditionalOnProperty(prefix = "query-tags", name = "action-filter-enabled", havingValue = "true", matchIfMissing = true)
    static class QueryTagsWebConfiguration implements WebMvcConfigurer {

        @Bean
        public QueryTagsHandlerInterceptor queryTagsHandlerInterceptor() {
            return new QueryTagsHandlerInterceptor();
        }

        @Override
        public void addInterceptors(InterceptorRegistry registry) {
            registry.addInterceptor(queryTagsHandlerInterceptor());
        }
    }

    /**
     * Job hooks, on by default. Disable with {@code query-tags.job-filter-enabled=false}.
     * Scheduled methods only need AspectJ; Kafka listeners also need spring-kafka.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    @ConditionalOnProperty(prefix = "query-tags", name = "job-filter-enabled", havingValue = "true", matchIfMissing = true)
    static class QueryTagsJobConfiguration {

        @Bean
        public ScheduledJobAspect scheduledJobAspect() {
            return new ScheduledJobAspect();
        }

        @Configuration(proxyBeanMethods = false)
        @ConditionalOnClass(name = "org.springframework.kafka.annotation.KafkaListener")
        static class QueryTagsKafkaJobConfiguration {

            @Bean
            public KafkaListenerJobAspect kafkaListenerJobAspect() {
                return new KafkaListenerJobAspect();
            }
        }
    }
}
