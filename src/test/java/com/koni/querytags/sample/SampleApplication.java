package com.koni.querytags.sample;

import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Application booted by the integration tests. Every statement sent to the database
 * passes through {@link SqlCapture}.
 */
@SpringBootApplication
public class SampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(SampleApplication.class, args);
    }

    @Bean
    static BeanPostProcessor sqlCaptureDataSourcePostProcessor(ObjectProvider<SqlCapture> sqlCapture) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof DataSource) {
                    return ProxyDataSourceBuilder.create((DataSource) bean)
                            .name(beanName)
                            .listener(sqlCapture.getObject())
                            .build();
                }
                return bean;
            }
        };
    }
}
