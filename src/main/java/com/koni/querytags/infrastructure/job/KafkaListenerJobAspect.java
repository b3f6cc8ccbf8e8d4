package com.koni.querytags.infrastructure.job;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

/**
 * Job hook for {@code @KafkaListener} and {@code @KafkaHandler} methods.
 * Only registered when spring-kafka is on the classpath.
 */
@Aspect
public class KafkaListenerJobAspect extends QueryTagsJobAspect {

    @Around("@annotation(org.springframework.kafka.annotation.KafkaListener)"
            + " || @annotation(org.springframework.kafka.annotation.KafkaHandler)")
    public Object aroundListener(ProceedingJoinPoint joinPoint) throws Throwable {
        return recordJob(joinPoint);
    }
}
