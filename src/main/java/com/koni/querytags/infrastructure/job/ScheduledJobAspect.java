package com.koni.querytags.infrastructure.job;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

/**
 * Job hook for {@code @Scheduled} methods.
 */
@Aspect
public class ScheduledJobAspect extends QueryTagsJobAspect {

    @Around("@annotation(org.springframework.scheduling.annotation.Scheduled)")
    public Object aroundScheduled(ProceedingJoinPoint joinPoint) throws Throwable {
        return recordJob(joinPoint);
    }
}
