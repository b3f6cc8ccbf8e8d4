package com.koni.querytags.infrastructure.job;

import com.koni.querytags.application.component.BuiltInTagComponents;
import com.koni.querytags.application.context.QueryTagsContextHolder;
import com.koni.querytags.application.context.QueryTagsScope;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.springframework.util.ClassUtils;

/**
 * Records the job class around one job execution, in a query tags scope that lives as
 * long as the execution. Subclasses bind it to the job annotations of one framework.
 */
@Slf4j
public abstract class QueryTagsJobAspect {

    protected Object recordJob(ProceedingJoinPoint joinPoint) throws Throwable {
        Class<?> jobType = ClassUtils.getUserClass(joinPoint.getSignature().getDeclaringType());
        if (joinPoint.getTarget() != null) {
            jobType = ClassUtils.getUserClass(joinPoint.getTarget());
        }

        try (QueryTagsScope scope = QueryTagsContextHolder.openScope()) {
            scope.getContext().update(BuiltInTagComponents.JOB, jobType);
            log.debug("Recorded query tags for job: job={}, method={}",
                    jobType.getName(), joinPoint.getSignature().getName());
            try {
                return joinPoint.proceed();
            } finally {
                scope.getContext().update(BuiltInTagComponents.JOB, null);
            }
        }
    }
}
