package com.resourcex.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Measures {@link Timed} methods and keeps the last duration per thread for
 * the controller's response envelope
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        String operation = timed.value().isEmpty() ? methodName : timed.value();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);

            if (timed.slowMillis() >= 0 && duration > timed.slowMillis()) {
                log.warn("{}#{} ({}) took {}ms, over {}ms", className, methodName, operation, duration,
                        timed.slowMillis());
            } else if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{}#{} ({}) executed in {}ms", className, methodName, operation, duration);
            } else {
                log.debug("{}#{} ({}) executed in {}ms", className, methodName, operation, duration);
            }
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            log.warn("{}#{} ({}) failed after {}ms: {}", className, methodName, operation, duration, e.getMessage());
            throw e;
        }
    }

    /**
     * Get the execution time for the current thread and clear it
     */
    public static String getAndClearExecutionTime() {
        Long duration = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        return duration != null ? duration + "ms" : "0ms";
    }
}
