package com.resourcex.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks service methods whose execution time is logged and reported in
 * the API response envelope
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Description of the operation being timed
     */
    String value() default "";

    /**
     * Log level for timing output
     */
    LogLevel logLevel() default LogLevel.DEBUG;

    /**
     * Calls taking longer than this many milliseconds are logged at WARN;
     * negative disables the check
     */
    long slowMillis() default -1;

    enum LogLevel {
        DEBUG, INFO
    }
}
