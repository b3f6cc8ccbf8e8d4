package com.koni.querytags.application.port;

/**
 * Port the persistence layer calls through before a statement is sent to the driver.
 */
@FunctionalInterface
public interface SqlInterceptor {

    /**
     * @param sql the statement about to be executed
     * @return the statement to execute instead
     */
    String intercept(String sql);
}
