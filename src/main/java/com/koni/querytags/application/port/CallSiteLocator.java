package com.koni.querytags.application.port;

import java.util.Optional;

/**
 * Port that finds the application code responsible for the statement being executed,
 * skipping framework and library frames.
 */
public interface CallSiteLocator {

    /**
     * @return the first application frame of the current thread's stack, if any
     */
    Optional<StackTraceElement> locate();
}
