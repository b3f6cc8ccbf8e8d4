package com.koni.querytags.infrastructure.diagnostics;

import com.koni.querytags.application.port.CallSiteLocator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds the application frame that triggered a statement by walking the current stack and
 * skipping infrastructure layers (JDK, Spring, Hibernate, connection pools, this library).
 */
public class StackTraceCallSiteLocator implements CallSiteLocator {

    /**
     * Package prefixes that are never the meaningful caller of a statement.
     */
    public static final List<String> DEFAULT_IGNORED_PACKAGES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "jakarta.",
            "org.springframework.",
            "org.hibernate.",
            "org.aspectj.",
            "org.apache.catalina.",
            "org.apache.tomcat.",
            "org.apache.kafka.",
            "com.zaxxer.",
            "net.ttddyy.",
            "ch.qos.logback.",
            "io.micrometer.",
            "org.slf4j.",
            "org.junit.",
            "org.gradle.",
            "org.apache.maven.",
            "com.koni.querytags.domain.",
            "com.koni.querytags.application.",
            "com.koni.querytags.infrastructure."
    );

    private final List<String> ignoredPackages;

    public StackTraceCallSiteLocator() {
        this(List.of());
    }

    /**
     * @param additionalIgnoredPackages prefixes to skip on top of {@link #DEFAULT_IGNORED_PACKAGES}
     */
    public StackTraceCallSiteLocator(Collection<String> additionalIgnoredPackages) {
        List<String> packages = new ArrayList<>(DEFAULT_IGNORED_PACKAGES);
        additionalIgnoredPackages.stream()
                .map(String::trim)
                .filter(prefix -> !prefix.isEmpty())
                .forEach(packages::add);
        this.ignoredPackages = List.copyOf(packages);
    }

    @Override
    public Optional<StackTraceElement> locate() {
        return locate(Thread.currentThread().getStackTrace());
    }

    Optional<StackTraceElement> locate(StackTraceElement[] stackTrace) {
        return Arrays.stream(stackTrace)
                .filter(element -> !shouldIgnore(element.getClassName()))
                .findFirst();
    }

    private boolean shouldIgnore(String className) {
        // generated proxies and lambdas
        if (className.contains("$$")) {
            return true;
        }
        return ignoredPackages.stream().anyMatch(className::startsWith);
    }
}
