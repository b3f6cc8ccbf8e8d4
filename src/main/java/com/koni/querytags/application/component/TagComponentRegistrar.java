package com.koni.querytags.application.component;

/**
 * Callback for contributing custom components. Declare an implementation as a bean and it
 * is applied before the configured component list is resolved.
 */
@FunctionalInterface
public interface TagComponentRegistrar {

    void register(TagComponentRegistry registry);
}
