package com.koni.querytags.domain.exception;

/**
 * Exception thrown when the configured component list names a component
 * that was never registered.
 */
public class UnknownTagComponentException extends RuntimeException {

    private final String componentName;

    public UnknownTagComponentException(String componentName) {
        super("Unknown query tag component: " + componentName);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
