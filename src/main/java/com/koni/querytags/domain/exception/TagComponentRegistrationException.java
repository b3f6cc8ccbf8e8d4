package com.koni.querytags.domain.exception;

/**
 * Exception thrown when a component cannot be added to the registry,
 * either because its name is blank or because the name is already taken.
 */
public class TagComponentRegistrationException extends RuntimeException {

    public TagComponentRegistrationException(String message) {
        super(message);
    }
}
