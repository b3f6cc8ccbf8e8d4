package com.koni.querytags.application.port;

import java.util.Optional;

/**
 * Port describing the database connection queries are sent to.
 * Implementations live in the infrastructure layer.
 */
public interface ConnectionDescriptor {

    Optional<String> host();

    Optional<String> database();

    Optional<String> socket();
}
