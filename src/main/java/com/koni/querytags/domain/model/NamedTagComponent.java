package com.koni.querytags.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A registered component together with the name it is rendered under.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class NamedTagComponent {

    private final String name;
    private final TagComponent component;

    @Override
    public String toString() {
        return name;
    }
}
