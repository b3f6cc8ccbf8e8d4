package com.koni.querytags.application.component;

import com.koni.querytags.domain.exception.TagComponentRegistrationException;
import com.koni.querytags.domain.exception.UnknownTagComponentException;
import com.koni.querytags.domain.model.NamedTagComponent;
import com.koni.querytags.domain.model.TagComponent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps component names to their renderers, in registration order.
 *
 * Names are validated when components are registered and when the configured list is
 * resolved, so rendering never looks a name up.
 */
@Slf4j
public class TagComponentRegistry {

    private final Map<String, TagComponent> components = new LinkedHashMap<>();

    /**
     * Registers a component under the given name.
     *
     * @throws TagComponentRegistrationException if the name is blank or already registered
     */
    public TagComponentRegistry register(String name, TagComponent component) {
        if (name == null || name.isBlank()) {
            throw new TagComponentRegistrationException("Component name must not be blank");
        }
        if (component == null) {
            throw new TagComponentRegistrationException("Component '" + name + "' must not be null");
        }
        if (components.containsKey(name)) {
            throw new TagComponentRegistrationException("Component '" + name + "' is already registered");
        }
        components.put(name, component);
        log.debug("Registered query tag component: {}", name);
        return this;
    }

    public boolean contains(String name) {
        return components.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(components.keySet());
    }

    /**
     * Resolves the configured component names, keeping their order and duplicates.
     *
     * @param names the configured component list
     * @return the components to render, in output order
     * @throws UnknownTagComponentException if a name was never registered
     */
    public List<NamedTagComponent> resolve(List<String> names) {
        List<NamedTagComponent> resolved = new ArrayList<>();
        if (names == null) {
            return resolved;
        }
        for (String raw : names) {
            String name = raw == null ? "" : raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            TagComponent component = components.get(name);
            if (component == null) {
                throw new UnknownTagComponentException(name);
            }
            resolved.add(new NamedTagComponent(name, component));
        }
        return Collections.unmodifiableList(resolved);
    }
}
