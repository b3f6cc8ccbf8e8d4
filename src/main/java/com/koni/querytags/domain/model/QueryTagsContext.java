package com.koni.querytags.domain.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value annotations of one logical unit of execution (an HTTP request or a job run).
 *
 * The context also owns the cached comment rendered from its values and the stack of
 * inline annotations pushed by {@code withAnnotation} blocks. Instances are confined to
 * the thread that runs the unit and are not thread-safe.
 */
public class QueryTagsContext {

    private final Map<String, Object> values;
    private final Deque<String> inlineAnnotations;
    private String cachedComment;

    public QueryTagsContext() {
        this(new LinkedHashMap<>(), new ArrayDeque<>());
    }

    private QueryTagsContext(Map<String, Object> values, Deque<String> inlineAnnotations) {
        this.values = values;
        this.inlineAnnotations = inlineAnnotations;
    }

    /**
     * Merges the given entries into the context and drops the cached comment.
     * A {@code null} value removes the key.
     *
     * @param entries the entries to merge
     */
    public void update(Map<String, ?> entries) {
        if (entries == null) {
            return;
        }
        entries.forEach(this::put);
        cachedComment = null;
    }

    /**
     * Single-entry variant of {@link #update(Map)}.
     */
    public void update(String key, Object value) {
        put(key, value);
        cachedComment = null;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public Optional<String> getCachedComment() {
        return Optional.ofNullable(cachedComment);
    }

    public void setCachedComment(String comment) {
        this.cachedComment = comment;
    }

    public void clearCachedComment() {
        this.cachedComment = null;
    }

    public void pushAnnotation(String annotation) {
        inlineAnnotations.addLast(annotation == null ? "" : annotation);
    }

    public void popAnnotation() {
        inlineAnnotations.pollLast();
    }

    /**
     * @return active inline annotations, outermost first
     */
    public List<String> inlineAnnotations() {
        return Collections.unmodifiableList(new ArrayList<>(inlineAnnotations));
    }

    public boolean hasInlineAnnotations() {
        return !inlineAnnotations.isEmpty();
    }

    /**
     * Creates a child context seeded with this context's values and inline annotations.
     * The child starts without a cached comment, and changes made to it are not visible here.
     *
     * @return the forked context
     */
    public QueryTagsContext fork() {
        return new QueryTagsContext(new LinkedHashMap<>(values), new ArrayDeque<>(inlineAnnotations));
    }

    private void put(String key, Object value) {
        if (key == null) {
            return;
        }
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "QueryTagsContext{" +
                "values=" + values +
                ", inlineAnnotations=" + inlineAnnotations +
                ", cached=" + (cachedComment != null) +
                '}';
    }
}
