package com.places.display.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Allow and deny lists narrowing which values an identifier accepts. Value sets hold trimmed,
 * lower-cased tokens. Attribute predicates are keyed by the (lower-cased) option name of another
 * attribute and condition acceptance on that attribute's current value.
 */
public final class FilterNode implements DisplayNode {
    private static final FilterNode NONE = new FilterNode(Set.of(), Set.of(), Map.of(), Map.of());

    private final Set<String> include;
    private final Set<String> exclude;
    private final Map<String, Set<String>> includeAttributes;
    private final Map<String, Set<String>> excludeAttributes;

    public FilterNode(
            Set<String> include,
            Set<String> exclude,
            Map<String, Set<String>> includeAttributes,
            Map<String, Set<String>> excludeAttributes) {
        this.include = copySet(include);
        this.exclude = copySet(exclude);
        this.includeAttributes = copyMap(includeAttributes);
        this.excludeAttributes = copyMap(excludeAttributes);
    }

    public static FilterNode none() {
        return NONE;
    }

    public static FilterNode including(Set<String> values) {
        return new FilterNode(values, Set.of(), Map.of(), Map.of());
    }

    public static FilterNode excluding(Set<String> values) {
        return new FilterNode(Set.of(), values, Map.of(), Map.of());
    }

    public Set<String> getInclude() {
        return include;
    }

    public Set<String> getExclude() {
        return exclude;
    }

    public Map<String, Set<String>> getIncludeAttributes() {
        return includeAttributes;
    }

    public Map<String, Set<String>> getExcludeAttributes() {
        return excludeAttributes;
    }

    public boolean isEmpty() {
        return include.isEmpty()
                && exclude.isEmpty()
                && includeAttributes.isEmpty()
                && excludeAttributes.isEmpty();
    }

    private static Set<String> copySet(Set<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(values, "values")));
    }

    private static Map<String, Set<String>> copyMap(Map<String, Set<String>> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : values.entrySet()) {
            copy.put(entry.getKey(), copySet(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FilterNode)) {
            return false;
        }
        FilterNode other = (FilterNode) obj;
        return include.equals(other.include)
                && exclude.equals(other.exclude)
                && includeAttributes.equals(other.includeAttributes)
                && excludeAttributes.equals(other.excludeAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(include, exclude, includeAttributes, excludeAttributes);
    }

    @Override
    public String toString() {
        return "(include="
                + include
                + ", exclude="
                + exclude
                + ", includeAttributes="
                + includeAttributes
                + ", excludeAttributes="
                + excludeAttributes
                + ")";
    }
}
