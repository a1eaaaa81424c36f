package com.places.display.parser.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One segment of an expression: an option name, the filter that conditions its own resolution and
 * the fallback evaluated when that filtered resolution yields nothing. The name may be empty, in
 * which case only the fallback can contribute.
 */
public final class IdentifierNode implements DisplayNode {
    private final String name;
    private final SourceLocation location;
    private final FilterNode filter;
    private final FallbackNode fallback;

    public IdentifierNode(String name, SourceLocation location, FilterNode filter, FallbackNode fallback) {
        this.name = Objects.requireNonNull(name, "name");
        this.location = Objects.requireNonNull(location, "location");
        this.filter = filter == null ? FilterNode.none() : filter;
        this.fallback = fallback;
    }

    public static IdentifierNode of(String name) {
        return new IdentifierNode(name, SourceLocation.UNKNOWN, null, null);
    }

    public String getName() {
        return name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public FilterNode getFilter() {
        return filter;
    }

    public Optional<FallbackNode> getFallback() {
        return Optional.ofNullable(fallback);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(name);
        if (!filter.isEmpty()) {
            builder.append(filter);
        }
        if (fallback != null) {
            builder.append(fallback);
        }
        return builder.toString();
    }
}
