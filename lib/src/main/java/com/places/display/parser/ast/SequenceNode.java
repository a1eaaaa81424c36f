package com.places.display.parser.ast;

import java.util.List;

/** Comma separated segments, evaluated left to right. */
public final class SequenceNode implements DisplayNode {
    private static final SequenceNode EMPTY = new SequenceNode(List.of());

    private final List<IdentifierNode> segments;

    public SequenceNode(List<IdentifierNode> segments) {
        this.segments = List.copyOf(segments);
    }

    public static SequenceNode empty() {
        return EMPTY;
    }

    public List<IdentifierNode> getSegments() {
        return segments;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
