package com.places.display.parser.ast;

import java.util.Objects;

/** Bracketed sub-expression used when the preceding identifier resolves to nothing. */
public final class FallbackNode implements DisplayNode {
    private final SequenceNode body;

    public FallbackNode(SequenceNode body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public SequenceNode getBody() {
        return body;
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public String toString() {
        return "[" + body + "]";
    }
}
