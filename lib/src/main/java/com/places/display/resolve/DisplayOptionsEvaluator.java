package com.places.display.resolve;

import com.places.display.parser.ast.FallbackNode;
import com.places.display.parser.ast.IdentifierNode;
import com.places.display.parser.ast.SequenceNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a parsed expression in order, appending each resolved segment to the state and splicing in
 * a segment's fallback when the segment itself resolves to nothing.
 */
public final class DisplayOptionsEvaluator {
    private final OptionResolver resolver;

    public DisplayOptionsEvaluator(OptionResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ResolutionState evaluate(SequenceNode expression) {
        ResolutionState state = new ResolutionState();
        evaluate(expression, state);
        return state;
    }

    public void evaluate(SequenceNode expression, ResolutionState state) {
        for (IdentifierNode segment : expression.getSegments()) {
            String resolved = resolver.resolve(segment.getName(), segment.getFilter(), state);
            if (resolved != null) {
                state.appendFragment(resolved);
                continue;
            }
            Optional<FallbackNode> fallback = segment.getFallback();
            if (fallback.isPresent() && !fallback.get().isEmpty()) {
                evaluate(fallback.get().getBody(), state);
            }
        }
    }
}
