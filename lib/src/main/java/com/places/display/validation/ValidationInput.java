package com.places.display.validation;

import com.places.display.parser.ast.SequenceNode;
import java.util.Objects;
import java.util.Optional;

/** The string under validation together with its parse tree, when it parsed. */
public final class ValidationInput {
    private final String expression;
    private final SequenceNode tree;

    public ValidationInput(String expression, SequenceNode tree) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.tree = tree;
    }

    public String getExpression() {
        return expression;
    }

    public Optional<SequenceNode> getTree() {
        return Optional.ofNullable(tree);
    }
}
