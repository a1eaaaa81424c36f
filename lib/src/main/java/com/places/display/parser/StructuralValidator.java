package com.places.display.parser;

import java.util.Objects;

/**
 * Pre-parse check on an expression: bracket and parenthesis counts must match and groups must not
 * nest deeper than the configured limit.
 */
public final class StructuralValidator {

    public enum Problem {
        NONE,
        BRACKET_MISMATCH,
        PARENTHESIS_MISMATCH,
        NESTING_TOO_DEEP
    }

    private final int maxNestingDepth;

    public StructuralValidator(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public Problem check(String expression) {
        Objects.requireNonNull(expression, "expression");
        int brackets = 0;
        int parens = 0;
        int depth = 0;
        int deepest = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            switch (c) {
                case '[' -> {
                    brackets++;
                    depth++;
                }
                case ']' -> {
                    brackets--;
                    depth--;
                }
                case '(' -> {
                    parens++;
                    depth++;
                }
                case ')' -> {
                    parens--;
                    depth--;
                }
                default -> {
                    continue;
                }
            }
            deepest = Math.max(deepest, depth);
        }
        if (brackets != 0) {
            return Problem.BRACKET_MISMATCH;
        }
        if (parens != 0) {
            return Problem.PARENTHESIS_MISMATCH;
        }
        if (deepest > maxNestingDepth) {
            return Problem.NESTING_TOO_DEEP;
        }
        return Problem.NONE;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
