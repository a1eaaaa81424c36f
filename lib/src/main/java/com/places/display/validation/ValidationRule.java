package com.places.display.validation;

import java.util.List;

/**
 * A single check over a candidate display options string. Rules report problems in the order they
 * find them, left to right.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given input.
     *
     * @param input The raw string and, when it parsed, its tree.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<DisplayMessage> validate(ValidationInput input);
}
