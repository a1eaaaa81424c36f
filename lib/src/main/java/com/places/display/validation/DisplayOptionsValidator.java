package com.places.display.validation;

import com.places.display.DisplayOptionsSettings;
import com.places.display.attributes.OptionNameMap;
import com.places.display.parser.DisplayOptionsAstBuilder;
import com.places.display.parser.DisplayOptionsParseException;
import com.places.display.parser.StructuralValidator;
import com.places.display.parser.ast.SequenceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks a display options string before it is stored as configuration. Runs each rule in order
 * and aggregates their diagnostics; the string is valid when none of them is an error.
 */
public final class DisplayOptionsValidator {
    static final String NESTING_CODE = "nesting_depth";
    private static final Logger LOGGER = Logger.getLogger(DisplayOptionsValidator.class.getName());

    private final List<ValidationRule> rules;
    private final StructuralValidator structuralValidator;
    private final DisplayOptionsAstBuilder astBuilder = new DisplayOptionsAstBuilder();

    public DisplayOptionsValidator(List<ValidationRule> rules, DisplayOptionsSettings settings) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.structuralValidator =
                new StructuralValidator(Objects.requireNonNull(settings, "settings").getMaxNestingDepth());
    }

    /**
     * Convenience factory that wires in the default rule set: bracket syntax, comma syntax, option
     * name shape, text after groups and known option names.
     */
    public static DisplayOptionsValidator defaultRules(OptionNameMap optionNames) {
        return new DisplayOptionsValidator(
                List.of(
                        new BracketSyntaxRule(),
                        new CommaSyntaxRule(),
                        new OptionNameRule(),
                        new TrailingTextRule(),
                        new KnownOptionRule(optionNames)),
                DisplayOptionsSettings.fromSystemProperties());
    }

    public List<DisplayMessage> validate(String expression) {
        Objects.requireNonNull(expression, "expression");
        List<DisplayMessage> diagnostics = new ArrayList<>();
        SequenceNode tree = null;
        StructuralValidator.Problem problem = structuralValidator.check(expression);
        if (problem == StructuralValidator.Problem.NESTING_TOO_DEEP) {
            diagnostics.add(
                    DisplayMessage.error(
                            NESTING_CODE,
                            "Groups nest deeper than " + structuralValidator.getMaxNestingDepth() + " levels",
                            0));
        } else if (problem == StructuralValidator.Problem.NONE) {
            tree = parseQuietly(expression);
        }

        ValidationInput input = new ValidationInput(expression, tree);
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(input));
        }
        return diagnostics;
    }

    public boolean isValid(String expression) {
        return validate(expression).stream().noneMatch(m -> m.getLevel() == DisplayMessage.Level.ERROR);
    }

    private SequenceNode parseQuietly(String expression) {
        try {
            return astBuilder.parse(expression);
        } catch (DisplayOptionsParseException ex) {
            LOGGER.log(Level.FINE, "Display options do not parse: {0}", ex.getMessage());
            return null;
        }
    }
}
