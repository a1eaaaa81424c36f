package com.places.display;

import com.places.display.attributes.AttributeStore;
import com.places.display.attributes.DisplayOptionNames;
import com.places.display.attributes.OptionNameMap;
import com.places.display.attributes.ZoneChecker;
import com.places.display.compile.DisplayCompiler;
import com.places.display.parser.DisplayOptionsAstBuilder;
import com.places.display.parser.DisplayOptionsParseException;
import com.places.display.parser.StructuralValidator;
import com.places.display.parser.ast.SequenceNode;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for turning a display options expression and an attribute snapshot into a display
 * string. Malformed expressions are logged and render as the empty string; evaluation never throws
 * for any expression text.
 */
public final class DisplayOptionsEngine {
    private static final Logger LOGGER = Logger.getLogger(DisplayOptionsEngine.class.getName());

    private final OptionNameMap optionNames;
    private final StructuralValidator structuralValidator;
    private final DisplayOptionsAstBuilder astBuilder = new DisplayOptionsAstBuilder();
    private final DisplayCompiler compiler = new DisplayCompiler();

    public DisplayOptionsEngine() {
        this(DisplayOptionNames.defaults(), DisplayOptionsSettings.fromSystemProperties());
    }

    public DisplayOptionsEngine(OptionNameMap optionNames) {
        this(optionNames, DisplayOptionsSettings.fromSystemProperties());
    }

    public DisplayOptionsEngine(OptionNameMap optionNames, DisplayOptionsSettings settings) {
        this.optionNames = Objects.requireNonNull(optionNames, "optionNames");
        Objects.requireNonNull(settings, "settings");
        this.structuralValidator = new StructuralValidator(settings.getMaxNestingDepth());
    }

    public ParsedDisplayOptions parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        StructuralValidator.Problem problem = structuralValidator.check(expression);
        if (problem != StructuralValidator.Problem.NONE) {
            LOGGER.log(Level.WARNING, "{0}: {1}", new Object[] {describe(problem), expression});
            return malformed(expression);
        }
        try {
            SequenceNode tree = astBuilder.parse(expression);
            return new ParsedDisplayOptions(expression, tree, true, optionNames, compiler);
        } catch (DisplayOptionsParseException ex) {
            LOGGER.log(
                    Level.WARNING,
                    "Unparseable display options \"{0}\": {1}",
                    new Object[] {expression, ex.getMessage()});
            return malformed(expression);
        }
    }

    public String evaluate(String expression, AttributeStore attributes, ZoneChecker zoneChecker) {
        return parse(expression).render(attributes, zoneChecker);
    }

    /** Runs {@link #evaluate} on the given executor. */
    public CompletableFuture<String> evaluateAsync(
            String expression, AttributeStore attributes, ZoneChecker zoneChecker, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> evaluate(expression, attributes, zoneChecker), executor);
    }

    private ParsedDisplayOptions malformed(String expression) {
        return new ParsedDisplayOptions(expression, SequenceNode.empty(), false, optionNames, compiler);
    }

    private String describe(StructuralValidator.Problem problem) {
        return switch (problem) {
            case BRACKET_MISMATCH -> "Bracket count mismatch";
            case PARENTHESIS_MISMATCH -> "Parenthesis count mismatch";
            case NESTING_TOO_DEEP ->
                    "Nesting deeper than " + structuralValidator.getMaxNestingDepth() + " levels";
            case NONE -> "Well formed";
        };
    }
}
