package com.places.display;

import com.places.display.attributes.AttributeStore;
import com.places.display.attributes.OptionNameMap;
import com.places.display.attributes.ZoneChecker;
import com.places.display.compile.DisplayCompiler;
import com.places.display.parser.ast.SequenceNode;
import com.places.display.resolve.DisplayOptionsEvaluator;
import com.places.display.resolve.OptionResolver;
import com.places.display.resolve.ResolutionState;
import java.util.Objects;

/**
 * A display options expression parsed once and rendered against any number of attribute
 * snapshots. Expressions that failed structural checks or parsing hold an empty tree and always
 * render the empty string.
 */
public final class ParsedDisplayOptions {
    private final String expression;
    private final SequenceNode tree;
    private final boolean wellFormed;
    private final OptionNameMap optionNames;
    private final DisplayCompiler compiler;

    ParsedDisplayOptions(
            String expression,
            SequenceNode tree,
            boolean wellFormed,
            OptionNameMap optionNames,
            DisplayCompiler compiler) {
        this.expression = expression;
        this.tree = tree;
        this.wellFormed = wellFormed;
        this.optionNames = optionNames;
        this.compiler = compiler;
    }

    public String getExpression() {
        return expression;
    }

    public SequenceNode getTree() {
        return tree;
    }

    public boolean isWellFormed() {
        return wellFormed;
    }

    /** Resolves every segment against the given snapshot without joining the fragments. */
    public ResolutionState resolve(AttributeStore attributes, ZoneChecker zoneChecker) {
        OptionResolver resolver = new OptionResolver(optionNames, attributes, zoneChecker);
        return new DisplayOptionsEvaluator(resolver).evaluate(tree);
    }

    public String render(AttributeStore attributes, ZoneChecker zoneChecker) {
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(zoneChecker, "zoneChecker");
        return compiler.compile(resolve(attributes, zoneChecker));
    }
}
