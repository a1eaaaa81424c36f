package com.places.display.validation;

import com.places.display.attributes.OptionNameMap;
import com.places.display.parser.ast.FallbackNode;
import com.places.display.parser.ast.IdentifierNode;
import com.places.display.parser.ast.SequenceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Every option name, including those inside fallbacks and attribute filters, must map to an
 * attribute. Only runs when the string parsed.
 */
final class KnownOptionRule implements ValidationRule {
    static final String CODE = "unknown_option";

    private final OptionNameMap optionNames;

    KnownOptionRule(OptionNameMap optionNames) {
        this.optionNames = Objects.requireNonNull(optionNames, "optionNames");
    }

    @Override
    public List<DisplayMessage> validate(ValidationInput input) {
        List<DisplayMessage> messages = new ArrayList<>();
        input.getTree().ifPresent(tree -> walk(tree, messages));
        return messages;
    }

    private void walk(SequenceNode sequence, List<DisplayMessage> out) {
        for (IdentifierNode segment : sequence.getSegments()) {
            int column = segment.getLocation().getColumn();
            if (!segment.getName().isEmpty()) {
                check(segment.getName(), column, out);
            }
            for (String attribute : segment.getFilter().getIncludeAttributes().keySet()) {
                check(attribute, column, out);
            }
            for (String attribute : segment.getFilter().getExcludeAttributes().keySet()) {
                check(attribute, column, out);
            }
            segment.getFallback().map(FallbackNode::getBody).ifPresent(body -> walk(body, out));
        }
    }

    private void check(String name, int column, List<DisplayMessage> out) {
        if (!optionNames.isKnown(name)) {
            out.add(DisplayMessage.error(CODE, "Unknown display option \"" + name + "\"", column));
        }
    }
}
