package com.places.display.validation;

import java.util.ArrayList;
import java.util.List;

/** Rejects empty items: leading, trailing or doubled commas, at any nesting level. */
final class CommaSyntaxRule implements ValidationRule {
    static final String CODE = "comma_syntax";

    @Override
    public List<DisplayMessage> validate(ValidationInput input) {
        String text = input.getExpression();
        List<DisplayMessage> messages = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != ',') {
                continue;
            }
            char previous = Syntax.previousSignificant(text, i);
            char next = Syntax.nextSignificant(text, i);
            if (previous == Syntax.NONE || previous == ',' || Syntax.isOpener(previous)) {
                messages.add(DisplayMessage.error(CODE, "Empty item before ','", i + 1));
            } else if (next == Syntax.NONE || Syntax.isCloser(next)) {
                messages.add(DisplayMessage.error(CODE, "Empty item after ','", i + 1));
            }
        }
        return messages;
    }
}
