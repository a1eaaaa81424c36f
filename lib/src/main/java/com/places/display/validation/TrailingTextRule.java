package com.places.display.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about text directly after a closing {@code ]} or {@code )}. It is not part of any option,
 * and it ends the list it appears in, so every later sibling is dropped from the label.
 */
final class TrailingTextRule implements ValidationRule {
    static final String CODE = "trailing_text";

    @Override
    public List<DisplayMessage> validate(ValidationInput input) {
        String text = input.getExpression();
        List<DisplayMessage> messages = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Syntax.isCloser(c)) {
                continue;
            }
            int next = nextSignificantIndex(text, i);
            if (next >= 0 && !Syntax.isStructural(text.charAt(next))) {
                messages.add(
                        DisplayMessage.warning(
                                CODE,
                                "Text after '" + c + "' ends the list; the options after it are ignored",
                                next + 1));
            }
        }
        return messages;
    }

    private static int nextSignificantIndex(String text, int index) {
        for (int i = index + 1; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
