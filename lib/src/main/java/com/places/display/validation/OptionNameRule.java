package com.places.display.validation;

import java.util.ArrayList;
import java.util.List;

/** Option names and filter values are single words; inner whitespace usually means a missing comma. */
final class OptionNameRule implements ValidationRule {
    static final String CODE = "option_name";

    @Override
    public List<DisplayMessage> validate(ValidationInput input) {
        String text = input.getExpression();
        List<DisplayMessage> messages = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i < text.length() && !Syntax.isStructural(text.charAt(i))) {
                continue;
            }
            check(text.substring(start, i), start, messages);
            start = i + 1;
        }
        return messages;
    }

    private static void check(String token, int offset, List<DisplayMessage> out) {
        String stripped = token.strip();
        for (int i = 0; i < stripped.length(); i++) {
            if (Character.isWhitespace(stripped.charAt(i))) {
                int column = offset + token.indexOf(stripped) + 1;
                out.add(
                        DisplayMessage.error(
                                CODE, "Option name \"" + stripped + "\" contains whitespace", column));
                return;
            }
        }
    }
}
