package com.places.display.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Checks that every {@code [} and {@code (} is attached to an option, is closed by the matching
 * character, and does not start or end with an empty item. Stops at the first mismatched closer,
 * since everything after it would be reported again.
 */
final class BracketSyntaxRule implements ValidationRule {
    static final String CODE = "bracket_syntax";

    @Override
    public List<DisplayMessage> validate(ValidationInput input) {
        String text = input.getExpression();
        List<DisplayMessage> messages = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char previous = Syntax.previousSignificant(text, i);
            if (Syntax.isOpener(c)) {
                if (previous == Syntax.NONE || previous == ',' || Syntax.isOpener(previous)) {
                    messages.add(
                            DisplayMessage.error(
                                    CODE, "'" + c + "' must follow an option name", i + 1));
                }
                open.push(i);
            } else if (Syntax.isCloser(c)) {
                if (open.isEmpty()) {
                    messages.add(DisplayMessage.error(CODE, "Unmatched '" + c + "'", i + 1));
                    return messages;
                }
                char opener = text.charAt(open.pop());
                if (Syntax.closerFor(opener) != c) {
                    messages.add(
                            DisplayMessage.error(
                                    CODE,
                                    "'" + c + "' does not close '" + opener + "'",
                                    i + 1));
                    return messages;
                }
                if (previous == ',') {
                    messages.add(DisplayMessage.error(CODE, "Empty item before '" + c + "'", i + 1));
                } else if (previous == opener) {
                    messages.add(DisplayMessage.error(CODE, "Empty group '" + opener + c + "'", i + 1));
                }
            } else if (c == ',' && Syntax.isOpener(previous)) {
                messages.add(DisplayMessage.error(CODE, "Empty item after '" + previous + "'", i + 1));
            }
        }

        while (!open.isEmpty()) {
            int index = open.removeLast();
            messages.add(DisplayMessage.error(CODE, "Unclosed '" + text.charAt(index) + "'", index + 1));
        }
        return messages;
    }
}
