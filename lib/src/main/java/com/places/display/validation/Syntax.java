package com.places.display.validation;

/** Character classes shared by the syntax rules. */
final class Syntax {
    static final char NONE = '\0';

    private Syntax() {}

    static boolean isOpener(char c) {
        return c == '[' || c == '(';
    }

    static boolean isCloser(char c) {
        return c == ']' || c == ')';
    }

    static boolean isStructural(char c) {
        return c == ',' || isOpener(c) || isCloser(c);
    }

    static char closerFor(char opener) {
        return opener == '[' ? ']' : ')';
    }

    /** Last non-whitespace character before {@code index}, or {@link #NONE}. */
    static char previousSignificant(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return NONE;
    }

    /** First non-whitespace character after {@code index}, or {@link #NONE}. */
    static char nextSignificant(String text, int index) {
        for (int i = index + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return NONE;
    }
}
