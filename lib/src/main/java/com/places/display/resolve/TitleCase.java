package com.places.display.resolve;

/** Upper-cases the first letter of every run of letters and lower-cases the rest. */
final class TitleCase {

    private TitleCase() {}

    static String apply(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean inWord = false;
        int i = 0;
        while (i < value.length()) {
            int codePoint = value.codePointAt(i);
            if (Character.isLetter(codePoint)) {
                builder.appendCodePoint(
                        inWord ? Character.toLowerCase(codePoint) : Character.toTitleCase(codePoint));
                inWord = true;
            } else {
                builder.appendCodePoint(codePoint);
                inWord = false;
            }
            i += Character.charCount(codePoint);
        }
        return builder.toString();
    }
}
