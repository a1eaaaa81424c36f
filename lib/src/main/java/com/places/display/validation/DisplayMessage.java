package com.places.display.validation;

import java.util.Objects;

/**
 * A diagnostic about a display options string. Columns are 1-based offsets into the checked string;
 * {@code 0} means the message applies to the whole string.
 */
public final class DisplayMessage {

    /** Only errors make a string invalid; warnings describe content that renders but is ignored. */
    public enum Level {
        WARNING,
        ERROR
    }

    private final Level level;
    private final String code;
    private final String message;
    private final int column;

    public DisplayMessage(Level level, String code, String message, int column) {
        this.level = Objects.requireNonNull(level, "level");
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.column = column;
    }

    static DisplayMessage error(String code, String message, int column) {
        return new DisplayMessage(Level.ERROR, code, message, column);
    }

    static DisplayMessage warning(String code, String message, int column) {
        return new DisplayMessage(Level.WARNING, code, message, column);
    }

    public Level getLevel() {
        return level;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DisplayMessage other)) {
            return false;
        }
        return column == other.column
                && level == other.level
                && code.equals(other.code)
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, code, message, column);
    }

    @Override
    public String toString() {
        return level + " " + code + " at column " + column + ": " + message;
    }
}
