package com.places.display.parser;

public final class DisplayOptionsParseException extends Exception {
    public DisplayOptionsParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
