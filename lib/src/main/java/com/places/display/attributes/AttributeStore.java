package com.places.display.attributes;

/**
 * Read-only snapshot of the geocoding attributes a display string is built from. Values are either
 * {@link String}s or {@link Number}s; absent keys map to {@code null}.
 */
public interface AttributeStore {

    /**
     * @param key Canonical attribute key.
     * @return The stored value, or {@code null} when the key is absent.
     */
    Object get(String key);

    /**
     * A value is blank when it is absent or the empty string. Numeric zero is not blank.
     */
    default boolean isBlank(String key) {
        Object value = get(key);
        return value == null || (value instanceof String text && text.isEmpty());
    }

    /**
     * String form of the value, or the empty string when it is absent. Numbers use their
     * {@code toString}, so coordinates such as {@code 40.8553478} render as written, while doubles
     * of magnitude 10^7 and above, or below 10^-3, render in exponent form ({@code 1.0E7}). Store such
     * values as text when an exact rendering matters.
     */
    default String getSafeString(String key) {
        Object value = get(key);
        return value == null ? "" : String.valueOf(value);
    }
}
