package com.places.display.attributes;

import java.util.Optional;

/** Maps the option names users write in display strings to canonical attribute keys. */
@FunctionalInterface
public interface OptionNameMap {

    /**
     * @param optionName Option name as written; lookups ignore case and surrounding whitespace.
     * @return The canonical attribute key, or empty when the name is not a known option.
     */
    Optional<String> canonicalKey(String optionName);

    default boolean isKnown(String optionName) {
        return canonicalKey(optionName).isPresent();
    }
}
