package com.places.display.attributes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DisplayOptionNamesTest {

    private final DisplayOptionNames names = DisplayOptionNames.defaults();

    @Test
    void aliasesShareCanonicalKeys() {
        assertEquals(Optional.of(AttributeKeys.STREET_NUMBER), names.canonicalKey("house_number"));
        assertEquals(Optional.of(AttributeKeys.STREET_NUMBER), names.canonicalKey("street_number"));
        assertEquals(Optional.of(AttributeKeys.PLACE_NEIGHBOURHOOD), names.canonicalKey("neighborhood"));
        assertEquals(Optional.of(AttributeKeys.REGION), names.canonicalKey("state"));
        assertEquals(Optional.of(AttributeKeys.STREET_REF), names.canonicalKey("route_number"));
    }

    @Test
    void lookupIgnoresCaseAndSurroundingWhitespace() {
        assertEquals(Optional.of(AttributeKeys.ZONE_NAME), names.canonicalKey("  Zone_Name "));
        assertFalse(names.canonicalKey(null).isPresent());
    }

    @Test
    void placeIsNotAnOption() {
        assertFalse(names.isKnown("place"));
        assertTrue(names.isKnown("name"));
    }

    @Test
    void customTablesAreNormalized() {
        DisplayOptionNames custom = new DisplayOptionNames(Map.of(" Town ", AttributeKeys.CITY));

        assertEquals(Optional.of(AttributeKeys.CITY), custom.canonicalKey("town"));
        assertEquals(Map.of("town", AttributeKeys.CITY), custom.asMap());
    }
}
