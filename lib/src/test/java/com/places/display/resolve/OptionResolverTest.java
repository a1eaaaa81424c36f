package com.places.display.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.places.display.attributes.AttributeKeys;
import com.places.display.attributes.DisplayOptionNames;
import com.places.display.attributes.MapAttributeStore;
import com.places.display.attributes.ZoneChecker;
import com.places.display.parser.ast.FilterNode;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class OptionResolverTest {

    private static final MapAttributeStore ATTRIBUTES =
            new MapAttributeStore(
                    Map.of(
                            AttributeKeys.ZONE_NAME, "home",
                            AttributeKeys.PLACE_TYPE, "fast food",
                            AttributeKeys.PLACE_CATEGORY, "Amenity",
                            AttributeKeys.STREET, "Main St",
                            AttributeKeys.STREET_NUMBER, "123",
                            AttributeKeys.CITY, "  ",
                            AttributeKeys.POSTAL_CODE, 0));

    @Test
    void unknownOptionResolvesToNullWithoutAdvancing() {
        ResolutionState state = new ResolutionState();

        assertNull(resolver(true).resolve("bogus", FilterNode.none(), state));
        assertEquals(0, state.getPositionCounter());
    }

    @Test
    void optionNamesAreCaseInsensitive() {
        assertEquals("Main St", resolver(true).resolve(" STREET ", FilterNode.none(), new ResolutionState()));
    }

    @Test
    void zeroIsNotBlankButWhitespaceIs() {
        OptionResolver resolver = resolver(true);

        assertEquals("0", resolver.resolve("postal_code", FilterNode.none(), new ResolutionState()));
        assertNull(resolver.resolve("city", FilterNode.none(), new ResolutionState()));
        assertNull(resolver.resolve("county", FilterNode.none(), new ResolutionState()));
    }

    @Test
    void titleCasesLowerCaseValuesOfSelectedOptions() {
        OptionResolver resolver = resolver(true);

        assertEquals("Fast Food", resolver.resolve("type", FilterNode.none(), new ResolutionState()));
        assertEquals("Home", resolver.resolve("zone_name", FilterNode.none(), new ResolutionState()));
        assertEquals("Amenity", resolver.resolve("category", FilterNode.none(), new ResolutionState()));
    }

    @Test
    void titleCaseRestartsAfterNonLetters() {
        assertEquals("O'Brien-Smith 2Nd", TitleCase.apply("o'brien-smith 2nd"));
    }

    @Test
    void zoneGatedOptionsRequireBeingInZone() {
        assertNull(resolver(false).resolve("zone_name", FilterNode.none(), new ResolutionState()));
    }

    @Test
    void zoneIsCheckedOncePerEvaluation() {
        AtomicInteger calls = new AtomicInteger();
        ZoneChecker counting =
                () -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture(true);
                };
        OptionResolver resolver = new OptionResolver(DisplayOptionNames.defaults(), ATTRIBUTES, counting);
        ResolutionState state = new ResolutionState();

        resolver.resolve("zone_name", FilterNode.none(), state);
        resolver.resolve("zone", FilterNode.none(), state);
        resolver.resolve("zone_name", FilterNode.none(), state);

        assertEquals(1, calls.get());
    }

    @Test
    void failingZoneCheckCountsAsOutOfZone() {
        ZoneChecker failing = () -> CompletableFuture.failedFuture(new IllegalStateException("offline"));
        OptionResolver resolver = new OptionResolver(DisplayOptionNames.defaults(), ATTRIBUTES, failing);

        assertNull(resolver.resolve("zone_name", FilterNode.none(), new ResolutionState()));
    }

    @Test
    void allowAndDenyListsCompareLowerCasedValues() {
        OptionResolver resolver = resolver(true);

        assertEquals(
                "Amenity",
                resolver.resolve("category", FilterNode.including(Set.of("amenity")), new ResolutionState()));
        assertNull(resolver.resolve("category", FilterNode.including(Set.of("shop")), new ResolutionState()));
        assertNull(resolver.resolve("category", FilterNode.excluding(Set.of("amenity")), new ResolutionState()));
        assertEquals(
                "Amenity",
                resolver.resolve("category", FilterNode.excluding(Set.of("shop")), new ResolutionState()));
    }

    @Test
    void attributePredicatesInspectOtherOptions() {
        OptionResolver resolver = resolver(true);
        FilterNode onlyFastFood =
                new FilterNode(Set.of(), Set.of(), Map.of("type", Set.of("fast food")), Map.of());
        FilterNode notFastFood =
                new FilterNode(Set.of(), Set.of(), Map.of(), Map.of("type", Set.of("fast food")));
        FilterNode missingOther =
                new FilterNode(Set.of(), Set.of(), Map.of("county", Set.of("bergen county")), Map.of());

        assertEquals("Main St", resolver.resolve("street", onlyFastFood, new ResolutionState()));
        assertNull(resolver.resolve("street", notFastFood, new ResolutionState()));
        assertNull(resolver.resolve("street", missingOther, new ResolutionState()));
    }

    @Test
    void attributePredicateOnZoneRespectsZoneGate() {
        FilterNode whenHome = new FilterNode(Set.of(), Set.of(), Map.of("zone_name", Set.of("home")), Map.of());

        assertEquals("Main St", resolver(true).resolve("street", whenHome, new ResolutionState()));
        assertNull(resolver(false).resolve("street", whenHome, new ResolutionState()));
    }

    @Test
    void marksLatestStreetPositionsOnSuccessfulResolutionsOnly() {
        OptionResolver resolver = resolver(true);
        ResolutionState state = new ResolutionState();

        resolver.resolve("street_number", FilterNode.excluding(Set.of("123")), state);
        assertTrue(state.getStreetNumberPosition().isEmpty());

        resolver.resolve("city_clean", FilterNode.none(), state);
        resolver.resolve("street_number", FilterNode.none(), state);
        resolver.resolve("route_number", FilterNode.none(), state);
        resolver.resolve("street", FilterNode.none(), state);
        resolver.resolve("street", FilterNode.none(), state);

        assertEquals(0, state.getStreetNumberPosition().getAsInt());
        assertEquals(2, state.getStreetPosition().getAsInt());
        assertEquals(3, state.getPositionCounter());

        resolver.resolve("street_number", FilterNode.excluding(Set.of("123")), state);
        assertEquals(0, state.getStreetNumberPosition().getAsInt());
    }

    private static OptionResolver resolver(boolean inZone) {
        return new OptionResolver(DisplayOptionNames.defaults(), ATTRIBUTES, ZoneChecker.fixed(inZone));
    }
}
