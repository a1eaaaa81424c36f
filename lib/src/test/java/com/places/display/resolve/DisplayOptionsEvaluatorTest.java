package com.places.display.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.places.display.attributes.AttributeKeys;
import com.places.display.attributes.DisplayOptionNames;
import com.places.display.attributes.MapAttributeStore;
import com.places.display.attributes.ZoneChecker;
import com.places.display.parser.ast.FallbackNode;
import com.places.display.parser.ast.FilterNode;
import com.places.display.parser.ast.IdentifierNode;
import com.places.display.parser.ast.SequenceNode;
import com.places.display.parser.ast.SourceLocation;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DisplayOptionsEvaluatorTest {

    private final DisplayOptionsEvaluator evaluator =
            new DisplayOptionsEvaluator(
                    new OptionResolver(
                            DisplayOptionNames.defaults(),
                            new MapAttributeStore(
                                    Map.of(
                                            AttributeKeys.CITY, "Fort Lee",
                                            AttributeKeys.COUNTY, "Bergen County",
                                            AttributeKeys.STATE_ABBR, "NJ")),
                            ZoneChecker.fixed(false)));

    @Test
    void appendsResolvedSegmentsInOrder() {
        ResolutionState state = evaluator.evaluate(sequence(IdentifierNode.of("state_abbr"), IdentifierNode.of("city")));

        assertEquals(List.of("NJ", "Fort Lee"), state.getFragments());
    }

    @Test
    void fallbackIsSplicedWhenSegmentResolvesToNothing() {
        IdentifierNode withFallback =
                withFallback(IdentifierNode.of("zone_name"), IdentifierNode.of("city"), IdentifierNode.of("county"));

        ResolutionState state = evaluator.evaluate(sequence(withFallback, IdentifierNode.of("state_abbr")));

        assertEquals(List.of("Fort Lee", "Bergen County", "NJ"), state.getFragments());
    }

    @Test
    void fallbackIsSkippedWhenSegmentResolves() {
        IdentifierNode withFallback = withFallback(IdentifierNode.of("city"), IdentifierNode.of("county"));

        assertEquals(List.of("Fort Lee"), evaluator.evaluate(sequence(withFallback)).getFragments());
    }

    @Test
    void filteredOutSegmentUsesItsFallback() {
        IdentifierNode filtered =
                new IdentifierNode(
                        "city",
                        SourceLocation.UNKNOWN,
                        FilterNode.excluding(Set.of("fort lee")),
                        new FallbackNode(sequence(IdentifierNode.of("county"))));

        assertEquals(List.of("Bergen County"), evaluator.evaluate(sequence(filtered)).getFragments());
    }

    @Test
    void nestedFallbacksResolveDepthFirst() {
        IdentifierNode inner = withFallback(IdentifierNode.of("street"), IdentifierNode.of("county"));
        IdentifierNode outer = withFallback(IdentifierNode.of("zone_name"), inner, IdentifierNode.of("state_abbr"));

        assertEquals(List.of("Bergen County", "NJ"), evaluator.evaluate(sequence(outer)).getFragments());
    }

    private static IdentifierNode withFallback(IdentifierNode node, IdentifierNode... fallback) {
        return new IdentifierNode(
                node.getName(), node.getLocation(), node.getFilter(), new FallbackNode(sequence(fallback)));
    }

    private static SequenceNode sequence(IdentifierNode... segments) {
        return new SequenceNode(List.of(segments));
    }
}
