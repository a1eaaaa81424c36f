package com.places.display.compile;

import com.places.display.resolve.ResolutionState;
import java.util.List;
import java.util.Objects;

/**
 * Joins resolved fragments into the display string. Fragments are separated by {@code ", "}, except
 * that a street number immediately followed by its street is joined with a single space.
 */
public final class DisplayCompiler {

    public String compile(ResolutionState state) {
        Objects.requireNonNull(state, "state");
        List<String> fragments = state.getFragments();
        // Street number position is recorded one resolution before the street it precedes.
        int streetNumberPosition = state.getStreetNumberPosition().orElse(-1) + 1;
        int streetPosition = state.getStreetPosition().orElse(-1);

        StringBuilder result = new StringBuilder();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                boolean joinStreet = i == streetPosition && i == streetNumberPosition;
                result.append(joinStreet ? " " : ", ");
            }
            result.append(fragments.get(i));
        }
        return result.toString();
    }
}
