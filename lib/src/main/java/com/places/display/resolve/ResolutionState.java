package com.places.display.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Mutable state of one evaluation: the fragments emitted so far and the positions the compiler
 * needs to join the last street number to the last street. Created per evaluation and confined to
 * it.
 */
public final class ResolutionState {
    private static final int UNSET = -1;

    private final List<String> fragments = new ArrayList<>();
    private int positionCounter;
    private int streetPosition = UNSET;
    private int streetNumberPosition = UNSET;
    private Boolean zoneStatus;

    public void appendFragment(String fragment) {
        fragments.add(fragment);
    }

    public List<String> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

    /** Number of successful resolutions so far. */
    public int getPositionCounter() {
        return positionCounter;
    }

    public OptionalInt getStreetPosition() {
        return streetPosition == UNSET ? OptionalInt.empty() : OptionalInt.of(streetPosition);
    }

    public OptionalInt getStreetNumberPosition() {
        return streetNumberPosition == UNSET ? OptionalInt.empty() : OptionalInt.of(streetNumberPosition);
    }

    /** Marks the next resolution as the street fragment; a later street replaces an earlier one. */
    public void markStreet() {
        streetPosition = positionCounter;
    }

    /** Marks the next resolution as the street number fragment; the latest mark wins. */
    public void markStreetNumber() {
        streetNumberPosition = positionCounter;
    }

    public void advance() {
        positionCounter++;
    }

    Boolean getZoneStatus() {
        return zoneStatus;
    }

    void setZoneStatus(boolean inZone) {
        this.zoneStatus = inZone;
    }
}
