package com.places.display.resolve;

import com.places.display.attributes.AttributeKeys;
import com.places.display.attributes.AttributeStore;
import com.places.display.attributes.OptionNameMap;
import com.places.display.attributes.ZoneChecker;
import com.places.display.parser.ast.FilterNode;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves a single option name, under its filter, to the text it contributes to the display
 * string. Returns {@code null} whenever the option is unknown, blank, outside its zone, or rejected
 * by the filter.
 */
public final class OptionResolver {
    private static final Logger LOGGER = Logger.getLogger(OptionResolver.class.getName());

    private final OptionNameMap optionNames;
    private final AttributeStore attributes;
    private final ZoneChecker zoneChecker;

    public OptionResolver(OptionNameMap optionNames, AttributeStore attributes, ZoneChecker zoneChecker) {
        this.optionNames = Objects.requireNonNull(optionNames, "optionNames");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.zoneChecker = Objects.requireNonNull(zoneChecker, "zoneChecker");
    }

    public String resolve(String identifier, FilterNode filter, ResolutionState state) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(state, "state");
        String option = identifier == null ? "" : identifier.strip().toLowerCase(Locale.ROOT);
        String key = optionNames.canonicalKey(option).orElse(null);
        if (key == null) {
            LOGGER.log(Level.FINE, "Option \"{0}\" is not a known display option", option);
            return null;
        }

        String value = currentValue(key, state);
        LOGGER.log(Level.FINE, "Option \"{0}\" ({1}) has value \"{2}\"", new Object[] {option, key, value});
        if (value == null || !accepts(value, filter, state)) {
            return null;
        }

        if (AttributeKeys.TITLE_CASED.contains(key) && value.equals(value.toLowerCase(Locale.ROOT))) {
            value = TitleCase.apply(value);
        }
        value = value.strip();
        if (value.isEmpty()) {
            return null;
        }

        if (AttributeKeys.STREET_KEYS.contains(key)) {
            state.markStreet();
        } else if (AttributeKeys.STREET_NUMBER.equals(key)) {
            state.markStreetNumber();
        }
        state.advance();
        return value;
    }

    private boolean accepts(String value, FilterNode filter, ResolutionState state) {
        String normalized = normalize(value);
        if (!filter.getInclude().isEmpty() && !filter.getInclude().contains(normalized)) {
            LOGGER.log(
                    Level.FINE,
                    "Value \"{0}\" is not in the allow-list {1}",
                    new Object[] {value, filter.getInclude()});
            return false;
        }
        if (!filter.getExclude().isEmpty() && filter.getExclude().contains(normalized)) {
            LOGGER.log(
                    Level.FINE,
                    "Value \"{0}\" is in the deny-list {1}",
                    new Object[] {value, filter.getExclude()});
            return false;
        }

        for (Map.Entry<String, Set<String>> predicate : filter.getIncludeAttributes().entrySet()) {
            String other = otherValue(predicate.getKey(), state);
            if (other == null || !predicate.getValue().contains(normalize(other))) {
                LOGGER.log(
                        Level.FINE,
                        "Attribute \"{0}\" value \"{1}\" is not in {2}",
                        new Object[] {predicate.getKey(), other, predicate.getValue()});
                return false;
            }
        }
        for (Map.Entry<String, Set<String>> predicate : filter.getExcludeAttributes().entrySet()) {
            String other = otherValue(predicate.getKey(), state);
            if (other != null && predicate.getValue().contains(normalize(other))) {
                LOGGER.log(
                        Level.FINE,
                        "Attribute \"{0}\" value \"{1}\" is in {2}",
                        new Object[] {predicate.getKey(), other, predicate.getValue()});
                return false;
            }
        }
        return true;
    }

    private String otherValue(String optionName, ResolutionState state) {
        String key = optionNames.canonicalKey(optionName).orElse(null);
        if (key == null) {
            return null;
        }
        return currentValue(key, state);
    }

    private String currentValue(String key, ResolutionState state) {
        if (attributes.isBlank(key)) {
            return null;
        }
        if (AttributeKeys.ZONE_GATED.contains(key) && !inZone(state)) {
            return null;
        }
        return attributes.getSafeString(key);
    }

    private boolean inZone(ResolutionState state) {
        Boolean cached = state.getZoneStatus();
        if (cached != null) {
            return cached;
        }
        boolean inZone = awaitZoneCheck();
        state.setZoneStatus(inZone);
        return inZone;
    }

    private boolean awaitZoneCheck() {
        try {
            return Boolean.TRUE.equals(zoneChecker.inZone().toCompletableFuture().join());
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Zone check failed, treating the subject as outside every zone", ex);
            return false;
        }
    }

    private static String normalize(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
