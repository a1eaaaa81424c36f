package com.places.display;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Engine settings, read from system properties with environment variable fallbacks. */
public final class DisplayOptionsSettings {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 32;

    static final String MAX_DEPTH_PROPERTY = "places.display.maxDepth";
    private static final String MAX_DEPTH_ENV = "PLACES_DISPLAY_MAX_DEPTH";
    private static final Logger LOGGER = Logger.getLogger(DisplayOptionsSettings.class.getName());
    private static final DisplayOptionsSettings DEFAULTS =
            new DisplayOptionsSettings(DEFAULT_MAX_NESTING_DEPTH);

    private final int maxNestingDepth;

    private DisplayOptionsSettings(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public static DisplayOptionsSettings defaults() {
        return DEFAULTS;
    }

    public static DisplayOptionsSettings withMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        return new DisplayOptionsSettings(maxNestingDepth);
    }

    public static DisplayOptionsSettings fromSystemProperties() {
        String value = System.getProperty(MAX_DEPTH_PROPERTY);
        if (value == null) {
            value = System.getenv(MAX_DEPTH_ENV);
        }
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }
        try {
            int depth = Integer.parseInt(value.strip());
            if (depth >= 1) {
                return new DisplayOptionsSettings(depth);
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.FINE, "Unparseable nesting depth", ex);
        }
        LOGGER.log(
                Level.WARNING,
                "Ignoring invalid {0} value \"{1}\", using {2}",
                new Object[] {MAX_DEPTH_PROPERTY, value, DEFAULT_MAX_NESTING_DEPTH});
        return DEFAULTS;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
