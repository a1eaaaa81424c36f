package com.places.display.attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/** Immutable {@link AttributeStore} backed by a copy of a map. */
public final class MapAttributeStore implements AttributeStore {
    private final Map<String, Object> values;

    public MapAttributeStore(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value != null && !(value instanceof String) && !(value instanceof Number)) {
                throw new IllegalArgumentException(
                        "Unsupported value type for attribute '"
                                + entry.getKey()
                                + "': "
                                + value.getClass().getName());
            }
            copy.put(entry.getKey(), value);
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static MapAttributeStore empty() {
        return new MapAttributeStore(Map.of());
    }

    /** Builds a store from string properties; every value is kept as text. */
    public static MapAttributeStore fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        return new MapAttributeStore(values);
    }

    @Override
    public Object get(String key) {
        if (key == null) {
            return null;
        }
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "MapAttributeStore" + values;
    }
}
