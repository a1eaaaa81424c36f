package com.places.display.attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Table-backed {@link OptionNameMap}. */
public final class DisplayOptionNames implements OptionNameMap {

    private static final DisplayOptionNames DEFAULTS = new DisplayOptionNames(defaultTable());

    private final Map<String, String> table;

    public DisplayOptionNames(Map<String, String> table) {
        Objects.requireNonNull(table, "table");
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : table.entrySet()) {
            normalized.put(normalize(entry.getKey()), Objects.requireNonNull(entry.getValue(), "attribute key"));
        }
        this.table = Collections.unmodifiableMap(normalized);
    }

    /** The option names understood by the places integration. */
    public static DisplayOptionNames defaults() {
        return DEFAULTS;
    }

    @Override
    public Optional<String> canonicalKey(String optionName) {
        if (optionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(normalize(optionName)));
    }

    public Map<String, String> asMap() {
        return table;
    }

    private static String normalize(String optionName) {
        return optionName.strip().toLowerCase(Locale.ROOT);
    }

    private static Map<String, String> defaultTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("driving", AttributeKeys.DRIVING);
        table.put("zone", AttributeKeys.ZONE);
        table.put("zone_name", AttributeKeys.ZONE_NAME);
        table.put("name", AttributeKeys.PLACE_NAME);
        table.put("place_name", AttributeKeys.PLACE_NAME);
        table.put("name_no_dupe", AttributeKeys.PLACE_NAME_NO_DUPE);
        table.put("type", AttributeKeys.PLACE_TYPE);
        table.put("place_type", AttributeKeys.PLACE_TYPE);
        table.put("category", AttributeKeys.PLACE_CATEGORY);
        table.put("place_category", AttributeKeys.PLACE_CATEGORY);
        table.put("neighborhood", AttributeKeys.PLACE_NEIGHBOURHOOD);
        table.put("neighbourhood", AttributeKeys.PLACE_NEIGHBOURHOOD);
        table.put("house_number", AttributeKeys.STREET_NUMBER);
        table.put("street_number", AttributeKeys.STREET_NUMBER);
        table.put("street", AttributeKeys.STREET);
        table.put("route_number", AttributeKeys.STREET_REF);
        table.put("street_ref", AttributeKeys.STREET_REF);
        table.put("city", AttributeKeys.CITY);
        table.put("city_clean", AttributeKeys.CITY_CLEAN);
        table.put("postal_town", AttributeKeys.POSTAL_TOWN);
        table.put("county", AttributeKeys.COUNTY);
        table.put("state", AttributeKeys.REGION);
        table.put("region", AttributeKeys.REGION);
        table.put("state_province", AttributeKeys.REGION);
        table.put("state_abbr", AttributeKeys.STATE_ABBR);
        table.put("postal_code", AttributeKeys.POSTAL_CODE);
        table.put("country", AttributeKeys.COUNTRY);
        table.put("country_code", AttributeKeys.COUNTRY_CODE);
        table.put("formatted_address", AttributeKeys.FORMATTED_ADDRESS);
        table.put("formatted_place", AttributeKeys.FORMATTED_PLACE);
        table.put("latitude", AttributeKeys.LATITUDE);
        table.put("longitude", AttributeKeys.LONGITUDE);
        table.put("osm_id", AttributeKeys.OSM_ID);
        table.put("osm_type", AttributeKeys.OSM_TYPE);
        table.put("wikidata_id", AttributeKeys.WIKIDATA_ID);
        table.put("last_place_name", AttributeKeys.LAST_PLACE_NAME);
        table.put("direction_of_travel", AttributeKeys.DIRECTION_OF_TRAVEL);
        return table;
    }
}
