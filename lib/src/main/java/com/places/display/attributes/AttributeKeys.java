package com.places.display.attributes;

import java.util.Set;

/** Canonical attribute keys produced by the geocoding pipeline. */
public final class AttributeKeys {
    public static final String DRIVING = "driving";
    public static final String ZONE = "devicetracker_zone";
    public static final String ZONE_NAME = "devicetracker_zone_name";
    public static final String PLACE_NAME = "place_name";
    public static final String PLACE_NAME_NO_DUPE = "place_name_no_dupe";
    public static final String PLACE_TYPE = "place_type";
    public static final String PLACE_CATEGORY = "place_category";
    public static final String PLACE_NEIGHBOURHOOD = "neighbourhood";
    public static final String STREET_NUMBER = "street_number";
    public static final String STREET = "street";
    public static final String STREET_REF = "street_ref";
    public static final String CITY = "city";
    public static final String CITY_CLEAN = "city_clean";
    public static final String POSTAL_TOWN = "postal_town";
    public static final String POSTAL_CODE = "postal_code";
    public static final String COUNTY = "county";
    public static final String REGION = "state_province";
    public static final String STATE_ABBR = "state_abbr";
    public static final String COUNTRY = "country";
    public static final String COUNTRY_CODE = "country_code";
    public static final String FORMATTED_ADDRESS = "formatted_address";
    public static final String FORMATTED_PLACE = "formatted_place";
    public static final String LATITUDE = "current_latitude";
    public static final String LONGITUDE = "current_longitude";
    public static final String OSM_ID = "osm_id";
    public static final String OSM_TYPE = "osm_type";
    public static final String WIKIDATA_ID = "wikidata_id";
    public static final String LAST_PLACE_NAME = "last_place_name";
    public static final String DIRECTION_OF_TRAVEL = "direction_of_travel";

    /** Keys whose value is suppressed while the subject is outside every zone. */
    public static final Set<String> ZONE_GATED = Set.of(ZONE, ZONE_NAME);

    /** Keys whose all-lower-case values are title-cased for display. */
    public static final Set<String> TITLE_CASED = Set.of(ZONE_NAME, PLACE_TYPE, PLACE_CATEGORY);

    /** Keys that mark the street fragment for street-number spacing. */
    public static final Set<String> STREET_KEYS = Set.of(STREET, STREET_REF);

    private AttributeKeys() {}
}
