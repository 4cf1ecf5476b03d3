/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.row;

import java.util.List;

/**
 * Output columns added to every row.
 */
public final class EnrichmentColumns {

    public static final String PARCEL_APN = "parcel_apn";
    public static final String PARCEL_APN_8 = "parcel_apn_8";
    public static final String PARCEL_OWNER = "parcel_owner";
    public static final String PARCEL_SITUS = "parcel_situs";
    public static final String PARCEL_ASSESSED_TOTAL = "parcel_assessed_total";
    public static final String PARCEL_ASSESSED_LAND = "parcel_assessed_land";
    public static final String PARCEL_ASSESSED_IMPR = "parcel_assessed_impr";
    public static final String PARCEL_SQFT_LIVING = "parcel_sqft_living";
    public static final String PARCEL_SQFT_LOT = "parcel_sqft_lot";
    public static final String PARCEL_ACREAGE = "parcel_acreage";
    public static final String PARCEL_BEDS = "parcel_beds";
    public static final String PARCEL_BATHS = "parcel_baths";
    public static final String PARCEL_COMMUNITY = "parcel_community";
    public static final String PARCEL_ZIP = "parcel_zip";
    public static final String PARCEL_MATCH_SCORE = "parcel_match_score";

    public static final String CENSUS_STATE_FIPS = "census_state_fips";
    public static final String CENSUS_STATE_NAME = "census_state_name";
    public static final String CENSUS_COUNTY_FIPS = "census_county_fips";
    public static final String CENSUS_COUNTY_GEOID = "census_county_geoid";
    public static final String CENSUS_COUNTY_NAME = "census_county_name";
    public static final String CENSUS_COUSUB_GEOID = "census_cousub_geoid";
    public static final String CENSUS_COUSUB_NAME = "census_cousub_name";
    public static final String CENSUS_PLACE_GEOID = "census_place_geoid";
    public static final String CENSUS_PLACE_NAME = "census_place_name";
    public static final String CENSUS_PLACE_CLASS = "census_place_class";
    public static final String CENSUS_PLACE_CLASSFP = "census_place_classfp";
    public static final String CENSUS_TRACT_GEOID = "census_tract_geoid";

    public static final String RESOLUTION_STATUS = "resolution_status";
    public static final String RESOLUTION_FAILED_STAGE = "resolution_failed_stage";

    public static final List<String> PARCEL = List.of(
            PARCEL_APN, PARCEL_APN_8, PARCEL_OWNER, PARCEL_SITUS,
            PARCEL_ASSESSED_TOTAL, PARCEL_ASSESSED_LAND, PARCEL_ASSESSED_IMPR,
            PARCEL_SQFT_LIVING, PARCEL_SQFT_LOT, PARCEL_ACREAGE, PARCEL_BEDS, PARCEL_BATHS,
            PARCEL_COMMUNITY, PARCEL_ZIP, PARCEL_MATCH_SCORE);

    public static final List<String> CENSUS = List.of(
            CENSUS_STATE_FIPS, CENSUS_STATE_NAME,
            CENSUS_COUNTY_FIPS, CENSUS_COUNTY_GEOID, CENSUS_COUNTY_NAME,
            CENSUS_COUSUB_GEOID, CENSUS_COUSUB_NAME,
            CENSUS_PLACE_GEOID, CENSUS_PLACE_NAME, CENSUS_PLACE_CLASS, CENSUS_PLACE_CLASSFP,
            CENSUS_TRACT_GEOID);

    public static final List<String> STATUS = List.of(RESOLUTION_STATUS, RESOLUTION_FAILED_STAGE);

    private EnrichmentColumns() {
    }
}
