/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.arcgis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * ArcGIS feature service holding the parcel layer, plus the layer's attribute names. The
 * defaults match the San Diego County PARCELS_ALL layer; another county's layer only needs
 * a different {@code fields} block.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "arcgis.parcels")
public class ArcGisParcelConfig {

    private String baseUrl = "https://gis-public.sandiegocounty.gov";
    private String queryPath = "/arcgis/rest/services/sdep_warehouse/PARCELS_ALL/FeatureServer/0/query";
    private String inSr = "4326";
    private String outFields = "*";
    private Fields fields = new Fields();

    @Data
    public static class Fields {
        private String parcelId = "APN";
        private String parcelId8 = "APN_8";
        private String ownerName = "OWN_NAME1";
        private String houseNumber = "SITUS_ADDRESS";
        private String preDirection = "SITUS_PRE_DIR";
        private String streetName = "SITUS_STREET";
        private String streetSuffix = "SITUS_SUFFIX";
        private String community = "SITUS_COMMUNITY";
        private String zip = "SITUS_ZIP";
        private String assessedTotal = "ASR_TOTAL";
        private String assessedLand = "ASR_LAND";
        private String assessedImprovement = "ASR_IMPR";
        private String livingArea = "TOTAL_LVG_AREA";
        private String usableLotArea = "USABLE_SQ_FEET";
        private String acreage = "ACREAGE";
        private String beds = "BEDROOMS";
        private String baths = "BATHS";
    }
}
