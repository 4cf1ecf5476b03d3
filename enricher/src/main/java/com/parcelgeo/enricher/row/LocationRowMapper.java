/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.row;

import com.parcelgeo.enricher.config.EnricherProperties;
import com.parcelgeo.resolver.model.AdministrativeHierarchy;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.EnrichedLocation;
import com.parcelgeo.resolver.model.LocationQuery;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.model.ResolutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.parcelgeo.enricher.row.EnrichmentColumns.*;

/**
 * Translates between tabular rows and the resolver's model: builds a {@link LocationQuery}
 * from a row's input columns and flattens an {@link EnrichedLocation} into output columns.
 */
@Slf4j
@Component
public class LocationRowMapper {

    private final EnricherProperties.Columns columns;

    public LocationRowMapper(EnricherProperties properties) {
        this.columns = properties.getColumns();
    }

    /**
     * Input header followed by every enrichment column it does not already have.
     */
    public List<String> outputHeader(List<String> inputHeader) {
        Set<String> header = new LinkedHashSet<>(inputHeader);
        header.add(columns.getLatitude());
        header.add(columns.getLongitude());
        header.addAll(PARCEL);
        header.addAll(CENSUS);
        header.addAll(STATUS);
        return new ArrayList<>(header);
    }

    public boolean isResolved(EnrichmentRow row) {
        return row.has(PARCEL_APN);
    }

    public String countyGeoid(EnrichmentRow row) {
        return row.get(columns.getCountyGeoid());
    }

    public String zip(EnrichmentRow row) {
        return row.get(columns.getZip());
    }

    public Optional<Coordinate> coordinate(EnrichmentRow row) {
        String lat = row.get(columns.getLatitude());
        String lon = row.get(columns.getLongitude());
        if (lat.isEmpty() || lon.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Coordinate.of(Double.parseDouble(lat), Double.parseDouble(lon)));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unusable coordinate '{}','{}' on {}", lat, lon, row);
            return Optional.empty();
        }
    }

    /**
     * Street address joined with city, state and ZIP when the row carries them separately.
     */
    public String fullAddress(EnrichmentRow row) {
        String stateZip = Stream.of(row.get(columns.getState()), row.get(columns.getZip()))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
        return Stream.of(row.get(columns.getAddress()), row.get(columns.getCity()), stateZip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
    }

    /**
     * @throws com.parcelgeo.resolver.exception.InvalidQueryException when the row has neither
     *         an address nor a usable coordinate
     */
    public LocationQuery toQuery(EnrichmentRow row) {
        return LocationQuery.of(fullAddress(row), coordinate(row).orElse(null), countyGeoid(row));
    }

    public Map<String, String> toColumns(EnrichmentRow row, EnrichedLocation location) {
        Map<String, String> out = new LinkedHashMap<>();

        if (location.wasGeocoded() && coordinate(row).isEmpty()) {
            location.coordinate().ifPresent(c -> {
                out.put(columns.getLatitude(), String.valueOf(c.lat()));
                out.put(columns.getLongitude(), String.valueOf(c.lon()));
            });
        }

        Optional<ParcelCandidate> parcel = location.bestParcel();
        out.put(PARCEL_APN, parcel.map(ParcelCandidate::getParcelId).map(LocationRowMapper::text).orElse(""));
        out.put(PARCEL_APN_8, parcel.map(p -> text(p.getParcelId8())).orElse(""));
        out.put(PARCEL_OWNER, parcel.map(p -> text(p.getOwnerName())).orElse(""));
        out.put(PARCEL_SITUS, parcel.map(ParcelCandidate::situsLine).orElse(""));
        out.put(PARCEL_ASSESSED_TOTAL, parcel.map(p -> number(p.getAssessedTotalValue())).orElse(""));
        out.put(PARCEL_ASSESSED_LAND, parcel.map(p -> number(p.getAssessedLandValue())).orElse(""));
        out.put(PARCEL_ASSESSED_IMPR, parcel.map(p -> number(p.getAssessedImprovementValue())).orElse(""));
        out.put(PARCEL_SQFT_LIVING, parcel.map(p -> number(p.getLivingAreaSqft())).orElse(""));
        out.put(PARCEL_SQFT_LOT, parcel.map(p -> number(p.getUsableLotSqft())).orElse(""));
        out.put(PARCEL_ACREAGE, parcel.map(p -> number(p.getLotAcreage())).orElse(""));
        out.put(PARCEL_BEDS, parcel.map(p -> text(p.getBeds())).orElse(""));
        out.put(PARCEL_BATHS, parcel.map(p -> text(p.getBaths())).orElse(""));
        out.put(PARCEL_COMMUNITY, parcel.map(p -> text(p.getSitusCommunity())).orElse(""));
        out.put(PARCEL_ZIP, parcel.map(p -> text(p.getSitusZip())).orElse(""));
        out.put(PARCEL_MATCH_SCORE, location.bestMatch().map(m -> String.valueOf(m.score())).orElse(""));

        AdministrativeHierarchy h = location.hierarchy();
        out.put(CENSUS_STATE_FIPS, h.getStateFips());
        out.put(CENSUS_STATE_NAME, h.getStateName());
        out.put(CENSUS_COUNTY_FIPS, h.getCountyFips());
        out.put(CENSUS_COUNTY_GEOID, h.getCountyGeoid());
        out.put(CENSUS_COUNTY_NAME, h.getCountyName());
        out.put(CENSUS_COUSUB_GEOID, h.getSubdivisionGeoid());
        out.put(CENSUS_COUSUB_NAME, h.getSubdivisionName());
        out.put(CENSUS_PLACE_GEOID, h.getPlaceGeoid());
        out.put(CENSUS_PLACE_NAME, h.getPlaceName());
        out.put(CENSUS_PLACE_CLASS, switch (h.getPlaceClass()) {
            case INCORPORATED -> "incorporated";
            case CDP -> "cdp";
            case NONE -> "";
        });
        out.put(CENSUS_PLACE_CLASSFP, h.getPlaceClassFp());
        out.put(CENSUS_TRACT_GEOID, h.getTractGeoid());

        out.put(RESOLUTION_STATUS, location.status().name());
        out.put(RESOLUTION_FAILED_STAGE, location.failedStage().map(Enum::name).orElse(""));
        return out;
    }

    /**
     * Blank enrichment columns carrying only a status, for rows that produced no location.
     */
    public Map<String, String> statusOnlyColumns(ResolutionStatus status) {
        Map<String, String> out = new LinkedHashMap<>();
        PARCEL.forEach(c -> out.put(c, ""));
        CENSUS.forEach(c -> out.put(c, ""));
        out.put(RESOLUTION_STATUS, status.name());
        out.put(RESOLUTION_FAILED_STAGE, "");
        return out;
    }

    private static String text(String value) {
        return Objects.requireNonNullElse(value, "");
    }

    private static String number(Long value) {
        return value == null ? "" : value.toString();
    }

    private static String number(Double value) {
        return value == null ? "" : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
