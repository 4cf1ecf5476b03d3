/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.arcgis;

import com.parcelgeo.resolver.model.ParcelCandidate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * Translates one feature's attribute map into a {@link ParcelCandidate} using the configured
 * attribute names. Null, blank and unparsable values become null fields.
 */
@Slf4j
public class ParcelAttributeMapper {

    private static final int ZIP5_LENGTH = 5;

    private final ArcGisParcelConfig.Fields fields;

    public ParcelAttributeMapper(ArcGisParcelConfig.Fields fields) {
        this.fields = fields;
    }

    /**
     * @return empty when the record carries no parcel id
     */
    public Optional<ParcelCandidate> map(Map<String, Object> attributes) {
        if (attributes == null) {
            return Optional.empty();
        }
        String parcelId = text(attributes, fields.getParcelId());
        if (parcelId == null) {
            return Optional.empty();
        }

        return Optional.of(ParcelCandidate.builder()
                .parcelId(parcelId)
                .parcelId8(text(attributes, fields.getParcelId8()))
                .ownerName(text(attributes, fields.getOwnerName()))
                .situsHouseNumber(text(attributes, fields.getHouseNumber()))
                .situsPreDirection(text(attributes, fields.getPreDirection()))
                .situsStreetName(text(attributes, fields.getStreetName()))
                .situsStreetSuffix(text(attributes, fields.getStreetSuffix()))
                .situsCommunity(text(attributes, fields.getCommunity()))
                .situsZip(zip5(text(attributes, fields.getZip())))
                .assessedTotalValue(wholeNumber(attributes, fields.getAssessedTotal()))
                .assessedLandValue(wholeNumber(attributes, fields.getAssessedLand()))
                .assessedImprovementValue(wholeNumber(attributes, fields.getAssessedImprovement()))
                .livingAreaSqft(wholeNumber(attributes, fields.getLivingArea()))
                .usableLotSqft(wholeNumber(attributes, fields.getUsableLotArea()))
                .lotAcreage(decimal(attributes, fields.getAcreage()))
                .beds(text(attributes, fields.getBeds()))
                .baths(text(attributes, fields.getBaths()))
                .build());
    }

    static String text(Map<String, Object> attributes, String field) {
        Object value = attributes.get(field);
        if (value == null || isNonFinite(value)) {
            return null;
        }
        String text;
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            // numeric house numbers arrive as 2260.0 from some layers
            text = new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        } else {
            text = value.toString();
        }
        text = text.trim();
        return text.isEmpty() ? null : text;
    }

    static Long wholeNumber(Map<String, Object> attributes, String field) {
        Object value = attributes.get(field);
        if (isNonFinite(value)) {
            log.debug("Ignoring non-finite {}={}", field, value);
            return null;
        }
        if (value instanceof Number number) {
            return Math.round(number.doubleValue());
        }
        String text = text(attributes, field);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Ignoring non-numeric {}='{}'", field, text);
            return null;
        }
    }

    static Double decimal(Map<String, Object> attributes, String field) {
        Object value = attributes.get(field);
        if (isNonFinite(value)) {
            log.debug("Ignoring non-finite {}={}", field, value);
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = text(attributes, field);
        if (text == null) {
            return null;
        }
        try {
            Double parsed = Double.valueOf(text);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}='{}'", field, text);
            return null;
        }
    }

    /**
     * Overflowing numbers such as {@code 1e400} arrive as infinities.
     */
    private static boolean isNonFinite(Object value) {
        return (value instanceof Double || value instanceof Float)
                && !Double.isFinite(((Number) value).doubleValue());
    }

    private static String zip5(String zip) {
        if (zip == null) {
            return null;
        }
        return zip.length() > ZIP5_LENGTH ? zip.substring(0, ZIP5_LENGTH) : zip;
    }
}
