/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.cli;

import com.parcelgeo.enricher.config.EnricherProperties;
import com.parcelgeo.enricher.service.EnrichmentRunner;
import com.parcelgeo.resolver.model.AdministrativeHierarchy;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.EnrichedLocation;
import com.parcelgeo.resolver.model.LocationQuery;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.service.ResolutionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <ul>
 *   <li>{@code --input=<csv> [--output=<csv>] [--dry-run] [--limit=N]} enriches a file</li>
 *   <li>{@code --lat=<lat> --lon=<lon> [--address=<text>]} resolves one coordinate</li>
 *   <li>{@code --address=<text>} resolves one address</li>
 * </ul>
 *
 * Does nothing when none of these options is given.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentCommandRunner implements ApplicationRunner {

    private final EnrichmentRunner enrichmentRunner;
    private final ResolutionOrchestrator orchestrator;
    private final EnricherProperties properties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String input = option(args, "input");
        String lat = option(args, "lat");
        String lon = option(args, "lon");
        String address = option(args, "address");

        if (input != null) {
            Path inputPath = Path.of(input);
            String output = option(args, "output");
            Path outputPath = output != null ? Path.of(output) : defaultOutput(inputPath);
            if (args.containsOption("dry-run")) {
                enrichmentRunner.dryRun(inputPath, outputPath);
            } else {
                String limit = option(args, "limit");
                enrichmentRunner.enrichFile(inputPath, outputPath, limit != null ? Integer.parseInt(limit) : 0);
            }
        } else if (lat != null && lon != null) {
            Coordinate coordinate = Coordinate.of(Double.parseDouble(lat), Double.parseDouble(lon));
            report(orchestrator.resolve(LocationQuery.of(address, coordinate, null)));
        } else if (address != null) {
            report(orchestrator.resolve(LocationQuery.ofAddress(address)));
        } else {
            log.debug("No --input, --lat/--lon or --address given; nothing to do");
        }
    }

    /**
     * {@code listings.csv} becomes {@code listings_with_parcels.csv} next to it.
     */
    Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : ".csv";
        return input.resolveSibling(stem + properties.getOutputSuffix() + extension);
    }

    private void report(EnrichedLocation location) {
        log.info("Status: {}", location.status());
        location.coordinate().ifPresent(c -> log.info("Coordinate: {}", c));
        location.failedStage().ifPresent(stage ->
                log.info("Failed at {}: {}", stage, location.errorMessage().orElse("")));

        if (location.bestParcel().isPresent()) {
            ParcelCandidate parcel = location.bestParcel().get();
            log.info("APN: {}", parcel.getParcelId());
            log.info("Owner: {}", parcel.getOwnerName());
            log.info("Situs: {}", parcel.situsLine());
            log.info("Assessed value: {}", parcel.getAssessedTotalValue());
            log.info("Candidates considered: {}", location.candidateCount());
        }

        AdministrativeHierarchy h = location.hierarchy();
        if (!h.isEmpty()) {
            log.info("Place: {} ({})", h.getPlaceName(), h.getPlaceGeoid());
            log.info("County: {} ({})", h.getCountyName(), h.getCountyGeoid());
            log.info("State: {} ({})", h.getStateName(), h.getStateFips());
            log.info("Tract: {}", h.getTractGeoid());
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }
}
