/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.service;

import com.parcelgeo.enricher.batch.BatchJob;
import com.parcelgeo.enricher.batch.BatchSink;
import com.parcelgeo.enricher.batch.BatchSummary;
import com.parcelgeo.enricher.batch.ResumableBatchDriver;
import com.parcelgeo.enricher.config.EnricherProperties;
import com.parcelgeo.enricher.csv.CsvRowReader;
import com.parcelgeo.enricher.csv.CsvRowSink;
import com.parcelgeo.enricher.row.EnrichmentRow;
import com.parcelgeo.enricher.row.LocationRowMapper;
import com.parcelgeo.resolver.exception.InvalidQueryException;
import com.parcelgeo.resolver.model.EnrichedLocation;
import com.parcelgeo.resolver.model.LocationQuery;
import com.parcelgeo.resolver.model.ResolutionStatus;
import com.parcelgeo.resolver.service.JurisdictionScope;
import com.parcelgeo.resolver.service.ResolutionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Runs the resolver over tabular rows.
 *
 * <p>Rows that already carry a parcel id are written through untouched. Rows outside the
 * configured jurisdiction are marked {@code OUT_OF_SCOPE} without any provider call.
 * Everything else is resolved, retrying {@code ERROR} outcomes with capped exponential
 * backoff, and merged back into the row. Every input row produces exactly one output row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentRunner {

    private static final int DRY_RUN_SAMPLE = 10;

    private final ResolutionOrchestrator orchestrator;
    private final LocationRowMapper rowMapper;
    private final JurisdictionScope jurisdictionScope;
    private final EnricherProperties properties;

    /**
     * Enriches rows in memory, in order.
     */
    public List<EnrichmentRow> enrich(List<EnrichmentRow> rows,
                                      Predicate<EnrichmentRow> alreadyResolved,
                                      Predicate<EnrichmentRow> outOfScope) {
        List<EnrichmentRow> out = new ArrayList<>(rows.size());
        RowJob job = new RowJob(0, alreadyResolved, outOfScope);
        try {
            driver().run(rows.iterator(), job, out::add, 0);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory sink failed", e);
        }
        return out;
    }

    /**
     * Enriches {@code input} into {@code output}, resuming after the rows an earlier run
     * already wrote when resume is enabled. Output follows input order, so an output holding
     * N rows covers exactly the first N input rows.
     *
     * @param limit maximum number of rows to write; zero or less for all
     */
    public EnrichmentReport enrichFile(Path input, Path output, int limit) throws IOException {
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Output must differ from input: " + input);
        }
        String idColumn = properties.getColumns().getId();
        int written = properties.isResume() ? CsvRowSink.writtenRowCount(output) : 0;
        if (written > 0) {
            log.info("Resuming {}: {} rows already written", output, written);
        }

        RowJob job = new RowJob(written, rowMapper::isResolved, jurisdictionFilter());
        BatchSummary summary;
        try (CsvRowReader reader = CsvRowReader.open(input, idColumn)) {
            List<String> header = rowMapper.outputHeader(reader.getHeader());
            try (BatchSink<EnrichmentRow> sink = written == 0
                    ? CsvRowSink.create(output, header)
                    : CsvRowSink.append(output, header)) {
                summary = driver().run(reader, job, sink, limit);
            }
        }

        EnrichmentReport report = EnrichmentReport.of(summary, job.statusCounts());
        log.info("Enriched {} -> {}: {}", input, output, report.describe());
        return report;
    }

    /**
     * Classifies the rows of {@code input} the way {@link #enrichFile} would, without any
     * provider call and without writing.
     */
    public DryRunReport dryRun(Path input, Path output) throws IOException {
        String idColumn = properties.getColumns().getId();
        int written = properties.isResume() ? CsvRowSink.writtenRowCount(output) : 0;
        Predicate<EnrichmentRow> outOfScope = jurisdictionFilter();
        int read = 0;
        int resumed = 0;
        int passedThrough = 0;
        int filtered = 0;
        int invalid = 0;
        int toResolve = 0;
        List<EnrichmentRow> sample = new ArrayList<>();

        try (CsvRowReader reader = CsvRowReader.open(input, idColumn)) {
            while (reader.hasNext()) {
                EnrichmentRow row = reader.next();
                read++;
                if (row.getPosition() <= written) {
                    resumed++;
                } else if (rowMapper.isResolved(row)) {
                    passedThrough++;
                } else if (outOfScope.test(row)) {
                    filtered++;
                } else if (!hasLocation(row)) {
                    invalid++;
                } else {
                    toResolve++;
                    if (sample.size() < DRY_RUN_SAMPLE) {
                        sample.add(row);
                    }
                }
            }
        }

        DryRunReport report = new DryRunReport(read, resumed, passedThrough, filtered, invalid, toResolve, sample);
        log.info("Dry run of {}: {} rows, {} to resolve, {} already resolved, {} out of scope, {} invalid, {} already written",
                input, read, toResolve, passedThrough, filtered, invalid, resumed);
        for (EnrichmentRow row : sample) {
            log.info("  [{}] {} {}", row.getPosition(), row.getKey(), describeLocation(row));
        }
        return report;
    }

    /**
     * True for rows whose known county or ZIP lies outside the configured jurisdiction.
     */
    public Predicate<EnrichmentRow> jurisdictionFilter() {
        return row -> !jurisdictionScope.isCountyInScope(rowMapper.countyGeoid(row))
                || !jurisdictionScope.isZipInScope(rowMapper.zip(row));
    }

    EnrichedLocation resolveWithRetry(EnrichmentRow row, LocationQuery query) {
        EnricherProperties.Retry retry = properties.getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        Duration backoff = retry.getInitialBackoff();

        EnrichedLocation location = orchestrator.resolve(query);
        int attempt = 1;
        while (location.status() == ResolutionStatus.ERROR && attempt < maxAttempts) {
            log.warn("{} failed at {}: {}; retry {}/{} in {} ms", row, stageOf(location),
                    location.errorMessage().orElse(""), attempt, maxAttempts - 1, backoff.toMillis());
            if (!pause(backoff)) {
                break;
            }
            backoff = min(backoff.multipliedBy(2), retry.getMaxBackoff());
            location = orchestrator.resolve(query);
            attempt++;
        }

        if (location.status() == ResolutionStatus.ERROR) {
            log.error("{} failed at {} after {} attempts: {}", row, stageOf(location), attempt,
                    location.errorMessage().orElse(""));
        }
        return location;
    }

    private ResumableBatchDriver driver() {
        return new ResumableBatchDriver(properties.getWorkers(), properties.getWindowSize());
    }

    private boolean hasLocation(EnrichmentRow row) {
        try {
            rowMapper.toQuery(row);
            return true;
        } catch (InvalidQueryException e) {
            return false;
        }
    }

    private String describeLocation(EnrichmentRow row) {
        String address = rowMapper.fullAddress(row);
        if (!address.isEmpty()) {
            return address;
        }
        return rowMapper.coordinate(row).map(Object::toString).orElse("");
    }

    private static String stageOf(EnrichedLocation location) {
        return location.failedStage().map(Enum::name).orElse("unknown stage");
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Per-row work for one run. Counts are shared between worker threads.
     */
    private final class RowJob implements BatchJob<EnrichmentRow> {

        private final int writtenRows;
        private final Predicate<EnrichmentRow> alreadyResolved;
        private final Predicate<EnrichmentRow> outOfScope;
        private final Map<ResolutionStatus, Integer> counts = new EnumMap<>(ResolutionStatus.class);

        RowJob(int writtenRows, Predicate<EnrichmentRow> alreadyResolved,
               Predicate<EnrichmentRow> outOfScope) {
            this.writtenRows = writtenRows;
            this.alreadyResolved = alreadyResolved;
            this.outOfScope = outOfScope;
        }

        @Override
        public boolean isAlreadyWritten(EnrichmentRow row) {
            return row.getPosition() <= writtenRows;
        }

        @Override
        public boolean isComplete(EnrichmentRow row) {
            return alreadyResolved.test(row);
        }

        @Override
        public EnrichmentRow process(EnrichmentRow row) {
            if (outOfScope.test(row)) {
                log.info("[{}] {} -> {}", row.getPosition(), row.getKey(), ResolutionStatus.OUT_OF_SCOPE);
                return mark(row, ResolutionStatus.OUT_OF_SCOPE);
            }

            LocationQuery query;
            try {
                query = rowMapper.toQuery(row);
            } catch (InvalidQueryException e) {
                log.warn("[{}] {} -> {}: {}", row.getPosition(), row.getKey(), ResolutionStatus.INVALID_INPUT,
                        e.getMessage());
                return mark(row, ResolutionStatus.INVALID_INPUT);
            }

            EnrichedLocation location = resolveWithRetry(row, query);
            tally(location.status());
            log.info("[{}] {} {} -> {}", row.getPosition(), row.getKey(), describeLocation(row), location.status());
            return row.with(rowMapper.toColumns(row, location));
        }

        @Override
        public EnrichmentRow onFailure(EnrichmentRow row, Exception failure) {
            return mark(row, ResolutionStatus.ERROR);
        }

        private EnrichmentRow mark(EnrichmentRow row, ResolutionStatus status) {
            tally(status);
            return row.with(rowMapper.statusOnlyColumns(status));
        }

        private synchronized void tally(ResolutionStatus status) {
            counts.merge(status, 1, Integer::sum);
        }

        synchronized Map<ResolutionStatus, Integer> statusCounts() {
            return new EnumMap<>(counts);
        }
    }
}
