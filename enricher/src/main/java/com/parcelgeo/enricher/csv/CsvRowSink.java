/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.csv;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.parcelgeo.enricher.batch.BatchSink;
import com.parcelgeo.enricher.row.EnrichmentRow;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes rows to a CSV file under a fixed header, flushing after every row so that a crash
 * leaves all previously written rows on disk.
 */
@Slf4j
public class CsvRowSink implements BatchSink<EnrichmentRow> {

    private final ICSVWriter writer;
    private final List<String> header;

    private CsvRowSink(ICSVWriter writer, List<String> header) {
        this.writer = writer;
        this.header = List.copyOf(header);
    }

    /**
     * Truncates {@code path} and writes the header.
     */
    public static CsvRowSink create(Path path, List<String> header) throws IOException {
        ICSVWriter writer = new CSVWriterBuilder(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))
                .build();
        CsvRowSink sink = new CsvRowSink(writer, header);
        writer.writeNext(header.toArray(String[]::new), false);
        writer.flush();
        return sink;
    }

    /**
     * Appends to an existing output whose header must equal {@code header}.
     *
     * @throws IllegalStateException if the existing header differs
     */
    public static CsvRowSink append(Path path, List<String> header) throws IOException {
        List<String> existing;
        try (CsvRowReader reader = CsvRowReader.open(path, "")) {
            existing = reader.getHeader();
        }
        if (!existing.equals(header)) {
            throw new IllegalStateException("Existing output " + path + " has header " + existing
                    + " but this run writes " + header);
        }
        ICSVWriter writer = new CSVWriterBuilder(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.APPEND, StandardOpenOption.WRITE))
                .build();
        return new CsvRowSink(writer, header);
    }

    /**
     * Number of data rows already present in a previous output, zero if there is none.
     */
    public static int writtenRowCount(Path path) throws IOException {
        if (!Files.isRegularFile(path) || Files.size(path) == 0) {
            return 0;
        }
        int count = 0;
        try (CsvRowReader reader = CsvRowReader.open(path, "")) {
            while (reader.hasNext()) {
                reader.next();
                count++;
            }
        }
        log.debug("Found {} rows already written to {}", count, path);
        return count;
    }

    @Override
    public void write(EnrichmentRow row) throws IOException {
        String[] cells = new String[header.size()];
        for (int i = 0; i < cells.length; i++) {
            String value = row.getValues().get(header.get(i));
            cells[i] = value == null ? "" : value;
        }
        writer.writeNext(cells, false);
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
