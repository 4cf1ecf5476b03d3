/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.parcelgeo.enricher.row.EnrichmentRow;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Streams the rows of a headed CSV file. Each row is keyed by its id column, or by
 * {@code row-<position>} when the id is blank.
 */
public class CsvRowReader implements Iterator<EnrichmentRow>, Closeable {

    private static final String BOM = "\uFEFF";

    private final CSVReader reader;
    private final List<String> header;
    private final String idColumn;
    private EnrichmentRow next;
    private int position;

    private CsvRowReader(CSVReader reader, List<String> header, String idColumn) {
        this.reader = reader;
        this.header = header;
        this.idColumn = idColumn;
    }

    public static CsvRowReader open(Path path, String idColumn) throws IOException {
        // RFC 4180 quoting only, matching what CsvRowSink writes; backslashes are plain text
        CSVReader reader = new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
        String[] first;
        try {
            first = reader.readNext();
        } catch (CsvValidationException e) {
            reader.close();
            throw new IOException("Malformed CSV header in " + path, e);
        }
        List<String> header = first == null ? List.of() : Arrays.asList(first);
        if (!header.isEmpty() && header.get(0).startsWith(BOM)) {
            header.set(0, header.get(0).substring(BOM.length()));
        }
        return new CsvRowReader(reader, Collections.unmodifiableList(header), idColumn);
    }

    public List<String> getHeader() {
        return header;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = readRow();
        }
        return next != null;
    }

    @Override
    public EnrichmentRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        EnrichmentRow row = next;
        next = null;
        return row;
    }

    private EnrichmentRow readRow() {
        if (header.isEmpty()) {
            return null;
        }
        try {
            String[] cells;
            do {
                cells = reader.readNext();
            } while (cells != null && isBlankLine(cells));
            if (cells == null) {
                return null;
            }
            position++;
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                values.put(header.get(i), i < cells.length ? cells[i] : "");
            }
            String id = values.getOrDefault(idColumn, "").trim();
            return new EnrichmentRow(id.isEmpty() ? "row-" + position : id, position, values);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading CSV row " + (position + 1), e);
        } catch (CsvValidationException e) {
            throw new UncheckedIOException(new IOException("Malformed CSV row " + (position + 1), e));
        }
    }

    private static boolean isBlankLine(String[] cells) {
        return cells.length == 1 && cells[0].isBlank();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
