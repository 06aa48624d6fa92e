package com.libragraph.evidence.formats.api;

import java.util.List;
import java.util.Objects;

/**
 * A fully read CSV document: the header row and the data rows.
 * Every row has exactly as many cells as the header.
 */
public record CsvTable(List<String> header, List<List<String>> rows) {

    public CsvTable {
        Objects.requireNonNull(header, "header cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int size() {
        return rows.size();
    }
}
