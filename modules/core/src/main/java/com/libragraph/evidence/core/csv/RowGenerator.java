package com.libragraph.evidence.core.csv;

import com.libragraph.evidence.core.entry.Entry;

/**
 * Builds the entry for one row of a CSV file.
 */
@FunctionalInterface
public interface RowGenerator {

    Entry create(CsvEntry csv, int rowIndex);
}
