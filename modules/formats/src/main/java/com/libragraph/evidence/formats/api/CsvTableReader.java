package com.libragraph.evidence.formats.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a CSV file into a header and its rows.
 */
public interface CsvTableReader {

    /**
     * @throws MalformedSourceException if the content is not valid CSV or has no header
     * @throws IOException              if the file cannot be read
     */
    CsvTable read(Path file) throws IOException;
}
