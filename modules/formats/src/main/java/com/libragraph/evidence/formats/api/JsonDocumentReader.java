package com.libragraph.evidence.formats.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses a JSON file into an in-memory tree of scalars, arrays and objects.
 */
public interface JsonDocumentReader {

    /**
     * @throws MalformedSourceException if the content is not a JSON document
     * @throws IOException              if the file cannot be read
     */
    JsonNode read(Path file) throws IOException;
}
