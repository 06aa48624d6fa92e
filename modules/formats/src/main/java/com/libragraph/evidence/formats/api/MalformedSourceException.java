package com.libragraph.evidence.formats.api;

import java.nio.file.Path;

/**
 * Thrown when a structured source document (CSV, JSON) cannot be parsed.
 * The underlying parser's exception is kept as the cause.
 */
public class MalformedSourceException extends RuntimeException {

    private final Path source;

    public MalformedSourceException(Path source, String message, Throwable cause) {
        super("Malformed source " + source + ": " + message, cause);
        this.source = source;
    }

    public MalformedSourceException(Path source, String message) {
        this(source, message, null);
    }

    public Path source() {
        return source;
    }
}
