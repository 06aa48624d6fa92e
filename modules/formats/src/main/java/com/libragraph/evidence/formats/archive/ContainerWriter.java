package com.libragraph.evidence.formats.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes a set of children into a single archive stream.
 */
public interface ContainerWriter {

    /**
     * Writes all children, in order, and finishes the archive.
     * The output stream is left open for the caller to close.
     *
     * @throws IOException if a source file cannot be read or the output cannot be written
     */
    void write(List<ContainerChild> children, OutputStream output) throws IOException;
}
