package com.libragraph.evidence.formats.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

/**
 * File-system metadata of a native file.
 * Nullable fields are only populated when the file system provides them.
 */
public record FileStat(
        long size,
        Instant created,
        Instant modified,
        Instant accessed,
        String ownerName,
        boolean directory
) {

    /**
     * Reads the stat block of {@code path}, following links.
     *
     * @throws IOException if the path does not exist or cannot be inspected
     */
    public static FileStat of(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileStat(
                attrs.size(),
                toInstant(attrs.creationTime()),
                toInstant(attrs.lastModifiedTime()),
                toInstant(attrs.lastAccessTime()),
                ownerOf(path),
                attrs.isDirectory()
        );
    }

    private static Instant toInstant(FileTime time) {
        return time != null ? time.toInstant() : null;
    }

    private static String ownerOf(Path path) throws IOException {
        try {
            return Files.getOwner(path).getName();
        } catch (UnsupportedOperationException e) {
            // no owner attribute view on this file system
            return null;
        }
    }
}
