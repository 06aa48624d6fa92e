package com.libragraph.evidence.formats.archive;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One record to be written into a container archive.
 *
 * <p>Exactly one kind of payload is set: a source file copied in chunks, in-memory
 * content, or nothing at all for a directory (whose path ends with {@code /}).
 *
 * @param path       archive-relative path, {@code /} separated
 * @param sourceFile file whose bytes are copied, or null
 * @param content    in-memory bytes, or null
 * @param mtime      last-modified time recorded for the record, or null for "now"
 */
public record ContainerChild(
        String path,
        Path sourceFile,
        byte[] content,
        Instant mtime
) {
    public ContainerChild {
        Objects.requireNonNull(path, "path cannot be null");
        if (sourceFile != null && content != null) {
            throw new IllegalArgumentException("Child has both a source file and content: " + path);
        }
        if (content != null) {
            content = Arrays.copyOf(content, content.length);
        }
    }

    public static ContainerChild directory(String path) {
        return new ContainerChild(path.endsWith("/") ? path : path + "/", null, null, null);
    }

    public static ContainerChild file(String path, Path sourceFile, Instant mtime) {
        Objects.requireNonNull(sourceFile, "sourceFile cannot be null");
        return new ContainerChild(path, sourceFile, null, mtime);
    }

    public static ContainerChild bytes(String path, byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        return new ContainerChild(path, null, content, null);
    }

    public boolean isDirectory() {
        return path.endsWith("/");
    }
}
