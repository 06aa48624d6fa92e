package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.field.FieldFactory;
import com.libragraph.evidence.formats.api.FileStat;
import com.libragraph.evidence.formats.tika.MimeTypeDetector;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.util.ContentHash;
import com.libragraph.evidence.util.FileDigests;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A pure container with no native bytes. Its name becomes a path segment of its descendants.
 *
 * <p>When the label names an existing directory on disk, the digest covers that directory
 * tree and the item date is its creation time; otherwise the digest is of the label.
 */
public class DirectoryEntry extends AbstractEntry {

    private final String label;
    private final Path sourceDirectory;

    public DirectoryEntry(String directory) {
        this(directory, null);
    }

    public DirectoryEntry(String directory, String parentId) {
        super(MimeTypeDetector.DIRECTORY, parentId);
        Objects.requireNonNull(directory, "directory cannot be null");
        this.label = lastSegment(directory);
        this.sourceDirectory = existingDirectory(directory);
    }

    /**
     * A directory described by field values; named by its {@code Name}-like field.
     */
    public DirectoryEntry(Map<String, ?> fields, String parentId) {
        super(MimeTypeDetector.DIRECTORY, parentId);
        fields.forEach((key, value) -> addField(FieldFactory.infer(key, value)));
        this.label = null;
        this.sourceDirectory = null;
    }

    @Override
    public EntryType entryType() {
        return EntryType.DIRECTORY;
    }

    @Override
    public String getName() {
        return label != null ? label : nameFromFields(config().defaultRowNameField());
    }

    @Override
    public Optional<Path> nativePath() {
        return Optional.empty();
    }

    public Optional<Path> sourceDirectory() {
        return Optional.ofNullable(sourceDirectory);
    }

    @Override
    public Optional<Instant> itemDate() {
        if (sourceDirectory == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(FileStat.of(sourceDirectory).created());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read attributes of " + sourceDirectory, e);
        }
    }

    @Override
    public String addAsParentPath(String existingPath) {
        return name() + "/" + existingPath;
    }

    @Override
    protected ContentHash computeDigest() {
        if (sourceDirectory != null) {
            try {
                return FileDigests.sha1Tree(sourceDirectory, config().hashBufferSize());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot hash directory " + sourceDirectory, e);
            }
        }
        return ContentHash.ofText(displayName());
    }

    private static String lastSegment(String directory) {
        String trimmed = directory;
        while (trimmed.length() > 1 && (trimmed.endsWith("/") || trimmed.endsWith("\\"))) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static Path existingDirectory(String directory) {
        if (directory.isBlank()) {
            return null;
        }
        try {
            Path path = Path.of(directory);
            return Files.isDirectory(path) ? path.toAbsolutePath().normalize() : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
