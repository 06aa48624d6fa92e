package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.field.StandardFields;
import com.libragraph.evidence.formats.api.FileStat;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.types.FieldType;
import com.libragraph.evidence.util.ContentHash;
import com.libragraph.evidence.util.FileDigests;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A file on disk, carried into the container as a native.
 *
 * <p>The file is stat'ed and hashed at registration; an unreadable file fails
 * registration with an {@link UncheckedIOException}.
 */
public class FileEntry extends AbstractEntry {

    private final Path filePath;
    private FileStat stat;

    public FileEntry(Path filePath, String mimeType) {
        this(filePath, mimeType, null);
    }

    public FileEntry(Path filePath, String mimeType, String parentId) {
        super(mimeType, parentId);
        this.filePath = Objects.requireNonNull(filePath, "filePath cannot be null").toAbsolutePath().normalize();
    }

    public Path filePath() {
        return filePath;
    }

    @Override
    public EntryType entryType() {
        return EntryType.FILE;
    }

    @Override
    public String getName() {
        Path fileName = filePath.getFileName();
        return fileName == null ? "" : fileName.toString();
    }

    @Override
    public Optional<Path> nativePath() {
        return Optional.of(filePath);
    }

    @Override
    public Optional<Instant> itemDate() {
        return Optional.ofNullable(stat().created());
    }

    public FileStat stat() {
        if (stat == null) {
            try {
                stat = FileStat.of(filePath);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read attributes of " + filePath, e);
            }
        }
        return stat;
    }

    @Override
    protected ContentHash computeDigest() {
        try {
            return FileDigests.sha1(filePath, config().hashBufferSize());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot hash " + filePath, e);
        }
    }

    @Override
    protected void fillStandardFields() {
        super.fillStandardFields();
        FileStat s = stat();
        putStandardField(StandardFields.PATH_NAME, FieldType.TEXT, filePath.toString());
        putStandardField(StandardFields.FILE_ACCESSED, FieldType.DATE_TIME, s.accessed());
        putStandardField(StandardFields.FILE_CREATED, FieldType.DATE_TIME, s.created());
        putStandardField(StandardFields.FILE_MODIFIED, FieldType.DATE_TIME, s.modified());
        putStandardField(StandardFields.FILE_OWNER, FieldType.TEXT,
                s.ownerName() != null ? s.ownerName() : StandardFields.UNKNOWN_OWNER);
        putStandardField(StandardFields.FILE_SIZE, FieldType.LONG_INTEGER, s.size());
    }
}
