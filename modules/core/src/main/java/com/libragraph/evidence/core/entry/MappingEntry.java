package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.core.field.FieldFactory;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.util.ContentHash;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A record of field values with no file behind it, such as a database row.
 *
 * <p>Its text is a {@code key: value} listing of the data fields, and that text is the
 * native written into a container. Subclasses name an item date source by overriding
 * {@link #timeField()}, and may override {@link #timeFormat()} to change the pattern.
 */
public class MappingEntry extends AbstractEntry {

    public static final String DEFAULT_MIME_TYPE = "application/x-database-table-row";

    public MappingEntry(Map<String, ?> mapping, String mimeType) {
        this(mapping, mimeType, null);
    }

    public MappingEntry(Map<String, ?> mapping, String mimeType, String parentId) {
        super(mimeType, parentId);
        mapping.forEach((key, value) -> addField(FieldFactory.infer(key, value)));
    }

    /**
     * For subclasses that add their own fields.
     */
    protected MappingEntry(String mimeType, String parentId) {
        super(mimeType, parentId);
    }

    @Override
    public EntryType entryType() {
        return EntryType.MAPPING;
    }

    /**
     * The configured row-name field, else the first field named like a name, else the first value.
     */
    @Override
    public String getName() {
        String name = nameFromFields(config().defaultRowNameField());
        if (name != null) {
            return name;
        }
        List<EntryField> data = dataFields();
        return data.isEmpty() ? null : data.get(0).render();
    }

    @Override
    public Optional<Path> nativePath() {
        return Optional.empty();
    }

    @Override
    public String text() {
        return dataFields().stream()
                .map(field -> field.name() + ": " + field.render())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Field holding the item date, if any.
     */
    protected Optional<String> timeField() {
        return Optional.empty();
    }

    protected String timeFormat() {
        return config().itemDateFormat();
    }

    /**
     * Read from {@link #timeField()}: date-time values are used as they are, strings are
     * parsed with {@link #timeFormat()} and taken as UTC unless they carry an offset.
     *
     * @throws DateParseException if the string does not match the pattern
     */
    @Override
    public Optional<Instant> itemDate() {
        Optional<String> timeField = timeField();
        if (timeField.isEmpty()) {
            return Optional.empty();
        }
        Optional<EntryField> field = field(timeField.get());
        if (field.isEmpty() || field.get().isEmpty()) {
            return Optional.empty();
        }
        Object value = field.get().value();
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        return Optional.of(parseDate(timeField.get(), value.toString().strip(), timeFormat()));
    }

    static Instant parseDate(String fieldName, String raw, String pattern) {
        try {
            DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
            TemporalAccessor parsed = formatter.parseBest(raw,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime z) {
                return z.toInstant();
            }
            if (parsed instanceof OffsetDateTime o) {
                return o.toInstant();
            }
            if (parsed instanceof LocalDateTime l) {
                return l.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new DateParseException(fieldName, raw, pattern, e);
        }
    }

    @Override
    protected boolean digestCoversFields() {
        return true;
    }

    @Override
    protected ContentHash computeDigest() {
        String text = text();
        return ContentHash.ofText(text != null ? text : displayName());
    }
}
