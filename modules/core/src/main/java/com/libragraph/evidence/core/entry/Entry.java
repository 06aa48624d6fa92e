package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.util.ContentHash;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One item of evidence: a file, a directory or a mapping of field values.
 *
 * <p>Implementations usually extend {@link AbstractEntry}, which handles the field
 * set, naming and registration. The hooks with default implementations here are
 * the ones composite entries (CSV, JSON) and custom variants override.
 */
public interface Entry {

    EntryType entryType();

    /**
     * Identifier assigned at registration, {@code null} before.
     */
    String id();

    /**
     * Parent reference: another entry's id or natural key, or {@code null} for a root.
     */
    String parentId();

    /**
     * Raw name as derived from the source, before sanitation. May be blank.
     */
    String getName();

    /**
     * Sanitized name, safe as a path segment. Never empty.
     */
    String name();

    /**
     * Name shown in the {@code Name} field; the raw name unless it is blank.
     */
    String displayName();

    String mimeType();

    /**
     * Field whose value is an alternative key that children may use as their parent reference.
     */
    default Optional<String> identifierField() {
        return Optional.empty();
    }

    /**
     * Extracted text, or {@code null} when the entry has none.
     */
    default String text() {
        return null;
    }

    Optional<Instant> itemDate();

    Optional<Path> nativePath();

    ContentHash digest();

    /**
     * Contributes this entry to a descendant's relative path. The default contributes nothing.
     */
    default String addAsParentPath(String existingPath) {
        return existingPath;
    }

    /**
     * Registers this entry, and any entries derived from it, with {@code builder}.
     *
     * @return the id of this entry
     */
    default String addToBuilder(EvidenceBuilder builder) {
        return builder.register(this);
    }

    /**
     * Snapshot of the fields in insertion order. Changing a returned field does not change the entry.
     */
    List<EntryField> fields();

    Optional<EntryField> field(String name);

    /**
     * Attaches a copy of {@code field}.
     *
     * @throws IllegalStateException if a field with that name already exists
     */
    void addField(EntryField field);

    /**
     * Attaches a copy of {@code field}, replacing any field with the same name in place.
     */
    void replaceField(EntryField field);

    /**
     * @throws IllegalArgumentException if no field with that name exists
     */
    void setFieldValue(String name, Object value);

    /**
     * Called once by the builder; assigns the id and fills the standard fields.
     *
     * @throws IllegalStateException if the entry is already registered
     */
    void onRegister(RegistrationContext context);
}
