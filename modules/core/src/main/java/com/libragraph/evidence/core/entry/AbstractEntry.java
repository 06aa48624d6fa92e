package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.core.field.FieldFactory;
import com.libragraph.evidence.core.field.StandardFields;
import com.libragraph.evidence.types.FieldType;
import com.libragraph.evidence.util.ContentHash;
import com.libragraph.evidence.util.NameSanitizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Field storage, naming and registration shared by all entry variants.
 *
 * <p>Subclasses supply {@link #getName()}, {@link #entryType()} and {@link #computeDigest()},
 * and extend {@link #fillStandardFields()} when they carry more standard fields.
 */
public abstract class AbstractEntry implements Entry {

    private final Map<String, EntryField> fields = new LinkedHashMap<>();
    private final Set<String> standardFieldNames = new HashSet<>();
    private final String mimeType;
    private String parentId;

    private RegistrationContext context;
    private String registeredName;
    private String registeredDisplayName;
    private ContentHash digest;

    protected AbstractEntry(String mimeType, String parentId) {
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType cannot be null");
        this.parentId = parentId;
    }

    @Override
    public final String id() {
        return context == null ? null : context.id();
    }

    @Override
    public String parentId() {
        return parentId;
    }

    /**
     * Changes the parent reference. Only allowed before registration.
     */
    public void setParentId(String parentId) {
        if (isRegistered()) {
            throw new IllegalStateException("Entry " + id() + " is registered; its parent is fixed");
        }
        this.parentId = parentId;
    }

    public boolean isRegistered() {
        return context != null;
    }

    @Override
    public String mimeType() {
        return mimeType;
    }

    @Override
    public String name() {
        if (registeredName != null) {
            return registeredName;
        }
        String fallback = id() != null ? id() : NameSanitizer.LAST_RESORT;
        return NameSanitizer.sanitize(getName(), fallback, config().maxNameLength());
    }

    @Override
    public String displayName() {
        if (registeredDisplayName != null) {
            return registeredDisplayName;
        }
        String raw = getName();
        return raw == null || raw.isBlank() ? name() : raw;
    }

    @Override
    public Optional<Instant> itemDate() {
        return Optional.empty();
    }

    @Override
    public final ContentHash digest() {
        if (digest == null) {
            digest = computeDigest();
        }
        return digest;
    }

    protected abstract ContentHash computeDigest();

    /**
     * Settings of the registering builder, or the built-in defaults before registration.
     */
    protected EvidenceConfig config() {
        return context == null ? EvidenceConfig.defaults() : context.config();
    }

    // --- Fields ---

    @Override
    public List<EntryField> fields() {
        List<EntryField> snapshot = new ArrayList<>(fields.size());
        for (EntryField field : fields.values()) {
            snapshot.add(field.copy());
        }
        return snapshot;
    }

    /**
     * Fields that came from the source data or the caller, excluding the standard ones.
     */
    public List<EntryField> dataFields() {
        List<EntryField> data = new ArrayList<>();
        for (EntryField field : fields.values()) {
            if (!standardFieldNames.contains(field.name())) {
                data.add(field.copy());
            }
        }
        return data;
    }

    @Override
    public Optional<EntryField> field(String name) {
        EntryField field = fields.get(name);
        return field == null ? Optional.empty() : Optional.of(field.copy());
    }

    @Override
    public void addField(EntryField field) {
        if (fields.containsKey(field.name())) {
            throw new IllegalStateException("Field '" + field.name() + "' already exists; use replaceField");
        }
        fields.put(field.name(), field.copy());
        dataChanged(field.name());
    }

    @Override
    public void replaceField(EntryField field) {
        fields.put(field.name(), field.copy());
        dataChanged(field.name());
    }

    @Override
    public void setFieldValue(String name, Object value) {
        EntryField field = fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException("No field named '" + name + "'");
        }
        field.setValue(value);
        dataChanged(name);
    }

    /**
     * Whether {@link #computeDigest()} reads the data fields. When it does, changing a data
     * field after registration recomputes the digest and the SHA-1 field.
     */
    protected boolean digestCoversFields() {
        return false;
    }

    private void dataChanged(String name) {
        if (!isRegistered() || standardFieldNames.contains(name) || !digestCoversFields()) {
            return;
        }
        digest = null;
        fields.put(StandardFields.SHA1, FieldFactory.generate(StandardFields.SHA1, FieldType.TEXT, digest().toHex()));
    }

    /**
     * Sets a standard field, overwriting a same-named field from the data.
     */
    protected void putStandardField(String name, FieldType type, Object value) {
        if (!fields.containsKey(name)) {
            standardFieldNames.add(name);
        }
        fields.put(name, FieldFactory.generate(name, type, value));
    }

    /**
     * Picks a name from the data fields: {@code preferredField} if present and non-blank,
     * else the first field whose name contains "name", else {@code null}.
     */
    protected String nameFromFields(String preferredField) {
        if (preferredField != null) {
            EntryField preferred = fields.get(preferredField);
            if (preferred != null && !preferred.render().isBlank()) {
                return preferred.render();
            }
        }
        for (EntryField field : fields.values()) {
            if (standardFieldNames.contains(field.name())) {
                continue;
            }
            if (field.name().toLowerCase(Locale.ROOT).contains("name") && !field.render().isBlank()) {
                return field.render();
            }
        }
        return null;
    }

    // --- Registration ---

    @Override
    public void onRegister(RegistrationContext context) {
        if (this.context != null) {
            throw new IllegalStateException("Entry " + id() + " (" + displayName() + ") is already registered");
        }
        Map<String, EntryField> fieldsBefore = new LinkedHashMap<>(fields);
        Set<String> standardBefore = new HashSet<>(standardFieldNames);
        this.context = context;
        try {
            // names are fixed from here on; standard fields can shadow the fields they were derived from
            this.registeredName = NameSanitizer.sanitize(getName(), context.id(), config().maxNameLength());
            String raw = getName();
            this.registeredDisplayName = raw == null || raw.isBlank() ? registeredName : raw;
            fillStandardFields();
        } catch (RuntimeException e) {
            // left unregistered so the caller can fix the data and register again
            fields.clear();
            fields.putAll(fieldsBefore);
            standardFieldNames.retainAll(standardBefore);
            this.context = null;
            this.registeredName = null;
            this.registeredDisplayName = null;
            this.digest = null;
            throw e;
        }
    }

    protected void fillStandardFields() {
        putStandardField(StandardFields.MIME_TYPE, FieldType.TEXT, mimeType());
        putStandardField(StandardFields.SHA1, FieldType.TEXT, digest().toHex());
        putStandardField(StandardFields.NAME, FieldType.TEXT, displayName());
        itemDate().ifPresent(date -> putStandardField(StandardFields.ITEM_DATE, FieldType.DATE_TIME, date));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id() + ", name=" + name() + ", parent=" + parentId + "]";
    }
}
