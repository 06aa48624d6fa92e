package com.libragraph.evidence.core.json;

import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.core.field.FieldFactory;

/**
 * A scalar JSON document, held in a single field.
 */
public class JsonValueEntry extends MappingEntry {

    public static final String MIME_TYPE = "application/x-json-value";

    private final String name;
    private final String keyName;

    public JsonValueEntry(String name, String keyName, Object value, String parentId) {
        this(name, keyName, value, MIME_TYPE, parentId);
    }

    public JsonValueEntry(String name, String keyName, Object value, String mimeType, String parentId) {
        super(mimeType, parentId);
        this.name = name;
        this.keyName = keyName;
        addField(FieldFactory.infer(keyName, value));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String text() {
        return field(keyName).filter(f -> !f.isEmpty()).map(EntryField::render).orElse("null");
    }
}
