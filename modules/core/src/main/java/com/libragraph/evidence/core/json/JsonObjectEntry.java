package com.libragraph.evidence.core.json;

import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.field.FieldFactory;

import java.util.Map;

/**
 * A JSON object. Scalar members are fields named by key.
 */
public class JsonObjectEntry extends MappingEntry {

    public static final String MIME_TYPE = "application/x-json-object";

    private final String name;

    public JsonObjectEntry(String name, Map<String, Object> members, String parentId) {
        this(name, members, MIME_TYPE, parentId);
    }

    public JsonObjectEntry(String name, Map<String, Object> members, String mimeType, String parentId) {
        super(mimeType, parentId);
        this.name = name;
        members.forEach((key, value) -> addField(FieldFactory.infer(key, value)));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String addAsParentPath(String existingPath) {
        return name() + "/" + existingPath;
    }
}
