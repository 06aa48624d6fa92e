package com.libragraph.evidence.core.json;

import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.field.FieldFactory;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * A JSON array. Scalar elements are fields named by index; the text joins them with {@code ", "}.
 */
public class JsonArrayEntry extends MappingEntry {

    public static final String MIME_TYPE = "application/x-json-array";

    private final String name;

    public JsonArrayEntry(String name, Map<String, Object> elements, String parentId) {
        this(name, elements, MIME_TYPE, parentId);
    }

    public JsonArrayEntry(String name, Map<String, Object> elements, String mimeType, String parentId) {
        super(mimeType, parentId);
        this.name = name;
        elements.forEach((index, value) -> addField(FieldFactory.infer(index, value)));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String text() {
        return dataFields().stream()
                .map(field -> field.isEmpty() ? "null" : field.render())
                .collect(Collectors.joining(", "));
    }

    @Override
    public String addAsParentPath(String existingPath) {
        return name() + "/" + existingPath;
    }
}
