package com.libragraph.evidence.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.entry.FileEntry;
import com.libragraph.evidence.formats.api.JsonDocumentReader;
import com.libragraph.evidence.formats.json.JacksonDocumentReader;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON file decomposed into a tree of entries.
 *
 * <p>The document root becomes a child of the file: {@code JSON Object}, {@code JSON Array}
 * or {@code JSON Value}. Nested objects and arrays become children named by their key or
 * index. Entries are registered depth-first in document order, each after its parent.
 */
public class JsonFileEntry extends FileEntry {

    private static final Logger log = Logger.getLogger(JsonFileEntry.class);

    public static final String MIME_TYPE = "application/json";
    public static final String ROOT_OBJECT_NAME = "JSON Object";
    public static final String ROOT_ARRAY_NAME = "JSON Array";
    public static final String ROOT_VALUE_NAME = "JSON Value";
    public static final String VALUE_KEY = "Value";

    private final JsonDocumentReader reader;
    private final JsonValueGenerator valueGenerator;
    private final JsonContainerGenerator arrayGenerator;
    private final JsonContainerGenerator objectGenerator;

    public JsonFileEntry(Path filePath) {
        this(filePath, null);
    }

    public JsonFileEntry(Path filePath, String parentId) {
        this(filePath, MIME_TYPE, parentId, new JacksonDocumentReader(),
                JsonValueEntry::new, JsonArrayEntry::new, JsonObjectEntry::new);
    }

    public JsonFileEntry(Path filePath, String mimeType, String parentId, JsonDocumentReader reader,
                         JsonValueGenerator valueGenerator, JsonContainerGenerator arrayGenerator,
                         JsonContainerGenerator objectGenerator) {
        super(filePath, mimeType, parentId);
        this.reader = Objects.requireNonNull(reader, "reader cannot be null");
        this.valueGenerator = Objects.requireNonNull(valueGenerator, "valueGenerator cannot be null");
        this.arrayGenerator = Objects.requireNonNull(arrayGenerator, "arrayGenerator cannot be null");
        this.objectGenerator = Objects.requireNonNull(objectGenerator, "objectGenerator cannot be null");
    }

    @Override
    public String addToBuilder(EvidenceBuilder builder) {
        // parsed up front so a malformed file registers nothing
        JsonNode document;
        try {
            document = reader.read(filePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read JSON " + filePath(), e);
        }
        String id = builder.register(this);
        int count = decompose(builder, document, id);
        log.debugf("Registered %d JSON entries from %s", count, filePath());
        return id;
    }

    @Override
    public String addAsParentPath(String existingPath) {
        return name() + "/" + existingPath;
    }

    private int decompose(EvidenceBuilder builder, JsonNode root, String fileId) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(rootName(root), root, fileId));
        int count = 0;

        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            JsonNode node = pending.node();
            List<Map.Entry<String, JsonNode>> nested = new ArrayList<>();
            Entry entry;

            if (node.isObject()) {
                Map<String, Object> scalars = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> members = node.fields();
                while (members.hasNext()) {
                    Map.Entry<String, JsonNode> member = members.next();
                    collect(member.getKey(), member.getValue(), scalars, nested);
                }
                entry = objectGenerator.create(pending.name(), scalars, pending.parentId());
            } else if (node.isArray()) {
                Map<String, Object> scalars = new LinkedHashMap<>();
                for (int i = 0; i < node.size(); i++) {
                    collect(String.valueOf(i), node.get(i), scalars, nested);
                }
                entry = arrayGenerator.create(pending.name(), scalars, pending.parentId());
            } else {
                entry = valueGenerator.create(pending.name(), VALUE_KEY, JsonScalars.toJava(node), pending.parentId());
            }

            String id = entry.addToBuilder(builder);
            count++;
            // reversed so the first nested member is popped next
            for (int i = nested.size() - 1; i >= 0; i--) {
                Map.Entry<String, JsonNode> child = nested.get(i);
                stack.push(new Pending(child.getKey(), child.getValue(), id));
            }
        }
        return count;
    }

    private static void collect(String key, JsonNode value, Map<String, Object> scalars,
                                List<Map.Entry<String, JsonNode>> nested) {
        if (JsonScalars.isContainer(value)) {
            nested.add(Map.entry(key, value));
        } else {
            scalars.put(key, JsonScalars.toJava(value));
        }
    }

    private static String rootName(JsonNode root) {
        if (root.isObject()) {
            return ROOT_OBJECT_NAME;
        }
        if (root.isArray()) {
            return ROOT_ARRAY_NAME;
        }
        return ROOT_VALUE_NAME;
    }

    private record Pending(String name, JsonNode node, String parentId) {
    }
}
