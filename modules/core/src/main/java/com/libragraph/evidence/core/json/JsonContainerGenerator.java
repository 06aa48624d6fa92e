package com.libragraph.evidence.core.json;

import com.libragraph.evidence.core.entry.Entry;

import java.util.Map;

/**
 * Builds the entry for a JSON object or array from its scalar members.
 * Nested objects and arrays are not in {@code scalars}; they become child entries.
 */
@FunctionalInterface
public interface JsonContainerGenerator {

    Entry create(String name, Map<String, Object> scalars, String parentId);
}
