package com.libragraph.evidence.core.json;

import com.libragraph.evidence.core.entry.Entry;

/**
 * Builds the entry for a scalar JSON document.
 */
@FunctionalInterface
public interface JsonValueGenerator {

    Entry create(String name, String keyName, Object value, String parentId);
}
