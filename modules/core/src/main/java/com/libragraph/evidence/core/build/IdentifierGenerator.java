package com.libragraph.evidence.core.build;

import com.libragraph.evidence.util.ContentHash;

/**
 * Entry ids: SHA-1 hex of effective name, parent reference and a per-builder sequence number.
 */
final class IdentifierGenerator {

    record Identifier(String id, long sequence) {
    }

    private long sequence;

    Identifier next(String name, String parentId) {
        long seq = ++sequence;
        String material = name + '\u0000' + (parentId == null ? "" : parentId) + '\u0000' + seq;
        return new Identifier(ContentHash.ofText(material).toHex(), seq);
    }
}
