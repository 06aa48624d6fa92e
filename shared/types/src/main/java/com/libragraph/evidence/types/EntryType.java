package com.libragraph.evidence.types;

/**
 * Variant tag of an entry in the evidence tree.
 * Drives how the manifest and the container packager treat the entry's native content.
 */
public enum EntryType {
    /** Backed by bytes on disk. */
    FILE(0, "file"),
    /** Pure container, no native content. */
    DIRECTORY(1, "directory"),
    /** Field dictionary; its native is a generated text artifact. */
    MAPPING(2, "mapping");

    private final int id;
    private final String label;

    EntryType(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static EntryType fromId(int id) {
        for (EntryType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown EntryType id: " + id);
    }
}
