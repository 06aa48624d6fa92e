package com.libragraph.evidence.core.build;

/**
 * An entry's parent reference matches no registered id or natural key.
 */
public class DanglingParentReferenceException extends RuntimeException {

    private final String entryId;
    private final String parentReference;

    public DanglingParentReferenceException(String entryId, String parentReference) {
        super("Entry " + entryId + " references unknown parent: " + parentReference);
        this.entryId = entryId;
        this.parentReference = parentReference;
    }

    public String entryId() {
        return entryId;
    }

    public String parentReference() {
        return parentReference;
    }
}
