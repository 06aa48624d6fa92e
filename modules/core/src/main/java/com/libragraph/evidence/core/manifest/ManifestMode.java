package com.libragraph.evidence.core.manifest;

/**
 * How natives are referenced from the manifest.
 */
public enum ManifestMode {
    /** Paths relative to the container root; mapping texts are packed as natives. */
    CONTAINER,
    /** Absolute paths and file URIs; mappings carry inline text only. */
    STANDALONE
}
