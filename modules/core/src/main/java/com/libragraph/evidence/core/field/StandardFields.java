package com.libragraph.evidence.core.field;

/**
 * Names of the fields populated automatically when an entry is registered.
 */
public final class StandardFields {

    public static final String NAME = "Name";
    public static final String ITEM_DATE = "Item Date";
    public static final String SHA1 = "SHA-1";
    public static final String MIME_TYPE = "MIME Type";

    public static final String PATH_NAME = "Path Name";
    public static final String FILE_ACCESSED = "File Accessed";
    public static final String FILE_CREATED = "File Created";
    public static final String FILE_MODIFIED = "File Modified";
    public static final String FILE_OWNER = "File Owner";
    public static final String FILE_SIZE = "File Size";

    public static final String UNKNOWN_OWNER = "Undefined";

    private StandardFields() {
    }
}
