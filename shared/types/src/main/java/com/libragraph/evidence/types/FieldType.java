package com.libragraph.evidence.types;

/**
 * Data types a field can declare in an EDRM XML 1.2 load file.
 * The label is written verbatim to the {@code DataType} attribute of a field definition.
 */
public enum FieldType {
    TEXT("Text"),
    LONG_TEXT("LongText"),
    DATE_TIME("DateTime"),
    LONG_INTEGER("LongInteger"),
    DECIMAL("Decimal"),
    BOOLEAN("Boolean");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FieldType fromLabel(String label) {
        for (FieldType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("Unknown FieldType label: " + label);
    }
}
