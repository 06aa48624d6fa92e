package com.libragraph.evidence.core.entry;

/**
 * An item date field held a string that does not match the expected pattern.
 */
public class DateParseException extends RuntimeException {

    private final String fieldName;
    private final String rawValue;
    private final String pattern;

    public DateParseException(String fieldName, String rawValue, String pattern, Throwable cause) {
        super("Field '" + fieldName + "' value '" + rawValue + "' does not match date pattern '" + pattern + "'", cause);
        this.fieldName = fieldName;
        this.rawValue = rawValue;
        this.pattern = pattern;
    }

    public String fieldName() {
        return fieldName;
    }

    public String rawValue() {
        return rawValue;
    }

    public String pattern() {
        return pattern;
    }
}
