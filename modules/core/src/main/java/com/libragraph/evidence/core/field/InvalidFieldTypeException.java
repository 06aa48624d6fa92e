package com.libragraph.evidence.core.field;

import com.libragraph.evidence.types.FieldType;

/**
 * A value could not be coerced to the declared type of a field.
 */
public class InvalidFieldTypeException extends RuntimeException {

    private final String fieldName;
    private final FieldType fieldType;

    public InvalidFieldTypeException(String fieldName, FieldType fieldType, Object value, Throwable cause) {
        super("Field '" + fieldName + "' of type " + fieldType.label()
                + " cannot hold " + value.getClass().getSimpleName() + " value: " + value, cause);
        this.fieldName = fieldName;
        this.fieldType = fieldType;
    }

    public InvalidFieldTypeException(String fieldName, FieldType fieldType, Object value) {
        this(fieldName, fieldType, value, null);
    }

    public String fieldName() {
        return fieldName;
    }

    public FieldType fieldType() {
        return fieldType;
    }
}
