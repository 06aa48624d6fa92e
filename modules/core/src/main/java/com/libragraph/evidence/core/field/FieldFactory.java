package com.libragraph.evidence.core.field;

import com.libragraph.evidence.types.FieldType;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Creates {@link EntryField}s, either with an explicit type or with one inferred from the value.
 */
public final class FieldFactory {

    private FieldFactory() {
    }

    /**
     * @throws InvalidFieldTypeException if {@code initialValue} cannot be coerced to {@code type}
     */
    public static EntryField generate(String name, FieldType type, Object initialValue) {
        return new EntryField(name, type, initialValue);
    }

    public static EntryField infer(String name, Object value) {
        return new EntryField(name, inferType(value), value);
    }

    public static FieldType inferType(Object value) {
        if (value instanceof Boolean) {
            return FieldType.BOOLEAN;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return FieldType.LONG_INTEGER;
        }
        if (value instanceof BigInteger b) {
            return b.bitLength() < Long.SIZE ? FieldType.LONG_INTEGER : FieldType.DECIMAL;
        }
        if (value instanceof Number) {
            return FieldType.DECIMAL;
        }
        if (value instanceof Instant || value instanceof OffsetDateTime || value instanceof ZonedDateTime
                || value instanceof LocalDateTime || value instanceof Date) {
            return FieldType.DATE_TIME;
        }
        return FieldType.TEXT;
    }
}
