package com.libragraph.evidence.core.field;

import com.libragraph.evidence.types.FieldType;
import com.libragraph.evidence.util.EdrmDates;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;

/**
 * A named, typed metadata value attached to an entry.
 *
 * <p>Assignment coerces the value to the field's type and fails with
 * {@link InvalidFieldTypeException} when that is not possible. Stored values are
 * {@code String} (text), {@code Long}, {@code BigDecimal}, {@code Boolean} or
 * {@code Instant}; {@code null} means empty.
 *
 * <p>{@link #render()} writes decimals rounded half-up to four places with trailing zeros
 * removed, so {@code 3.14159} appears as {@code 3.1416} in the manifest, the text of a
 * mapping and its digest. {@link #value()} keeps the full precision.
 *
 * <p>Entries store their own {@link #copy() copies}, so a field instance is never
 * shared between two entries.
 */
public final class EntryField {

    private static final int DECIMAL_SCALE = 4;

    private final String name;
    private final FieldType type;
    private Object value;

    EntryField(String name, FieldType type, Object value) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        setValue(value);
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    public Object value() {
        return value;
    }

    public boolean isEmpty() {
        return value == null;
    }

    public void setValue(Object newValue) {
        this.value = coerce(newValue);
    }

    public EntryField copy() {
        // stored values are immutable, the copy can share them
        EntryField copy = new EntryField(name, type, null);
        copy.value = value;
        return copy;
    }

    /**
     * Manifest rendering of the value; {@code ""} when empty.
     */
    public String render() {
        if (value == null) {
            return "";
        }
        return switch (type) {
            case DATE_TIME -> EdrmDates.format((Instant) value);
            case DECIMAL -> ((BigDecimal) value).setScale(DECIMAL_SCALE, RoundingMode.HALF_UP)
                    .stripTrailingZeros().toPlainString();
            default -> value.toString();
        };
    }

    private Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return switch (type) {
                case TEXT, LONG_TEXT -> raw.toString();
                case LONG_INTEGER -> toLong(raw);
                case DECIMAL -> toDecimal(raw);
                case BOOLEAN -> toBoolean(raw);
                case DATE_TIME -> toInstant(raw);
            };
        } catch (ArithmeticException | NumberFormatException | DateTimeException e) {
            throw new InvalidFieldTypeException(name, type, raw, e);
        }
    }

    private Long toLong(Object raw) {
        if (raw instanceof Long l) {
            return l;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger b) {
            return b.longValueExact();
        }
        if (raw instanceof BigDecimal d) {
            return d.longValueExact();
        }
        if (raw instanceof CharSequence s) {
            return Long.parseLong(s.toString().trim());
        }
        throw new InvalidFieldTypeException(name, type, raw);
    }

    private BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal d) {
            return d;
        }
        if (raw instanceof BigInteger b) {
            return new BigDecimal(b);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidFieldTypeException(name, type, raw);
            }
            return BigDecimal.valueOf(d);
        }
        if (raw instanceof Number n) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (raw instanceof CharSequence s) {
            return new BigDecimal(s.toString().trim());
        }
        throw new InvalidFieldTypeException(name, type, raw);
    }

    private Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof CharSequence s) {
            String text = s.toString().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true")) {
                return Boolean.TRUE;
            }
            if (text.equals("false")) {
                return Boolean.FALSE;
            }
        }
        throw new InvalidFieldTypeException(name, type, raw);
    }

    private Instant toInstant(Object raw) {
        if (raw instanceof Instant i) {
            return i;
        }
        if (raw instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (raw instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (raw instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (raw instanceof Date d) {
            return d.toInstant();
        }
        if (raw instanceof CharSequence s) {
            return parseIso(s.toString().trim());
        }
        throw new InvalidFieldTypeException(name, type, raw);
    }

    private static Instant parseIso(String text) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime z) {
                return z.toInstant();
            }
            if (parsed instanceof OffsetDateTime o) {
                return o.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return Instant.parse(text);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryField other)) return false;
        return name.equals(other.name) && type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value);
    }

    @Override
    public String toString() {
        return name + "(" + type.label() + ")=" + value;
    }
}
