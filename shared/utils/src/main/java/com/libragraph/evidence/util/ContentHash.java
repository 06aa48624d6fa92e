package com.libragraph.evidence.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a SHA-1 content digest (20 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Used both as the {@code SHA-1} field value of an entry and as the material
 * for generated entry identifiers.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 20; // 160 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 20 bytes (SHA-1), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Digests the given bytes.
     */
    public static ContentHash of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new ContentHash(DigestUtils.sha1(data));
    }

    /**
     * Digests the UTF-8 encoding of the given text.
     */
    public static ContentHash ofText(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates ContentHash from hex string (40 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException(
                "SHA-1 hex string must be 40 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (40 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
