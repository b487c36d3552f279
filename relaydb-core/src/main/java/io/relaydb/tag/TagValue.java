package io.relaydb.tag;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Stored form of a tag value. Exactly one of {@link #value()} and {@link #valueHex()}
 * is non-null.
 *
 * <p>A value is hex-packed only when the packing is lossless: even length and every
 * character in {@code [0-9a-f]}. Hex-encoding the packed bytes then yields the
 * original string again. Anything else (uppercase, odd length, other characters)
 * is kept verbatim as UTF-8.
 */
public final class TagValue {
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;
    private final byte[] valueHex;

    private TagValue(byte[] value, byte[] valueHex) {
        this.value = value;
        this.valueHex = valueHex;
    }

    /**
     * Chooses the storage form for a raw tag value.
     */
    public static TagValue of(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (isLosslessHex(raw)) {
            return new TagValue(null, HEX.parseHex(raw));
        }
        return new TagValue(raw.getBytes(StandardCharsets.UTF_8), null);
    }

    /**
     * Rebuilds a value from the two stored columns.
     *
     * @throws IllegalArgumentException unless exactly one column is non-null
     */
    public static TagValue fromColumns(byte[] value, byte[] valueHex) {
        if ((value == null) == (valueHex == null)) {
            throw new IllegalArgumentException("exactly one of value and value_hex must be set");
        }
        return new TagValue(copy(value), copy(valueHex));
    }

    /**
     * True iff {@code raw} has even length and only lowercase hex digits.
     */
    public static boolean isLosslessHex(String raw) {
        if (raw.length() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            boolean digit = c >= '0' && c <= '9';
            boolean lower = c >= 'a' && c <= 'f';
            if (!digit && !lower) {
                return false;
            }
        }
        return true;
    }

    public boolean isHex() {
        return valueHex != null;
    }

    /** Verbatim UTF-8 bytes, or {@code null} when hex-packed. */
    public byte[] value() {
        return copy(value);
    }

    /** Decoded hex bytes, or {@code null} when stored verbatim. */
    public byte[] valueHex() {
        return copy(valueHex);
    }

    /**
     * Reconstructs the original string.
     */
    public String asString() {
        return isHex() ? HEX.formatHex(valueHex) : new String(value, StandardCharsets.UTF_8);
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagValue other)) return false;
        return Arrays.equals(value, other.value) && Arrays.equals(valueHex, other.valueHex);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(value) + Arrays.hashCode(valueHex);
    }

    @Override
    public String toString() {
        return (isHex() ? "hex:" : "raw:") + asString();
    }
}
