package io.relaydb.tag;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagValueTest {

    @Test
    void lowercaseEvenLengthHexIsPacked() {
        TagValue value = TagValue.of("deadbeef");

        assertTrue(value.isHex());
        assertNull(value.value());
        assertArrayEquals(new byte[]{(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}, value.valueHex());
        assertEquals("deadbeef", HexFormat.of().formatHex(value.valueHex()));
        assertEquals("deadbeef", value.asString());
    }

    @Test
    void mixedCaseIsStoredVerbatim() {
        TagValue value = TagValue.of("DeadBeef");

        assertFalse(value.isHex());
        assertNull(value.valueHex());
        assertArrayEquals("DeadBeef".getBytes(StandardCharsets.UTF_8), value.value());
        assertEquals("DeadBeef", value.asString());
    }

    @Test
    void oddLengthHexIsStoredVerbatim() {
        TagValue value = TagValue.of("abc");

        assertFalse(value.isHex());
        assertEquals("abc", value.asString());
    }

    @Test
    void nonHexCharactersAreStoredVerbatim() {
        assertFalse(TagValue.of("wss://relay.example.com").isHex());
        assertFalse(TagValue.of("0g").isHex());
        assertFalse(TagValue.of("12 34").isHex());
    }

    @Test
    void emptyStringPacksToZeroBytes() {
        TagValue value = TagValue.of("");

        assertTrue(value.isHex());
        assertEquals(0, value.valueHex().length);
        assertEquals("", value.asString());
    }

    @Test
    void nonAsciiValueRoundTrips() {
        TagValue value = TagValue.of("héllo wörld");

        assertFalse(value.isHex());
        assertEquals("héllo wörld", value.asString());
    }

    @Test
    void fromColumnsRequiresExactlyOneColumn() {
        assertThrows(IllegalArgumentException.class, () -> TagValue.fromColumns(null, null));
        assertThrows(IllegalArgumentException.class, () -> TagValue.fromColumns(new byte[1], new byte[1]));
        assertEquals(TagValue.of("00ff"), TagValue.fromColumns(null, new byte[]{0, (byte) 0xff}));
    }

    @Test
    void equalValuesAreEqual() {
        assertEquals(TagValue.of("abc123"), TagValue.of("abc123"));
        assertEquals(TagValue.of("abc123").hashCode(), TagValue.of("abc123").hashCode());
    }

    @Test
    void returnedBytesAreCopies() {
        TagValue value = TagValue.of("00");
        value.valueHex()[0] = 1;

        assertEquals("00", value.asString());
    }
}
