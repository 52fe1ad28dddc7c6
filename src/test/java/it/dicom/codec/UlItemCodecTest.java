package it.dicom.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

class UlItemCodecTest {

    @Test
    void shouldDecodeConsecutiveItems() {
        byte[] payload = UlItemCodec.concat(
            UlItemCodec.encode(0x30, "1.2.3".getBytes(StandardCharsets.US_ASCII)),
            UlItemCodec.encode(0x40, new byte[0])
        );

        List<UlItem> items = UlItemCodec.decodeAll(payload);

        assertEquals(2, items.size());
        assertEquals(0x30, items.get(0).type());
        assertEquals("1.2.3", new String(items.get(0).value(), StandardCharsets.US_ASCII));
        assertEquals(0, items.get(1).length());
    }

    @Test
    void shouldRejectItemOverrunningPayload() {
        byte[] payload = new byte[] {0x30, 0x00, 0x00, 0x08, '1', '.', '2'};

        assertThrows(FramingException.class, () -> UlItemCodec.decodeAll(payload));
    }

    @Test
    void shouldRejectTruncatedItemHeader() {
        assertThrows(FramingException.class, () -> UlItemCodec.decodeAll(new byte[] {0x30, 0x00, 0x00}));
    }

    @Test
    void shouldTrimUidPadding() {
        assertEquals("1.2.840.10008.1.2", UlItemCodec.decodeUid("1.2.840.10008.1.2\0".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("1.2.3", UlItemCodec.decodeUid("1.2.3 ".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void shouldRejectUidWithControlCharacters() {
        byte[] raw = new byte[] {'1', '.', 0x07, '2'};

        assertThrows(FramingException.class, () -> UlItemCodec.decodeUid(raw));
    }

    @Test
    void shouldRejectEmptyUid() {
        assertThrows(FramingException.class, () -> UlItemCodec.decodeUid(new byte[] {0, 0}));
    }

    @Test
    void shouldPadAndTrimAeTitles() {
        byte[] fixed = new byte[16];
        UlItemCodec.encodeAeTitle(fixed, 0, "STORESCP");

        assertEquals(' ', fixed[15]);
        assertEquals("STORESCP", UlItemCodec.decodeAeTitle(fixed, 0));

        byte[] leading = "   ARCHIVE      ".getBytes(StandardCharsets.US_ASCII);
        assertEquals("ARCHIVE", UlItemCodec.decodeAeTitle(leading, 0));
    }

    @Test
    void shouldRejectOversizedAeTitle() {
        assertThrows(IllegalArgumentException.class, () -> UlItemCodec.encodeAeTitle(new byte[16], 0, "A-TITLE-LONGER-THAN-16"));
    }

    @Test
    void shouldRejectAeTitleWithBackslash() {
        byte[] raw = "BAD\\TITLE       ".getBytes(StandardCharsets.US_ASCII);

        assertThrows(FramingException.class, () -> UlItemCodec.decodeAeTitle(raw, 0));
    }

    @Test
    void shouldWriteBigEndianIntegers() {
        byte[] bytes = new byte[4];
        UlItemCodec.writeUnsignedInt(bytes, 0, 0x01020304L);

        assertArrayEquals(new byte[] {1, 2, 3, 4}, bytes);
        assertEquals(0x01020304L, UlItemCodec.readUnsignedInt(bytes, 0));
        assertEquals(0x0102, UlItemCodec.readUnsignedShort(bytes, 0));
    }
}
