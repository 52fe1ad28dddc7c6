package it.dicom.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class UlItemCodec {

    public static final int AE_TITLE_LENGTH = 16;

    private UlItemCodec() {
    }

    public static List<UlItem> decodeAll(byte[] payload) {
        return decodeAll(payload, 0, payload.length);
    }

    public static List<UlItem> decodeAll(byte[] payload, int offset, int end) {
        List<UlItem> result = new ArrayList<>();
        int index = offset;
        while (index < end) {
            if (index + 4 > end) {
                throw new FramingException("Truncated item header at offset " + index);
            }
            int type = payload[index] & 0xFF;
            int length = readUnsignedShort(payload, index + 2);
            int valueStart = index + 4;
            if (valueStart + length > end) {
                throw new FramingException("Item 0x" + Integer.toHexString(type) + " length " + length + " exceeds available bytes");
            }
            result.add(new UlItem(type, length, Arrays.copyOfRange(payload, valueStart, valueStart + length)));
            index = valueStart + length;
        }
        return result;
    }

    public static byte[] encode(UlItem item) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(4 + item.length());
        out.write(item.type());
        out.write(0);
        out.write((item.length() >> 8) & 0xFF);
        out.write(item.length() & 0xFF);
        out.writeBytes(item.value());
        return out.toByteArray();
    }

    public static byte[] encode(int type, byte[] value) {
        return encode(UlItem.of(type, value));
    }

    public static Optional<UlItem> findOptional(List<UlItem> items, int type) {
        return items.stream()
            .filter(item -> item.type() == type)
            .findFirst();
    }

    public static List<UlItem> findAll(List<UlItem> items, int type) {
        return items.stream()
            .filter(item -> item.type() == type)
            .toList();
    }

    public static int readUnsignedShort(byte[] bytes, int offset) {
        return ((bytes[offset] & 0xFF) << 8) | (bytes[offset + 1] & 0xFF);
    }

    public static long readUnsignedInt(byte[] bytes, int offset) {
        return ((long) (bytes[offset] & 0xFF) << 24)
            | ((bytes[offset + 1] & 0xFF) << 16)
            | ((bytes[offset + 2] & 0xFF) << 8)
            | (bytes[offset + 3] & 0xFF);
    }

    public static void writeUnsignedShort(byte[] bytes, int offset, int value) {
        bytes[offset] = (byte) ((value >> 8) & 0xFF);
        bytes[offset + 1] = (byte) (value & 0xFF);
    }

    public static void writeUnsignedInt(byte[] bytes, int offset, long value) {
        bytes[offset] = (byte) ((value >> 24) & 0xFF);
        bytes[offset + 1] = (byte) ((value >> 16) & 0xFF);
        bytes[offset + 2] = (byte) ((value >> 8) & 0xFF);
        bytes[offset + 3] = (byte) (value & 0xFF);
    }

    public static String decodeUid(byte[] raw) {
        int end = raw.length;
        while (end > 0 && (raw[end - 1] == 0 || raw[end - 1] == ' ')) {
            end--;
        }
        if (end == 0) {
            throw new FramingException("Empty UID field");
        }
        requirePrintable(raw, 0, end, "UID");
        return new String(raw, 0, end, StandardCharsets.US_ASCII);
    }

    public static byte[] encodeUid(String uid) {
        return uid.getBytes(StandardCharsets.US_ASCII);
    }

    public static String decodeAeTitle(byte[] pdu, int offset) {
        int start = offset;
        int end = offset + AE_TITLE_LENGTH;
        if (end > pdu.length) {
            throw new FramingException("Truncated AE title field");
        }
        while (end > start && (pdu[end - 1] == 0 || pdu[end - 1] == ' ')) {
            end--;
        }
        while (start < end && pdu[start] == ' ') {
            start++;
        }
        requirePrintable(pdu, start, end, "AE title");
        for (int i = start; i < end; i++) {
            if (pdu[i] == '\\') {
                throw new FramingException("AE title contains a backslash");
            }
        }
        return new String(pdu, start, end - start, StandardCharsets.US_ASCII);
    }

    public static void encodeAeTitle(byte[] pdu, int offset, String aeTitle) {
        byte[] bytes = aeTitle.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length > AE_TITLE_LENGTH) {
            throw new IllegalArgumentException("AE title longer than 16 characters: " + aeTitle);
        }
        Arrays.fill(pdu, offset, offset + AE_TITLE_LENGTH, (byte) ' ');
        System.arraycopy(bytes, 0, pdu, offset, bytes.length);
    }

    public static String decodeAscii(byte[] raw) {
        requirePrintable(raw, 0, raw.length, "text");
        return new String(raw, StandardCharsets.US_ASCII);
    }

    private static void requirePrintable(byte[] bytes, int start, int end, String field) {
        for (int i = start; i < end; i++) {
            int b = bytes[i] & 0xFF;
            if (b < 0x20 || b > 0x7E) {
                throw new FramingException(field + " contains illegal byte " + String.format("0x%02X", b));
            }
        }
    }

    public static byte[] concat(byte[]... chunks) {
        int len = 0;
        for (byte[] chunk : chunks) {
            len += chunk.length;
        }
        byte[] out = new byte[len];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, out, offset, chunk.length);
            offset += chunk.length;
        }
        return out;
    }
}
