package it.dicom.dimse;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import it.dicom.codec.FramingException;

public final class CommandSetCodec {

    private static final int ELEMENT_HEADER_LENGTH = 8;

    private CommandSetCodec() {
    }

    public static byte[] encode(CommandSet command) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (Map.Entry<Integer, byte[]> entry : command.elements().entrySet()) {
            writeElement(body, entry.getKey(), entry.getValue());
        }
        byte[] elements = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream(ELEMENT_HEADER_LENGTH + 4 + elements.length);
        writeElement(out, CommandTags.COMMAND_GROUP_LENGTH, littleEndianInt(elements.length));
        out.writeBytes(elements);
        return out.toByteArray();
    }

    public static CommandSet decode(byte[] bytes) {
        TreeMap<Integer, byte[]> elements = new TreeMap<>();
        int index = 0;
        int previousTag = -1;
        Integer groupLength = null;
        int groupStart = 0;
        while (index < bytes.length) {
            if (index + ELEMENT_HEADER_LENGTH > bytes.length) {
                throw new FramingException("Truncated command element header at offset " + index);
            }
            int group = readUnsignedShort(bytes, index);
            int element = readUnsignedShort(bytes, index + 2);
            long length = readUnsignedInt(bytes, index + 4);
            int valueStart = index + ELEMENT_HEADER_LENGTH;
            if (group != 0) {
                throw new FramingException(String.format("Command set contains non-command element (%04X,%04X)", group, element));
            }
            if (length > bytes.length - valueStart) {
                throw new FramingException(String.format("Command element (%04X,%04X) length %d exceeds command set", group, element, length));
            }
            int tag = element;
            if (tag <= previousTag) {
                throw new FramingException("Command elements out of order at " + CommandTags.toString(tag));
            }
            previousTag = tag;
            byte[] value = Arrays.copyOfRange(bytes, valueStart, valueStart + (int) length);
            index = valueStart + (int) length;
            if (tag == CommandTags.COMMAND_GROUP_LENGTH) {
                if (value.length != 4) {
                    throw new FramingException("Command group length must be a 4-byte value");
                }
                groupLength = (int) readUnsignedIntLittle(value);
                groupStart = index;
                continue;
            }
            elements.put(tag, value);
        }
        if (groupLength != null && groupLength != bytes.length - groupStart) {
            throw new FramingException("Command group length " + groupLength + " does not match " + (bytes.length - groupStart) + " encoded bytes");
        }
        if (!elements.containsKey(CommandTags.COMMAND_FIELD)) {
            throw new FramingException("Command set has no command field");
        }
        CommandSet.Builder builder = CommandSet.builder();
        elements.forEach(builder::putRaw);
        return builder.build();
    }

    private static void writeElement(ByteArrayOutputStream out, int tag, byte[] value) {
        int group = CommandTags.group(tag);
        int element = CommandTags.element(tag);
        out.write(group & 0xFF);
        out.write((group >> 8) & 0xFF);
        out.write(element & 0xFF);
        out.write((element >> 8) & 0xFF);
        out.writeBytes(littleEndianInt(value.length));
        out.writeBytes(value);
    }

    private static byte[] littleEndianInt(int value) {
        return new byte[] {(byte) value, (byte) (value >> 8), (byte) (value >> 16), (byte) (value >> 24)};
    }

    private static int readUnsignedShort(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
    }

    private static long readUnsignedInt(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFFL)
            | ((bytes[offset + 1] & 0xFFL) << 8)
            | ((bytes[offset + 2] & 0xFFL) << 16)
            | ((bytes[offset + 3] & 0xFFL) << 24);
    }

    private static long readUnsignedIntLittle(byte[] value) {
        return readUnsignedInt(value, 0);
    }
}
