package it.dicom.dimse;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

import it.dicom.domain.DimseCommandField;

public final class CommandSet {

    private final TreeMap<Integer, byte[]> elements;

    private CommandSet(TreeMap<Integer, byte[]> elements) {
        this.elements = elements;
    }

    public static Builder builder() {
        return new Builder(new TreeMap<>());
    }

    public Builder toBuilder() {
        TreeMap<Integer, byte[]> copy = new TreeMap<>();
        elements.forEach((tag, value) -> copy.put(tag, value.clone()));
        return new Builder(copy);
    }

    public boolean contains(int tag) {
        return elements.containsKey(tag);
    }

    public Optional<byte[]> raw(int tag) {
        byte[] value = elements.get(tag);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    public OptionalInt intValue(int tag) {
        byte[] value = elements.get(tag);
        if (value == null || value.length == 0) {
            return OptionalInt.empty();
        }
        if (value.length == 2) {
            return OptionalInt.of((value[0] & 0xFF) | ((value[1] & 0xFF) << 8));
        }
        if (value.length == 4) {
            return OptionalInt.of((value[0] & 0xFF) | ((value[1] & 0xFF) << 8) | ((value[2] & 0xFF) << 16) | ((value[3] & 0xFF) << 24));
        }
        throw new IllegalStateException("Element " + CommandTags.toString(tag) + " is not an integer value");
    }

    public int requireInt(int tag) {
        return intValue(tag).orElseThrow(() -> new IllegalStateException("Missing command element " + CommandTags.toString(tag)));
    }

    public Optional<String> string(int tag) {
        byte[] value = elements.get(tag);
        if (value == null) {
            return Optional.empty();
        }
        int start = 0;
        int end = value.length;
        while (end > 0 && (value[end - 1] == 0 || value[end - 1] == ' ')) {
            end--;
        }
        while (start < end && value[start] == ' ') {
            start++;
        }
        return Optional.of(new String(value, start, end - start, StandardCharsets.US_ASCII));
    }

    public int commandFieldCode() {
        return requireInt(CommandTags.COMMAND_FIELD);
    }

    public Optional<DimseCommandField> commandField() {
        return intValue(CommandTags.COMMAND_FIELD).stream()
            .mapToObj(DimseCommandField::fromCode)
            .flatMap(Optional::stream)
            .findFirst();
    }

    public int messageId() {
        return requireInt(CommandTags.MESSAGE_ID);
    }

    public int messageIdBeingRespondedTo() {
        return requireInt(CommandTags.MESSAGE_ID_BEING_RESPONDED_TO);
    }

    public OptionalInt status() {
        return intValue(CommandTags.STATUS);
    }

    public Optional<String> affectedSopClassUid() {
        return string(CommandTags.AFFECTED_SOP_CLASS_UID);
    }

    public Optional<String> sopClassUid() {
        Optional<String> affected = affectedSopClassUid();
        return affected.isPresent() ? affected : string(CommandTags.REQUESTED_SOP_CLASS_UID);
    }

    public boolean hasDataSet() {
        return intValue(CommandTags.COMMAND_DATA_SET_TYPE).orElse(CommandTags.DATA_SET_ABSENT) != CommandTags.DATA_SET_ABSENT;
    }

    Map<Integer, byte[]> elements() {
        return Collections.unmodifiableMap(elements);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CommandSet that) || elements.size() != that.elements.size()) {
            return false;
        }
        for (Map.Entry<Integer, byte[]> entry : elements.entrySet()) {
            if (!Arrays.equals(entry.getValue(), that.elements.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (Map.Entry<Integer, byte[]> entry : elements.entrySet()) {
            result = 31 * result + entry.getKey();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("CommandSet[");
        commandField().ifPresentOrElse(field -> builder.append(field), () -> builder.append("unknown"));
        intValue(CommandTags.MESSAGE_ID).ifPresent(id -> builder.append(", id=").append(id));
        intValue(CommandTags.MESSAGE_ID_BEING_RESPONDED_TO).ifPresent(id -> builder.append(", respondsTo=").append(id));
        status().ifPresent(status -> builder.append(", status=0x").append(Integer.toHexString(status)));
        return builder.append(']').toString();
    }

    public static final class Builder {

        private final TreeMap<Integer, byte[]> elements;

        private Builder(TreeMap<Integer, byte[]> elements) {
            this.elements = elements;
        }

        public Builder putUnsignedShort(int tag, int value) {
            requireCommandGroup(tag);
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("Value out of US range for " + CommandTags.toString(tag) + ": " + value);
            }
            elements.put(tag, new byte[] {(byte) value, (byte) (value >> 8)});
            return this;
        }

        public Builder putUnsignedInt(int tag, long value) {
            requireCommandGroup(tag);
            elements.put(tag, new byte[] {(byte) value, (byte) (value >> 8), (byte) (value >> 16), (byte) (value >> 24)});
            return this;
        }

        public Builder putString(int tag, String value) {
            requireCommandGroup(tag);
            byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
            if (bytes.length % 2 != 0) {
                byte pad = CommandTags.vrOf(tag) == CommandTags.Vr.UI ? (byte) 0 : (byte) ' ';
                bytes = Arrays.copyOf(bytes, bytes.length + 1);
                bytes[bytes.length - 1] = pad;
            }
            elements.put(tag, bytes);
            return this;
        }

        public Builder putRaw(int tag, byte[] value) {
            requireCommandGroup(tag);
            elements.put(tag, value.clone());
            return this;
        }

        public Builder commandField(DimseCommandField field) {
            return putUnsignedShort(CommandTags.COMMAND_FIELD, field.code());
        }

        public Builder messageId(int messageId) {
            return putUnsignedShort(CommandTags.MESSAGE_ID, messageId);
        }

        public Builder messageIdBeingRespondedTo(int messageId) {
            return putUnsignedShort(CommandTags.MESSAGE_ID_BEING_RESPONDED_TO, messageId);
        }

        public Builder affectedSopClassUid(String uid) {
            return putString(CommandTags.AFFECTED_SOP_CLASS_UID, uid);
        }

        public Builder status(int status) {
            return putUnsignedShort(CommandTags.STATUS, status);
        }

        public Builder dataSetPresent(boolean present) {
            return putUnsignedShort(CommandTags.COMMAND_DATA_SET_TYPE, present ? CommandTags.DATA_SET_PRESENT : CommandTags.DATA_SET_ABSENT);
        }

        public Builder remove(int tag) {
            elements.remove(tag);
            return this;
        }

        public CommandSet build() {
            TreeMap<Integer, byte[]> copy = new TreeMap<>();
            elements.forEach((tag, value) -> copy.put(tag, value.clone()));
            return new CommandSet(copy);
        }

        private static void requireCommandGroup(int tag) {
            if (CommandTags.group(tag) != 0) {
                throw new IllegalArgumentException("Not a command element: " + CommandTags.toString(tag));
            }
            if (tag == CommandTags.COMMAND_GROUP_LENGTH) {
                throw new IllegalArgumentException("Command group length is computed on encode");
            }
        }
    }
}
