package it.dicom.codec;

public record UlItem(int type, int length, byte[] value) {

    public UlItem {
        if (type < 0 || type > 0xFF) {
            throw new FramingException("Invalid item type: " + type);
        }
        if (length < 0 || length > 0xFFFF) {
            throw new FramingException("Invalid item length: " + length);
        }
        if (value == null || value.length != length) {
            throw new FramingException("Item value length mismatch");
        }
    }

    public static UlItem of(int type, byte[] value) {
        return new UlItem(type, value.length, value);
    }

    public boolean isUserInformationSubItem() {
        return (type & 0xF0) == 0x50;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof UlItem item && type == item.type && java.util.Arrays.equals(value, item.value);
    }

    @Override
    public int hashCode() {
        return 31 * type + java.util.Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "UlItem[type=0x" + Integer.toHexString(type) + ", length=" + length + "]";
    }
}
