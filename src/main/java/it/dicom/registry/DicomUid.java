package it.dicom.registry;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.UUID;

public final class DicomUid {

    private static final String DICOM_ROOT = "1.2.840.10008";

    private final String uid;
    private final String name;
    private final DicomUidType type;
    private final boolean retired;

    public DicomUid(String uid, String name, DicomUidType type, boolean retired) {
        this.uid = Objects.requireNonNull(uid, "uid");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.retired = retired;
    }

    public static DicomUid unknown(String uid) {
        return new DicomUid(uid, "Unknown", DicomUidType.UNKNOWN, false);
    }

    public static DicomUid generate() {
        UUID uuid = UUID.randomUUID();
        ByteBuffer bytes = ByteBuffer.allocate(16);
        bytes.putLong(uuid.getMostSignificantBits());
        bytes.putLong(uuid.getLeastSignificantBits());
        return new DicomUid("2.25." + new BigInteger(1, bytes.array()), "SOP Instance UID", DicomUidType.SOP_INSTANCE, false);
    }

    public static DicomUid append(DicomUid base, long nextSequence) {
        return new DicomUid(base.uid + "." + nextSequence, "SOP Instance UID", DicomUidType.SOP_INSTANCE, false);
    }

    public String uid() {
        return uid;
    }

    public String name() {
        return name;
    }

    public DicomUidType type() {
        return type;
    }

    public boolean isRetired() {
        return retired;
    }

    public boolean isTransferSyntax() {
        return type == DicomUidType.TRANSFER_SYNTAX;
    }

    public boolean isImageStorage() {
        return storageCategory() == DicomStorageCategory.IMAGE;
    }

    public boolean isVolumeStorage() {
        return storageCategory() == DicomStorageCategory.VOLUME;
    }

    public DicomStorageCategory storageCategory() {
        if (type == DicomUidType.SOP_CLASS && !uid.startsWith(DICOM_ROOT)) {
            return DicomStorageCategory.PRIVATE;
        }
        if (type != DicomUidType.SOP_CLASS || !name.contains("Storage")) {
            return DicomStorageCategory.NONE;
        }
        if (name.contains("Image Storage")) {
            return DicomStorageCategory.IMAGE;
        }
        if (name.contains("Volume Storage")) {
            return DicomStorageCategory.VOLUME;
        }
        if (name.contains("Presentation State Storage")) {
            return DicomStorageCategory.PRESENTATION_STATE;
        }
        if (name.contains("SR Storage")) {
            return DicomStorageCategory.STRUCTURED_REPORT;
        }
        if (name.contains("Waveform Storage")) {
            return DicomStorageCategory.WAVEFORM;
        }
        if (name.startsWith("Encapsulated")) {
            return DicomStorageCategory.DOCUMENT;
        }
        if (name.equals("Raw Data Storage")) {
            return DicomStorageCategory.RAW;
        }
        return DicomStorageCategory.OTHER;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DicomUid that && uid.equals(that.uid);
    }

    @Override
    public int hashCode() {
        return uid.hashCode();
    }

    @Override
    public String toString() {
        return name + " [" + uid + "]";
    }
}
