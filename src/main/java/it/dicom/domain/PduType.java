package it.dicom.domain;

import java.util.Arrays;
import java.util.Optional;

public enum PduType {
    A_ASSOCIATE_RQ(0x01),
    A_ASSOCIATE_AC(0x02),
    A_ASSOCIATE_RJ(0x03),
    P_DATA_TF(0x04),
    A_RELEASE_RQ(0x05),
    A_RELEASE_RP(0x06),
    A_ABORT(0x07);

    private final int code;

    PduType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<PduType> fromCode(int code) {
        return Arrays.stream(values())
            .filter(type -> type.code == code)
            .findFirst();
    }
}
