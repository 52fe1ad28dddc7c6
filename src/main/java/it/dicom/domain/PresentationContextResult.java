package it.dicom.domain;

public enum PresentationContextResult {
    ACCEPTANCE(0),
    USER_REJECTION(1),
    NO_REASON(2),
    ABSTRACT_SYNTAX_NOT_SUPPORTED(3),
    TRANSFER_SYNTAXES_NOT_SUPPORTED(4);

    private final int code;

    PresentationContextResult(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isAccepted() {
        return this == ACCEPTANCE;
    }

    public static PresentationContextResult fromCode(int code) {
        for (PresentationContextResult result : values()) {
            if (result.code == code) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown presentation-context result: " + code);
    }
}
