package it.dicom.domain;

public final class DimseStatus {

    public static final int SUCCESS = 0x0000;
    public static final int PENDING = 0xFF00;
    public static final int PENDING_WARNING = 0xFF01;
    public static final int CANCEL = 0xFE00;
    public static final int WARNING = 0xB000;
    public static final int PROCESSING_FAILURE = 0x0110;
    public static final int NO_SUCH_SOP_CLASS = 0x0118;
    public static final int DUPLICATE_INVOCATION = 0x0210;
    public static final int UNRECOGNIZED_OPERATION = 0x0211;
    public static final int UNABLE_TO_PROCESS = 0xC000;
    public static final int CANNOT_UNDERSTAND = 0xC000;
    public static final int OUT_OF_RESOURCES = 0xA700;

    private DimseStatus() {
    }

    public static boolean isPending(int status) {
        return status == PENDING || status == PENDING_WARNING;
    }

    public static boolean isTerminal(int status) {
        return !isPending(status);
    }

    public static boolean isSuccess(int status) {
        return status == SUCCESS;
    }

    public static boolean isWarning(int status) {
        return status == 0x0001 || (status & 0xF000) == 0xB000 || status == 0x0107 || status == 0x0116;
    }

    public static boolean isFailure(int status) {
        return !isSuccess(status) && !isPending(status) && !isWarning(status) && status != CANCEL;
    }

    public static String describe(int status) {
        if (isSuccess(status)) {
            return "success";
        }
        if (isPending(status)) {
            return "pending";
        }
        if (status == CANCEL) {
            return "cancel";
        }
        if (isWarning(status)) {
            return "warning";
        }
        return "failure";
    }
}
