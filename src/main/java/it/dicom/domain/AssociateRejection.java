package it.dicom.domain;

public record AssociateRejection(int result, int source, int reason) {

    public static final int RESULT_PERMANENT = 1;
    public static final int RESULT_TRANSIENT = 2;

    public static final int SOURCE_SERVICE_USER = 1;
    public static final int SOURCE_SERVICE_PROVIDER_ACSE = 2;
    public static final int SOURCE_SERVICE_PROVIDER_PRESENTATION = 3;

    public static final int REASON_NO_REASON = 1;
    public static final int REASON_APPLICATION_CONTEXT_NOT_SUPPORTED = 2;
    public static final int REASON_CALLING_AE_NOT_RECOGNIZED = 3;
    public static final int REASON_CALLED_AE_NOT_RECOGNIZED = 7;
    public static final int REASON_PROTOCOL_VERSION_NOT_SUPPORTED = 2;
    public static final int REASON_TEMPORARY_CONGESTION = 1;
    public static final int REASON_LOCAL_LIMIT_EXCEEDED = 2;

    public static AssociateRejection noReasonGiven() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_USER, REASON_NO_REASON);
    }

    public static AssociateRejection noAcceptablePresentationContext() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_USER, REASON_NO_REASON);
    }

    public static AssociateRejection invalidPresentationContexts() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_PROVIDER_ACSE, REASON_NO_REASON);
    }

    public static AssociateRejection applicationContextNotSupported() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_USER, REASON_APPLICATION_CONTEXT_NOT_SUPPORTED);
    }

    public static AssociateRejection calledAeTitleNotRecognized() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_USER, REASON_CALLED_AE_NOT_RECOGNIZED);
    }

    public static AssociateRejection protocolVersionNotSupported() {
        return new AssociateRejection(RESULT_PERMANENT, SOURCE_SERVICE_PROVIDER_ACSE, REASON_PROTOCOL_VERSION_NOT_SUPPORTED);
    }

    public static AssociateRejection localLimitExceeded() {
        return new AssociateRejection(RESULT_TRANSIENT, SOURCE_SERVICE_PROVIDER_PRESENTATION, REASON_LOCAL_LIMIT_EXCEEDED);
    }

    public String describe() {
        String resultText = result == RESULT_PERMANENT ? "permanent" : result == RESULT_TRANSIENT ? "transient" : "result-" + result;
        return resultText + ", source=" + source + ", reason=" + reason;
    }
}
