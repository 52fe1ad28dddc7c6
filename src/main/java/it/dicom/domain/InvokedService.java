package it.dicom.domain;

import java.util.Optional;

public enum InvokedService {
    C_ECHO(DimseCommandField.C_ECHO_RQ, DimseCommandField.C_ECHO_RSP, DimseStatus.PROCESSING_FAILURE),
    C_FIND(DimseCommandField.C_FIND_RQ, DimseCommandField.C_FIND_RSP, DimseStatus.UNABLE_TO_PROCESS),
    C_STORE(DimseCommandField.C_STORE_RQ, DimseCommandField.C_STORE_RSP, DimseStatus.CANNOT_UNDERSTAND),
    C_GET(DimseCommandField.C_GET_RQ, DimseCommandField.C_GET_RSP, DimseStatus.UNABLE_TO_PROCESS),
    C_MOVE(DimseCommandField.C_MOVE_RQ, DimseCommandField.C_MOVE_RSP, DimseStatus.UNABLE_TO_PROCESS),
    N_EVENT_REPORT(DimseCommandField.N_EVENT_REPORT_RQ, DimseCommandField.N_EVENT_REPORT_RSP, DimseStatus.PROCESSING_FAILURE),
    N_GET(DimseCommandField.N_GET_RQ, DimseCommandField.N_GET_RSP, DimseStatus.PROCESSING_FAILURE),
    N_SET(DimseCommandField.N_SET_RQ, DimseCommandField.N_SET_RSP, DimseStatus.PROCESSING_FAILURE),
    N_ACTION(DimseCommandField.N_ACTION_RQ, DimseCommandField.N_ACTION_RSP, DimseStatus.PROCESSING_FAILURE),
    N_CREATE(DimseCommandField.N_CREATE_RQ, DimseCommandField.N_CREATE_RSP, DimseStatus.PROCESSING_FAILURE),
    N_DELETE(DimseCommandField.N_DELETE_RQ, DimseCommandField.N_DELETE_RSP, DimseStatus.PROCESSING_FAILURE);

    private final DimseCommandField requestField;
    private final DimseCommandField responseField;
    private final int failureStatus;

    InvokedService(DimseCommandField requestField, DimseCommandField responseField, int failureStatus) {
        this.requestField = requestField;
        this.responseField = responseField;
        this.failureStatus = failureStatus;
    }

    public DimseCommandField requestField() {
        return requestField;
    }

    public DimseCommandField responseField() {
        return responseField;
    }

    public int failureStatus() {
        return failureStatus;
    }

    public boolean isCancellable() {
        return this == C_FIND || this == C_GET || this == C_MOVE;
    }

    public boolean isNormalized() {
        return name().startsWith("N_");
    }

    public static Optional<InvokedService> fromCommandField(DimseCommandField field) {
        for (InvokedService service : values()) {
            if (service.requestField == field || service.responseField == field) {
                return Optional.of(service);
            }
        }
        return Optional.empty();
    }
}
