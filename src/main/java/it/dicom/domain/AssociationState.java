package it.dicom.domain;

public enum AssociationState {
    IDLE,
    REQUEST_SENT,
    WAITING_FOR_RESPONSE,
    ESTABLISHED,
    RELEASING,
    CLOSED,
    ABORTED;

    public boolean isTerminal() {
        return this == CLOSED || this == ABORTED;
    }
}
