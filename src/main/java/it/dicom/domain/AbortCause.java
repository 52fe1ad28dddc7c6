package it.dicom.domain;

public enum AbortCause {
    PEER_ABORT,
    LOCAL_ABORT,
    FRAMING_ERROR,
    PROTOCOL_ERROR,
    TRANSPORT_ERROR,
    ARTIM_EXPIRED,
    IDLE_TIMEOUT;

    public boolean isLocallyInitiated() {
        return this != PEER_ABORT && this != TRANSPORT_ERROR;
    }
}
