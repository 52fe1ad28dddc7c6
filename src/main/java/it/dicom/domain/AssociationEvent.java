package it.dicom.domain;

public enum AssociationEvent {
    ISSUE_ASSOCIATE_RQ,
    RECEIVE_ASSOCIATE_RQ,
    RECEIVE_ASSOCIATE_AC,
    RECEIVE_ASSOCIATE_RJ,
    LOCAL_ACCEPT,
    LOCAL_REJECT,
    SEND_P_DATA,
    RECEIVE_P_DATA,
    ISSUE_RELEASE_RQ,
    RECEIVE_RELEASE_RQ,
    RECEIVE_RELEASE_RP,
    SEND_RELEASE_RP,
    RECEIVE_ABORT,
    LOCAL_ABORT,
    TRANSPORT_ERROR,
    TIMER_EXPIRED;

    public static AssociationEvent received(PduType type) {
        return switch (type) {
            case A_ASSOCIATE_RQ -> RECEIVE_ASSOCIATE_RQ;
            case A_ASSOCIATE_AC -> RECEIVE_ASSOCIATE_AC;
            case A_ASSOCIATE_RJ -> RECEIVE_ASSOCIATE_RJ;
            case P_DATA_TF -> RECEIVE_P_DATA;
            case A_RELEASE_RQ -> RECEIVE_RELEASE_RQ;
            case A_RELEASE_RP -> RECEIVE_RELEASE_RP;
            case A_ABORT -> RECEIVE_ABORT;
        };
    }
}
