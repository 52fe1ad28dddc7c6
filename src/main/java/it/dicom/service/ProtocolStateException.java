package it.dicom.service;

import it.dicom.domain.AssociationEvent;
import it.dicom.domain.AssociationState;

public class ProtocolStateException extends IllegalStateException {

    private final AssociationState state;
    private final AssociationEvent event;

    public ProtocolStateException(AssociationState state, AssociationEvent event) {
        super("Event " + event + " is not allowed in state " + state);
        this.state = state;
        this.event = event;
    }

    public ProtocolStateException(String message) {
        super(message);
        this.state = null;
        this.event = null;
    }

    public AssociationState getState() {
        return state;
    }

    public AssociationEvent getEvent() {
        return event;
    }
}
