package it.dicom.service;

import it.dicom.domain.AssociateRejection;

public class AssociationRejectedException extends IllegalStateException {

    private final AssociateRejection rejection;

    public AssociationRejectedException(AssociateRejection rejection) {
        super("Association rejected: " + rejection.describe());
        this.rejection = rejection;
    }

    public AssociateRejection getRejection() {
        return rejection;
    }
}
