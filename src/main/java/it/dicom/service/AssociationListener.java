package it.dicom.service;

import it.dicom.domain.AbortCause;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.AssociationState;

// Every association ends with exactly one of rejected, released or aborted.
public interface AssociationListener {

    AssociationListener NONE = new AssociationListener() {
    };

    default void onEstablished(Association association) {
    }

    default void onRejected(Association association, AssociateRejection rejection) {
    }

    default void onReleased(Association association) {
    }

    default void onAborted(Association association, AbortCause cause, AssociationState previousState, String detail) {
    }
}
