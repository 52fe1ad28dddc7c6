package it.dicom.service;

import java.util.Map;
import java.util.Optional;

import it.dicom.dimse.AcceptedContext;
import it.dicom.domain.AssociateRejection;
import it.dicom.service.PduModels.AssociateAccept;
import it.dicom.service.PduModels.AssociateRequest;

@FunctionalInterface
public interface AcceptancePolicy {

    Decision evaluate(AssociateRequest request);

    static AcceptancePolicy rejectAll(AssociateRejection rejection) {
        return request -> Decision.reject(rejection);
    }

    record Decision(Optional<AssociateAccept> accept, Optional<AssociateRejection> rejection, Map<Integer, AcceptedContext> contexts) {

        public Decision {
            contexts = Map.copyOf(contexts);
        }

        public static Decision accept(AssociateAccept accept, Map<Integer, AcceptedContext> contexts) {
            return new Decision(Optional.of(accept), Optional.empty(), contexts);
        }

        public static Decision reject(AssociateRejection rejection) {
            return new Decision(Optional.empty(), Optional.of(rejection), Map.of());
        }

        public boolean accepted() {
            return accept.isPresent();
        }
    }
}
