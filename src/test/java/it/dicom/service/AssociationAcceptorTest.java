package it.dicom.service;

import static it.dicom.service.TestRegistries.EXPLICIT_LE;
import static it.dicom.service.TestRegistries.IMPLICIT_LE;
import static it.dicom.service.TestRegistries.PATIENT_ROOT_FIND;
import static it.dicom.service.TestRegistries.VERIFICATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import it.dicom.dimse.AcceptedContext;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.PresentationContextResult;
import it.dicom.service.AcceptancePolicy.Decision;
import it.dicom.service.PduModels.AssociateAccept;
import it.dicom.service.PduModels.AssociateRequest;
import it.dicom.service.PduModels.AsyncOperationsWindow;
import it.dicom.service.PduModels.PresentationContextReply;
import it.dicom.service.PduModels.UserInformation;

class AssociationAcceptorTest {

    private final AssociationSettings settings = new AssociationSettings();
    private final AssociationAcceptor acceptor = new AssociationAcceptor(settings,
        TestRegistries.negotiator(VERIFICATION + "->" + IMPLICIT_LE + ";" + PATIENT_ROOT_FIND + "->" + EXPLICIT_LE));

    private static AssociateRequest request(String calledAe, List<PresentationContext> contexts) {
        return new AssociateRequest(1, calledAe, "SCU", PduModels.DICOM_APPLICATION_CONTEXT, contexts,
            UserInformation.of(32768, "1.2.3.4", "SCU_1"));
    }

    @Test
    void shouldAcceptAndMapNegotiatedContexts() {
        Decision decision = acceptor.evaluate(request("ANY", List.of(
            new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE)),
            new PresentationContext(3, "1.2.840.10008.5.1.4.1.1.2", List.of(IMPLICIT_LE)),
            new PresentationContext(5, PATIENT_ROOT_FIND, List.of(IMPLICIT_LE, EXPLICIT_LE))
        )));

        assertTrue(decision.accepted());
        AssociateAccept accept = decision.accept().orElseThrow();
        assertEquals(3, accept.presentationContexts().size());
        assertEquals(PresentationContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED, accept.presentationContexts().get(1).result());
        assertEquals(Map.of(
            1, new AcceptedContext(1, VERIFICATION, IMPLICIT_LE),
            5, new AcceptedContext(5, PATIENT_ROOT_FIND, EXPLICIT_LE)
        ), decision.contexts());
        assertEquals(settings.getMaxPduLength(), accept.userInformation().maxPduLength());
        assertEquals(Optional.of(AssociationSettings.IMPLEMENTATION_CLASS_UID), accept.userInformation().implementationClassUid());
        assertEquals("ANY", accept.calledAeTitle());
        assertEquals("SCU", accept.callingAeTitle());
    }

    @Test
    void shouldRejectWhenNoContextIsAcceptable() {
        Decision decision = acceptor.evaluate(request("ANY", List.of(
            new PresentationContext(1, "1.2.3.4.5.6.7", List.of(IMPLICIT_LE))
        )));

        assertFalse(decision.accepted());
        assertEquals(AssociateRejection.noAcceptablePresentationContext(), decision.rejection().orElseThrow());
        assertTrue(decision.contexts().isEmpty());
    }

    @Test
    void shouldRejectMalformedProposal() {
        Decision decision = acceptor.evaluate(request("ANY", List.of(
            new PresentationContext(2, VERIFICATION, List.of(IMPLICIT_LE))
        )));

        assertEquals(AssociateRejection.invalidPresentationContexts(), decision.rejection().orElseThrow());
    }

    @Test
    void shouldRejectUnknownCalledAeTitleWhenConfigured() {
        settings.setAcceptAnyCalledAeTitle(false);
        settings.setAeTitle("ARCHIVE");
        List<PresentationContext> contexts = List.of(new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE)));

        assertEquals(AssociateRejection.calledAeTitleNotRecognized(), acceptor.evaluate(request("OTHER", contexts)).rejection().orElseThrow());
        assertTrue(acceptor.evaluate(request("ARCHIVE", contexts)).accepted());
    }

    @Test
    void shouldRejectForeignApplicationContextAndProtocolVersion() {
        List<PresentationContext> contexts = List.of(new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE)));
        UserInformation userInformation = UserInformation.of(0, null, null);

        Decision foreignContext = acceptor.evaluate(new AssociateRequest(1, "ANY", "SCU", "1.2.3", contexts, userInformation));
        Decision wrongVersion = acceptor.evaluate(new AssociateRequest(2, "ANY", "SCU", PduModels.DICOM_APPLICATION_CONTEXT, contexts, userInformation));

        assertEquals(AssociateRejection.applicationContextNotSupported(), foreignContext.rejection().orElseThrow());
        assertEquals(AssociateRejection.protocolVersionNotSupported(), wrongVersion.rejection().orElseThrow());
    }

    @Test
    void shouldAnswerAsyncWindowWithSynchronousOperation() {
        UserInformation userInformation = new UserInformation(16384, Optional.of("1.2.3"), Optional.empty(),
            Optional.of(new AsyncOperationsWindow(8, 8)), List.of(), List.of());
        AssociateRequest request = new AssociateRequest(1, "ANY", "SCU", PduModels.DICOM_APPLICATION_CONTEXT,
            List.of(new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE))), userInformation);

        AssociateAccept accept = acceptor.evaluate(request).accept().orElseThrow();

        assertEquals(Optional.of(new AsyncOperationsWindow(1, 1)), accept.userInformation().asyncOperationsWindow());
    }

    @Test
    void shouldRefuseAcceptanceOfContextNeverProposed() {
        List<PresentationContext> proposed = List.of(new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE)));

        assertThrows(ProtocolStateException.class, () -> AssociationAcceptor.acceptedContexts(proposed,
            List.of(PresentationContextReply.accepted(3, IMPLICIT_LE))));
    }
}
