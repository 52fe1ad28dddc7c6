package it.dicom.service;

import static it.dicom.service.TestRegistries.CT_IMAGE_STORAGE;
import static it.dicom.service.TestRegistries.EXPLICIT_LE;
import static it.dicom.service.TestRegistries.IMPLICIT_LE;
import static it.dicom.service.TestRegistries.JPEG_BASELINE;
import static it.dicom.service.TestRegistries.PATIENT_ROOT_FIND;
import static it.dicom.service.TestRegistries.VERIFICATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import it.dicom.domain.PresentationContextResult;
import it.dicom.service.PduModels.PresentationContextReply;

class PresentationContextNegotiatorTest {

    @Test
    void shouldAcceptTheOnlyCommonTransferSyntax() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(PATIENT_ROOT_FIND + "->" + IMPLICIT_LE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(1, PATIENT_ROOT_FIND, List.of(EXPLICIT_LE, IMPLICIT_LE))
        ));

        assertTrue(result.valid());
        assertEquals(List.of(PresentationContextReply.accepted(1, IMPLICIT_LE)), result.replies());
    }

    @Test
    void shouldPreferRequesterOrderAmongSupportedSyntaxes() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(CT_IMAGE_STORAGE + "->" + IMPLICIT_LE + "|" + EXPLICIT_LE + "|" + JPEG_BASELINE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(1, CT_IMAGE_STORAGE, List.of(JPEG_BASELINE, IMPLICIT_LE))
        ));

        assertEquals(JPEG_BASELINE, result.replies().get(0).transferSyntax());
    }

    @Test
    void shouldRejectUnknownAbstractSyntaxButKeepOtherContexts() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(VERIFICATION + "->" + IMPLICIT_LE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(1, "1.2.3.4.5.6.7", List.of(IMPLICIT_LE)),
            new PresentationContext(3, VERIFICATION, List.of(IMPLICIT_LE))
        ));

        assertTrue(result.hasAcceptedContext());
        assertEquals(PresentationContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED, result.replies().get(0).result());
        assertEquals(PresentationContextResult.ACCEPTANCE, result.replies().get(1).result());
    }

    @Test
    void shouldReportNoOverlappingTransferSyntax() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(VERIFICATION + "->" + IMPLICIT_LE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(5, VERIFICATION, List.of(JPEG_BASELINE))
        ));

        assertFalse(result.hasAcceptedContext());
        assertEquals(PresentationContextResult.TRANSFER_SYNTAXES_NOT_SUPPORTED, result.replies().get(0).result());
        assertEquals(5, result.replies().get(0).identifier());
    }

    @Test
    void shouldRejectMalformedAbstractSyntaxAsNotSupported() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator("*->" + IMPLICIT_LE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(1, "not-a-uid", List.of(IMPLICIT_LE))
        ));

        assertEquals(PresentationContextResult.ABSTRACT_SYNTAX_NOT_SUPPORTED, result.replies().get(0).result());
    }

    @Test
    void shouldRejectWholeProposalWithEvenOrDuplicateIdentifiers() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(VERIFICATION + "->" + IMPLICIT_LE);

        assertFalse(negotiator.negotiate(List.of(new PresentationContext(2, VERIFICATION, List.of(IMPLICIT_LE)))).valid());
        assertFalse(negotiator.negotiate(List.of(
            new PresentationContext(1, VERIFICATION, List.of(IMPLICIT_LE)),
            new PresentationContext(1, VERIFICATION, List.of(EXPLICIT_LE))
        )).valid());
        assertFalse(negotiator.negotiate(List.of()).valid());
    }

    @Test
    void shouldAnswerEveryContextOnceInProposalOrder() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator("*->" + EXPLICIT_LE + "|" + IMPLICIT_LE);
        List<PresentationContext> proposal = List.of(
            new PresentationContext(7, CT_IMAGE_STORAGE, List.of(IMPLICIT_LE)),
            new PresentationContext(1, "1.9.9.9", List.of(IMPLICIT_LE)),
            new PresentationContext(3, VERIFICATION, List.of(JPEG_BASELINE, EXPLICIT_LE))
        );

        List<PresentationContextReply> first = negotiator.negotiate(proposal).replies();
        List<PresentationContextReply> second = negotiator.negotiate(proposal).replies();

        assertEquals(first, second);
        assertEquals(List.of(7, 1, 3), first.stream().map(PresentationContextReply::identifier).toList());
        assertEquals(EXPLICIT_LE, first.get(2).transferSyntax());
    }

    @Test
    void shouldNotAcceptNonTransferSyntaxUidAsTransferSyntax() {
        PresentationContextNegotiator negotiator = TestRegistries.negotiator(VERIFICATION + "->" + CT_IMAGE_STORAGE);

        PresentationContextNegotiator.NegotiationResult result = negotiator.negotiate(List.of(
            new PresentationContext(1, VERIFICATION, List.of(CT_IMAGE_STORAGE))
        ));

        assertEquals(PresentationContextResult.TRANSFER_SYNTAXES_NOT_SUPPORTED, result.replies().get(0).result());
    }
}
