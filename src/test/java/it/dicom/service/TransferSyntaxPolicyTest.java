package it.dicom.service;

import static it.dicom.service.TestRegistries.CT_IMAGE_STORAGE;
import static it.dicom.service.TestRegistries.EXPLICIT_LE;
import static it.dicom.service.TestRegistries.IMPLICIT_LE;
import static it.dicom.service.TestRegistries.VERIFICATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TransferSyntaxPolicyTest {

    @Test
    void shouldParseRowsAndMergeDuplicates() {
        TransferSyntaxPolicy policy = TransferSyntaxPolicy.parse(
            VERIFICATION + "->" + IMPLICIT_LE + "; " + VERIFICATION + " -> " + EXPLICIT_LE + "|" + IMPLICIT_LE,
            TestRegistries.registry()
        );

        assertEquals(List.of(IMPLICIT_LE, EXPLICIT_LE), policy.transferSyntaxesFor(VERIFICATION).orElseThrow());
    }

    @Test
    void shouldApplyWildcardOnlyToRegisteredSopClasses() {
        TransferSyntaxPolicy policy = TransferSyntaxPolicy.parse("*->" + EXPLICIT_LE, TestRegistries.registry());

        assertEquals(List.of(EXPLICIT_LE), policy.transferSyntaxesFor(CT_IMAGE_STORAGE).orElseThrow());
        assertTrue(policy.transferSyntaxesFor("1.2.3.4").isEmpty());
        assertTrue(policy.transferSyntaxesFor(IMPLICIT_LE).isEmpty());
    }

    @Test
    void shouldPreferExplicitRowOverWildcard() {
        TransferSyntaxPolicy policy = TransferSyntaxPolicy.parse(
            "*->" + EXPLICIT_LE + ";" + CT_IMAGE_STORAGE + "->" + IMPLICIT_LE, TestRegistries.registry());

        assertEquals(List.of(IMPLICIT_LE), policy.transferSyntaxesFor(CT_IMAGE_STORAGE).orElseThrow());
    }

    @Test
    void shouldRejectMalformedRows() {
        assertThrows(IllegalArgumentException.class, () -> TransferSyntaxPolicy.parse(VERIFICATION, TestRegistries.registry()));
        assertThrows(IllegalArgumentException.class, () -> TransferSyntaxPolicy.parse(VERIFICATION + "->", TestRegistries.registry()));
    }

    @Test
    void shouldTreatBlankTableAsEmptyPolicy() {
        assertTrue(TransferSyntaxPolicy.parse("  ", TestRegistries.registry()).entries().isEmpty());
    }
}
