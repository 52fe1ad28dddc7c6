package it.dicom.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class UidRegistryTest {

    private final UidRegistry registry = UidRegistry.builder()
        .register("1.2.840.10008.1.2", "Implicit VR Little Endian", DicomUidType.TRANSFER_SYNTAX)
        .register("1.2.840.10008.1.1", "Verification SOP Class", DicomUidType.SOP_CLASS)
        .build();

    @Test
    void shouldFindRegisteredUidIgnoringPadding() {
        DicomUid uid = registry.lookup("1.2.840.10008.1.2\0");

        assertEquals(DicomUidType.TRANSFER_SYNTAX, uid.type());
        assertEquals("Implicit VR Little Endian [1.2.840.10008.1.2]", uid.toString());
    }

    @Test
    void shouldSynthesizeUnknownDescriptor() {
        DicomUid uid = registry.lookup("1.2.3.4");

        assertEquals(DicomUidType.UNKNOWN, uid.type());
        assertEquals("1.2.3.4", uid.uid());
        assertFalse(registry.isKnown("1.2.3.4"));
    }

    @Test
    void shouldSynthesizeEvenForMalformedStrings() {
        assertEquals(DicomUidType.UNKNOWN, registry.lookup("hello").type());
        assertFalse(UidRegistry.isValid("hello"));
    }

    @Test
    void shouldValidateDigitsAndDots() {
        assertTrue(UidRegistry.isValid("1.2.840.10008.1.2"));
        assertFalse(UidRegistry.isValid(""));
        assertFalse(UidRegistry.isValid(null));
        assertFalse(UidRegistry.isValid("1.2.a"));
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        UidRegistry.Builder builder = UidRegistry.builder().register("1.2.3", "First", DicomUidType.SOP_CLASS);

        assertThrows(IllegalArgumentException.class, () -> builder.register("1.2.3", "Second", DicomUidType.SOP_CLASS));
    }

    @Test
    void shouldEnumerateInRegistrationOrder() {
        assertEquals(List.of("1.2.840.10008.1.2", "1.2.840.10008.1.1"), registry.enumerate().stream().map(DicomUid::uid).toList());
        assertEquals(1, registry.transferSyntaxes().size());
    }

    @Test
    void shouldCompareDescriptorsByUid() {
        DicomUid named = new DicomUid("1.2.3", "Something", DicomUidType.SOP_CLASS, false);

        assertEquals(named, DicomUid.unknown("1.2.3"));
        assertEquals(named.hashCode(), DicomUid.unknown("1.2.3").hashCode());
    }
}
