package it.dicom.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DicomUidTest {

    @Test
    void shouldGenerateUuidDerivedUids() {
        DicomUid first = DicomUid.generate();
        DicomUid second = DicomUid.generate();

        assertTrue(first.uid().startsWith("2.25."));
        assertTrue(first.uid().length() <= 64);
        assertTrue(UidRegistry.isValid(first.uid()));
        assertNotEquals(first, second);
    }

    @Test
    void shouldAppendSequenceToBase() {
        DicomUid base = new DicomUid("1.2.3", "Root", DicomUidType.SOP_INSTANCE, false);

        assertEquals("1.2.3.42", DicomUid.append(base, 42).uid());
    }

    @Test
    void shouldClassifyStorageSopClasses() {
        assertEquals(DicomStorageCategory.IMAGE, sopClass("1.2.840.10008.5.1.4.1.1.2", "CT Image Storage").storageCategory());
        assertEquals(DicomStorageCategory.PRESENTATION_STATE,
            sopClass("1.2.840.10008.5.1.4.1.1.11.1", "Grayscale Softcopy Presentation State Storage").storageCategory());
        assertEquals(DicomStorageCategory.STRUCTURED_REPORT, sopClass("1.2.840.10008.5.1.4.1.1.88.11", "Basic Text SR Storage").storageCategory());
        assertEquals(DicomStorageCategory.WAVEFORM, sopClass("1.2.840.10008.5.1.4.1.1.9.1.1", "12-lead ECG Waveform Storage").storageCategory());
        assertEquals(DicomStorageCategory.DOCUMENT, sopClass("1.2.840.10008.5.1.4.1.1.104.1", "Encapsulated PDF Storage").storageCategory());
        assertEquals(DicomStorageCategory.RAW, sopClass("1.2.840.10008.5.1.4.1.1.66", "Raw Data Storage").storageCategory());
        assertEquals(DicomStorageCategory.NONE, sopClass("1.2.840.10008.1.1", "Verification SOP Class").storageCategory());
        assertEquals(DicomStorageCategory.PRIVATE, sopClass("1.3.6.1.4.1.9590.100.1", "Vendor Storage").storageCategory());
        assertTrue(sopClass("1.2.840.10008.5.1.4.1.1.4", "MR Image Storage").isImageStorage());
    }

    private static DicomUid sopClass(String uid, String name) {
        return new DicomUid(uid, name, DicomUidType.SOP_CLASS, false);
    }
}
