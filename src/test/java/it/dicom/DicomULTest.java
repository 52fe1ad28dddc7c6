package it.dicom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import it.dicom.dimse.DimseServiceRegistry;
import it.dicom.domain.InvokedService;
import it.dicom.network.DicomServer;
import it.dicom.registry.UidRegistry;
import it.dicom.service.AssociationSettings;

@SpringBootTest(properties = {"dicom.server.enabled=false", "dicom.ae-title=TEST-SCP"})
class DicomULTest {

    @Autowired
    private AssociationSettings settings;
    @Autowired
    private DimseServiceRegistry registry;
    @Autowired
    private UidRegistry uidRegistry;
    @Autowired
    private DicomServer server;

    @Test
    void shouldWireEngineFromProperties() {
        assertEquals("TEST-SCP", settings.getAeTitle());
        assertEquals(16384, settings.getMaxPduLength());
        assertTrue(registry.services().contains(InvokedService.C_ECHO));
        assertTrue(uidRegistry.isKnown("1.2.840.10008.1.2"));
        assertFalse(server.isRunning());
    }
}
