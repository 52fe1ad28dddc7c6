package it.dicom.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class UidRegistryLoaderTest {

    @Test
    void shouldParseTabSeparatedRows() throws IOException {
        String table = "# comment\n"
            + "\n"
            + "1.2.840.10008.1.2\tImplicit VR Little Endian\ttransfer_syntax\n"
            + "1.2.840.10008.1.2.2\tExplicit VR Big Endian\ttransfer_syntax\tretired\n";

        UidRegistry registry = UidRegistryLoader.parse(new ByteArrayInputStream(table.getBytes(StandardCharsets.UTF_8)), "test");

        assertEquals(2, registry.size());
        assertTrue(registry.lookup("1.2.840.10008.1.2.2").isRetired());
    }

    @Test
    void shouldRejectRowsWithMissingColumns() {
        byte[] table = "1.2.3\tOnly a name\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> UidRegistryLoader.parse(new ByteArrayInputStream(table), "test"));
    }

    @Test
    void shouldLoadBundledRegistry() {
        UidRegistry registry = new UidRegistryLoader(new DefaultResourceLoader()).load("classpath:dicom/uid-registry.tsv");

        assertEquals(DicomUidType.TRANSFER_SYNTAX, registry.lookup("1.2.840.10008.1.2").type());
        assertEquals(DicomUidType.SOP_CLASS, registry.lookup("1.2.840.10008.1.1").type());
        assertEquals(DicomUidType.APPLICATION_CONTEXT_NAME, registry.lookup("1.2.840.10008.3.1.1.1").type());
        assertTrue(registry.lookup("1.2.840.10008.5.1.4.1.1.2").isImageStorage());
    }

    @Test
    void shouldFailForMissingResource() {
        UidRegistryLoader loader = new UidRegistryLoader(new DefaultResourceLoader());

        assertThrows(IllegalStateException.class, () -> loader.load("classpath:dicom/missing.tsv"));
    }
}
