package it.dicom.registry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

@Component
public class UidRegistryLoader {

    private static final Logger logger = LoggerFactory.getLogger(UidRegistryLoader.class);

    private final ResourceLoader resourceLoader;

    public UidRegistryLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public UidRegistry load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream is = resource.getInputStream()) {
            UidRegistry registry = parse(is, location);
            logger.info("Loaded {} UIDs from {}", registry.size(), location);
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load UID registry from " + location, e);
        }
    }

    static UidRegistry parse(InputStream is, String source) throws IOException {
        UidRegistry.Builder builder = UidRegistry.builder();
        BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] columns = trimmed.split("\t");
            if (columns.length < 3) {
                throw new IllegalArgumentException(source + ":" + lineNumber + ": expected uid, name and type columns");
            }
            String uid = columns[0].trim();
            if (!UidRegistry.isValid(uid)) {
                throw new IllegalArgumentException(source + ":" + lineNumber + ": invalid UID " + uid);
            }
            DicomUidType type = DicomUidType.valueOf(columns[2].trim().toUpperCase(Locale.ROOT));
            boolean retired = columns.length > 3 && "retired".equalsIgnoreCase(columns[3].trim());
            builder.register(new DicomUid(uid, columns[1].trim(), type, retired));
        }
        return builder.build();
    }
}
