package it.dicom;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import it.dicom.network.DicomServer;
import it.dicom.registry.UidRegistry;
import it.dicom.registry.UidRegistryLoader;
import it.dicom.service.AssociationSettings;
import it.dicom.service.PresentationContextNegotiator;
import it.dicom.service.TransferSyntaxPolicy;

@SpringBootApplication
public class DicomUL {

    private static final Logger logger = LoggerFactory.getLogger(DicomUL.class);

    @Value("${dicom.server.enabled:true}")
    private boolean serverEnabled;
    @Value("${dicom.ae-title:DICOM-UL}")
    private String aeTitle;
    @Value("${dicom.accept-any-called-ae:true}")
    private boolean acceptAnyCalledAeTitle;
    @Value("${dicom.pdu.max-length:16384}")
    private long maxPduLength;
    @Value("${dicom.timeout.artim-ms:30000}")
    private long artimTimeoutMillis;
    @Value("${dicom.timeout.idle-ms:60000}")
    private long idleTimeoutMillis;
    @Value("${dicom.timeout.release-drain-ms:30000}")
    private long releaseDrainTimeoutMillis;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DicomUL.class);
        app.setBanner((environment, sourceClass, out) -> out.println("=== DICOM UPPER LAYER ==="));
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Bean
    public UidRegistry uidRegistry(UidRegistryLoader loader, @Value("${dicom.registry.location:classpath:dicom/uid-registry.tsv}") String location) {
        return loader.load(location);
    }

    @Bean
    public TransferSyntaxPolicy transferSyntaxPolicy(UidRegistry registry, @Value("${dicom.policy.transfer-syntaxes}") String table) {
        return TransferSyntaxPolicy.parse(table, registry);
    }

    @Bean
    public PresentationContextNegotiator presentationContextNegotiator(UidRegistry registry, TransferSyntaxPolicy policy) {
        return new PresentationContextNegotiator(registry, policy);
    }

    @Bean
    public AssociationSettings associationSettings() {
        AssociationSettings settings = new AssociationSettings();
        settings.setAeTitle(aeTitle);
        settings.setAcceptAnyCalledAeTitle(acceptAnyCalledAeTitle);
        settings.setMaxPduLength(maxPduLength);
        settings.setArtimTimeoutMillis(artimTimeoutMillis);
        settings.setIdleTimeoutMillis(idleTimeoutMillis);
        settings.setReleaseDrainTimeoutMillis(releaseDrainTimeoutMillis);
        return settings;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService dicomTimerScheduler() {
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "dicom-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CommandLineRunner startServer(DicomServer server) {
        return args -> {
            if (!serverEnabled) {
                logger.info("DICOM server disabled");
                return;
            }
            Thread acceptor = new Thread(() -> {
                try {
                    server.start();
                } catch (Exception e) {
                    logger.error("DICOM server failed", e);
                }
            }, "dicom-server");
            acceptor.start();
        };
    }
}
