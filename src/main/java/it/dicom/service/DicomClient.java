package it.dicom.service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.dicom.dimse.AcceptedContext;
import it.dicom.dimse.CommandSet;
import it.dicom.dimse.CommandTags;
import it.dicom.dimse.DataSet;
import it.dicom.dimse.DimseResponse;
import it.dicom.dimse.DimseResponseStream;
import it.dicom.dimse.DimseServiceRegistry;
import it.dicom.domain.AbortCause;
import it.dicom.domain.AssociationState;
import it.dicom.domain.DimseCommandField;
import it.dicom.network.SocketTransport;
import it.dicom.service.PduModels.AssociateRequest;
import it.dicom.service.PduModels.UserInformation;

@Component
public class DicomClient {

    private static final Logger logger = LoggerFactory.getLogger(DicomClient.class);

    public static final String VERIFICATION_SOP_CLASS = "1.2.840.10008.1.1";

    private final PduCodec codec;
    private final AssociationSettings settings;
    private final DimseServiceRegistry registry;
    private final ScheduledExecutorService timerScheduler;
    private final int connectTimeoutMillis;
    private final AtomicInteger messageIds = new AtomicInteger();

    public DicomClient(
        PduCodec codec,
        AssociationSettings settings,
        DimseServiceRegistry registry,
        ScheduledExecutorService timerScheduler,
        @Value("${dicom.client.connect-timeout-ms:10000}") int connectTimeoutMillis
    ) {
        this.codec = codec;
        this.settings = settings;
        this.registry = registry;
        this.timerScheduler = timerScheduler;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public Association open(String host, int port, String calledAeTitle, List<PresentationContext> contexts) throws IOException, InterruptedException {
        return open(host, port, calledAeTitle, contexts, AssociationListener.NONE);
    }

    public Association open(
        String host,
        int port,
        String calledAeTitle,
        List<PresentationContext> contexts,
        AssociationListener listener
    ) throws IOException, InterruptedException {
        SocketTransport transport = SocketTransport.connect(host, port, connectTimeoutMillis);
        Association association = Association.requestor(
            transport, codec, settings, registry, new AssociationTimers(timerScheduler), listener);
        AssociateRequest request = new AssociateRequest(
            PduModels.PROTOCOL_VERSION,
            calledAeTitle,
            settings.getAeTitle(),
            PduModels.DICOM_APPLICATION_CONTEXT,
            contexts,
            new UserInformation(
                settings.getMaxPduLength(),
                Optional.of(settings.getImplementationClassUid()),
                Optional.ofNullable(settings.getImplementationVersionName()),
                Optional.empty(),
                List.of(),
                List.of()
            )
        );
        try {
            association.request(request);
        } catch (IOException | RuntimeException ex) {
            transport.close();
            throw ex;
        }
        Thread reader = new Thread(association, "dicom-reader-" + host + ":" + port);
        reader.setDaemon(true);
        reader.start();

        AssociationState state = association.awaitNegotiation(settings.getArtimTimeoutMillis() + connectTimeoutMillis);
        if (state == AssociationState.ESTABLISHED) {
            return association;
        }
        if (association.rejection().isPresent()) {
            throw new AssociationRejectedException(association.rejection().get());
        }
        if (!state.isTerminal()) {
            association.abort();
        }
        AbortCause cause = association.abortCause().orElse(AbortCause.LOCAL_ABORT);
        throw new IllegalStateException("Association to " + host + ":" + port + " failed: " + cause);
    }

    public int nextMessageId() {
        return messageIds.updateAndGet(current -> current >= 0xFFFF ? 1 : current + 1);
    }

    public DimseResponseStream invoke(Association association, String abstractSyntax, CommandSet command, Optional<DataSet> dataSet) throws IOException {
        AcceptedContext context = association.findContext(abstractSyntax)
            .orElseThrow(() -> new IllegalArgumentException("No accepted presentation context for " + abstractSyntax));
        return association.invoke(context.identifier(), command, dataSet);
    }

    public int echo(Association association) throws IOException, InterruptedException {
        CommandSet command = CommandSet.builder()
            .commandField(DimseCommandField.C_ECHO_RQ)
            .messageId(nextMessageId())
            .affectedSopClassUid(VERIFICATION_SOP_CLASS)
            .dataSetPresent(false)
            .build();
        List<DimseResponse> responses = invoke(association, VERIFICATION_SOP_CLASS, command, Optional.empty()).toList();
        if (responses.isEmpty()) {
            throw new IllegalStateException("C-ECHO on " + association.name() + " produced no response");
        }
        return responses.get(responses.size() - 1).status();
    }

    public DimseResponseStream find(Association association, String sopClassUid, byte[] identifier) throws IOException {
        AcceptedContext context = association.findContext(sopClassUid)
            .orElseThrow(() -> new IllegalArgumentException("No accepted presentation context for " + sopClassUid));
        CommandSet command = CommandSet.builder()
            .commandField(DimseCommandField.C_FIND_RQ)
            .messageId(nextMessageId())
            .affectedSopClassUid(sopClassUid)
            .putUnsignedShort(CommandTags.PRIORITY, CommandTags.PRIORITY_MEDIUM)
            .dataSetPresent(true)
            .build();
        return association.invoke(context.identifier(), command, Optional.of(new DataSet(identifier, context.transferSyntax())));
    }

    public void release(Association association) throws IOException, InterruptedException {
        association.release();
        if (!association.awaitTermination(settings.getArtimTimeoutMillis())) {
            logger.warn("[{}] no A-RELEASE-RP received, aborting", association.name());
            association.abort();
        }
    }
}
