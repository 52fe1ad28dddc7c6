package it.dicom.network;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.dicom.dimse.DimseServiceRegistry;
import it.dicom.domain.AbortCause;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.AssociationState;
import it.dicom.service.AcceptancePolicy;
import it.dicom.service.Association;
import it.dicom.service.AssociationListener;
import it.dicom.service.AssociationSettings;
import it.dicom.service.AssociationTimers;
import it.dicom.service.PduCodec;

@Component
public class DicomServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DicomServer.class);

    private final int port;
    private final int maxAssociations;
    private final PduCodec codec;
    private final AssociationSettings settings;
    private final DimseServiceRegistry registry;
    private final AcceptancePolicy acceptancePolicy;
    private final ScheduledExecutorService timerScheduler;
    private final ExecutorService associationExecutor;
    private final Set<Association> associations = ConcurrentHashMap.newKeySet();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();
    private volatile AssociationListener listener = AssociationListener.NONE;
    private volatile ServerSocket serverSocket;

    public DicomServer(
        @Value("${dicom.server.port:11112}") int port,
        @Value("${dicom.server.max-associations:50}") int maxAssociations,
        PduCodec codec,
        AssociationSettings settings,
        DimseServiceRegistry registry,
        AcceptancePolicy acceptancePolicy,
        ScheduledExecutorService timerScheduler
    ) {
        this.port = port;
        this.maxAssociations = maxAssociations;
        this.codec = codec;
        this.settings = settings;
        this.registry = registry;
        this.acceptancePolicy = acceptancePolicy;
        this.timerScheduler = timerScheduler;
        this.associationExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "dicom-association-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setListener(AssociationListener listener) {
        this.listener = listener == null ? AssociationListener.NONE : listener;
    }

    public synchronized int bind() throws IOException {
        if (serverSocket == null) {
            serverSocket = new ServerSocket(port);
            logger.info("DICOM server listening on port {} as {}", serverSocket.getLocalPort(), settings.getAeTitle());
        }
        return serverSocket.getLocalPort();
    }

    public void start() throws IOException {
        bind();
        serve();
    }

    public void serve() throws IOException {
        ServerSocket server = serverSocket;
        if (server == null) {
            throw new IllegalStateException("DICOM server is not bound");
        }
        while (!server.isClosed()) {
            Socket socket;
            try {
                socket = server.accept();
            } catch (SocketException ex) {
                if (server.isClosed()) {
                    break;
                }
                throw ex;
            }
            logger.info("DICOM connection from {}", socket.getRemoteSocketAddress());
            accept(new SocketTransport(socket));
        }
        logger.info("DICOM server stopped");
    }

    void accept(Transport transport) {
        AcceptancePolicy policy = acceptancePolicy;
        if (active.incrementAndGet() > maxAssociations) {
            logger.warn("Association limit {} reached, rejecting {}", maxAssociations, transport.remoteAddress());
            policy = AcceptancePolicy.rejectAll(AssociateRejection.localLimitExceeded());
        }
        Association association = Association.acceptor(
            transport, codec, settings, registry, policy, new AssociationTimers(timerScheduler), new TrackingListener());
        associations.add(association);
        associationExecutor.execute(association);
    }

    public int activeAssociations() {
        return active.get();
    }

    public boolean isRunning() {
        ServerSocket server = serverSocket;
        return server != null && !server.isClosed();
    }

    @Override
    public void close() {
        ServerSocket server = serverSocket;
        if (server != null) {
            try {
                server.close();
            } catch (IOException ex) {
                logger.warn("Error closing DICOM server socket: {}", ex.getMessage());
            }
        }
        associations.forEach(Association::abort);
        associationExecutor.shutdownNow();
    }

    private final class TrackingListener implements AssociationListener {

        @Override
        public void onEstablished(Association association) {
            listener.onEstablished(association);
        }

        @Override
        public void onRejected(Association association, AssociateRejection rejection) {
            finished(association);
            listener.onRejected(association, rejection);
        }

        @Override
        public void onReleased(Association association) {
            finished(association);
            listener.onReleased(association);
        }

        @Override
        public void onAborted(Association association, AbortCause cause, AssociationState previousState, String detail) {
            finished(association);
            listener.onAborted(association, cause, previousState, detail);
        }

        private void finished(Association association) {
            if (associations.remove(association)) {
                active.decrementAndGet();
            }
        }
    }
}
