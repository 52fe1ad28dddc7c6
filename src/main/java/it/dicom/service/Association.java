package it.dicom.service;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.dicom.codec.FramingException;
import it.dicom.dimse.AcceptedContext;
import it.dicom.dimse.CommandSet;
import it.dicom.dimse.DataSet;
import it.dicom.dimse.DimseResponseStream;
import it.dicom.dimse.DimseServiceRegistry;
import it.dicom.domain.AbortCause;
import it.dicom.domain.AssociateRejection;
import it.dicom.domain.AssociationEvent;
import it.dicom.domain.AssociationState;
import it.dicom.network.Transport;
import it.dicom.service.AssociationStateMachine.Transition;
import it.dicom.service.PduModels.Abort;
import it.dicom.service.PduModels.AssociateAccept;
import it.dicom.service.PduModels.AssociateReject;
import it.dicom.service.PduModels.AssociateRequest;
import it.dicom.service.PduModels.PDataTf;
import it.dicom.service.PduModels.Pdu;
import it.dicom.service.PduModels.ReleaseRequest;
import it.dicom.service.PduModels.ReleaseResponse;

/**
 * One association over one transport. A single reader thread runs {@link #run()} and handles PDUs strictly in
 * arrival order; all writes go through one lock.
 */
public class Association implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(Association.class);

    private static final long ABORT_WRITE_WAIT_MILLIS = 200;

    public enum Role {
        ACCEPTOR,
        REQUESTOR
    }

    private final Role role;
    private final Transport transport;
    private final PduCodec codec;
    private final AssociationSettings settings;
    private final DimseServiceRegistry registry;
    private final AcceptancePolicy acceptancePolicy;
    private final AssociationListener listener;
    private final AssociationTimers timers;
    private final AssociationStateMachine stateMachine = new AssociationStateMachine();
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final CountDownLatch negotiated = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile String name;
    private volatile AssociateRequest associateRequest;
    private volatile AssociateAccept associateAccept;
    private volatile AssociateRejection rejection;
    private volatile AbortCause abortCause;
    private volatile DimseMultiplexer multiplexer;
    private volatile boolean releaseRequestedLocally;

    private Association(
        Role role,
        Transport transport,
        PduCodec codec,
        AssociationSettings settings,
        DimseServiceRegistry registry,
        AcceptancePolicy acceptancePolicy,
        AssociationTimers timers,
        AssociationListener listener
    ) {
        this.role = role;
        this.transport = transport;
        this.codec = codec;
        this.settings = settings;
        this.registry = registry;
        this.acceptancePolicy = acceptancePolicy;
        this.timers = timers;
        this.listener = listener == null ? AssociationListener.NONE : listener;
        this.name = transport.remoteAddress();
    }

    public static Association acceptor(
        Transport transport,
        PduCodec codec,
        AssociationSettings settings,
        DimseServiceRegistry registry,
        AcceptancePolicy acceptancePolicy,
        AssociationTimers timers,
        AssociationListener listener
    ) {
        return new Association(Role.ACCEPTOR, transport, codec, settings, registry, acceptancePolicy, timers, listener);
    }

    public static Association requestor(
        Transport transport,
        PduCodec codec,
        AssociationSettings settings,
        DimseServiceRegistry registry,
        AssociationTimers timers,
        AssociationListener listener
    ) {
        return new Association(Role.REQUESTOR, transport, codec, settings, registry, null, timers, listener);
    }

    @Override
    public void run() {
        try {
            if (role == Role.ACCEPTOR) {
                timers.startArtim(settings.getArtimTimeoutMillis(), () -> onTimerExpired(AbortCause.ARTIM_EXPIRED));
            }
            while (!stateMachine.state().isTerminal()) {
                Pdu pdu = codec.read(transport.input());
                if (pdu == null) {
                    onTransportFailure("connection closed by peer");
                    break;
                }
                handle(pdu);
            }
        } catch (FramingException ex) {
            Transition transition = stateMachine.fire(AssociationEvent.LOCAL_ABORT);
            if (!transition.absorbed()) {
                logger.warn("[{}] framing error: {}", name, ex.getMessage());
                finishAborted(AbortCause.FRAMING_ERROR, transition.from(), PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
                    PduModels.ABORT_REASON_INVALID_PDU_PARAMETER_VALUE, ex.getMessage());
            }
        } catch (ProtocolStateException ex) {
            AssociationState previous = ex.getState() != null ? ex.getState() : stateMachine.fire(AssociationEvent.LOCAL_ABORT).from();
            logger.warn("[{}] protocol error: {}", name, ex.getMessage());
            finishAborted(AbortCause.PROTOCOL_ERROR, previous, PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
                PduModels.ABORT_REASON_UNEXPECTED_PDU, ex.getMessage());
        } catch (RuntimeException ex) {
            Transition transition = stateMachine.fire(AssociationEvent.LOCAL_ABORT);
            if (!transition.absorbed()) {
                logger.warn("[{}] failed to process PDU", name, ex);
                finishAborted(AbortCause.PROTOCOL_ERROR, transition.from(), PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
                    PduModels.ABORT_REASON_NOT_SPECIFIED, ex.getMessage());
            }
        } catch (IOException ex) {
            onTransportFailure(ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            onTransportFailure("reader interrupted");
        } finally {
            if (!stateMachine.state().isTerminal()) {
                onTransportFailure("reader stopped");
            }
            transport.close();
        }
    }

    /**
     * Requestor side: sends the A-ASSOCIATE-RQ. The outcome is reported to the listener and through
     * {@link #awaitNegotiation(long)}.
     */
    public void request(AssociateRequest request) throws IOException {
        if (role != Role.REQUESTOR) {
            throw new ProtocolStateException("Only a requestor issues an A-ASSOCIATE-RQ");
        }
        PresentationContext.validateProposal(request.presentationContexts());
        sendLock.lock();
        try {
            ensureState(AssociationState.IDLE);
            stateMachine.fireOrThrow(AssociationEvent.ISSUE_ASSOCIATE_RQ);
            associateRequest = request;
            name = request.callingAeTitle() + "->" + request.calledAeTitle();
            write(request);
        } finally {
            sendLock.unlock();
        }
        timers.startArtim(settings.getArtimTimeoutMillis(), () -> onTimerExpired(AbortCause.ARTIM_EXPIRED));
    }

    /**
     * Waits until the association is established, rejected or aborted. Returns the state reached.
     */
    public AssociationState awaitNegotiation(long timeoutMillis) throws InterruptedException {
        negotiated.await(timeoutMillis, TimeUnit.MILLISECONDS);
        return stateMachine.state();
    }

    public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
        return terminated.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public DimseResponseStream invoke(int presentationContextId, CommandSet command, Optional<DataSet> dataSet) throws IOException {
        return requireMultiplexer().invoke(presentationContextId, command, dataSet);
    }

    public void cancel(int presentationContextId, int messageId) throws IOException {
        requireMultiplexer().cancel(presentationContextId, messageId);
    }

    /**
     * Sends an A-RELEASE-RQ. The association closes when the peer answers; use {@link #awaitTermination(long)}.
     */
    public void release() throws IOException {
        sendLock.lock();
        try {
            ensureState(AssociationState.ESTABLISHED);
            stateMachine.fireOrThrow(AssociationEvent.ISSUE_RELEASE_RQ);
            releaseRequestedLocally = true;
            write(new ReleaseRequest());
        } finally {
            sendLock.unlock();
        }
        timers.cancelIdle();
        timers.startArtim(settings.getArtimTimeoutMillis(), () -> onTimerExpired(AbortCause.ARTIM_EXPIRED));
        logger.debug("[{}] release requested", name);
    }

    /**
     * Aborts as service user. Does nothing once the association has ended.
     */
    public void abort() {
        Transition transition = stateMachine.fire(AssociationEvent.LOCAL_ABORT);
        if (transition.absorbed()) {
            return;
        }
        finishAborted(AbortCause.LOCAL_ABORT, transition.from(), PduModels.ABORT_SOURCE_SERVICE_USER,
            PduModels.ABORT_REASON_NOT_SPECIFIED, "aborted by local user");
    }

    public String name() {
        return name;
    }

    public Role role() {
        return role;
    }

    public AssociationState state() {
        return stateMachine.state();
    }

    public Optional<AssociateRequest> associateRequest() {
        return Optional.ofNullable(associateRequest);
    }

    public Optional<AssociateAccept> associateAccept() {
        return Optional.ofNullable(associateAccept);
    }

    public Optional<AssociateRejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    public Optional<AbortCause> abortCause() {
        return Optional.ofNullable(abortCause);
    }

    public Map<Integer, AcceptedContext> acceptedContexts() {
        DimseMultiplexer current = multiplexer;
        return current == null ? Map.of() : current.contexts();
    }

    public Optional<AcceptedContext> findContext(String abstractSyntax) {
        return acceptedContexts().values().stream()
            .filter(context -> context.abstractSyntax().equals(abstractSyntax))
            .sorted((left, right) -> Integer.compare(left.identifier(), right.identifier()))
            .findFirst();
    }

    private void handle(Pdu pdu) throws IOException, InterruptedException {
        logger.debug("[{}] received {}", name, pdu.type());
        Transition transition = stateMachine.fireOrThrow(AssociationEvent.received(pdu.type()));
        restartIdleTimer();
        if (pdu instanceof AssociateRequest request) {
            onAssociateRequest(request);
        } else if (pdu instanceof AssociateAccept accept) {
            onAssociateAccept(accept);
        } else if (pdu instanceof AssociateReject reject) {
            onAssociateReject(reject.rejection());
        } else if (pdu instanceof PDataTf pData) {
            requireMultiplexer().onPData(pData);
        } else if (pdu instanceof ReleaseRequest) {
            onReleaseRequest(transition);
        } else if (pdu instanceof ReleaseResponse) {
            finishReleased();
        } else if (pdu instanceof Abort abort) {
            finishAborted(AbortCause.PEER_ABORT, transition.from(), -1, -1,
                "peer abort source=" + abort.source() + " reason=" + abort.reason());
        }
    }

    private void onAssociateRequest(AssociateRequest request) throws IOException {
        if (acceptancePolicy == null) {
            throw new ProtocolStateException("A-ASSOCIATE-RQ received by a requestor");
        }
        timers.startArtim(settings.getArtimTimeoutMillis(), () -> onTimerExpired(AbortCause.ARTIM_EXPIRED));
        associateRequest = request;
        name = request.callingAeTitle() + "->" + request.calledAeTitle();
        long peerMaxPduLength = request.userInformation().maxPduLength();
        if (!PdvFragmenter.isUsableMaxPduLength(peerMaxPduLength)) {
            timers.cancelArtim();
            logger.info("[{}] rejecting association, maximum PDU length {} leaves no room for PDV payload", name, peerMaxPduLength);
            reject(AssociateRejection.noReasonGiven());
            return;
        }
        AcceptancePolicy.Decision decision = acceptancePolicy.evaluate(request);
        timers.cancelArtim();
        if (!decision.accepted()) {
            reject(decision.rejection().orElseThrow());
            return;
        }
        AssociateAccept accept = decision.accept().orElseThrow();
        startDimse(decision.contexts(), peerMaxPduLength, request.callingAeTitle());
        sendLock.lock();
        try {
            stateMachine.fireOrThrow(AssociationEvent.LOCAL_ACCEPT);
            associateAccept = accept;
            write(accept);
        } finally {
            sendLock.unlock();
        }
        onEstablished();
    }

    private void reject(AssociateRejection rejected) throws IOException {
        sendLock.lock();
        try {
            stateMachine.fireOrThrow(AssociationEvent.LOCAL_REJECT);
            write(new AssociateReject(rejected));
        } finally {
            sendLock.unlock();
        }
        finishRejected(rejected);
    }

    private void onAssociateAccept(AssociateAccept accept) {
        timers.cancelArtim();
        associateAccept = accept;
        long peerMaxPduLength = accept.userInformation().maxPduLength();
        if (!PdvFragmenter.isUsableMaxPduLength(peerMaxPduLength)) {
            Transition transition = stateMachine.fire(AssociationEvent.LOCAL_ABORT);
            finishAborted(AbortCause.PROTOCOL_ERROR, transition.from(), PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
                PduModels.ABORT_REASON_INVALID_PDU_PARAMETER_VALUE, "peer maximum PDU length " + peerMaxPduLength + " leaves no room for PDV payload");
            return;
        }
        Map<Integer, AcceptedContext> contexts = AssociationAcceptor.acceptedContexts(
            associateRequest.presentationContexts(), accept.presentationContexts());
        startDimse(contexts, peerMaxPduLength, associateRequest.calledAeTitle());
        onEstablished();
    }

    private void onAssociateReject(AssociateRejection rejected) {
        finishRejected(rejected);
    }

    private void onEstablished() {
        restartIdleTimer();
        logger.info("[{}] association established with {} presentation context(s)", name, acceptedContexts().size());
        negotiated.countDown();
        listener.onEstablished(this);
    }

    private void onReleaseRequest(Transition transition) throws IOException, InterruptedException {
        if (releaseRequestedLocally) {
            logger.debug("[{}] release collision, answering with A-RELEASE-RP", name);
            sendLock.lock();
            try {
                write(new ReleaseResponse());
            } finally {
                sendLock.unlock();
            }
            return;
        }
        timers.cancelIdle();
        timers.startArtim(settings.getArtimTimeoutMillis(), () -> onTimerExpired(AbortCause.ARTIM_EXPIRED));
        DimseMultiplexer current = multiplexer;
        if (current != null && !current.awaitDrained(settings.getReleaseDrainTimeoutMillis())) {
            logger.warn("[{}] outstanding DIMSE work did not drain before release", name);
        }
        sendLock.lock();
        try {
            Transition sent = stateMachine.fire(AssociationEvent.SEND_RELEASE_RP);
            if (sent.absorbed()) {
                return;
            }
            write(new ReleaseResponse());
        } finally {
            sendLock.unlock();
        }
        finishReleased();
    }

    private void startDimse(Map<Integer, AcceptedContext> contexts, long peerMaxPduLength, String peerAeTitle) {
        int maxPduLength = PdvFragmenter.effectiveMaxPduLength(settings.getMaxPduLength(), peerMaxPduLength);
        multiplexer = new DimseMultiplexer(name, contexts, registry, peerAeTitle, maxPduLength, this::sendPData, this::onDimseFailure);
    }

    private void sendPData(PDataTf pdu) throws IOException {
        sendLock.lock();
        try {
            if (!stateMachine.isIn(AssociationState.ESTABLISHED, AssociationState.RELEASING)) {
                throw new ProtocolStateException("Cannot send P-DATA in state " + stateMachine.state());
            }
            stateMachine.fireOrThrow(AssociationEvent.SEND_P_DATA);
            write(pdu);
        } finally {
            sendLock.unlock();
        }
        restartIdleTimer();
    }

    private void write(Pdu pdu) throws IOException {
        codec.write(transport.output(), pdu);
        logger.debug("[{}] sent {}", name, pdu.type());
    }

    private void restartIdleTimer() {
        if (stateMachine.isIn(AssociationState.ESTABLISHED)) {
            timers.restartIdle(settings.getIdleTimeoutMillis(), () -> onTimerExpired(AbortCause.IDLE_TIMEOUT));
        }
    }

    private void onDimseFailure(RuntimeException failure) {
        Transition transition = stateMachine.fire(AssociationEvent.LOCAL_ABORT);
        if (transition.absorbed()) {
            return;
        }
        finishAborted(AbortCause.PROTOCOL_ERROR, transition.from(), PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
            PduModels.ABORT_REASON_NOT_SPECIFIED, "DIMSE dispatch failed: " + failure.getMessage());
    }

    private void onTimerExpired(AbortCause cause) {
        Transition transition = stateMachine.fire(AssociationEvent.TIMER_EXPIRED);
        if (transition.absorbed()) {
            return;
        }
        logger.warn("[{}] {} in state {}", name, cause, transition.from());
        finishAborted(cause, transition.from(), PduModels.ABORT_SOURCE_SERVICE_PROVIDER,
            PduModels.ABORT_REASON_NOT_SPECIFIED, cause + " in state " + transition.from());
    }

    private void onTransportFailure(String detail) {
        Transition transition = stateMachine.fire(AssociationEvent.TRANSPORT_ERROR);
        if (transition.absorbed()) {
            return;
        }
        logger.warn("[{}] transport failure in state {}: {}", name, transition.from(), detail);
        finishAborted(AbortCause.TRANSPORT_ERROR, transition.from(), -1, -1, detail);
    }

    private void finishAborted(AbortCause cause, AssociationState previous, int source, int reason, String detail) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        abortCause = cause;
        timers.cancelAll();
        if (cause.isLocallyInitiated() && transport.isOpen()) {
            sendAbort(source, reason);
        }
        transport.close();
        closeDimse("association aborted: " + cause);
        logger.info("[{}] association aborted ({}) from state {}: {}", name, cause, previous, detail);
        negotiated.countDown();
        terminated.countDown();
        listener.onAborted(this, cause, previous, detail);
    }

    // A writer blocked on a peer that stopped reading holds the lock; closing the transport is what releases it.
    private void sendAbort(int source, int reason) {
        boolean locked;
        try {
            locked = sendLock.tryLock(ABORT_WRITE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            locked = false;
        }
        if (!locked) {
            logger.debug("[{}] writer busy, closing without A-ABORT", name);
            return;
        }
        try {
            write(new Abort(source, reason));
        } catch (IOException ex) {
            logger.debug("[{}] could not send A-ABORT: {}", name, ex.getMessage());
        } finally {
            sendLock.unlock();
        }
    }

    private void finishRejected(AssociateRejection rejected) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        rejection = rejected;
        timers.cancelAll();
        transport.close();
        logger.info("[{}] association rejected: {}", name, rejected.describe());
        negotiated.countDown();
        terminated.countDown();
        listener.onRejected(this, rejected);
    }

    private void finishReleased() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        timers.cancelAll();
        closeDimse("association released");
        transport.close();
        logger.info("[{}] association released", name);
        terminated.countDown();
        listener.onReleased(this);
    }

    private void closeDimse(String reason) {
        DimseMultiplexer current = multiplexer;
        if (current != null) {
            current.close(reason);
        }
    }

    private DimseMultiplexer requireMultiplexer() {
        DimseMultiplexer current = multiplexer;
        if (current == null) {
            throw new ProtocolStateException("Association " + name + " is not established");
        }
        return current;
    }

    private void ensureState(AssociationState expected) {
        AssociationState current = stateMachine.state();
        if (current != expected) {
            throw new ProtocolStateException("Association " + name + " is " + current + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return "Association[" + name + ", " + role + ", " + stateMachine.state() + "]";
    }
}
