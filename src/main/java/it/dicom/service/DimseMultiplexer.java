package it.dicom.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.dicom.codec.FramingException;
import it.dicom.dimse.AcceptedContext;
import it.dicom.dimse.CommandSet;
import it.dicom.dimse.CommandSetCodec;
import it.dicom.dimse.CommandTags;
import it.dicom.dimse.DataSet;
import it.dicom.dimse.DimseMessage;
import it.dicom.dimse.DimseRequest;
import it.dicom.dimse.DimseResponse;
import it.dicom.dimse.DimseResponseStream;
import it.dicom.dimse.DimseServiceException;
import it.dicom.dimse.DimseServiceHandler;
import it.dicom.dimse.DimseServiceRegistry;
import it.dicom.dimse.ResponseChannel;
import it.dicom.domain.DimseCommandField;
import it.dicom.domain.DimseStatus;
import it.dicom.domain.InvokedService;
import it.dicom.service.PduModels.PDataTf;
import it.dicom.service.PduModels.PresentationDataValue;

/**
 * DIMSE layer of one established association.
 *
 * <p>Inbound PDVs are reassembled per presentation context on the reader thread. Complete requests run on a single
 * dispatch worker, one at a time, and their response streams are pulled there. Responses to requests we issued are
 * routed to the waiting {@link ResponseChannel}. Every outbound message is fragmented and written under one lock so
 * PDVs of different messages never interleave.
 */
public class DimseMultiplexer {

    private static final Logger logger = LoggerFactory.getLogger(DimseMultiplexer.class);

    @FunctionalInterface
    public interface PduSender {

        void send(PDataTf pdu) throws IOException;
    }

    @FunctionalInterface
    public interface FailureHandler {

        void onDispatchFailure(RuntimeException failure);
    }

    private final String name;
    private final Map<Integer, AcceptedContext> contexts;
    private final DimseServiceRegistry registry;
    private final String peerAeTitle;
    private final int maxPduLength;
    private final PduSender sender;
    private final FailureHandler failureHandler;
    private final ExecutorService dispatcher;
    private final Object writeLock = new Object();
    private final Object drainLock = new Object();
    private final Map<Integer, Reassembly> reassembly = new ConcurrentHashMap<>();
    private final Map<RequestKey, ResponseChannel> outstanding = new ConcurrentHashMap<>();
    private final Map<RequestKey, ActiveRequest> active = new ConcurrentHashMap<>();
    private int inFlight;
    private volatile boolean closed;

    public DimseMultiplexer(
        String name,
        Map<Integer, AcceptedContext> contexts,
        DimseServiceRegistry registry,
        String peerAeTitle,
        int maxPduLength,
        PduSender sender,
        FailureHandler failureHandler
    ) {
        this.name = name;
        this.contexts = Map.copyOf(contexts);
        this.registry = registry;
        this.peerAeTitle = peerAeTitle;
        this.maxPduLength = maxPduLength;
        this.sender = sender;
        this.failureHandler = failureHandler;
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "dimse-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    public Map<Integer, AcceptedContext> contexts() {
        return contexts;
    }

    public int maxPduLength() {
        return maxPduLength;
    }

    /**
     * Consumes one inbound P-DATA-TF. Called from the reader thread only.
     */
    public void onPData(PDataTf pdu) throws InterruptedException {
        for (PresentationDataValue pdv : pdu.values()) {
            AcceptedContext context = contexts.get(pdv.presentationContextId());
            if (context == null) {
                throw new ProtocolStateException("PDV received on presentation context " + pdv.presentationContextId() + " which was not accepted");
            }
            Reassembly buffer = reassembly.computeIfAbsent(context.identifier(), id -> new Reassembly());
            Optional<DimseMessage> message = buffer.accept(pdv, context);
            if (message.isPresent()) {
                deliver(context, message.get());
            }
        }
    }

    /**
     * Sends a request and returns the stream its responses will arrive on.
     */
    public DimseResponseStream invoke(int presentationContextId, CommandSet command, Optional<DataSet> dataSet) throws IOException {
        ensureOpen();
        if (!contexts.containsKey(presentationContextId)) {
            throw new IllegalArgumentException("Presentation context " + presentationContextId + " was not accepted");
        }
        RequestKey key = new RequestKey(presentationContextId, command.messageId());
        ResponseChannel channel = new ResponseChannel();
        if (outstanding.putIfAbsent(key, channel) != null) {
            throw new IllegalStateException("Message ID " + command.messageId() + " already outstanding on context " + presentationContextId);
        }
        try {
            send(new DimseMessage(presentationContextId, command, dataSet));
        } catch (IOException | RuntimeException ex) {
            outstanding.remove(key);
            throw ex;
        }
        return channel;
    }

    public void cancel(int presentationContextId, int messageId) throws IOException {
        CommandSet command = CommandSet.builder()
            .commandField(DimseCommandField.C_CANCEL_RQ)
            .messageIdBeingRespondedTo(messageId)
            .dataSetPresent(false)
            .build();
        send(new DimseMessage(presentationContextId, command, Optional.empty()));
    }

    public void send(DimseMessage message) throws IOException {
        ensureOpen();
        byte[] command = CommandSetCodec.encode(message.command());
        byte[] data = message.dataSet().map(DataSet::bytes).orElse(null);
        List<PDataTf> pdus = PdvFragmenter.fragment(message.presentationContextId(), command, data, maxPduLength);
        synchronized (writeLock) {
            for (PDataTf pdu : pdus) {
                sender.send(pdu);
            }
        }
        logger.debug("[{}] sent {} on context {} in {} PDU(s)", name, message.command(), message.presentationContextId(), pdus.size());
    }

    public boolean hasOutstandingRequests() {
        return !outstanding.isEmpty();
    }

    /**
     * Waits until no inbound request is being processed. Returns false when the timeout elapsed first.
     */
    public boolean awaitDrained(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        synchronized (drainLock) {
            while (inFlight > 0) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                drainLock.wait(remaining);
            }
            return true;
        }
    }

    /**
     * Stops all DIMSE activity: running streams are closed, waiting requesters are failed, queued requests are
     * dropped and no further service operation is invoked.
     */
    public void close(String reason) {
        if (closed) {
            return;
        }
        closed = true;
        reassembly.clear();
        active.values().forEach(ActiveRequest::cancel);
        IllegalStateException failure = new IllegalStateException(reason);
        outstanding.values().forEach(channel -> channel.fail(failure));
        outstanding.clear();
        dispatcher.shutdownNow();
        logger.debug("[{}] DIMSE layer closed: {}", name, reason);
    }

    public boolean isClosed() {
        return closed;
    }

    boolean awaitDispatcherTermination(long timeoutMillis) throws InterruptedException {
        return dispatcher.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void deliver(AcceptedContext context, DimseMessage message) throws InterruptedException {
        CommandSet command = message.command();
        Optional<DimseCommandField> field = command.commandField();
        if (field.isEmpty()) {
            int code = command.commandFieldCode();
            logger.warn("[{}] unrecognized command field 0x{} on context {}", name, Integer.toHexString(code), context.identifier());
            if ((code & 0x8000) == 0 && command.contains(CommandTags.MESSAGE_ID)) {
                submit(() -> sendUnrecognized(context, command, code));
            }
            return;
        }
        if (field.get().isCancel()) {
            cancelActive(context, command);
        } else if (field.get().isResponse()) {
            routeResponse(context, message);
        } else {
            dispatch(context, field.get(), message);
        }
    }

    private void dispatch(AcceptedContext context, DimseCommandField field, DimseMessage message) {
        InvokedService service = InvokedService.fromCommandField(field)
            .orElseThrow(() -> new ProtocolStateException("No DIMSE service for command field " + field));
        DimseRequest request = new DimseRequest(service, context, message.command(), message.dataSet(), peerAeTitle);
        RequestKey key = new RequestKey(context.identifier(), request.messageId());
        ActiveRequest activeRequest = new ActiveRequest(request);
        if (active.putIfAbsent(key, activeRequest) != null) {
            logger.warn("[{}] duplicate invocation of message ID {} on context {}", name, key.messageId(), key.contextId());
            submit(() -> sendResponse(context, DimseResponse.failure(request, DimseStatus.DUPLICATE_INVOCATION, "Duplicate message ID")));
            return;
        }
        logger.debug("[{}] dispatching {} message ID {} on context {}", name, service, request.messageId(), context.identifier());
        if (!submit(() -> process(key, activeRequest))) {
            active.remove(key);
        }
    }

    private boolean submit(IoTask task) {
        if (closed) {
            return false;
        }
        synchronized (drainLock) {
            inFlight++;
        }
        try {
            dispatcher.execute(() -> {
                try {
                    task.run();
                } catch (IOException ex) {
                    logger.warn("[{}] failed to write DIMSE response: {}", name, ex.getMessage());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException ex) {
                    if (!closed) {
                        logger.warn("[{}] DIMSE dispatch task failed", name, ex);
                        failureHandler.onDispatchFailure(ex);
                    }
                } finally {
                    finishTask();
                }
            });
            return true;
        } catch (RejectedExecutionException ex) {
            finishTask();
            logger.debug("[{}] dispatch rejected, DIMSE layer closed", name);
            return false;
        }
    }

    private void finishTask() {
        synchronized (drainLock) {
            inFlight--;
            drainLock.notifyAll();
        }
    }

    private void process(RequestKey key, ActiveRequest activeRequest) throws IOException, InterruptedException {
        DimseRequest request = activeRequest.request;
        try {
            if (closed) {
                return;
            }
            Optional<DimseServiceHandler> handler = registry.handlerFor(request.service());
            if (handler.isEmpty()) {
                sendResponse(request.context(), DimseResponse.failure(request, DimseStatus.UNRECOGNIZED_OPERATION, request.service() + " not supported"));
                return;
            }
            DimseResponseStream stream;
            try {
                stream = handler.get().handle(request);
            } catch (InterruptedException ex) {
                throw ex;
            } catch (Exception ex) {
                sendResponse(request.context(), failureFor(request, ex));
                return;
            }
            if (stream == null) {
                sendResponse(request.context(), DimseResponse.failure(request, request.service().failureStatus(), "No response produced"));
                return;
            }
            activeRequest.attach(stream);
            pump(activeRequest, stream);
        } finally {
            active.remove(key, activeRequest);
        }
    }

    private void pump(ActiveRequest activeRequest, DimseResponseStream stream) throws IOException, InterruptedException {
        DimseRequest request = activeRequest.request;
        boolean terminalSent = false;
        try {
            Optional<DimseResponse> next;
            while (!closed && (next = stream.next()).isPresent()) {
                DimseResponse response = next.get();
                sendResponse(request.context(), response);
                if (response.isTerminal()) {
                    terminalSent = true;
                    break;
                }
            }
            if (!terminalSent && !closed) {
                if (activeRequest.cancelled) {
                    sendResponse(request.context(), DimseResponse.of(request, DimseStatus.CANCEL, Optional.empty()));
                } else {
                    logger.warn("[{}] {} response stream ended without a terminal response", name, request.service());
                    sendResponse(request.context(), DimseResponse.failure(request, request.service().failureStatus(), "Response stream ended early"));
                }
            }
        } catch (RuntimeException ex) {
            if (!terminalSent && !closed) {
                sendResponse(request.context(), failureFor(request, ex));
            }
        } finally {
            stream.close();
        }
    }

    private DimseResponse failureFor(DimseRequest request, Exception ex) {
        if (ex instanceof DimseServiceException serviceException) {
            logger.warn("[{}] {} failed with status 0x{}: {}", name, request.service(), Integer.toHexString(serviceException.getStatus()), ex.getMessage());
            return DimseResponse.failure(request, serviceException.getStatus(), ex.getMessage());
        }
        logger.warn("[{}] {} handler failed", name, request.service(), ex);
        return DimseResponse.failure(request, request.service().failureStatus(), ex.getMessage());
    }

    private void sendResponse(AcceptedContext context, DimseResponse response) throws IOException {
        if (closed) {
            return;
        }
        send(new DimseMessage(context.identifier(), response.command(), response.dataSet()));
    }

    private void sendUnrecognized(AcceptedContext context, CommandSet request, int code) throws IOException {
        CommandSet response = CommandSet.builder()
            .putUnsignedShort(CommandTags.COMMAND_FIELD, code | 0x8000)
            .messageIdBeingRespondedTo(request.messageId())
            .dataSetPresent(false)
            .status(DimseStatus.UNRECOGNIZED_OPERATION)
            .build();
        sendResponse(context, new DimseResponse(response, Optional.empty()));
    }

    private void cancelActive(AcceptedContext context, CommandSet command) {
        RequestKey key = new RequestKey(context.identifier(), command.messageIdBeingRespondedTo());
        ActiveRequest target = active.get(key);
        if (target == null) {
            logger.debug("[{}] C-CANCEL for message ID {} which is not active", name, key.messageId());
            return;
        }
        if (!target.request.service().isCancellable()) {
            logger.debug("[{}] ignoring C-CANCEL for {}", name, target.request.service());
            return;
        }
        logger.info("[{}] cancelling {} message ID {}", name, target.request.service(), key.messageId());
        target.cancel();
    }

    private void routeResponse(AcceptedContext context, DimseMessage message) throws InterruptedException {
        CommandSet command = message.command();
        if (command.status().isEmpty() || !command.contains(CommandTags.MESSAGE_ID_BEING_RESPONDED_TO)) {
            throw new FramingException("Response command without status or message ID being responded to: " + command);
        }
        RequestKey key = new RequestKey(context.identifier(), command.messageIdBeingRespondedTo());
        ResponseChannel channel = outstanding.get(key);
        if (channel == null) {
            logger.warn("[{}] discarding response to unknown message ID {} on context {}", name, key.messageId(), key.contextId());
            return;
        }
        DimseResponse response = new DimseResponse(command, message.dataSet());
        if (!channel.publish(response)) {
            logger.debug("[{}] response to message ID {} dropped, stream already closed", name, key.messageId());
        }
        if (response.isTerminal()) {
            outstanding.remove(key);
            channel.complete();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ProtocolStateException("DIMSE layer of association " + name + " is closed");
        }
    }

    @FunctionalInterface
    private interface IoTask {

        void run() throws IOException, InterruptedException;
    }

    private record RequestKey(int contextId, int messageId) {
    }

    private static final class ActiveRequest {

        private final DimseRequest request;
        private volatile DimseResponseStream stream;
        private volatile boolean cancelled;

        private ActiveRequest(DimseRequest request) {
            this.request = request;
        }

        void attach(DimseResponseStream stream) {
            this.stream = stream;
            if (cancelled) {
                stream.close();
            }
        }

        void cancel() {
            cancelled = true;
            DimseResponseStream current = stream;
            if (current != null) {
                current.close();
            }
        }
    }

    /**
     * Command and data-set buffers of one presentation context.
     */
    private static final class Reassembly {

        private final ByteArrayOutputStream commandBytes = new ByteArrayOutputStream();
        private final ByteArrayOutputStream dataBytes = new ByteArrayOutputStream();
        private CommandSet pendingCommand;

        Optional<DimseMessage> accept(PresentationDataValue pdv, AcceptedContext context) {
            if (pdv.command()) {
                if (pendingCommand != null) {
                    throw new ProtocolStateException("Command fragment on context " + context.identifier() + " while a data set is still expected");
                }
                commandBytes.writeBytes(pdv.data());
                if (!pdv.last()) {
                    return Optional.empty();
                }
                CommandSet command = CommandSetCodec.decode(commandBytes.toByteArray());
                commandBytes.reset();
                if (command.hasDataSet()) {
                    pendingCommand = command;
                    return Optional.empty();
                }
                return Optional.of(new DimseMessage(context.identifier(), command, Optional.empty()));
            }
            if (pendingCommand == null) {
                throw new ProtocolStateException("Data fragment on context " + context.identifier() + " without a preceding command");
            }
            dataBytes.writeBytes(pdv.data());
            if (!pdv.last()) {
                return Optional.empty();
            }
            DataSet dataSet = new DataSet(dataBytes.toByteArray(), context.transferSyntax());
            DimseMessage message = new DimseMessage(context.identifier(), pendingCommand, Optional.of(dataSet));
            pendingCommand = null;
            dataBytes.reset();
            return Optional.of(message);
        }
    }
}
