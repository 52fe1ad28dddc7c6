package it.dicom.dimse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import it.dicom.domain.DimseCommandField;
import it.dicom.domain.DimseStatus;

class ResponseChannelTest {

    private static DimseResponse response(int status) {
        CommandSet command = CommandSet.builder()
            .commandField(DimseCommandField.C_FIND_RSP)
            .messageIdBeingRespondedTo(1)
            .dataSetPresent(false)
            .status(status)
            .build();
        return new DimseResponse(command, Optional.empty());
    }

    @Test
    void shouldDeliverPublishedResponsesInOrder() throws Exception {
        ResponseChannel channel = new ResponseChannel();
        channel.publish(response(DimseStatus.PENDING));
        channel.publish(response(DimseStatus.SUCCESS));
        channel.complete();

        List<DimseResponse> responses = channel.toList();

        assertEquals(2, responses.size());
        assertTrue(responses.get(0).isPending());
        assertTrue(responses.get(1).isTerminal());
        assertTrue(channel.next().isEmpty());
    }

    @Test
    void shouldBlockUntilProducerPublishes() throws Exception {
        ResponseChannel channel = new ResponseChannel();
        CompletableFuture<Optional<DimseResponse>> pulled = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        channel.publish(response(DimseStatus.SUCCESS));

        assertEquals(DimseStatus.SUCCESS, pulled.get(5, TimeUnit.SECONDS).orElseThrow().status());
    }

    @Test
    void shouldEndAndRefusePublishingOnceClosed() throws Exception {
        ResponseChannel channel = new ResponseChannel();
        channel.publish(response(DimseStatus.PENDING));

        channel.close();

        assertTrue(channel.isClosed());
        assertTrue(channel.next().isEmpty());
        assertFalse(channel.publish(response(DimseStatus.SUCCESS)));
    }

    @Test
    void shouldSurfaceFailureToConsumer() {
        ResponseChannel channel = new ResponseChannel();

        channel.fail(new IllegalStateException("association aborted"));

        assertThrows(IllegalStateException.class, channel::next);
    }

    @Test
    void shouldBlockPublisherWhileConsumerIsBehind() throws Exception {
        ResponseChannel channel = new ResponseChannel(2);
        channel.publish(response(DimseStatus.PENDING));
        channel.publish(response(DimseStatus.PENDING));
        CompletableFuture<Boolean> third = CompletableFuture.supplyAsync(() -> publish(channel, response(DimseStatus.SUCCESS)));

        assertThrows(TimeoutException.class, () -> third.get(200, TimeUnit.MILLISECONDS));
        assertTrue(channel.next().isPresent());

        assertTrue(third.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldReleaseBlockedPublisherOnClose() throws Exception {
        ResponseChannel channel = new ResponseChannel(1);
        channel.publish(response(DimseStatus.PENDING));
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> publish(channel, response(DimseStatus.PENDING)));

        channel.close();

        assertFalse(blocked.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldReleaseBlockedPublisherOnFailure() throws Exception {
        ResponseChannel channel = new ResponseChannel(1);
        channel.publish(response(DimseStatus.PENDING));
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> publish(channel, response(DimseStatus.PENDING)));

        channel.fail(new IllegalStateException("association aborted"));

        assertFalse(blocked.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseChannel(0));
    }

    private static boolean publish(ResponseChannel channel, DimseResponse response) {
        try {
            return channel.publish(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void shouldStopIteratorStreamOnClose() throws Exception {
        DimseResponseStream stream = DimseResponseStream.of(response(DimseStatus.PENDING), response(DimseStatus.SUCCESS));

        assertTrue(stream.next().isPresent());
        stream.close();

        assertTrue(stream.next().isEmpty());
    }
}
