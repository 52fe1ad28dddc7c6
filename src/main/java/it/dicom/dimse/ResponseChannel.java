package it.dicom.dimse;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;

/**
 * Push-to-pull bridge: a producer publishes responses as they arrive, a consumer pulls them through the stream API.
 * Used for responses coming back from a peer and for service implementations that produce on their own thread.
 * At most {@code capacity} responses wait unconsumed; past that {@link #publish} blocks until the consumer pulls,
 * closes the channel, or the channel fails.
 */
public class ResponseChannel implements DimseResponseStream {

    public static final int DEFAULT_CAPACITY = 64;

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final int capacity;
    private final Semaphore slots;
    private volatile boolean closed;
    private volatile boolean ended;
    private volatile Throwable failure;
    private boolean finished;

    public ResponseChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ResponseChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Response channel capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
    }

    /**
     * Returns false when the consumer has already closed the channel or the channel has ended.
     */
    public boolean publish(DimseResponse response) throws InterruptedException {
        if (closed || ended) {
            return false;
        }
        slots.acquire();
        if (closed || ended) {
            return false;
        }
        queue.add(response);
        return true;
    }

    public void complete() {
        ended = true;
        queue.add(END);
    }

    public void fail(Throwable cause) {
        failure = cause;
        ended = true;
        queue.add(END);
        slots.release(capacity);
    }

    @Override
    public synchronized Optional<DimseResponse> next() throws InterruptedException {
        if (finished) {
            return endOfStream();
        }
        Object next = queue.take();
        if (next == END) {
            finished = true;
            return endOfStream();
        }
        slots.release();
        return Optional.of((DimseResponse) next);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
        queue.add(END);
        slots.release(capacity);
    }

    private Optional<DimseResponse> endOfStream() {
        Throwable cause = failure;
        if (cause != null && !closed) {
            throw new IllegalStateException("Response stream failed: " + cause.getMessage(), cause);
        }
        return Optional.empty();
    }
}
