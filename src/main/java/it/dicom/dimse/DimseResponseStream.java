package it.dicom.dimse;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Pull-based sequence of responses to one request. Consumers call {@link #next()} until it returns empty;
 * {@link #close()} stops production early and is how cancellation and abort reach a producer.
 */
public interface DimseResponseStream extends AutoCloseable {

    /**
     * Blocks until the next response is available. Returns empty once the stream is exhausted or closed.
     */
    Optional<DimseResponse> next() throws InterruptedException;

    boolean isClosed();

    @Override
    void close();

    default List<DimseResponse> toList() throws InterruptedException {
        List<DimseResponse> responses = new ArrayList<>();
        Optional<DimseResponse> next;
        while ((next = next()).isPresent()) {
            responses.add(next.get());
        }
        return responses;
    }

    static DimseResponseStream of(DimseResponse... responses) {
        return fromIterator(List.of(responses).iterator());
    }

    static DimseResponseStream of(List<DimseResponse> responses) {
        return fromIterator(List.copyOf(responses).iterator());
    }

    /**
     * Wraps a lazy iterator. Each pull advances it by one element, so producers only do work on demand.
     */
    static DimseResponseStream fromIterator(Iterator<DimseResponse> iterator) {
        return new IteratorResponseStream(iterator);
    }

    final class IteratorResponseStream implements DimseResponseStream {

        private final Iterator<DimseResponse> iterator;
        private volatile boolean closed;

        private IteratorResponseStream(Iterator<DimseResponse> iterator) {
            this.iterator = iterator;
        }

        @Override
        public Optional<DimseResponse> next() {
            if (closed || !iterator.hasNext()) {
                return Optional.empty();
            }
            return Optional.of(iterator.next());
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
