package com.flagship.marketplace.messaging;

import org.springframework.data.domain.PageRequest;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, oldest-first view of a transaction's messages.
 *
 * Nothing is read until iteration starts. Each call to {@link #iterator()}
 * starts over from the first message and stops at the newest message that
 * existed when that iteration began, so a listing always terminates even
 * while new messages are being posted. Pages are fetched by sequence number.
 */
public class MessageHistory implements Iterable<Message> {

    private final MessageRepository repository;
    private final UUID transactionId;
    private final int pageSize;

    MessageHistory(MessageRepository repository, UUID transactionId, int pageSize) {
        this.repository = repository;
        this.transactionId = transactionId;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<Message> iterator() {
        long upTo = repository.findMaxSequence(transactionId).orElse(0L);
        return new PagingIterator(upTo);
    }

    public Stream<Message> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private class PagingIterator implements Iterator<Message> {

        private final long upTo;
        private final Deque<Message> buffer = new ArrayDeque<>();
        private long cursor;
        private boolean exhausted;

        PagingIterator(long upTo) {
            this.upTo = upTo;
            this.exhausted = upTo == 0L;
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                fetchNextPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public Message next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fetchNextPage() {
            var page = repository.findPage(transactionId, cursor, upTo, PageRequest.of(0, pageSize));
            for (MessageEntity entity : page) {
                buffer.add(entity.toDomain());
                cursor = entity.getSequenceNumber();
            }
            if (page.size() < pageSize || cursor >= upTo) {
                exhausted = true;
            }
        }
    }
}
