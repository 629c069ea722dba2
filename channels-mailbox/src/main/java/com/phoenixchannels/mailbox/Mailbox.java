package com.phoenixchannels.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Queue of messages for one consumer.
 *
 * <p>Two kinds of consumer use it: an actor thread draining its commands in batches, and a
 * caller blocked on a subscription inbox waiting for a reply or a channel event. Producers
 * never block: {@link #offer(Object)} either accepts the message at once or reports that the
 * mailbox is full.
 *
 * @param <T> message type; nulls are rejected
 */
public interface Mailbox<T> {

    /**
     * Enqueues without blocking.
     *
     * @return false if a bounded mailbox is full
     * @throws NullPointerException if {@code message} is null
     */
    boolean offer(T message);

    /**
     * @return the head of the mailbox, or null if it is empty
     */
    T poll();

    /**
     * Waits up to the timeout for a message.
     *
     * @return the head of the mailbox, or null if nothing arrived in time
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Moves up to {@code maxElements} queued messages into {@code target} without waiting.
     *
     * @return the number moved
     */
    int drainTo(Collection<? super T> target, int maxElements);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Discards every queued message.
     */
    void clear();
}
