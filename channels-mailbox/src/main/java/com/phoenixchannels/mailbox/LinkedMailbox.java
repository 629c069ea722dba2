package com.phoenixchannels.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link Mailbox} over a {@link LinkedBlockingQueue}. Used for subscription inboxes, where a
 * bound keeps a consumer that stopped reading from growing the heap without limit.
 *
 * @param <T> message type
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final BlockingQueue<T> queue;

    /** Unbounded. */
    public LinkedMailbox() {
        this.queue = new LinkedBlockingQueue<>();
    }

    /**
     * @param capacity maximum number of queued messages
     */
    public LinkedMailbox(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(T message) {
        return queue.offer(Objects.requireNonNull(message, "message"));
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public int drainTo(Collection<? super T> target, int maxElements) {
        return queue.drainTo(target, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    /**
     * @return how many more messages fit before {@link #offer(Object)} starts refusing
     */
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }
}
