package com.phoenixchannels.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded mailbox over a JCTools multi-producer single-consumer queue.
 *
 * <p>Backs the socket actor: callers, the receive worker and the heartbeat timer enqueue from
 * their own threads while one actor thread drains. Producers only touch the lock when the
 * consumer has announced that it is parked.
 *
 * @param <T> message type
 */
public class MpscMailbox<T> implements Mailbox<T> {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition arrived = lock.newCondition();
    private volatile boolean parked = false;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize growth step of the backing array; rounded up to a power of two, at least 2
     */
    public MpscMailbox(int chunkSize) {
        int size = 2;
        while (size < chunkSize) {
            size <<= 1;
        }
        this.queue = new MpscUnboundedArrayQueue<>(size);
    }

    @Override
    public boolean offer(T message) {
        queue.offer(Objects.requireNonNull(message, "message"));
        if (parked) {
            lock.lock();
            try {
                arrived.signal();
            } finally {
                lock.unlock();
            }
        }
        return true;
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T head = queue.poll();
        if (head != null || timeout <= 0) {
            return head;
        }
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            // announce before polling again: a producer that misses the flag has already enqueued
            parked = true;
            while ((head = queue.poll()) == null && remaining > 0) {
                remaining = arrived.awaitNanos(remaining);
            }
            return head;
        } finally {
            parked = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> target, int maxElements) {
        Objects.requireNonNull(target, "target");
        int moved = 0;
        T next;
        while (moved < maxElements && (next = queue.poll()) != null) {
            target.add(next);
            moved++;
        }
        return moved;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }
}
