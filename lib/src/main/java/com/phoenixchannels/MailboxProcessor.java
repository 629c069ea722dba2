package com.phoenixchannels;

import com.phoenixchannels.config.ThreadPoolFactory;
import com.phoenixchannels.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * The single thread behind an actor. It waits on the mailbox, drains up to a batch of
 * messages at a time and hands them to {@link Lifecycle#receive(Object)} in arrival order.
 *
 * @param <T> mailbox element type
 */
final class MailboxProcessor<T> {

    /**
     * Callbacks driven by the processor.
     */
    interface Lifecycle<T> {
        void preStart();

        void receive(T message) throws Exception;

        void postStop();
    }

    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private static final long IDLE_WAIT_MS = 100;
    private static final long STARTUP_WAIT_SECONDS = 5;

    private final String actorId;
    private final Mailbox<T> mailbox;
    private final Lifecycle<T> lifecycle;
    private final BiConsumer<T, Throwable> onFailure;
    private final ThreadPoolFactory threads;
    private final int batchSize;

    private volatile boolean running;
    private volatile Thread loopThread;

    MailboxProcessor(String actorId,
                     Mailbox<T> mailbox,
                     Lifecycle<T> lifecycle,
                     BiConsumer<T, Throwable> onFailure,
                     ThreadPoolFactory threads) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.lifecycle = lifecycle;
        this.onFailure = onFailure;
        this.threads = threads;
        this.batchSize = Math.max(1, threads.getActorBatchSize());
    }

    /**
     * Runs preStart, then starts the loop and waits until it is polling.
     */
    void start() {
        if (running) {
            return;
        }
        running = true;
        lifecycle.preStart();
        CountDownLatch polling = new CountDownLatch(1);
        loopThread = threads.newThread("actor-" + actorId, () -> {
            polling.countDown();
            loop();
        });
        loopThread.start();
        try {
            if (!polling.await(STARTUP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Actor {} loop not polling after {} s", actorId, STARTUP_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Actor {} started", actorId);
    }

    /**
     * Ends the loop, drops queued messages and runs postStop on the calling thread. When the
     * loop thread stops itself it is not joined.
     */
    void stop() {
        if (!running) {
            return;
        }
        running = false;
        mailbox.clear();
        Thread loop = loopThread;
        loopThread = null;
        if (loop != null && loop != Thread.currentThread()) {
            loop.interrupt();
            long waitMs = TimeUnit.SECONDS.toMillis(threads.getActorShutdownTimeoutSeconds());
            try {
                loop.join(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loop.isAlive()) {
                logger.warn("Actor {} loop still alive {} ms after stop", actorId, waitMs);
            }
        }
        lifecycle.postStop();
        logger.debug("Actor {} stopped", actorId);
    }

    boolean enqueue(T message) {
        return running && mailbox.offer(message);
    }

    boolean isRunning() {
        return running;
    }

    private void loop() {
        List<T> batch = new ArrayList<>(batchSize);
        while (running) {
            T head;
            try {
                head = mailbox.poll(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (running) {
                    // interrupt leaked from a handler
                    continue;
                }
                Thread.currentThread().interrupt();
                return;
            }
            if (head == null) {
                continue;
            }
            batch.add(head);
            mailbox.drainTo(batch, batchSize - 1);
            for (int i = 0; i < batch.size() && running; i++) {
                T message = batch.get(i);
                try {
                    lifecycle.receive(message);
                } catch (Throwable failure) {
                    logger.error("Actor {} failed on {}", actorId, message, failure);
                    onFailure.accept(message, failure);
                }
            }
            batch.clear();
        }
    }
}
