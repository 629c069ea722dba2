package com.phoenixchannels.config;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Makes every thread the client runs: mailbox loops, receive workers and the scheduler that
 * fires heartbeats and ask timeouts. Threads are daemons unless configured otherwise.
 */
public class ThreadPoolFactory {

    private int schedulerThreads = 2;
    private int schedulerShutdownTimeoutSeconds = 5;
    private int actorShutdownTimeoutSeconds = 10;
    private int actorBatchSize = 10;
    private boolean daemon = true;

    /**
     * @return an unstarted thread named {@code name}
     */
    public Thread newThread(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(daemon);
        return thread;
    }

    public ScheduledExecutorService newScheduler(String name) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newScheduledThreadPool(schedulerThreads,
                task -> newThread(name + "-scheduler-" + sequence.incrementAndGet(), task));
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be at least 1");
        }
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public int getSchedulerShutdownTimeoutSeconds() {
        return schedulerShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setSchedulerShutdownTimeoutSeconds(int seconds) {
        this.schedulerShutdownTimeoutSeconds = seconds;
        return this;
    }

    /**
     * How long stopping an actor waits for its loop thread to exit.
     */
    public int getActorShutdownTimeoutSeconds() {
        return actorShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setActorShutdownTimeoutSeconds(int seconds) {
        this.actorShutdownTimeoutSeconds = seconds;
        return this;
    }

    /**
     * Messages handled per mailbox drain.
     */
    public int getActorBatchSize() {
        return actorBatchSize;
    }

    public ThreadPoolFactory setActorBatchSize(int actorBatchSize) {
        this.actorBatchSize = actorBatchSize;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }
}
