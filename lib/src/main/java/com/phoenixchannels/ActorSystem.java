package com.phoenixchannels;

import com.phoenixchannels.builder.ActorBuilder;
import com.phoenixchannels.config.MailboxConfig;
import com.phoenixchannels.config.ThreadPoolFactory;
import com.phoenixchannels.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of running actors plus the shared scheduler used for delayed messages and ask
 * timeouts.
 *
 * <p>An ask does not need a temporary actor: the reply address is the key of a pending
 * future, registered before the request is enqueued.
 */
public class ActorSystem {

    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    /**
     * A request that expects an answer at {@code replyTo}.
     */
    record Ask<M>(M message, String replyTo) {
    }

    private final ThreadPoolFactory threads;
    private final MailboxConfig mailboxConfig;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Actor<?>> actors = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Object>> pendingAsks = new ConcurrentHashMap<>();
    private final Set<ScheduledFuture<?>> delayed = ConcurrentHashMap.newKeySet();

    private volatile boolean shutdown;

    public ActorSystem() {
        this(new ThreadPoolFactory(), new MailboxConfig());
    }

    public ActorSystem(ThreadPoolFactory threads) {
        this(threads, new MailboxConfig());
    }

    public ActorSystem(ThreadPoolFactory threads, MailboxConfig mailboxConfig) {
        this.threads = threads != null ? threads : new ThreadPoolFactory();
        this.mailboxConfig = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        this.scheduler = this.threads.newScheduler("actor-system");
    }

    public <Message> ActorBuilder<Message> actorOf(Handler<Message> handler) {
        return new ActorBuilder<>(this, handler);
    }

    /**
     * Creates, registers and starts an actor. Called by {@link ActorBuilder#spawn()}.
     *
     * @throws IllegalStateException if the system is shut down or {@code actorId} is taken
     */
    public <Message> Pid spawn(String actorId,
                               Handler<Message> handler,
                               SupervisionStrategy strategy,
                               MailboxConfig mailbox,
                               ThreadPoolFactory threadOverride) {
        if (shutdown) {
            throw new IllegalStateException("Actor system is shut down");
        }
        Actor<Message> actor = new Actor<>(this, actorId, handler,
                strategy != null ? strategy : SupervisionStrategy.RESUME,
                mailbox != null ? mailbox : mailboxConfig,
                threadOverride != null ? threadOverride : threads);
        if (actors.putIfAbsent(actorId, actor) != null) {
            throw new IllegalStateException("Actor id already in use: " + actorId);
        }
        actor.start();
        return actor.self();
    }

    void unregister(String actorId) {
        actors.remove(actorId);
    }

    /**
     * @return the actor behind {@code pid}, or null once it has stopped
     */
    public Actor<?> getActor(Pid pid) {
        return actors.get(pid.actorId());
    }

    public Map<String, Actor<?>> getActors() {
        return Collections.unmodifiableMap(actors);
    }

    /**
     * Stops an actor. Its postStop runs on the calling thread before this returns.
     */
    public void stopActor(Pid pid) {
        Actor<?> actor = actors.get(pid.actorId());
        if (actor != null) {
            actor.stop();
        }
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threads;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public String generateActorId() {
        return UUID.randomUUID().toString();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public <T> void tell(Pid pid, T message) {
        deliver(pid.actorId(), message);
    }

    public <T> ScheduledFuture<?> tell(Pid pid, T message, long delay, TimeUnit timeUnit) {
        return deliverLater(pid.actorId(), message, delay, timeUnit);
    }

    /**
     * Sends {@code message} and returns a future for the handler's {@link ActorContext#reply}.
     * The future fails with {@link TimeoutException} when no reply comes within {@code timeout},
     * and with {@link ActorException} when the target is not running.
     */
    @SuppressWarnings("unchecked")
    public <Request, Response> CompletableFuture<Response> ask(Pid target, Request message, Duration timeout) {
        Actor<?> actor = actors.get(target.actorId());
        if (actor == null) {
            return CompletableFuture.failedFuture(new ActorException("No such actor", target.actorId()));
        }
        String replyTo = "ask-" + generateActorId();
        CompletableFuture<Object> pending = new CompletableFuture<>();
        pendingAsks.put(replyTo, pending);

        ScheduledFuture<?> expiry = scheduler.schedule(
                () -> failAsk(replyTo, new TimeoutException(
                        "No reply from " + target.actorId() + " within " + timeout.toMillis() + " ms")),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        pending.whenComplete((response, error) -> expiry.cancel(false));

        if (!actor.enqueue(new Ask<>(message, replyTo))) {
            failAsk(replyTo, new ActorException("Actor is not accepting messages", target.actorId()));
        }
        return pending.thenApply(response -> (Response) response);
    }

    /**
     * Stops every actor, fails outstanding asks and cancels delayed messages. Idempotent.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down actor system with {} actor(s)", actors.size());
        for (Actor<?> actor : new ArrayList<>(actors.values())) {
            try {
                actor.stop();
            } catch (RuntimeException e) {
                logger.warn("Actor {} failed to stop cleanly", actor.getActorId(), e);
            }
        }
        actors.clear();

        for (String replyTo : new ArrayList<>(pendingAsks.keySet())) {
            failAsk(replyTo, new IllegalStateException("Actor system shut down"));
        }
        delayed.forEach(task -> task.cancel(false));
        delayed.clear();

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(threads.getSchedulerShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Actor system shut down");
    }

    void deliver(String actorId, Object message) {
        Actor<?> actor = actors.get(actorId);
        if (actor == null) {
            logger.warn("Dropping {} for unknown actor {}", message, actorId);
        } else if (!actor.enqueue(message)) {
            logger.warn("Actor {} rejected {}", actorId, message);
        }
    }

    ScheduledFuture<?> deliverLater(String actorId, Object message, long delay, TimeUnit timeUnit) {
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        ScheduledFuture<?> task = scheduler.schedule(() -> {
            if (self[0] != null) {
                delayed.remove(self[0]);
            }
            deliver(actorId, message);
        }, delay, timeUnit);
        self[0] = task;
        delayed.add(task);
        if (task.isDone()) {
            delayed.remove(task);
        }
        return task;
    }

    void completeAsk(String replyTo, Object response) {
        CompletableFuture<Object> pending = pendingAsks.remove(replyTo);
        if (pending == null) {
            logger.debug("Reply to {} arrived after the ask expired", replyTo);
            return;
        }
        pending.complete(response);
    }

    private void failAsk(String replyTo, Throwable error) {
        CompletableFuture<Object> pending = pendingAsks.remove(replyTo);
        if (pending != null) {
            pending.completeExceptionally(error);
        }
    }
}
