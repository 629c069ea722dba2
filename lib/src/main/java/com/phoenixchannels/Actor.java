package com.phoenixchannels;

import com.phoenixchannels.config.MailboxConfig;
import com.phoenixchannels.config.ThreadPoolFactory;
import com.phoenixchannels.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A running handler: a mailbox, the thread that drains it and the context handed to every
 * callback. Created through {@link ActorSystem#actorOf(Handler)}.
 *
 * @param <Message> what the handler accepts
 */
public final class Actor<Message> {

    private final ActorSystem system;
    private final String actorId;
    private final Pid pid;
    private final Handler<Message> handler;
    private final SupervisionStrategy supervisionStrategy;
    private final Context context;
    private final MailboxProcessor<Object> processor;

    // reply address of the ask being handled; only read on the loop thread
    private String replyTo;

    Actor(ActorSystem system,
          String actorId,
          Handler<Message> handler,
          SupervisionStrategy supervisionStrategy,
          MailboxConfig mailboxConfig,
          ThreadPoolFactory threads) {
        this.system = system;
        this.actorId = actorId;
        this.pid = new Pid(actorId, system);
        this.handler = handler;
        this.supervisionStrategy = supervisionStrategy;
        this.context = new Context(LoggerFactory.getLogger(handler.getClass().getName() + "." + actorId));
        this.processor = new MailboxProcessor<Object>(actorId, mailboxConfig.createMailbox(),
                new MailboxProcessor.Lifecycle<Object>() {
                    @Override
                    public void preStart() {
                        handler.preStart(context);
                    }

                    @Override
                    public void receive(Object envelope) {
                        dispatch(envelope);
                    }

                    @Override
                    public void postStop() {
                        handler.postStop(context);
                    }
                },
                (envelope, failure) -> Supervisor.supervise(this, unwrap(envelope), failure),
                threads);
    }

    public String getActorId() {
        return actorId;
    }

    public Pid self() {
        return pid;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    public boolean isRunning() {
        return processor.isRunning();
    }

    /**
     * Stops the loop, runs postStop and unregisters the actor. Safe to call more than once.
     */
    public void stop() {
        if (!processor.isRunning()) {
            return;
        }
        processor.stop();
        system.unregister(actorId);
    }

    void start() {
        processor.start();
    }

    /**
     * @param envelope a message or an {@link ActorSystem.Ask} carrying one
     */
    boolean enqueue(Object envelope) {
        return processor.enqueue(envelope);
    }

    boolean handlerRecovered(Message message, Throwable failure) {
        return handler.onError(message, failure, context);
    }

    private void dispatch(Object envelope) {
        replyTo = envelope instanceof ActorSystem.Ask<?> ask ? ask.replyTo() : null;
        try {
            handler.receive(unwrap(envelope), context);
        } finally {
            replyTo = null;
        }
    }

    @SuppressWarnings("unchecked")
    private Message unwrap(Object envelope) {
        Object message = envelope instanceof ActorSystem.Ask<?> ask ? ask.message() : envelope;
        return (Message) message;
    }

    private final class Context implements ActorContext {

        private final Logger logger;

        private Context(Logger logger) {
            this.logger = logger;
        }

        @Override
        public Pid self() {
            return pid;
        }

        @Override
        public String getActorId() {
            return actorId;
        }

        @Override
        public <T> ScheduledFuture<?> tellSelf(T message, long delay, TimeUnit timeUnit) {
            return pid.tell(message, delay, timeUnit);
        }

        @Override
        public <T> void reply(T response) {
            if (replyTo == null) {
                logger.debug("No ask to answer, dropping reply {}", response);
                return;
            }
            system.completeAsk(replyTo, response);
        }

        @Override
        public ActorSystem getSystem() {
            return system;
        }

        @Override
        public void stop() {
            Actor.this.stop();
        }

        @Override
        public Logger getLogger() {
            return logger;
        }
    }
}
