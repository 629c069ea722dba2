package com.phoenixchannels.builder;

import com.phoenixchannels.ActorSystem;
import com.phoenixchannels.Pid;
import com.phoenixchannels.SupervisionStrategy;
import com.phoenixchannels.config.MailboxConfig;
import com.phoenixchannels.config.ThreadPoolFactory;
import com.phoenixchannels.handler.Handler;

/**
 * Fluent setup for an actor. Anything left unset falls back to the system's defaults.
 *
 * <pre>{@code
 * Pid pid = system.actorOf(handler)
 *         .withId("socket")
 *         .withSupervisionStrategy(SupervisionStrategy.RESUME)
 *         .spawn();
 * }</pre>
 */
public class ActorBuilder<Message> {

    private final ActorSystem system;
    private final Handler<Message> handler;
    private String id;
    private SupervisionStrategy supervisionStrategy;
    private MailboxConfig mailboxConfig;
    private ThreadPoolFactory threadPoolFactory;

    public ActorBuilder(ActorSystem system, Handler<Message> handler) {
        this.system = system;
        this.handler = handler;
    }

    public ActorBuilder<Message> withId(String id) {
        this.id = id;
        return this;
    }

    public ActorBuilder<Message> withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = supervisionStrategy;
        return this;
    }

    public ActorBuilder<Message> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    public ActorBuilder<Message> withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    /**
     * @throws IllegalStateException if the id is already taken or the system is shut down
     */
    public Pid spawn() {
        return system.spawn(id != null ? id : system.generateActorId(),
                handler, supervisionStrategy, mailboxConfig, threadPoolFactory);
    }
}
