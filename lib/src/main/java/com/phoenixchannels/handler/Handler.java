package com.phoenixchannels.handler;

import com.phoenixchannels.ActorContext;

/**
 * Behaviour of an actor. Every callback except {@link #postStop(ActorContext)} runs on the
 * actor's own thread, one message at a time, so a handler can keep plain mutable fields.
 *
 * @param <Message> the messages this handler accepts
 */
public interface Handler<Message> {

    void receive(Message message, ActorContext context);

    /**
     * Runs before the first message is delivered.
     */
    default void preStart(ActorContext context) {
    }

    /**
     * Runs once the actor has stopped taking messages, on the thread that stopped it.
     * Release connections and threads here.
     */
    default void postStop(ActorContext context) {
    }

    /**
     * Called when {@link #receive} throws.
     *
     * @return true if the failure was dealt with here and the supervision strategy should not apply
     */
    default boolean onError(Message message, Throwable exception, ActorContext context) {
        return false;
    }
}
