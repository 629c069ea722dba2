package com.phoenixchannels;

import org.slf4j.Logger;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * What a {@link com.phoenixchannels.handler.Handler} may do with the actor running it.
 */
public interface ActorContext {

    Pid self();

    String getActorId();

    /**
     * Schedules a message to this actor.
     *
     * @return a handle that cancels the delivery if it has not happened yet
     */
    <T> ScheduledFuture<?> tellSelf(T message, long delay, TimeUnit timeUnit);

    /**
     * Answers the ask that delivered the current message. Messages that were told rather than
     * asked have nobody to answer; the response is then dropped with a debug log.
     */
    <T> void reply(T response);

    ActorSystem getSystem();

    void stop();

    /**
     * @return a logger named after the handler class and the actor id
     */
    Logger getLogger();
}
