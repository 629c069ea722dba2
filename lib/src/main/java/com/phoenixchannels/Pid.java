package com.phoenixchannels;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Address of an actor. Any thread holding it may send messages; none may reach the state
 * behind it.
 */
public record Pid(String actorId, ActorSystem system) {

    public <Message> void tell(Message message) {
        system.deliver(actorId, message);
    }

    /**
     * Sends after a delay.
     *
     * @return a handle that cancels the delivery if it has not happened yet
     */
    public <Message> ScheduledFuture<?> tell(Message message, long delay, TimeUnit timeUnit) {
        return system.deliverLater(actorId, message, delay, timeUnit);
    }

    @Override
    public String toString() {
        return actorId + "@local";
    }
}
