package com.phoenixchannels;

/**
 * The runtime could not deliver a message or collect a reply, typically because the target
 * actor has already stopped.
 */
public class ActorException extends RuntimeException {

    private final String actorId;

    public ActorException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ActorException(String message, String actorId) {
        this(message, null, actorId);
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the actor involved, or null when the failure is not tied to one
     */
    public String getActorId() {
        return actorId;
    }
}
