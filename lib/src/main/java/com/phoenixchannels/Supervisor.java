package com.phoenixchannels;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the fate of an actor whose handler threw.
 */
final class Supervisor {

    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private Supervisor() {
    }

    /**
     * Gives the handler the first say through {@code onError}; if it declines, applies the
     * actor's strategy.
     */
    static <M> void supervise(Actor<M> actor, M message, Throwable failure) {
        if (actor.handlerRecovered(message, failure)) {
            logger.debug("Actor {} handler recovered from failure on {}", actor.getActorId(), message);
            return;
        }
        if (actor.getSupervisionStrategy() == SupervisionStrategy.STOP) {
            logger.info("Actor {} stopping after failure on {}", actor.getActorId(), message);
            actor.stop();
        } else {
            logger.debug("Actor {} resuming after failure on {}", actor.getActorId(), message);
        }
    }
}
