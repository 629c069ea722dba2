package com.phoenixchannels;

/**
 * What happens to an actor after its handler throws.
 */
public enum SupervisionStrategy {
    /** Log and go on with the next message; handler state is untouched. */
    RESUME,
    /** Stop the actor and drop whatever is still queued. */
    STOP
}
