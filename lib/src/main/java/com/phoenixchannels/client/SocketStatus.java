package com.phoenixchannels.client;

import java.util.Set;

/**
 * Point-in-time view of the socket actor's state.
 *
 * @param state              connection state
 * @param epoch              number of successful connects so far
 * @param nextReference      the reference the next push will get
 * @param subscriptionKeys   keys currently in the registry
 * @param heartbeatScheduled whether a heartbeat timer is pending
 * @param workerRunning      whether the current receive worker thread is alive
 */
public record SocketStatus(
        ConnectionState state,
        long epoch,
        long nextReference,
        Set<String> subscriptionKeys,
        boolean heartbeatScheduled,
        boolean workerRunning) {

    public SocketStatus {
        subscriptionKeys = Set.copyOf(subscriptionKeys);
    }

    public boolean hasSubscription(String key) {
        return subscriptionKeys.contains(key);
    }
}
