package com.phoenixchannels.client;

/**
 * Lifecycle of the socket actor's connection.
 */
public enum ConnectionState {
    /** Started, never asked to connect. */
    IDLE,
    /** Opening a transport connection. */
    CONNECTING,
    /** A connection, its receive worker and its heartbeat are live. */
    CONNECTED,
    /** The last connect failed or the peer closed; waiting for an explicit reconnect. */
    DISCONNECTED,
    /** The actor has stopped. */
    TERMINATED
}
