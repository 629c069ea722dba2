package com.phoenixchannels.transport;

import java.net.URI;
import java.time.Duration;

/**
 * Opens message-stream connections.
 */
public interface Transport {

    /**
     * Opens a connection and completes the handshake.
     *
     * @param uri the endpoint, including query parameters
     * @param connectTimeout upper bound for connecting and handshaking
     * @return the open connection
     * @throws TransportException if the connection cannot be established
     */
    TransportConnection open(URI uri, Duration connectTimeout);
}
