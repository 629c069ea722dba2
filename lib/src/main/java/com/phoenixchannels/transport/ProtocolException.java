package com.phoenixchannels.transport;

/**
 * An inbound frame could not be decoded into an envelope.
 */
public class ProtocolException extends TransportException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
