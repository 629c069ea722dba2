package com.phoenixchannels.transport;

/**
 * Failure to open a connection, or to send or receive on an established one.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
