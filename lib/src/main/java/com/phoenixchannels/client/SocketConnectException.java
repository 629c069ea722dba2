package com.phoenixchannels.client;

/**
 * {@code connect} or {@code reconnect} could not establish a connection.
 */
public class SocketConnectException extends RuntimeException {

    public SocketConnectException(String message) {
        super(message);
    }

    public SocketConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
