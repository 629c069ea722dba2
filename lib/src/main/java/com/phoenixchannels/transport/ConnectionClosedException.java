package com.phoenixchannels.transport;

/**
 * The connection was closed, by the peer or because the underlying channel was lost.
 */
public class ConnectionClosedException extends TransportException {

    private final int code;
    private final String reason;

    public ConnectionClosedException(int code, String reason) {
        super("Connection closed (" + code + (reason == null || reason.isEmpty() ? "" : ": " + reason) + ")");
        this.code = code;
        this.reason = reason;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }
}
