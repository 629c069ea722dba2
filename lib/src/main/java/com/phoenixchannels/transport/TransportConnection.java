package com.phoenixchannels.transport;

/**
 * One open message-stream connection. Frames are delivered in order.
 *
 * <p>{@link #send} may be called from any thread. {@link #receive} is meant for a single reader.
 */
public interface TransportConnection {

    /**
     * Sends one frame.
     *
     * @param frame the frame to send
     * @throws TransportException if the connection is closed or the write fails
     */
    void send(Frame frame);

    /**
     * Blocks until the next frame arrives. A lost connection is reported once as a
     * {@link Frame.Close} with code {@link Frame#ABNORMAL_CLOSURE}.
     *
     * @return the next frame
     * @throws TransportException if the connection has been aborted or the read fails
     * @throws InterruptedException if the reading thread is interrupted
     */
    Frame receive() throws InterruptedException;

    /**
     * Starts an orderly close. Never throws.
     */
    void close();

    /**
     * Drops the connection immediately and makes any pending {@link #receive} fail. Never throws.
     */
    void abort();

    boolean isOpen();
}
