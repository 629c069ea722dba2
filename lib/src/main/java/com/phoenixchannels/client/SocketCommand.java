package com.phoenixchannels.client;

import com.phoenixchannels.codec.Envelope;

/**
 * Protocol of the socket actor.
 *
 * <p>{@link Connect}, {@link Reconnect}, {@link NextReference}, {@link CurrentConnection} and
 * {@link GetStatus} are asked and answered. {@link Subscribe} and {@link Unsubscribe} are told.
 * The remaining commands come from the receive worker and the heartbeat timer and carry the
 * epoch of the connection they belong to.
 */
public sealed interface SocketCommand {

    /** Replies {@code Result<Long>} holding the new epoch, or a {@link SocketConnectException}. */
    record Connect(SocketConfig config) implements SocketCommand {}

    /** Same reply as {@link Connect}, using the stored configuration. */
    record Reconnect() implements SocketCommand {}

    /** Replies the next reference as a {@code Long}. */
    record NextReference() implements SocketCommand {}

    /** Replies {@code Optional<TransportConnection>}. */
    record CurrentConnection() implements SocketCommand {}

    /** Replies a {@link SocketStatus}. */
    record GetStatus() implements SocketCommand {}

    record Subscribe(Subscription subscription) implements SocketCommand {}

    record Unsubscribe(String key) implements SocketCommand {}

    record Inbound(long epoch, Envelope envelope) implements SocketCommand {}

    record InboundError(long epoch, Throwable error) implements SocketCommand {}

    record InboundClosed(long epoch, int code, String reason) implements SocketCommand {}

    record Heartbeat(long epoch) implements SocketCommand {}
}
