package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.phoenixchannels.codec.PhoenixProtocol;
import com.phoenixchannels.transport.ConnectionClosedException;
import com.phoenixchannels.transport.ProtocolException;

/**
 * Outcome of a request/reply exchange on a channel.
 */
public sealed interface ChannelResult
        permits ChannelResult.Ok, ChannelResult.Error, ChannelResult.Timeout, ChannelResult.Failed {

    /** The server replied with status {@code ok}. */
    record Ok(JsonNode response) implements ChannelResult {}

    /** The server replied with status {@code error}. */
    record Error(JsonNode response) implements ChannelResult {}

    /** No reply arrived in time. */
    record Timeout() implements ChannelResult {}

    /** The push could not be sent, or the connection failed while waiting. */
    record Failed(Throwable cause) implements ChannelResult {}

    default boolean isOk() {
        return this instanceof Ok;
    }

    static ChannelResult timeout() {
        return new Timeout();
    }

    /**
     * Interprets whatever arrived in a reply inbox.
     *
     * @param message the delivered message
     * @return the matching result
     */
    static ChannelResult fromReply(ChannelMessage message) {
        if (message instanceof ChannelMessage.Closed closed) {
            return new Failed(new ConnectionClosedException(closed.code(), closed.reason()));
        }
        if (message instanceof ChannelMessage.Failure failure) {
            return new Failed(failure.cause());
        }
        JsonNode payload = ((ChannelMessage.Event) message).payload();
        JsonNode status = payload.get(PhoenixProtocol.REPLY_STATUS);
        JsonNode response = payload.get(PhoenixProtocol.REPLY_RESPONSE);
        if (status != null && status.isTextual() && response != null) {
            if (PhoenixProtocol.STATUS_OK.equals(status.asText())) {
                return new Ok(response);
            }
            if (PhoenixProtocol.STATUS_ERROR.equals(status.asText())) {
                return new Error(response);
            }
        }
        return new Failed(new ProtocolException("Unrecognised reply payload: " + payload));
    }
}
