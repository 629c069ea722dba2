package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a subscription owner finds in its inbox.
 */
public sealed interface ChannelMessage permits ChannelMessage.Event, ChannelMessage.Closed, ChannelMessage.Failure {

    /**
     * An envelope routed to the owner, reduced to its event and payload.
     */
    record Event(String event, JsonNode payload) implements ChannelMessage {}

    /**
     * The connection closed. Sent to every owner registered at the time.
     */
    record Closed(int code, String reason) implements ChannelMessage {}

    /**
     * The receive side failed, typically an undecodable frame. The connection stays up.
     */
    record Failure(Throwable cause) implements ChannelMessage {}
}
