package com.phoenixchannels.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * One protocol message. {@code ref} is null for broadcasts and heartbeats and set for
 * messages that take part in a request/reply exchange.
 */
public record Envelope(String topic, String event, JsonNode payload, Long ref) {

    public Envelope {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(event, "event");
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Creates an envelope without a reference.
     */
    public static Envelope broadcast(String topic, String event, JsonNode payload) {
        return new Envelope(topic, event, payload, null);
    }

    /**
     * The heartbeat message: topic {@code phoenix}, event {@code heartbeat}, empty payload.
     */
    public static Envelope heartbeat() {
        return broadcast(PhoenixProtocol.HEARTBEAT_TOPIC, PhoenixProtocol.EVENT_HEARTBEAT, null);
    }

    public boolean hasRef() {
        return ref != null;
    }
}
