package com.phoenixchannels.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phoenixchannels.transport.ProtocolException;

/**
 * JSON codec for the v1 Phoenix serializer: a single object with the keys
 * {@code topic}, {@code event}, {@code payload} and {@code ref}.
 */
public class JacksonEnvelopeCodec implements EnvelopeCodec {

    private static final String TOPIC = "topic";
    private static final String EVENT = "event";
    private static final String PAYLOAD = "payload";
    private static final String REF = "ref";

    private final ObjectMapper mapper;

    public JacksonEnvelopeCodec() {
        this(new ObjectMapper());
    }

    public JacksonEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String encode(Envelope envelope) {
        ObjectNode node = mapper.createObjectNode();
        node.put(TOPIC, envelope.topic());
        node.put(EVENT, envelope.event());
        node.set(PAYLOAD, envelope.payload());
        if (envelope.ref() != null) {
            node.put(REF, envelope.ref());
        } else {
            node.putNull(REF);
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode envelope for topic " + envelope.topic(), e);
        }
    }

    @Override
    public Envelope decode(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        JsonNode topic = root.get(TOPIC);
        JsonNode event = root.get(EVENT);
        if (topic == null || !topic.isTextual()) {
            throw new ProtocolException("Frame has no topic");
        }
        if (event == null || !event.isTextual()) {
            throw new ProtocolException("Frame has no event");
        }
        JsonNode payload = root.get(PAYLOAD);
        if (payload == null || payload.isNull()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
        return new Envelope(topic.asText(), event.asText(), payload, parseRef(root.get(REF)));
    }

    @Override
    public JsonNode toPayload(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(value);
    }

    private static Long parseRef(JsonNode ref) {
        if (ref == null || ref.isNull()) {
            return null;
        }
        if (ref.isIntegralNumber() && ref.canConvertToLong()) {
            return ref.asLong();
        }
        if (ref.isTextual()) {
            try {
                return Long.parseLong(ref.asText().trim());
            } catch (NumberFormatException e) {
                // refs this client did not issue cannot be correlated
                return null;
            }
        }
        return null;
    }
}
