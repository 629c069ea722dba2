package com.phoenixchannels.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixchannels.transport.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonEnvelopeCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec(mapper);

    @Test
    void encodesAllFourKeys() throws Exception {
        Envelope envelope = new Envelope("room:lobby", "new_msg", codec.toPayload(Map.of("body", "hi")), 7L);

        JsonNode json = mapper.readTree(codec.encode(envelope));

        assertEquals("room:lobby", json.get("topic").asText());
        assertEquals("new_msg", json.get("event").asText());
        assertEquals("hi", json.get("payload").get("body").asText());
        assertEquals(7L, json.get("ref").asLong());
    }

    @Test
    void heartbeatHasEmptyPayloadAndNullRef() throws Exception {
        JsonNode json = mapper.readTree(codec.encode(Envelope.heartbeat()));

        assertEquals("phoenix", json.get("topic").asText());
        assertEquals("heartbeat", json.get("event").asText());
        assertTrue(json.get("payload").isObject());
        assertEquals(0, json.get("payload").size());
        assertTrue(json.get("ref").isNull());
    }

    @Test
    void decodesReplyWithNumericRef() {
        Envelope envelope = codec.decode(
                "{\"topic\":\"room:lobby\",\"event\":\"phx_reply\",\"payload\":{\"status\":\"ok\",\"response\":{}},\"ref\":3}");

        assertEquals("room:lobby", envelope.topic());
        assertEquals(PhoenixProtocol.EVENT_REPLY, envelope.event());
        assertEquals("ok", envelope.payload().get("status").asText());
        assertEquals(3L, envelope.ref());
    }

    @Test
    void decodesStringRefs() {
        Envelope envelope = codec.decode("{\"topic\":\"t\",\"event\":\"e\",\"payload\":{},\"ref\":\"12\"}");

        assertEquals(12L, envelope.ref());
    }

    @Test
    void missingOrForeignRefDecodesAsAbsent() {
        assertFalse(codec.decode("{\"topic\":\"t\",\"event\":\"e\",\"payload\":{}}").hasRef());
        assertFalse(codec.decode("{\"topic\":\"t\",\"event\":\"e\",\"payload\":{},\"ref\":null}").hasRef());
        assertFalse(codec.decode("{\"topic\":\"t\",\"event\":\"e\",\"payload\":{},\"ref\":\"abc\"}").hasRef());
    }

    @Test
    void missingPayloadBecomesEmptyObject() {
        Envelope envelope = codec.decode("{\"topic\":\"t\",\"event\":\"e\"}");

        assertTrue(envelope.payload().isObject());
        assertEquals(0, envelope.payload().size());
    }

    @Test
    void rejectsMalformedFrames() {
        assertThrows(ProtocolException.class, () -> codec.decode("not json"));
        assertThrows(ProtocolException.class, () -> codec.decode("[1,2,3]"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"event\":\"e\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"topic\":\"t\"}"));
    }

    @Test
    void toPayloadConvertsValues() {
        assertTrue(codec.toPayload(null).isObject());
        JsonNode node = mapper.createObjectNode().put("a", 1);
        assertSame(node, codec.toPayload(node));
        assertEquals(2, codec.toPayload(Map.of("b", 2)).get("b").asInt());
    }
}
