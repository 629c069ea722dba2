package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phoenixchannels.transport.ConnectionClosedException;
import com.phoenixchannels.transport.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ChannelMessage reply(String status) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("status", status);
        payload.set("response", mapper.createObjectNode().put("id", 1));
        return new ChannelMessage.Event("phx_reply", payload);
    }

    @Test
    void okReply() {
        ChannelResult result = ChannelResult.fromReply(reply("ok"));

        ChannelResult.Ok ok = assertInstanceOf(ChannelResult.Ok.class, result);
        assertEquals(1, ok.response().get("id").asInt());
        assertTrue(result.isOk());
    }

    @Test
    void errorReply() {
        ChannelResult result = ChannelResult.fromReply(reply("error"));

        assertInstanceOf(ChannelResult.Error.class, result);
        assertFalse(result.isOk());
    }

    @Test
    void unknownShapeIsAProtocolFailure() {
        ChannelResult result = ChannelResult.fromReply(reply("maybe"));
        ChannelResult missing = ChannelResult.fromReply(new ChannelMessage.Event("phx_reply", mapper.createObjectNode()));

        assertInstanceOf(ProtocolException.class, assertInstanceOf(ChannelResult.Failed.class, result).cause());
        assertInstanceOf(ProtocolException.class, assertInstanceOf(ChannelResult.Failed.class, missing).cause());
    }

    @Test
    void notificationsBecomeFailures() {
        ChannelResult closed = ChannelResult.fromReply(new ChannelMessage.Closed(1006, "gone"));
        IllegalStateException cause = new IllegalStateException("bad frame");
        ChannelResult failure = ChannelResult.fromReply(new ChannelMessage.Failure(cause));

        ConnectionClosedException e = assertInstanceOf(ConnectionClosedException.class,
                assertInstanceOf(ChannelResult.Failed.class, closed).cause());
        assertEquals(1006, e.getCode());
        assertSame(cause, assertInstanceOf(ChannelResult.Failed.class, failure).cause());
    }
}
