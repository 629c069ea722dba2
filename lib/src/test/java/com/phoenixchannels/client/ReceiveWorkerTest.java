package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.phoenixchannels.ActorContext;
import com.phoenixchannels.ActorSystem;
import com.phoenixchannels.AsyncAssertion;
import com.phoenixchannels.Pid;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.JacksonEnvelopeCodec;
import com.phoenixchannels.handler.Handler;
import com.phoenixchannels.mocks.ScriptedTransport;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.ProtocolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ReceiveWorkerTest {

    private ActorSystem system;
    private ScriptedTransport.ScriptedConnection connection;
    private final BlockingQueue<SocketCommand> forwarded = new LinkedBlockingQueue<>();
    private ReceiveWorker worker;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
        Pid sink = system.actorOf(new Handler<SocketCommand>() {
            @Override
            public void receive(SocketCommand message, ActorContext context) {
                forwarded.add(message);
            }
        }).spawn();
        connection = (ScriptedTransport.ScriptedConnection) new ScriptedTransport()
                .open(URI.create("ws://test/"), Duration.ofSeconds(1));
        worker = new ReceiveWorker("recv-test", 3, connection, new JacksonEnvelopeCodec(), sink,
                system.getThreadPoolFactory());
        worker.start();
    }

    @AfterEach
    void tearDown() {
        worker.stop();
        worker.join(Duration.ofSeconds(1));
        system.shutdown();
    }

    private SocketCommand next() throws InterruptedException {
        SocketCommand command = forwarded.poll(2, TimeUnit.SECONDS);
        assertNotNull(command, "worker forwarded nothing");
        return command;
    }

    @Test
    void textFramesAreDecodedAndTaggedWithTheEpoch() throws Exception {
        connection.inject(new Envelope("room:1", "new_msg", JsonNodeFactory.instance.objectNode(), null));

        SocketCommand.Inbound inbound = assertInstanceOf(SocketCommand.Inbound.class, next());
        assertEquals(3, inbound.epoch());
        assertEquals("room:1", inbound.envelope().topic());
        assertEquals("new_msg", inbound.envelope().event());
    }

    @Test
    void pingIsAnsweredWithPongCarryingTheSameData() {
        connection.inject(new Frame.Ping(new byte[]{1, 2, 3}));

        AsyncAssertion.eventually(() -> connection.sentFrames().contains(new Frame.Pong(new byte[]{1, 2, 3})),
                Duration.ofSeconds(2));
        assertTrue(forwarded.isEmpty());
    }

    @Test
    void pongIsIgnored() throws Exception {
        connection.inject(new Frame.Pong(new byte[0]));
        connection.inject(new Frame.Text("{\"topic\":\"t\",\"event\":\"after\"}"));

        SocketCommand.Inbound inbound = assertInstanceOf(SocketCommand.Inbound.class, next());
        assertEquals("after", inbound.envelope().event());
        assertTrue(connection.sentFrames().isEmpty());
    }

    @Test
    void undecodableFrameIsReportedAndTheLoopContinues() throws Exception {
        connection.inject(new Frame.Text("garbage"));
        connection.inject(new Frame.Text("{\"topic\":\"t\",\"event\":\"ok\"}"));

        SocketCommand.InboundError error = assertInstanceOf(SocketCommand.InboundError.class, next());
        assertEquals(3, error.epoch());
        assertInstanceOf(ProtocolException.class, error.error());
        assertInstanceOf(SocketCommand.Inbound.class, next());
        assertTrue(worker.isAlive());
    }

    @Test
    void closeFrameIsForwardedAndEndsTheWorker() throws Exception {
        connection.closeFromServer(4000, "kicked");

        SocketCommand.InboundClosed closed = assertInstanceOf(SocketCommand.InboundClosed.class, next());
        assertEquals(3, closed.epoch());
        assertEquals(4000, closed.code());
        assertEquals("kicked", closed.reason());
        assertTrue(worker.join(Duration.ofSeconds(2)));
    }

    @Test
    void stopEndsTheWorkerWithoutForwarding() {
        worker.stop();
        connection.abort();

        assertTrue(worker.join(Duration.ofSeconds(2)));
        assertTrue(forwarded.isEmpty());
    }
}
