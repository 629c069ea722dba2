package com.phoenixchannels.mocks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.EnvelopeCodec;
import com.phoenixchannels.codec.JacksonEnvelopeCodec;
import com.phoenixchannels.codec.PhoenixProtocol;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Transport}. Connections record what the client sends, replay frames the test
 * injects, and can answer pushes automatically with a {@code phx_reply}.
 */
public class ScriptedTransport implements Transport {

    private final EnvelopeCodec codec = new JacksonEnvelopeCodec();
    private final List<URI> openedUris = new CopyOnWriteArrayList<>();
    private final List<ScriptedConnection> connections = new CopyOnWriteArrayList<>();
    private final Map<String, JsonNode> autoReplies = new ConcurrentHashMap<>();
    private final AtomicInteger failuresToInject = new AtomicInteger();

    /**
     * Makes the next {@code count} calls to {@link #open(URI, Duration)} fail.
     */
    public ScriptedTransport failNextOpens(int count) {
        failuresToInject.set(count);
        return this;
    }

    /**
     * Answers every push of {@code event} with {@code {status, response}} on the push's topic and ref.
     */
    public ScriptedTransport replyTo(String event, String status, JsonNode response) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(PhoenixProtocol.REPLY_STATUS, status);
        payload.set(PhoenixProtocol.REPLY_RESPONSE, response);
        autoReplies.put(event, payload);
        return this;
    }

    /**
     * Answers every push of {@code event} with an arbitrary reply payload.
     */
    public ScriptedTransport replyTo(String event, JsonNode payload) {
        autoReplies.put(event, payload);
        return this;
    }

    public ScriptedTransport stopReplyingTo(String event) {
        autoReplies.remove(event);
        return this;
    }

    @Override
    public TransportConnection open(URI uri, Duration connectTimeout) {
        openedUris.add(uri);
        if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransportException("connection refused: " + uri);
        }
        ScriptedConnection connection = new ScriptedConnection();
        connections.add(connection);
        return connection;
    }

    public List<URI> openedUris() {
        return new ArrayList<>(openedUris);
    }

    public List<ScriptedConnection> connections() {
        return new ArrayList<>(connections);
    }

    public ScriptedConnection lastConnection() {
        if (connections.isEmpty()) {
            throw new AssertionError("No connection has been opened");
        }
        return connections.get(connections.size() - 1);
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    /**
     * One scripted connection.
     */
    public class ScriptedConnection implements TransportConnection {

        private static final Object ABORT_SIGNAL = new Object();

        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final List<Frame> sent = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;
        private volatile boolean closed = false;
        private volatile boolean aborted = false;
        private volatile boolean failSends = false;

        @Override
        public void send(Frame frame) {
            if (!open) {
                throw new TransportException("Connection is not open");
            }
            if (failSends) {
                throw new TransportException("Scripted send failure");
            }
            sent.add(frame);
            if (frame instanceof Frame.Text text) {
                Envelope envelope = codec.decode(text.text());
                JsonNode reply = autoReplies.get(envelope.event());
                if (reply != null && envelope.hasRef()) {
                    inject(new Envelope(envelope.topic(), PhoenixProtocol.EVENT_REPLY, reply.deepCopy(), envelope.ref()));
                }
            }
        }

        @Override
        public Frame receive() throws InterruptedException {
            Object next = inbound.take();
            if (next == ABORT_SIGNAL) {
                throw new TransportException("Connection aborted");
            }
            return (Frame) next;
        }

        @Override
        public void close() {
            closed = true;
            open = false;
            inbound.offer(ABORT_SIGNAL);
        }

        @Override
        public void abort() {
            aborted = true;
            open = false;
            inbound.offer(ABORT_SIGNAL);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        public void inject(Frame frame) {
            inbound.offer(frame);
        }

        public void inject(Envelope envelope) {
            inject(new Frame.Text(codec.encode(envelope)));
        }

        /**
         * Simulates the server closing the connection.
         */
        public void closeFromServer(int code, String reason) {
            open = false;
            inject(new Frame.Close(code, reason));
        }

        public void failSends(boolean fail) {
            this.failSends = fail;
        }

        public List<Frame> sentFrames() {
            return new ArrayList<>(sent);
        }

        public List<Envelope> sentEnvelopes() {
            List<Envelope> envelopes = new ArrayList<>();
            for (Frame frame : sent) {
                if (frame instanceof Frame.Text text) {
                    envelopes.add(codec.decode(text.text()));
                }
            }
            return envelopes;
        }

        public long countSent(String event) {
            return sentEnvelopes().stream().filter(e -> e.event().equals(event)).count();
        }

        public boolean wasClosed() {
            return closed;
        }

        public boolean wasAborted() {
            return aborted;
        }
    }
}
