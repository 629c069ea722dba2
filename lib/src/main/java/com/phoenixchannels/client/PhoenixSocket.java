package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.phoenixchannels.ActorException;
import com.phoenixchannels.ActorSystem;
import com.phoenixchannels.Pid;
import com.phoenixchannels.Result;
import com.phoenixchannels.SupervisionStrategy;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.EnvelopeCodec;
import com.phoenixchannels.mailbox.LinkedMailbox;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Caller-side handle of a socket actor. Thread-safe: every method either tells or asks the actor,
 * and frames are written from the calling thread on the connection the actor hands out.
 *
 * <pre>{@code
 * PhoenixSocket socket = PhoenixSocket.connect(system, new NettyWebSocketTransport(),
 *         new JacksonEnvelopeCodec(), new SocketConfig().setHost("localhost").setPort(4000).setPath("/socket/websocket"));
 * Channel room = socket.channel("room:lobby");
 * ChannelResult joined = room.join();
 * }</pre>
 */
public final class PhoenixSocket implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PhoenixSocket.class);

    private final ActorSystem system;
    private final Pid pid;
    private final EnvelopeCodec codec;
    private volatile SocketConfig settings = new SocketConfig();

    private PhoenixSocket(ActorSystem system, Pid pid, EnvelopeCodec codec) {
        this.system = system;
        this.pid = pid;
        this.codec = codec;
    }

    /**
     * Spawns an idle socket actor.
     */
    public static PhoenixSocket start(ActorSystem system, Transport transport, EnvelopeCodec codec) {
        Pid pid = system.actorOf(new SocketHandler(transport, codec))
                .withId("phoenix-socket-" + system.generateActorId())
                .withSupervisionStrategy(SupervisionStrategy.RESUME)
                .spawn();
        logger.debug("Started socket actor {}", pid);
        return new PhoenixSocket(system, pid, codec);
    }

    /**
     * Spawns a socket actor and connects it. The actor is stopped if the connect fails.
     *
     * @throws SocketConnectException if the connection could not be established
     */
    public static PhoenixSocket connect(ActorSystem system, Transport transport, EnvelopeCodec codec, SocketConfig config) {
        PhoenixSocket socket = start(system, transport, codec);
        try {
            socket.connect(config);
        } catch (RuntimeException e) {
            socket.close();
            throw e;
        }
        return socket;
    }

    /**
     * Opens a connection, replacing any existing one.
     *
     * @return the epoch of the new connection
     * @throws SocketConnectException if the configuration is invalid, in which case the current
     *                                connection and settings are left as they were, or if the
     *                                connection could not be established
     */
    public long connect(SocketConfig config) {
        SocketConfig snapshot = new SocketConfig(config);
        try {
            snapshot.validate();
        } catch (IllegalArgumentException e) {
            throw new SocketConnectException("Invalid socket configuration", e);
        }
        try {
            return awaitConnect(new SocketCommand.Connect(snapshot), snapshot);
        } finally {
            // the actor keeps a valid config even when the open fails, and reconnect reuses it
            settings = snapshot;
        }
    }

    /**
     * Opens a new connection with the configuration of the last {@link #connect(SocketConfig)}.
     *
     * @return the epoch of the new connection
     * @throws SocketConnectException if the connection could not be established, or if
     *                                connect was never called
     */
    public long reconnect() {
        return awaitConnect(new SocketCommand.Reconnect(), settings);
    }

    private long awaitConnect(SocketCommand command, SocketConfig config) {
        Duration timeout = config.getConnectTimeout()
                .plus(config.getAskTimeout())
                .plus(SocketHandler.WORKER_JOIN_TIMEOUT);
        Result<Long> result = ask(command, timeout);
        if (result instanceof Result.Failure<Long> failure && failure.error() instanceof SocketConnectException e) {
            throw e;
        }
        return result.getOrThrow();
    }

    public Channel channel(String topic) {
        return channel(topic, null);
    }

    /**
     * Describes a channel on this socket. Nothing is sent until {@link Channel#join()}.
     *
     * @param params join parameters, converted with the socket's codec
     */
    public Channel channel(String topic, Object params) {
        return new Channel(this, topic, codec.toPayload(params), new LinkedMailbox<>());
    }

    /**
     * @return a reference never handed out before by this socket
     */
    public long nextReference() {
        Long ref = ask(new SocketCommand.NextReference(), settings.getAskTimeout());
        return ref;
    }

    public Optional<TransportConnection> currentConnection() {
        return ask(new SocketCommand.CurrentConnection(), settings.getAskTimeout());
    }

    public void subscribe(Subscription subscription) {
        pid.tell(new SocketCommand.Subscribe(subscription));
    }

    public void unsubscribe(String key) {
        pid.tell(new SocketCommand.Unsubscribe(key));
    }

    /**
     * Encodes and writes an envelope on the current connection.
     *
     * @return the envelope's reference, or a {@link TransportException} if there is no
     *         connection or the write failed
     */
    public Result<Long> send(Envelope envelope) {
        Optional<TransportConnection> connection = currentConnection();
        if (connection.isEmpty()) {
            return Result.failure(new TransportException("Socket is not connected"));
        }
        try {
            connection.get().send(new Frame.Text(codec.encode(envelope)));
        } catch (TransportException e) {
            logger.debug("Send of {} on {} failed: {}", envelope.event(), envelope.topic(), e.getMessage());
            return Result.failure(e);
        }
        return Result.success(envelope.ref());
    }

    /**
     * Writes an envelope with a fresh reference.
     */
    public Result<Long> push(String topic, String event, JsonNode payload) {
        long ref = nextReference();
        return send(new Envelope(topic, event, payload, ref));
    }

    public SocketStatus status() {
        return ask(new SocketCommand.GetStatus(), settings.getAskTimeout());
    }

    /**
     * Stops the actor. The connection is aborted and every subscriber gets a closed notification.
     */
    @Override
    public void close() {
        system.stopActor(pid);
    }

    public Pid pid() {
        return pid;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public Duration defaultTimeout() {
        return settings.getDefaultTimeout();
    }

    public Duration maxTimeout() {
        return settings.getMaxTimeout();
    }

    /**
     * Clamps a caller's timeout to the configured ceiling.
     */
    Duration effectiveTimeout(Duration requested) {
        Duration max = maxTimeout();
        if (requested == null || requested.isNegative()) {
            return defaultTimeout().compareTo(max) > 0 ? max : defaultTimeout();
        }
        return requested.compareTo(max) > 0 ? max : requested;
    }

    private <R> R ask(SocketCommand command, Duration timeout) {
        try {
            return system.<SocketCommand, R>ask(pid, command, timeout).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("Interrupted waiting for " + command.getClass().getSimpleName(), e, pid.actorId());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ActorException actorException) {
                throw actorException;
            }
            throw new ActorException("Socket did not answer " + command.getClass().getSimpleName(),
                    e.getCause(), pid.actorId());
        }
    }
}
