package com.phoenixchannels.client;

import com.phoenixchannels.ActorContext;
import com.phoenixchannels.Result;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.EnvelopeCodec;
import com.phoenixchannels.handler.Handler;
import com.phoenixchannels.transport.Frame;
import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportConnection;
import com.phoenixchannels.transport.TransportException;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The socket actor. Owns the connection, the receive worker, the heartbeat timer, the reference
 * counter and the subscription registry; all of it is touched only from the actor thread, apart
 * from {@link #postStop(ActorContext)} which runs after that thread has exited.
 */
public class SocketHandler implements Handler<SocketCommand> {

    static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(1);

    private final Transport transport;
    private final EnvelopeCodec codec;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private SocketConfig config;
    private URI uri;
    private TransportConnection connection;
    private ReceiveWorker worker;
    private ScheduledFuture<?> heartbeatTimer;
    private long nextReference = 0;
    private long epoch = 0;
    private ConnectionState state = ConnectionState.IDLE;

    public SocketHandler(Transport transport, EnvelopeCodec codec) {
        this.transport = transport;
        this.codec = codec;
    }

    @Override
    public void receive(SocketCommand command, ActorContext context) {
        if (command instanceof SocketCommand.Connect connect) {
            context.reply(connect(new SocketConfig(connect.config()), context));
        } else if (command instanceof SocketCommand.Reconnect) {
            if (config == null) {
                context.reply(Result.failure(new SocketConnectException("reconnect called before connect")));
            } else {
                context.getLogger().info("Reconnecting to {}", uri);
                context.reply(connect(config, context));
            }
        } else if (command instanceof SocketCommand.NextReference) {
            context.reply(nextReference++);
        } else if (command instanceof SocketCommand.CurrentConnection) {
            context.reply(Optional.ofNullable(connection));
        } else if (command instanceof SocketCommand.GetStatus) {
            context.reply(status());
        } else if (command instanceof SocketCommand.Subscribe subscribe) {
            registry.put(subscribe.subscription());
        } else if (command instanceof SocketCommand.Unsubscribe unsubscribe) {
            registry.remove(unsubscribe.key());
        } else if (command instanceof SocketCommand.Inbound inbound) {
            if (isCurrent(inbound.epoch(), command, context)) {
                registry.route(inbound.envelope());
            }
        } else if (command instanceof SocketCommand.InboundError error) {
            if (isCurrent(error.epoch(), command, context)) {
                context.getLogger().warn("Receive error on epoch {}: {}", epoch, error.error().getMessage());
                registry.broadcast(new ChannelMessage.Failure(error.error()));
            }
        } else if (command instanceof SocketCommand.InboundClosed closed) {
            if (isCurrent(closed.epoch(), command, context)) {
                onClosed(closed, context);
            }
        } else if (command instanceof SocketCommand.Heartbeat heartbeat) {
            if (isCurrent(heartbeat.epoch(), command, context)) {
                heartbeat(context);
            }
        }
    }

    @Override
    public void postStop(ActorContext context) {
        teardown(true, context);
        state = ConnectionState.TERMINATED;
        registry.broadcast(new ChannelMessage.Closed(1001, "socket terminated"));
        context.getLogger().info("Socket terminated after {} connection(s)", epoch);
    }

    private Result<Long> connect(SocketConfig requested, ActorContext context) {
        URI target;
        try {
            target = requested.toUri();
        } catch (IllegalArgumentException e) {
            return Result.failure(new SocketConnectException("Invalid socket configuration", e));
        }
        // stored before the attempt so a later reconnect retries the same endpoint
        config = requested;
        uri = target;

        teardown(false, context);
        state = ConnectionState.CONNECTING;
        context.getLogger().info("Connecting to {}", target);

        TransportConnection opened;
        try {
            opened = transport.open(target, requested.getConnectTimeout());
        } catch (TransportException e) {
            state = ConnectionState.DISCONNECTED;
            context.getLogger().warn("Connect to {} failed: {}", target, e.getMessage());
            return Result.failure(new SocketConnectException("Failed to connect to " + target, e));
        }

        epoch++;
        connection = opened;
        worker = new ReceiveWorker(
                context.getActorId() + "-recv-" + epoch,
                epoch,
                opened,
                codec,
                context.self(),
                context.getSystem().getThreadPoolFactory());
        worker.start();
        scheduleHeartbeat(context);
        state = ConnectionState.CONNECTED;
        context.getLogger().info("Connected to {} (epoch {})", target, epoch);
        return Result.success(epoch);
    }

    private void onClosed(SocketCommand.InboundClosed closed, ActorContext context) {
        context.getLogger().info("Connection closed by peer on epoch {}: {} {}", epoch, closed.code(), closed.reason());
        teardown(false, context);
        state = ConnectionState.DISCONNECTED;
        registry.broadcast(new ChannelMessage.Closed(closed.code(), closed.reason()));
    }

    private void heartbeat(ActorContext context) {
        heartbeatTimer = null;
        if (connection == null) {
            return;
        }
        context.getLogger().debug("Sending heartbeat on epoch {}", epoch);
        try {
            connection.send(new Frame.Text(codec.encode(Envelope.heartbeat())));
        } catch (TransportException e) {
            context.getLogger().warn("Heartbeat failed on epoch {}: {}", epoch, e.getMessage());
        }
        scheduleHeartbeat(context);
    }

    private void scheduleHeartbeat(ActorContext context) {
        heartbeatTimer = context.tellSelf(
                new SocketCommand.Heartbeat(epoch),
                config.getHeartbeatInterval().toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /**
     * Cancels the timer, stops the worker and releases the connection. A graceful teardown sends
     * a close frame; otherwise the connection is aborted.
     */
    private void teardown(boolean abort, ActorContext context) {
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
            heartbeatTimer = null;
        }
        ReceiveWorker oldWorker = worker;
        worker = null;
        if (oldWorker != null) {
            oldWorker.stop();
        }
        TransportConnection oldConnection = connection;
        connection = null;
        if (oldConnection != null) {
            try {
                if (abort) {
                    oldConnection.abort();
                } else {
                    oldConnection.close();
                }
            } catch (TransportException e) {
                context.getLogger().debug("Error releasing connection of epoch {}: {}", epoch, e.getMessage());
                oldConnection.abort();
            }
        }
        if (oldWorker != null && !oldWorker.join(WORKER_JOIN_TIMEOUT)) {
            context.getLogger().warn("Receive worker {} did not exit within {} ms",
                    oldWorker.name(), WORKER_JOIN_TIMEOUT.toMillis());
        }
    }

    private boolean isCurrent(long commandEpoch, SocketCommand command, ActorContext context) {
        if (commandEpoch != epoch || connection == null) {
            context.getLogger().debug("Dropping stale {} (epoch {}, current {})", command, commandEpoch, epoch);
            return false;
        }
        return true;
    }

    private SocketStatus status() {
        return new SocketStatus(
                state,
                epoch,
                nextReference,
                registry.keys(),
                heartbeatTimer != null,
                worker != null && worker.isAlive());
    }
}
