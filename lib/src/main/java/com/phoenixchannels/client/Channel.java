package com.phoenixchannels.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.phoenixchannels.Result;
import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.PhoenixProtocol;
import com.phoenixchannels.mailbox.LinkedMailbox;
import com.phoenixchannels.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A topic on a socket. Holds no connection state: joining registers {@link #inbox()} with the
 * socket, and everything pushed to the topic after that is delivered there.
 *
 * @param socket the owning socket
 * @param topic  the channel topic
 * @param params parameters sent with {@code phx_join}
 * @param inbox  receives the channel's events and connection notifications
 */
public record Channel(PhoenixSocket socket, String topic, JsonNode params, Mailbox<ChannelMessage> inbox) {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    public Channel {
        Objects.requireNonNull(socket, "socket");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(inbox, "inbox");
    }

    public ChannelResult join() {
        return join(socket.defaultTimeout());
    }

    /**
     * Subscribes the inbox to the topic and sends {@code phx_join}. The subscription is dropped
     * again if the server does not answer in time; server errors leave it in place.
     */
    public ChannelResult join(Duration timeout) {
        Subscription subscription = new Subscription.TopicSubscription(topic, inbox);
        socket.subscribe(subscription);
        ChannelResult result = pushAndReceive(PhoenixProtocol.EVENT_JOIN, params, timeout);
        if (result instanceof ChannelResult.Timeout) {
            logger.debug("Join of {} timed out", topic);
            socket.unsubscribe(subscription.key());
        }
        return result;
    }

    public ChannelResult leave() {
        return leave(socket.defaultTimeout());
    }

    /**
     * Unsubscribes the inbox, then sends {@code phx_leave} and waits for the reply.
     */
    public ChannelResult leave(Duration timeout) {
        socket.unsubscribe(Subscription.topicKey(topic));
        return pushAndReceive(PhoenixProtocol.EVENT_LEAVE, null, timeout);
    }

    /**
     * Sends an event without waiting for a reply.
     *
     * @return the reference the push carried
     */
    public Result<Long> push(String event, Object payload) {
        return socket.push(topic, event, socket.codec().toPayload(payload));
    }

    public ChannelResult pushAndReceive(String event, Object payload) {
        return pushAndReceive(event, payload, socket.defaultTimeout());
    }

    /**
     * Sends an event and waits for its {@code phx_reply}. The wait never exceeds the socket's
     * maximum timeout. The reply subscription is always removed before returning.
     */
    public ChannelResult pushAndReceive(String event, Object payload, Duration timeout) {
        long ref = socket.nextReference();
        Mailbox<ChannelMessage> replies = new LinkedMailbox<>();
        Subscription subscription = new Subscription.ReplySubscription(topic, ref, replies);
        socket.subscribe(subscription);
        try {
            Result<Long> sent = socket.send(new Envelope(topic, event, socket.codec().toPayload(payload), ref));
            if (sent instanceof Result.Failure<Long> failure) {
                return new ChannelResult.Failed(failure.error());
            }
            ChannelMessage reply = replies.poll(socket.effectiveTimeout(timeout).toMillis(), TimeUnit.MILLISECONDS);
            if (reply == null) {
                return ChannelResult.timeout();
            }
            return ChannelResult.fromReply(reply);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ChannelResult.Failed(e);
        } finally {
            socket.unsubscribe(subscription.key());
        }
    }

    /**
     * Takes the next message from the inbox.
     *
     * @return empty if nothing arrived within {@code timeout}
     */
    public Optional<ChannelMessage> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
