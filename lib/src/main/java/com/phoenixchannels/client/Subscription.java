package com.phoenixchannels.client;

import com.phoenixchannels.codec.Envelope;
import com.phoenixchannels.codec.PhoenixProtocol;
import com.phoenixchannels.mailbox.Mailbox;

import java.util.Objects;

/**
 * A route from inbound envelopes to an owner's inbox. Variants carry the values they compare
 * against instead of arbitrary predicates.
 */
public sealed interface Subscription permits Subscription.TopicSubscription, Subscription.ReplySubscription {

    /**
     * Unique key within the registry.
     */
    String key();

    Mailbox<ChannelMessage> owner();

    boolean matches(Envelope envelope);

    /**
     * The message delivered to the owner for a matching envelope.
     */
    ChannelMessage toMessage(Envelope envelope);

    static String topicKey(String topic) {
        return "channel_" + topic;
    }

    static String replyKey(long ref) {
        return "reply_" + ref;
    }

    /**
     * Every envelope on a topic, for the lifetime of a joined channel.
     */
    record TopicSubscription(String topic, Mailbox<ChannelMessage> owner) implements Subscription {

        public TopicSubscription {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(owner, "owner");
        }

        @Override
        public String key() {
            return topicKey(topic);
        }

        @Override
        public boolean matches(Envelope envelope) {
            return topic.equals(envelope.topic());
        }

        @Override
        public ChannelMessage toMessage(Envelope envelope) {
            return new ChannelMessage.Event(envelope.event(), envelope.payload());
        }
    }

    /**
     * The single {@code phx_reply} answering the push that carried {@code ref}.
     */
    record ReplySubscription(String topic, long ref, Mailbox<ChannelMessage> owner) implements Subscription {

        public ReplySubscription {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(owner, "owner");
        }

        @Override
        public String key() {
            return replyKey(ref);
        }

        @Override
        public boolean matches(Envelope envelope) {
            return topic.equals(envelope.topic())
                    && PhoenixProtocol.EVENT_REPLY.equals(envelope.event())
                    && envelope.ref() != null
                    && envelope.ref() == ref;
        }

        @Override
        public ChannelMessage toMessage(Envelope envelope) {
            return new ChannelMessage.Event(PhoenixProtocol.EVENT_REPLY, envelope.payload());
        }
    }
}
