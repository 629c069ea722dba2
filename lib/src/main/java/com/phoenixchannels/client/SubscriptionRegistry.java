package com.phoenixchannels.client;

import com.phoenixchannels.codec.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Subscription table of the socket actor. Not thread-safe: only the actor thread touches it.
 * Delivery uses non-blocking offers so a slow owner never stalls routing.
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    /**
     * Adds a subscription, replacing any existing one with the same key.
     *
     * @return the replaced subscription, if any
     */
    public Optional<Subscription> put(Subscription subscription) {
        Subscription previous = subscriptions.put(subscription.key(), subscription);
        if (previous != null) {
            logger.debug("Subscription {} replaced", subscription.key());
        } else {
            logger.debug("Subscription {} added", subscription.key());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<Subscription> remove(String key) {
        Subscription removed = subscriptions.remove(key);
        if (removed != null) {
            logger.debug("Subscription {} removed", key);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Offers the envelope to every matching owner.
     *
     * @return the number of owners that accepted it
     */
    public int route(Envelope envelope) {
        int delivered = 0;
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.matches(envelope)) {
                continue;
            }
            if (subscription.owner().offer(subscription.toMessage(envelope))) {
                delivered++;
            } else {
                logger.warn("Inbox of {} is full, dropped {} on {}", subscription.key(), envelope.event(), envelope.topic());
            }
        }
        if (delivered == 0) {
            logger.debug("No subscriber for {} on {} (ref {})", envelope.event(), envelope.topic(), envelope.ref());
        }
        return delivered;
    }

    /**
     * Offers the same message to every owner.
     *
     * @return the number of owners that accepted it
     */
    public int broadcast(ChannelMessage message) {
        int delivered = 0;
        for (Subscription subscription : new ArrayList<>(subscriptions.values())) {
            if (subscription.owner().offer(message)) {
                delivered++;
            } else {
                logger.warn("Inbox of {} is full, dropped {}", subscription.key(), message);
            }
        }
        return delivered;
    }

    public boolean contains(String key) {
        return subscriptions.containsKey(key);
    }

    public Set<String> keys() {
        return new LinkedHashSet<>(subscriptions.keySet());
    }

    public int size() {
        return subscriptions.size();
    }
}
