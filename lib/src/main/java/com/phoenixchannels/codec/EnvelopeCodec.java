package com.phoenixchannels.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.phoenixchannels.transport.ProtocolException;

/**
 * Converts envelopes to and from the text carried in transport frames.
 * Implementations must be thread-safe.
 */
public interface EnvelopeCodec {

    String encode(Envelope envelope);

    /**
     * @throws ProtocolException if the text is not a well-formed envelope
     */
    Envelope decode(String text);

    /**
     * Converts an arbitrary value (maps, lists, beans, JSON trees) into a payload.
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    JsonNode toPayload(Object value);
}
