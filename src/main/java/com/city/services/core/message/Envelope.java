package com.city.services.core.message;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transport wrapper around every payload published on the city bus.
 *
 * <p>The payload stays a {@link JsonNode} until the dispatch table knows which handler will
 * consume it; only then is it bound (and validated) to {@link MessageType#payloadType()}.</p>
 *
 * @param messageId   unique id; used as the JetStream Msg-Id for server-side de-dup
 * @param type        message kind
 * @param from        logical sender name
 * @param to          logical recipient name (last subject token)
 * @param publishedAt publish time at the sender
 * @param payload     raw JSON payload
 */
public record Envelope(
        String messageId,
        MessageType type,
        String from,
        String to,
        Instant publishedAt,
        JsonNode payload
) {
}
