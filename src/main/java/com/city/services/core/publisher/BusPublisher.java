package com.city.services.core.publisher;

import com.city.services.core.message.MessageType;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * BusPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for putting one typed payload on the city bus.
 *
 * The primary implementation targets NATS JetStream. Council and dispatch
 * code depend only on this interface, which keeps them testable without a
 * server.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ CityCouncil / NotificationDispatcher / DispatchRouter ]
 *          │
 *          ▼
 *   [ BusPublisher ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ JetStream ]
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono completes: the stream persisted the message (Msg-Id de-dup applied)
 * - Mono errors: the message is NOT guaranteed to be published
 *
 * Success does NOT mean the recipient received or acknowledged it.
 *
 * THREAD SAFETY
 * -------------
 * Implementations MUST be thread-safe; they are called from the ticker and
 * from every consumer loop.
 */
public interface BusPublisher {

    /**
     * Wraps the payload in an envelope and publishes it to
     * {@code city.<type>.<recipient>}.
     *
     * @param from      logical sender, recorded in the envelope
     * @param type      message kind; {@code payload} must be an instance of {@link MessageType#payloadType()}
     * @param recipient logical recipient (subject token)
     * @param payload   message body
     * @return Mono completing with the envelope message id once the stream accepted it
     */
    Mono<String> publish(String from, MessageType type, String recipient, Object payload);
}
