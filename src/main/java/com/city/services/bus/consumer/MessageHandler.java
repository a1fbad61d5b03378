package com.city.services.bus.consumer;

import java.util.function.Consumer;

import com.city.services.core.message.Envelope;

/**
 * Handles one decoded and validated bus payload.
 *
 * <p>Returning normally acks the message. Throwing leaves it unacked so JetStream redelivers it.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Envelope envelope, Object payload);

    /**
     * Adapts a typed payload consumer.
     */
    static <T> MessageHandler of(Class<T> payloadType, Consumer<T> body) {
        return (envelope, payload) -> body.accept(payloadType.cast(payload));
    }
}
