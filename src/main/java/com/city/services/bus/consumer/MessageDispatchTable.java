package com.city.services.bus.consumer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.bus.codec.EnvelopeCodec;
import com.city.services.bus.codec.MalformedMessageException;
import com.city.services.core.message.Envelope;
import com.city.services.core.message.MessageType;
import com.city.services.core.subject.CitySubject;

/**
 * Closed message type to handler table for one endpoint.
 *
 * <h2>Outcome of {@link #dispatch(String, byte[])}</h2>
 * <ul>
 *   <li>{@link Outcome#HANDLED}: handler ran; ack.</li>
 *   <li>{@link Outcome#IGNORED}: no handler for the type; ack.</li>
 *   <li>{@link MalformedMessageException}: undecodable or invalid; the caller acks and drops.</li>
 *   <li>Any other exception: handler failure; the caller does not ack.</li>
 * </ul>
 */
public class MessageDispatchTable {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatchTable.class);

    public enum Outcome { HANDLED, IGNORED }

    private final String role;
    private final EnvelopeCodec codec;
    private final Map<MessageType, MessageHandler> handlers;

    public MessageDispatchTable(String role, EnvelopeCodec codec, Map<MessageType, MessageHandler> handlers) {
        this.role = role;
        this.codec = codec;
        EnumMap<MessageType, MessageHandler> copy = new EnumMap<>(MessageType.class);
        copy.putAll(handlers);
        this.handlers = Collections.unmodifiableMap(copy);
    }

    public Outcome dispatch(String subject, byte[] data) {
        CitySubject parsed = CitySubject.tryParse(subject);
        if (parsed == null) {
            throw new MalformedMessageException(subject, "non-canonical subject");
        }

        Envelope envelope = codec.decode(subject, data);
        if (envelope.type() != parsed.type()) {
            throw new MalformedMessageException(subject,
                    "envelope type " + envelope.type().tag() + " does not match subject");
        }

        MessageHandler handler = handlers.get(envelope.type());
        if (handler == null) {
            log.debug("No handler role={} type={} subject={}", role, envelope.type().tag(), subject);
            return Outcome.IGNORED;
        }

        Object payload = codec.bindPayload(subject, envelope);
        handler.handle(envelope, payload);
        return Outcome.HANDLED;
    }

    public Map<MessageType, MessageHandler> handlers() {
        return handlers;
    }
}
