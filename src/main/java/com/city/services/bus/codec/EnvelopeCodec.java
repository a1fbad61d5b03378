package com.city.services.bus.codec;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.city.services.core.message.Envelope;
import com.city.services.core.message.MessageType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * Converts between payload objects, {@link Envelope}s and the bytes on the wire.
 *
 * <h2>Decoding contract</h2>
 * <ul>
 *   <li>{@link #decode(String, byte[])} only checks the envelope: JSON shape, known type tag,
 *       presence of a payload.</li>
 *   <li>{@link #bindPayload(String, Envelope)} binds the payload to
 *       {@link MessageType#payloadType()} and runs bean validation.</li>
 * </ul>
 * Every failure surfaces as {@link MalformedMessageException}.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper mapper;
    private final Validator validator;
    private final Clock clock;

    public EnvelopeCodec(ObjectMapper mapper, Validator validator, Clock clock) {
        this.mapper = mapper;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Wraps a payload in a fresh envelope with a random message id.
     *
     * @throws IllegalArgumentException when {@code payload} is not the class {@code type} carries
     */
    public Envelope wrap(String from, MessageType type, String to, Object payload) {
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload for " + type.tag() + " must be "
                    + type.payloadType().getSimpleName() + " but was "
                    + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        JsonNode body = mapper.valueToTree(payload);
        return new Envelope(UUID.randomUUID().toString(), type, from, to, clock.instant(), body);
    }

    public byte[] encode(Envelope envelope) {
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize envelope " + envelope.messageId(), e);
        }
    }

    public Envelope decode(String subject, byte[] data) {
        if (data == null || data.length == 0) {
            throw new MalformedMessageException(subject, "empty message body");
        }
        Envelope envelope;
        try {
            envelope = mapper.readValue(data, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(subject, "undecodable envelope: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMessageException(subject, "undecodable envelope: " + e.getMessage(), e);
        }
        if (envelope.type() == null) {
            throw new MalformedMessageException(subject, "envelope has no type");
        }
        if (envelope.payload() == null || envelope.payload().isNull()) {
            throw new MalformedMessageException(subject, "envelope has no payload");
        }
        return envelope;
    }

    public Object bindPayload(String subject, Envelope envelope) {
        Object payload;
        try {
            payload = mapper.treeToValue(envelope.payload(), envelope.type().payloadType());
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(subject,
                    "payload does not match " + envelope.type().tag() + ": " + e.getOriginalMessage(), e);
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining("; "));
            throw new MalformedMessageException(subject, envelope.type().tag() + " failed validation: " + detail);
        }
        return payload;
    }
}
