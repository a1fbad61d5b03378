package com.city.services.bus.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.city.services.bus.codec.EnvelopeCodec;
import com.city.services.core.message.Envelope;
import com.city.services.core.message.MessageType;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.core.subject.CitySubject;

import io.nats.client.JetStream;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive JetStream implementation of {@link BusPublisher}.
 *
 * <h2>De-duplication rule (LOCKED)</h2>
 * <ul>
 *   <li>{@code Msg-Id == envelope.message_id}</li>
 *   <li>Implemented by setting {@link PublishOptions#messageId} on every publish.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link JetStream#publish(String, byte[], PublishOptions)} blocks for the server ack, so the call
 * runs on {@link Schedulers#boundedElastic()}.
 */
@Component
public class JetStreamBusPublisher implements BusPublisher {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBusPublisher.class);

    private final JetStream js;
    private final EnvelopeCodec codec;

    public JetStreamBusPublisher(JetStream js, EnvelopeCodec codec) {
        this.js = js;
        this.codec = codec;
    }

    @Override
    public Mono<String> publish(String from, MessageType type, String recipient, Object payload) {
        return Mono.fromCallable(() -> {
                    // Subject validation happens before anything is sent.
                    String subject = CitySubject.of(type, recipient).toSubject();
                    Envelope envelope = codec.wrap(from, type, recipient, payload);

                    PublishOptions opts = PublishOptions.builder()
                            .messageId(envelope.messageId())
                            .build();

                    PublishAck ack = js.publish(subject, codec.encode(envelope), opts);

                    log.debug("Published id={} subject={} stream={} seq={} duplicate={}",
                            envelope.messageId(), subject, ack.getStream(), ack.getSeqno(), ack.isDuplicate());

                    return envelope.messageId();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
