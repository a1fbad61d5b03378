package com.city.services.bus.consumer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.city.services.bus.codec.EnvelopeCodec;
import com.city.services.bus.config.JacksonConfig;
import com.city.services.core.message.Envelope;
import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.MessageType;

import io.nats.client.Message;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BusConsumerTest {

    private static final String SUBJECT = "city.health_check.fire_department";

    @Mock
    private Message msg;

    private ValidatorFactory validatorFactory;
    private EnvelopeCodec codec;
    private final List<HealthCheckRequest> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        codec = new EnvelopeCodec(JacksonConfig.cityObjectMapper(), validatorFactory.getValidator(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    private BusConsumer consumerWith(MessageHandler handler) {
        MessageDispatchTable table = new MessageDispatchTable("fire_department", codec,
                Map.of(MessageType.HEALTH_CHECK, handler));
        // handle() never touches JetStream.
        return new BusConsumer(null, "CITY", "fire_department_inbox", "city.*.fire_department", table,
                Duration.ofMillis(100), Duration.ofSeconds(1), 10);
    }

    private byte[] healthCheck() {
        Envelope env = codec.wrap("city_council", MessageType.HEALTH_CHECK, "fire_department",
                new HealthCheckRequest("chk-1", "city_council", "fire_department"));
        return codec.encode(env);
    }

    @Test
    void handledMessageIsAcked() {
        when(msg.getSubject()).thenReturn(SUBJECT);
        when(msg.getData()).thenReturn(healthCheck());

        consumerWith(MessageHandler.of(HealthCheckRequest.class, received::add)).handle(msg);

        assertThat(received).extracting(HealthCheckRequest::checkId).containsExactly("chk-1");
        verify(msg).ack();
    }

    @Test
    void undecodablePayloadIsAckedAndDropped() {
        when(msg.getSubject()).thenReturn(SUBJECT);
        when(msg.getData()).thenReturn("not json".getBytes(StandardCharsets.UTF_8));

        consumerWith(MessageHandler.of(HealthCheckRequest.class, received::add)).handle(msg);

        assertThat(received).isEmpty();
        verify(msg).ack();
    }

    @Test
    void nonCanonicalSubjectIsAckedAndDropped() {
        when(msg.getSubject()).thenReturn("city.health_check");
        when(msg.getData()).thenReturn(healthCheck());

        consumerWith(MessageHandler.of(HealthCheckRequest.class, received::add)).handle(msg);

        verify(msg).ack();
    }

    @Test
    void failingHandlerLeavesMessageUnackedForRedelivery() {
        when(msg.getSubject()).thenReturn(SUBJECT);
        when(msg.getData()).thenReturn(healthCheck());
        BusConsumer consumer = consumerWith(MessageHandler.of(HealthCheckRequest.class, r -> {
            throw new IllegalStateException("department busy");
        }));

        assertThatCode(() -> consumer.handle(msg)).doesNotThrowAnyException();

        verify(msg, never()).ack();
    }
}
