package com.city.services.bus.consumer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.city.services.bus.codec.EnvelopeCodec;
import com.city.services.bus.codec.MalformedMessageException;
import com.city.services.bus.config.JacksonConfig;
import com.city.services.core.message.Envelope;
import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageDispatchTableTest {

    private ValidatorFactory validatorFactory;
    private EnvelopeCodec codec;
    private final List<HealthCheckRequest> received = new ArrayList<>();
    private MessageDispatchTable table;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        codec = new EnvelopeCodec(JacksonConfig.cityObjectMapper(), validatorFactory.getValidator(), Clock.systemUTC());
        table = new MessageDispatchTable("fire_department", codec,
                Map.of(MessageType.HEALTH_CHECK, MessageHandler.of(HealthCheckRequest.class, received::add)));
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    private byte[] encoded(MessageType type, Object payload) {
        Envelope env = codec.wrap("city_council", type, "fire_department", payload);
        return codec.encode(env);
    }

    @Test
    void handled() {
        HealthCheckRequest check = new HealthCheckRequest("c-1", "city_council", "fire_department");

        MessageDispatchTable.Outcome outcome =
                table.dispatch("city.health_check.fire_department", encoded(MessageType.HEALTH_CHECK, check));

        assertThat(outcome).isEqualTo(MessageDispatchTable.Outcome.HANDLED);
        assertThat(received).containsExactly(check);
    }

    @Test
    void typeWithoutHandlerIsIgnored() {
        byte[] data = encoded(MessageType.HEALTH_STATUS,
                new HealthStatusReply("c-1", "police_department", "healthy", 1.0, 0L));

        assertThat(table.dispatch("city.health_status.fire_department", data))
                .isEqualTo(MessageDispatchTable.Outcome.IGNORED);
        assertThat(received).isEmpty();
    }

    @Test
    void subjectAndEnvelopeMustAgree() {
        byte[] data = encoded(MessageType.HEALTH_CHECK, new HealthCheckRequest("c-1", "city_council", "fire_department"));

        assertThatThrownBy(() -> table.dispatch("city.emergency_call.fire_department", data))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessageContaining("does not match subject");
    }

    @Test
    void nonCanonicalSubject() {
        assertThatThrownBy(() -> table.dispatch("fire_department", new byte[]{'{', '}'}))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessage("non-canonical subject");
    }

    @Test
    void handlerFailurePropagates() {
        MessageDispatchTable failing = new MessageDispatchTable("fire_department", codec,
                Map.of(MessageType.HEALTH_CHECK, (envelope, payload) -> {
                    throw new IllegalStateException("boom");
                }));
        byte[] data = encoded(MessageType.HEALTH_CHECK, new HealthCheckRequest("c-1", "city_council", "fire_department"));

        assertThatThrownBy(() -> failing.dispatch("city.health_check.fire_department", data))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void handlerTableIsImmutable() {
        assertThatThrownBy(() -> table.handlers().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
