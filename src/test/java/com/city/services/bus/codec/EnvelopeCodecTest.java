package com.city.services.bus.codec;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.city.services.bus.config.JacksonConfig;
import com.city.services.core.message.DepartmentAnnouncement;
import com.city.services.core.message.Envelope;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;
import com.city.services.core.message.ServiceRequest;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private static final String SUBJECT = "city.service_request.city_council";

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final ObjectMapper mapper = JacksonConfig.cityObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private EnvelopeCodec codec;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec(mapper, validator, clock);
    }

    @BeforeAll
    static void validator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void close() {
        validatorFactory.close();
    }

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void wireFormatIsSnakeCase() throws Exception {
        ServiceRequest request = new ServiceRequest("emergency_dispatch_center", "water_emergency",
                "Need water department to handle: main break", "high", "911-1", "water_department");

        Envelope env = codec.wrap("emergency_dispatch_center", MessageType.SERVICE_REQUEST, "city_council", request);
        String wire = new String(codec.encode(env), StandardCharsets.UTF_8);

        assertThat(env.messageId()).isNotBlank();
        assertThat(env.publishedAt()).isEqualTo(clock.instant());
        assertThat(mapper.readTree(wire).get("type").asText()).isEqualTo("service_request");
        assertThat(mapper.readTree(wire).at("/payload/department_needed").asText()).isEqualTo("water_department");
        assertThat(wire).contains("\"published_at\":\"2026-03-01T08:00:00Z\"");
    }

    @Test
    void decodeAndBind() {
        byte[] data = json("""
                {"message_id":"m-1","type":"health_status","from":"fire_department","to":"city_council",
                 "published_at":"2026-03-01T08:00:00Z",
                 "payload":{"check_id":"c-1","service_name":"fire_department","status":"healthy",
                            "uptime_seconds":12.5,"message_count":3,"extra_field":"ignored"}}
                """);

        Envelope env = codec.decode("city.health_status.city_council", data);
        Object payload = codec.bindPayload("city.health_status.city_council", env);

        assertThat(env.type()).isEqualTo(MessageType.HEALTH_STATUS);
        assertThat(payload).isEqualTo(new HealthStatusReply("c-1", "fire_department", "healthy", 12.5, 3L));
    }

    @Test
    void wrapRejectsMismatchedPayload() {
        assertThatThrownBy(() -> codec.wrap("a", MessageType.SERVICE_REQUEST, "b",
                new DepartmentAnnouncement("fire_department", "active", 1L, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ServiceRequest");
    }

    @Test
    void emptyBody() {
        assertThatThrownBy(() -> codec.decode(SUBJECT, new byte[0]))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessage("empty message body");
    }

    @Test
    void garbage() {
        assertThatThrownBy(() -> codec.decode(SUBJECT, json("not json")))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessageStartingWith("undecodable envelope");
    }

    @Test
    void unknownTypeTag() {
        assertThatThrownBy(() -> codec.decode(SUBJECT, json("{\"type\":\"gossip\",\"payload\":{}}")))
                .isInstanceOfSatisfying(MalformedMessageException.class,
                        e -> assertThat(e.subject()).isEqualTo(SUBJECT));
    }

    @Test
    void missingPayload() {
        assertThatThrownBy(() -> codec.decode(SUBJECT, json("{\"type\":\"service_request\"}")))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessage("envelope has no payload");
    }

    @Test
    void validationFailuresAreMalformed() {
        Envelope env = codec.decode(SUBJECT, json(
                "{\"type\":\"service_request\",\"payload\":{\"requesting_service\":\"emergency_dispatch_center\"}}"));

        assertThatThrownBy(() -> codec.bindPayload(SUBJECT, env))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessageContaining("departmentNeeded");
    }

    @Test
    void announcementStatusIsConstrained() {
        Envelope env = codec.decode("city.department_announcement.all", json(
                "{\"type\":\"department_announcement\",\"payload\":{\"department_name\":\"fire_department\",\"status\":\"sleeping\"}}"));

        assertThatThrownBy(() -> codec.bindPayload("city.department_announcement.all", env))
                .isInstanceOf(MalformedMessageException.class)
                .hasMessageContaining("status");
    }
}
