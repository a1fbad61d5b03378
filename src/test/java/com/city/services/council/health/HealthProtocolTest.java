package com.city.services.council.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;
import com.city.services.council.supervisor.HealthObservation;
import com.city.services.support.RecordingPublisher;

import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class HealthProtocolTest {

    private RecordingPublisher publisher;
    private HealthProtocol protocol;

    @BeforeEach
    void setUp() {
        publisher = new RecordingPublisher();
        protocol = new HealthProtocol(publisher, "city_council");
    }

    @Test
    void sendCheckPublishesToTheDepartment() {
        String checkId = protocol.sendCheck("parks_department");

        RecordingPublisher.Published p = publisher.ofType(MessageType.HEALTH_CHECK).get(0);
        assertThat(p.from()).isEqualTo("city_council");
        assertThat(p.recipient()).isEqualTo("parks_department");
        assertThat(p.payload()).isEqualTo(new HealthCheckRequest(checkId, "city_council", "parks_department"));
        assertThat(protocol.hasOutstandingCheck("parks_department")).isTrue();
    }

    @Test
    void matchingReplyIsAcceptedOnce() {
        String checkId = protocol.sendCheck("parks_department");
        HealthStatusReply reply = new HealthStatusReply(checkId, "parks_department", "healthy", 42.5, 7L);

        HealthObservation obs = protocol.onReply(reply).orElseThrow();
        assertThat(obs.healthy()).isTrue();
        assertThat(obs.checkId()).isEqualTo(checkId);
        assertThat(obs.messageCount()).isEqualTo(7L);

        assertThat(protocol.onReply(reply)).isEmpty();
        assertThat(protocol.hasOutstandingCheck("parks_department")).isFalse();
    }

    @Test
    void staleReplyIsDiscarded() {
        String first = protocol.sendCheck("parks_department");
        String second = protocol.sendCheck("parks_department");

        assertThat(protocol.onReply(new HealthStatusReply(first, "parks_department", "healthy", null, null))).isEmpty();
        assertThat(protocol.onReply(new HealthStatusReply(second, "parks_department", "warning", null, null)))
                .get().extracting(HealthObservation::healthy).isEqualTo(false);
    }

    @Test
    void unsolicitedReplyIsDiscarded() {
        assertThat(protocol.onReply(new HealthStatusReply("x", "parks_department", "healthy", null, null))).isEmpty();
    }

    @Test
    void replyWithoutCheckIdAnswersTheOutstandingCheck() {
        protocol.sendCheck("parks_department");

        assertThat(protocol.onReply(new HealthStatusReply(null, "parks_department", "healthy", null, null))).isPresent();
    }

    @Test
    void cancelledCheckIgnoresLateReply() {
        String checkId = protocol.sendCheck("parks_department");
        protocol.cancel("parks_department");

        assertThat(protocol.onReply(new HealthStatusReply(checkId, "parks_department", "healthy", null, null))).isEmpty();
    }

    @Test
    void failedPublishStillLeavesTheCheckOutstanding() {
        HealthProtocol failing = new HealthProtocol(
                (from, type, recipient, payload) -> Mono.error(new IllegalStateException("bus down")), "city_council");

        failing.sendCheck("parks_department");

        // Silence is detected by the supervisor on a later tick.
        assertThat(failing.hasOutstandingCheck("parks_department")).isTrue();
    }
}
