package com.city.services.council.health;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.council.supervisor.HealthCheckSender;
import com.city.services.council.supervisor.HealthObservation;

/**
 * Request/reply correlation for department health checks.
 *
 * <h2>Outbound</h2>
 * {@link #sendCheck(String)} records a fresh check id as outstanding for the department and
 * publishes a {@link HealthCheckRequest} to {@code city.health_check.<department>}. The publish
 * is not awaited; a lost request simply shows up as a missing reply on a later tick.
 *
 * <h2>Inbound</h2>
 * {@link #onReply(HealthStatusReply)} accepts a reply only when the department has an
 * outstanding check and the reply carries that check's id (or none). Anything else
 * (unknown department, permanently failed department, reply to an older check) is dropped
 * at debug level.
 */
public class HealthProtocol implements HealthCheckSender {

    private static final Logger log = LoggerFactory.getLogger(HealthProtocol.class);

    private final BusPublisher publisher;
    private final String requester;

    /** department name to outstanding check id */
    private final Map<String, String> outstanding = new ConcurrentHashMap<>();

    public HealthProtocol(BusPublisher publisher, String requester) {
        this.publisher = publisher;
        this.requester = requester;
    }

    @Override
    public String sendCheck(String departmentName) {
        String checkId = UUID.randomUUID().toString();
        outstanding.put(departmentName, checkId);

        publisher.publish(requester, MessageType.HEALTH_CHECK, departmentName,
                        new HealthCheckRequest(checkId, requester, departmentName))
                .subscribe(
                        id -> log.debug("Health check sent to {} checkId={}", departmentName, checkId),
                        err -> log.warn("Health check to {} not published: {}", departmentName, err.toString())
                );
        return checkId;
    }

    @Override
    public void cancel(String departmentName) {
        outstanding.remove(departmentName);
    }

    public Optional<HealthObservation> onReply(HealthStatusReply reply) {
        String name = reply.serviceName();
        String expected = outstanding.get(name);
        if (expected == null) {
            log.debug("Discarding health reply from {}: no outstanding check", name);
            return Optional.empty();
        }
        if (reply.checkId() != null && !reply.checkId().equals(expected)) {
            log.debug("Discarding stale health reply from {} checkId={} expected={}", name, reply.checkId(), expected);
            return Optional.empty();
        }
        if (!outstanding.remove(name, expected)) {
            // A newer check was sent while this reply was in flight.
            return Optional.empty();
        }
        return Optional.of(new HealthObservation(
                name,
                reply.checkId(),
                reply.isHealthy(),
                reply.status(),
                reply.uptimeSeconds(),
                reply.messageCount()));
    }

    public boolean hasOutstandingCheck(String departmentName) {
        return outstanding.containsKey(departmentName);
    }
}
