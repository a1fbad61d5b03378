package com.city.services.council.notify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.message.CouncilDecisionMessage;
import com.city.services.core.message.MessageType;
import com.city.services.core.model.ChangeNotification;
import com.city.services.core.model.ChangeType;
import com.city.services.core.model.ConsolidationRecommendation;
import com.city.services.core.model.Decision;
import com.city.services.core.model.Recommendation;
import com.city.services.core.model.RollbackInstructions;
import com.city.services.core.model.TerminationRecommendation;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.council.supervisor.DepartmentRoster;

/**
 * =====================================================================
 * NotificationDispatcher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns approved decisions into {@link ChangeNotification}s and delivers
 * them to every routing-aware consumer; sends every decision back to the
 * analyzer that proposed it.
 *
 * NOTIFICATION SHAPES
 * -------------------
 * consolidated: one edge per merged department -> proposed name,
 *               capabilities of each merged department -> unified list,
 *               fallback keyed on the successor.
 * terminated:   one edge retired department -> computed fallback,
 *               capabilities from the reassigned services,
 *               rollback instructions (restore_department).
 * created:      availability of a (re)created department.
 *
 * Sources the roster does not know get no edge; the rest of the
 * notification is still built and sent.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final BusPublisher publisher;
    private final DepartmentRoster roster;
    private final FallbackPolicy fallbackPolicy;
    private final Clock clock;
    private final String councilName;
    private final List<String> routingConsumers;
    private final Duration effectiveDelay;

    public NotificationDispatcher(BusPublisher publisher,
                                  DepartmentRoster roster,
                                  FallbackPolicy fallbackPolicy,
                                  Clock clock,
                                  String councilName,
                                  List<String> routingConsumers,
                                  Duration effectiveDelay) {
        this.publisher = publisher;
        this.roster = roster;
        this.fallbackPolicy = fallbackPolicy;
        this.clock = clock;
        this.councilName = councilName;
        this.routingConsumers = List.copyOf(routingConsumers);
        this.effectiveDelay = effectiveDelay == null ? Duration.ZERO : effectiveDelay;
    }

    /**
     * Sends the decision to the proposer and, when approved, broadcasts the resulting change.
     *
     * @return the broadcast notification, empty unless the decision was approved
     */
    public Optional<ChangeNotification> broadcast(Decision decision, Recommendation recommendation) {
        sendDecision(decision, recommendation);
        if (!decision.isApproved()) {
            return Optional.empty();
        }

        ChangeNotification notification;
        if (recommendation instanceof ConsolidationRecommendation c) {
            notification = consolidationNotice(c);
        } else if (recommendation instanceof TerminationRecommendation t) {
            notification = terminationNotice(t);
        } else {
            throw new IllegalArgumentException("Unsupported recommendation " + recommendation.getClass().getName());
        }

        publishToConsumers(notification);
        return Optional.of(notification);
    }

    public void sendDecision(Decision decision, Recommendation recommendation) {
        String proposer = recommendation.analyzedBy();
        publisher.publish(councilName, MessageType.COUNCIL_DECISION, proposer,
                        CouncilDecisionMessage.from(decision, councilName))
                .subscribe(
                        id -> log.info("Council decision sent to {}: id={} outcome={}",
                                proposer, decision.recommendationId(), decision.outcome().wire()),
                        err -> log.warn("Council decision to {} not published: id={} err={}",
                                proposer, decision.recommendationId(), err.toString())
                );
    }

    ChangeNotification consolidationNotice(ConsolidationRecommendation c) {
        String successor = c.proposedName();
        Map<String, String> routes = new LinkedHashMap<>();
        Map<String, List<String>> capabilities = new LinkedHashMap<>();

        for (String old : c.departmentsToMerge()) {
            if (!roster.isKnown(old)) {
                log.warn("Consolidation {} names unknown department {}; no routing entry", c.recommendationId(), old);
                continue;
            }
            routes.put(old, successor);
            if (!c.unifiedCapabilities().isEmpty()) {
                capabilities.put(old, c.unifiedCapabilities());
            }
        }

        return stamp(ChangeNotification.builder(ChangeType.CONSOLIDATED))
                .changeId(c.recommendationId())
                .affectedDepartments(c.departmentsToMerge())
                .newDepartment(successor)
                .routingChanges(routes)
                .capabilitiesMapping(capabilities)
                .emergencyTypesAffected(EmergencyTypeCatalog.affectedBy(c.departmentsToMerge()))
                .fallbackDepartment(FallbackPolicy.DISPATCH_CENTER)
                .additionalInstructions("Departments " + String.join(", ", c.departmentsToMerge())
                        + " are being merged into " + successor)
                .build();
    }

    ChangeNotification terminationNotice(TerminationRecommendation t) {
        String retired = t.departmentName();
        String fallback = fallbackPolicy.fallbackFor(retired);

        Map<String, String> routes = new LinkedHashMap<>();
        if (roster.isKnown(retired)) {
            routes.put(retired, fallback);
        } else {
            log.warn("Termination {} names unknown department {}; no routing entry", t.recommendationId(), retired);
        }

        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        for (TerminationRecommendation.ServiceReassignment r : t.servicesToReassign()) {
            capabilities.put(r.service(), List.of(r.reassignTo()));
        }

        return stamp(ChangeNotification.builder(ChangeType.TERMINATED))
                .changeId(t.recommendationId())
                .affectedDepartments(List.of(retired))
                .routingChanges(routes)
                .capabilitiesMapping(capabilities)
                .emergencyTypesAffected(EmergencyTypeCatalog.affectedBy(List.of(retired)))
                .fallbackDepartment(fallback)
                .additionalInstructions("Department " + retired + " is being terminated. Route calls to " + fallback)
                .rollback(new RollbackInstructions(RollbackInstructions.RESTORE_DEPARTMENT, retired, routes))
                .build();
    }

    /**
     * Broadcasts that a department exists (again). Consumers clear any override of its name.
     */
    public ChangeNotification announceCreated(String departmentName) {
        ChangeNotification n = ChangeNotification.builder(ChangeType.CREATED)
                .affectedDepartments(List.of(departmentName))
                .newDepartment(departmentName)
                .initiatedBy(councilName)
                .changedAt(clock.instant())
                .additionalInstructions("Department " + departmentName + " is available")
                .build();
        publishToConsumers(n);
        return n;
    }

    /**
     * Undoes a termination by announcing the retired department as created again.
     *
     * @throws IllegalArgumentException when the notification carries no rollback instructions
     */
    public ChangeNotification rollback(ChangeNotification original) {
        if (!original.rollbackAvailable() || original.rollback() == null) {
            throw new IllegalArgumentException("Change " + original.changeId() + " cannot be rolled back");
        }
        String restored = original.rollback().department();
        ChangeNotification n = ChangeNotification.builder(ChangeType.CREATED)
                .affectedDepartments(List.of(restored))
                .newDepartment(restored)
                .initiatedBy(councilName)
                .changedAt(clock.instant())
                .additionalInstructions("Rollback of change " + original.changeId() + ": "
                        + original.rollback().action() + " " + restored)
                .build();
        publishToConsumers(n);
        log.info("Rolled back change id={} department={}", original.changeId(), restored);
        return n;
    }

    private ChangeNotification.Builder stamp(ChangeNotification.Builder b) {
        Instant now = clock.instant();
        b.initiatedBy(councilName).changedAt(now);
        if (effectiveDelay.isZero() || effectiveDelay.isNegative()) {
            b.effectiveImmediately(true);
        } else {
            b.effectiveImmediately(false).effectiveAt(now.plus(effectiveDelay));
        }
        return b;
    }

    private void publishToConsumers(ChangeNotification n) {
        for (String consumer : routingConsumers) {
            publisher.publish(councilName, MessageType.DEPARTMENT_CHANGE, consumer, n)
                    .subscribe(
                            id -> log.info("Change notification sent to {}: id={} type={}",
                                    consumer, n.changeId(), n.changeType().wire()),
                            err -> log.warn("Change notification to {} not published: id={} err={}",
                                    consumer, n.changeId(), err.toString())
                    );
        }
    }
}
