package com.city.services.council;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import com.city.services.bus.consumer.BusEndpoint;
import com.city.services.bus.consumer.MessageHandler;
import com.city.services.core.message.AnalysisRequest;
import com.city.services.core.message.DepartmentAnnouncement;
import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;
import com.city.services.core.message.ServiceRequest;
import com.city.services.core.model.ChangeNotification;
import com.city.services.core.model.ConsolidationRecommendation;
import com.city.services.core.model.Decision;
import com.city.services.core.model.Recommendation;
import com.city.services.core.model.TerminationRecommendation;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.core.subject.CitySubject;
import com.city.services.council.health.HealthProtocol;
import com.city.services.council.notify.NotificationDispatcher;
import com.city.services.council.policy.DecisionLedger;
import com.city.services.council.policy.RecommendationEvaluator;
import com.city.services.council.process.DepartmentProcess;
import com.city.services.council.registry.RegistryScanner;
import com.city.services.council.supervisor.ProcessSupervisor;
import com.city.services.council.supervisor.StatusTransition;
import com.city.services.routing.RoutingTable;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * =====================================================================
 * CityCouncil
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The orchestrator. Drives supervision on a fixed cadence and reacts to
 * what departments, analyzers and routing-aware consumers send it.
 *
 * TICK
 * ----
 *  1. Rescan the registry; register new departments, warn about vanished
 *     ones (vanished departments keep running until terminated).
 *  2. Supervisor tick; announce restarts, recoveries and permanent
 *     failures.
 *  3. Log the health summary.
 *  4. Every analysis interval, with enough departments, ask the
 *     analyzers for recommendations.
 *
 * INBOX (city.*.&lt;council&gt;)
 * --------------------------
 *  health_status                  -> HealthProtocol -> supervisor
 *  consolidation_recommendation   -> ledger -> evaluator -> dispatcher
 *  termination_recommendation     -> ledger -> evaluator -> dispatcher
 *  service_request                -> provisioner -> register + announce
 *  health_check                   -> own status reply
 *
 * PROCESS WORK
 * ------------
 * Spawns and kills caused by inbox messages (service requests, approved
 * terminations, rollbacks) run on the scheduler, never on the bus
 * consumer thread.
 *
 * TIME
 * ----
 * The ticker runs on an injected Reactor {@link Scheduler} and reads an
 * injected {@link Clock}; tests drive both virtually.
 */
public class CityCouncil implements BusEndpoint, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(CityCouncil.class);

    private final String name;
    private final String broadcastName;
    private final RegistryScanner registry;
    private final ProcessSupervisor supervisor;
    private final HealthProtocol healthProtocol;
    private final RecommendationEvaluator evaluator;
    private final DecisionLedger ledger;
    private final NotificationDispatcher notifier;
    private final DepartmentProvisioner provisioner;
    private final RoutingTable routing;
    private final BusPublisher publisher;
    private final CouncilProperties props;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Instant startedAt;
    private final AtomicReference<Disposable> ticker = new AtomicReference<>();
    private final Object tickLock = new Object();

    private final Set<DepartmentProcess> stopping = ConcurrentHashMap.newKeySet();
    private final Set<String> provisioning = ConcurrentHashMap.newKeySet();

    // Guarded by tickLock.
    private Set<String> declared = new LinkedHashSet<>();
    private Instant lastAnalysis;

    public CityCouncil(String name,
                       String broadcastName,
                       RegistryScanner registry,
                       ProcessSupervisor supervisor,
                       HealthProtocol healthProtocol,
                       RecommendationEvaluator evaluator,
                       DecisionLedger ledger,
                       NotificationDispatcher notifier,
                       DepartmentProvisioner provisioner,
                       BusPublisher publisher,
                       CouncilProperties props,
                       Clock clock,
                       Scheduler scheduler) {
        this.name = CitySubject.requireToken(name, "council name");
        this.broadcastName = broadcastName;
        this.registry = registry;
        this.supervisor = supervisor;
        this.healthProtocol = healthProtocol;
        this.evaluator = evaluator;
        this.ledger = ledger;
        this.notifier = notifier;
        this.provisioner = provisioner;
        this.publisher = publisher;
        this.props = props;
        this.clock = clock;
        this.scheduler = scheduler;
        this.routing = new RoutingTable(supervisor);
        this.startedAt = clock.instant();
    }

    // ---------------------------------------------------------------------
    // Ticker
    // ---------------------------------------------------------------------

    /**
     * Idempotently starts the supervision cadence. The first tick runs immediately.
     */
    public void start() {
        if (ticker.get() != null) {
            return;
        }
        Duration every = props.getSupervision().getTickInterval();
        Disposable d = Flux.interval(Duration.ZERO, every, scheduler)
                .subscribe(
                        t -> tickSafely(),
                        err -> log.error("Council ticker terminated unexpectedly: {}", err.toString(), err)
                );
        if (ticker.compareAndSet(null, d)) {
            log.info("City council {} started (tick every {})", name, every);
        } else {
            d.dispose();
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // One bad cycle must not end supervision.
            log.error("Supervision tick failed: {}", e.toString(), e);
        }
    }

    /**
     * Runs one full orchestration cycle.
     */
    public void tick() {
        synchronized (tickLock) {
            if (supervisor.isDraining()) {
                return;
            }
            rescan();

            List<StatusTransition> transitions = supervisor.tick();
            transitions.forEach(this::announce);

            HealthSummary summary = healthSummary();
            if (summary.hasIssues()) {
                log.warn("Department health issues: {} unhealthy, {} warning, {} healthy",
                        summary.unhealthy(), summary.warning(), summary.healthy());
            } else if (summary.monitored() > 0) {
                log.debug("All {} monitored departments healthy", summary.healthy());
            }

            maybeRequestAnalysis();
        }
    }

    private void rescan() {
        List<String> current;
        try {
            current = registry.scan();
        } catch (RuntimeException e) {
            log.warn("Registry scan failed; keeping previous department set: {}", e.toString());
            return;
        }

        Set<String> now = new LinkedHashSet<>(current);
        Set<String> removed = new LinkedHashSet<>(declared);
        removed.removeAll(now);
        if (!removed.isEmpty()) {
            log.warn("Departments removed/missing from registry: {}", removed);
        }

        for (String dept : now) {
            if (!supervisor.isKnown(dept) && !declared.contains(dept)) {
                log.info("New department detected: {}", dept);
                Optional<DepartmentProcess> p = supervisor.register(dept);
                p.ifPresent(proc -> publishAnnouncement(dept, DepartmentAnnouncement.LAUNCHED, proc.pid(),
                        "registered from registry"));
            }
        }
        declared = now;
    }

    private void maybeRequestAnalysis() {
        CouncilProperties.Analysis analysis = props.getAnalysis();
        if (!analysis.isEnabled()) {
            return;
        }
        List<String> names = List.copyOf(supervisor.names());
        if (names.size() < analysis.getMinimumDepartments()) {
            return;
        }
        Instant now = clock.instant();
        if (lastAnalysis != null && Duration.between(lastAnalysis, now).compareTo(analysis.getInterval()) < 0) {
            return;
        }
        requestAnalysis("periodic_audit", List.of());
        lastAnalysis = now;
    }

    /**
     * Asks every configured analyzer for recommendations.
     *
     * @param targets departments to focus on, empty for all
     */
    public void requestAnalysis(String analysisType, List<String> targets) {
        AnalysisRequest request = new AnalysisRequest(
                analysisType,
                name,
                targets,
                props.getAnalysis().getFocusAreas(),
                "Periodic efficiency review to optimize city services");
        for (String analyzer : props.getAnalysis().getAnalyzers()) {
            publisher.publish(name, MessageType.ANALYSIS_REQUEST, analyzer, request)
                    .subscribe(
                            id -> log.info("Analysis request sent to {} type={}", analyzer, analysisType),
                            err -> log.warn("Analysis request to {} not published: {}", analyzer, err.toString())
                    );
        }
    }

    // ---------------------------------------------------------------------
    // Inbox handlers
    // ---------------------------------------------------------------------

    public void onHealthStatus(HealthStatusReply reply) {
        healthProtocol.onReply(reply)
                .flatMap(supervisor::recordHealthReply)
                .ifPresent(this::announce);
    }

    /**
     * Decides a recommendation exactly once. A redelivered recommendation gets its first
     * decision sent again and causes no second broadcast.
     */
    public Decision decide(Recommendation recommendation) {
        Optional<Decision> prior = ledger.find(recommendation.recommendationId());
        if (prior.isPresent()) {
            log.info("Recommendation {} already decided ({}); resending decision only",
                    recommendation.recommendationId(), prior.get().outcome().wire());
            notifier.sendDecision(prior.get(), recommendation);
            return prior.get();
        }

        Decision decision = evaluator.evaluate(recommendation);
        if (!ledger.record(decision)) {
            // Concurrent redelivery won the race.
            return ledger.find(recommendation.recommendationId()).orElse(decision);
        }

        Optional<ChangeNotification> change = notifier.broadcast(decision, recommendation);
        change.ifPresent(routing::apply);

        if (decision.isApproved() && recommendation instanceof TerminationRecommendation t) {
            String dept = t.departmentName();
            supervisor.retire(dept).ifPresent(p -> {
                stopping.add(p);
                offload("stop of retired " + dept, () -> stopRetired(p));
            });
        }
        return decision;
    }

    public void onServiceRequest(ServiceRequest request) {
        String needed = request.departmentNeeded();
        log.info("Service request from {} for {} (call={}, type={})",
                request.requestingService(), needed, request.originalCallId(), request.emergencyType());

        if (!CitySubject.isValidToken(needed)) {
            log.warn("Service request for invalid department name '{}' ignored", needed);
            return;
        }

        if (supervisor.isLive(needed)) {
            // Requester missed the earlier announcement.
            Long pid = supervisor.snapshot(needed).map(s -> s.pid()).orElse(null);
            publishAnnouncement(needed, DepartmentAnnouncement.ACTIVE, pid, "already available");
            return;
        }
        if (supervisor.isKnown(needed)) {
            publishAnnouncement(needed, DepartmentAnnouncement.FAILED, null, "department permanently failed");
            return;
        }

        Optional<String> provided = provisioner.provision(request);
        if (provided.isEmpty()) {
            publishAnnouncement(needed, DepartmentAnnouncement.FAILED, null, "no template for department");
            return;
        }

        String dept = provided.get();
        if (!provisioning.add(dept)) {
            log.info("Department {} is already being created", dept);
            return;
        }
        offload("creation of " + dept, () -> {
            try {
                createDepartment(dept, request.requestingService());
            } finally {
                provisioning.remove(dept);
            }
        });
    }

    private void createDepartment(String dept, String requester) {
        if (supervisor.isKnown(dept)) {
            log.info("Department {} was registered meanwhile; not creating it again", dept);
            return;
        }
        Optional<DepartmentProcess> process = supervisor.register(dept);
        ChangeNotification created = notifier.announceCreated(dept);
        routing.apply(created);
        if (process.isEmpty()) {
            // The next tick restarts it and announces the launch.
            log.warn("Department {} registered but its first launch failed", dept);
            return;
        }
        publishAnnouncement(dept, DepartmentAnnouncement.LAUNCHED, process.get().pid(),
                "created on request of " + requester);
    }

    /**
     * Restores a department retired by an earlier termination.
     *
     * @return false when the change cannot be rolled back
     */
    public boolean rollback(ChangeNotification termination) {
        if (!termination.rollbackAvailable() || termination.rollback() == null) {
            return false;
        }
        routing.revert(termination);
        String dept = termination.rollback().department();
        offload("restore of " + dept, () -> supervisor.register(dept).ifPresent(p ->
                publishAnnouncement(dept, DepartmentAnnouncement.LAUNCHED, p.pid(), "restored by rollback")));
        routing.apply(notifier.rollback(termination));
        return true;
    }

    public void onHealthCheck(HealthCheckRequest request) {
        int count = supervisor.names().size();
        double uptime = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        HealthStatusReply reply = new HealthStatusReply(request.checkId(), name, councilStatus(count), uptime, null);
        publisher.publish(name, MessageType.HEALTH_STATUS, request.from(), reply)
                .subscribe(
                        id -> log.info("Responded to health check from {}: {} ({} departments)",
                                request.from(), reply.status(), count),
                        err -> log.warn("Health reply to {} not published: {}", request.from(), err.toString())
                );
    }

    // ---------------------------------------------------------------------
    // Process work off the inbox thread
    // ---------------------------------------------------------------------

    /**
     * Runs spawn or kill work on the council scheduler so a bus handler never waits on a
     * process. Work that cannot be scheduled runs on the calling thread.
     */
    private void offload(String what, Runnable work) {
        Runnable guarded = () -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Council task '{}' failed: {}", what, e.toString(), e);
            }
        };
        try {
            scheduler.schedule(guarded);
        } catch (RejectedExecutionException e) {
            log.warn("Council scheduler rejected '{}'; running it inline", what);
            guarded.run();
        }
    }

    // Whoever removes the process from stopping kills it.
    private void stopRetired(DepartmentProcess p) {
        if (stopping.remove(p)) {
            supervisor.stop(p);
        }
    }

    static String councilStatus(int departmentCount) {
        if (departmentCount <= 2) {
            return "critical";
        }
        if (departmentCount <= 5) {
            return "warning";
        }
        return HealthStatusReply.HEALTHY;
    }

    // ---------------------------------------------------------------------
    // Announcements
    // ---------------------------------------------------------------------

    private void announce(StatusTransition t) {
        switch (t.to()) {
            case RESTARTING -> {
                if (t.pid() != null) {
                    publishAnnouncement(t.departmentName(), DepartmentAnnouncement.LAUNCHED, t.pid(), t.reason());
                }
            }
            case RUNNING -> publishAnnouncement(t.departmentName(), DepartmentAnnouncement.ACTIVE, t.pid(), t.reason());
            case PERMANENTLY_FAILED -> publishAnnouncement(t.departmentName(), DepartmentAnnouncement.FAILED, null, t.reason());
            default -> log.debug("Department {} {} -> {} ({})", t.departmentName(), t.from(), t.to(), t.reason());
        }
    }

    private void publishAnnouncement(String department, String status, Long pid, String description) {
        DepartmentAnnouncement a = new DepartmentAnnouncement(department, status, pid, description);
        publisher.publish(name, MessageType.DEPARTMENT_ANNOUNCEMENT, broadcastName, a)
                .subscribe(
                        id -> log.info("Announced department={} status={}", department, status),
                        err -> log.warn("Announcement for {} not published: {}", department, err.toString())
                );
    }

    // ---------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------

    public HealthSummary healthSummary() {
        return HealthSummary.of(supervisor.snapshots());
    }

    public String status() {
        return councilStatus(supervisor.names().size());
    }

    public RoutingTable routing() {
        return routing;
    }

    public ProcessSupervisor supervisor() {
        return supervisor;
    }

    // ---------------------------------------------------------------------
    // BusEndpoint
    // ---------------------------------------------------------------------

    @Override
    public String role() {
        return name;
    }

    @Override
    public List<Subscription> subscriptions() {
        return List.of(new Subscription("inbox", CitySubject.inboxFilter(name)));
    }

    @Override
    public Map<MessageType, MessageHandler> handlers() {
        Map<MessageType, MessageHandler> h = new EnumMap<>(MessageType.class);
        h.put(MessageType.HEALTH_STATUS, MessageHandler.of(HealthStatusReply.class, this::onHealthStatus));
        h.put(MessageType.CONSOLIDATION_RECOMMENDATION,
                MessageHandler.of(ConsolidationRecommendation.class, this::decide));
        h.put(MessageType.TERMINATION_RECOMMENDATION,
                MessageHandler.of(TerminationRecommendation.class, this::decide));
        h.put(MessageType.SERVICE_REQUEST, MessageHandler.of(ServiceRequest.class, this::onServiceRequest));
        h.put(MessageType.HEALTH_CHECK, MessageHandler.of(HealthCheckRequest.class, this::onHealthCheck));
        return h;
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    /**
     * Stops ticking, drains the supervisor, then terminates every department synchronously,
     * retired ones whose kill has not run yet included.
     */
    @Override
    public void destroy() {
        Disposable d = ticker.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
        supervisor.drain();
        synchronized (tickLock) {
            supervisor.terminateAll();
        }
        List.copyOf(stopping).forEach(this::stopRetired);
        log.info("City council {} stopped", name);
    }
}
