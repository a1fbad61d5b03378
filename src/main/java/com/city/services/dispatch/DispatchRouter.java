package com.city.services.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import com.city.services.bus.consumer.BusEndpoint;
import com.city.services.bus.consumer.MessageHandler;
import com.city.services.core.message.DepartmentAnnouncement;
import com.city.services.core.message.EmergencyCall;
import com.city.services.core.message.HealthCheckRequest;
import com.city.services.core.message.HealthStatusReply;
import com.city.services.core.message.MessageType;
import com.city.services.core.message.ServiceRequest;
import com.city.services.core.model.ChangeNotification;
import com.city.services.core.model.ChangeType;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.core.subject.CitySubject;
import com.city.services.council.registry.RegistryScanner;
import com.city.services.routing.RoutingTable;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * =====================================================================
 * DispatchRouter
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The emergency dispatch center. Classifies each incoming call, resolves
 * every candidate department through its own routing table mirror and
 * forwards the call to each live target.
 *
 * UNAVAILABLE TARGETS
 * -------------------
 *  - A ServiceRequest goes to the council for the resolved name.
 *  - The call is parked under the classified name until that name
 *    resolves to an available department (launched / active announcement,
 *    created notification, routing change, registry rescan) or the
 *    pending timeout elapses.
 *  - When no candidate is live, the default department takes the call if
 *    it is live itself.
 *  - An expired call is reported undeliverable only when no department
 *    ever received it; otherwise the parked entry is dropped.
 *
 * CHANGE NOTIFICATIONS
 * --------------------
 * Applied to the mirror as soon as they are effective. Notifications
 * with a future effective time are staged and applied by housekeeping.
 *
 * THREAD SAFETY
 * -------------
 * Pending calls, staged notifications and counters share one mutex.
 * Publishing happens outside it.
 */
public class DispatchRouter implements BusEndpoint, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(DispatchRouter.class);

    private static final DateTimeFormatter CALL_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final String name;
    private final String councilName;
    private final BusPublisher publisher;
    private final DepartmentClassifier classifier;
    private final DepartmentDirectory directory;
    private final RegistryScanner registry;
    private final RoutingTable routing;
    private final DispatchProperties props;
    private final Clock clock;
    private final Scheduler scheduler;
    private final Instant startedAt;

    private final AtomicReference<Disposable> housekeeping = new AtomicReference<>();

    private final Object lock = new Object();
    // Guarded by lock.
    private final List<PendingCall> pending = new ArrayList<>();
    private final List<ChangeNotification> staged = new ArrayList<>();
    private final Map<String, Long> dispatches = new TreeMap<>();
    private long callCounter;
    private long undeliverable;

    public DispatchRouter(String name,
                          String councilName,
                          BusPublisher publisher,
                          DepartmentClassifier classifier,
                          DepartmentDirectory directory,
                          RegistryScanner registry,
                          DispatchProperties props,
                          Clock clock,
                          Scheduler scheduler) {
        this.name = CitySubject.requireToken(name, "dispatch name");
        this.councilName = councilName;
        this.publisher = publisher;
        this.classifier = classifier;
        this.directory = directory;
        this.registry = registry;
        this.props = props;
        this.clock = clock;
        this.scheduler = scheduler;
        this.routing = new RoutingTable(directory);
        this.startedAt = clock.instant();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    public void start() {
        if (housekeeping.get() != null) {
            return;
        }
        Duration every = props.getRescanInterval();
        Disposable d = Flux.interval(Duration.ZERO, every, scheduler)
                .subscribe(
                        t -> housekeepSafely(),
                        err -> log.error("Dispatch housekeeping terminated unexpectedly: {}", err.toString(), err)
                );
        if (housekeeping.compareAndSet(null, d)) {
            log.info("Dispatch center {} started (housekeeping every {})", name, every);
        } else {
            d.dispose();
        }
    }

    private void housekeepSafely() {
        try {
            housekeep();
        } catch (RuntimeException e) {
            log.error("Dispatch housekeeping failed: {}", e.toString(), e);
        }
    }

    /**
     * Rescans the registry, applies staged notifications that became effective, retries
     * parked calls and expires the ones past their deadline.
     */
    public List<UndeliverableCall> housekeep() {
        rescan();
        applyStaged();
        retryPending();
        return expirePending();
    }

    void rescan() {
        List<String> found;
        try {
            found = registry.scan();
        } catch (RuntimeException e) {
            log.warn("Registry scan failed: {}", e.toString());
            return;
        }
        List<String> added = directory.addAll(found);
        if (!added.isEmpty()) {
            log.info("New departments available: {}", added);
        }
    }

    @Override
    public void destroy() {
        Disposable d = housekeeping.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
        synchronized (lock) {
            if (!pending.isEmpty()) {
                log.warn("Dispatch center stopping with {} parked calls", pending.size());
            }
        }
    }

    // ---------------------------------------------------------------------
    // Calls
    // ---------------------------------------------------------------------

    public DispatchResult route(EmergencyCall inbound) {
        EmergencyCall call = inbound.withCallId(nextCallId(inbound));
        log.warn("911 CALL {}: {} at {} - {}",
                call.callId(), call.emergencyType(), call.callerLocation(), call.description());

        List<String> required = classifier.classify(call);
        Set<String> dispatched = new LinkedHashSet<>();
        // Unavailable target -> classified name it was resolved from.
        Map<String, String> awaiting = new LinkedHashMap<>();

        for (String dept : required) {
            String target = routing.resolve(dept);
            if (!target.equals(dept)) {
                log.info("Routing redirected for call {}: {} -> {}", call.callId(), dept, target);
            }
            if (directory.isLive(target)) {
                dispatched.add(target);
            } else {
                awaiting.putIfAbsent(target, dept);
            }
        }

        if (dispatched.isEmpty() && directory.isLive(props.getDefaultDepartment())) {
            log.info("No classified department available for call {}; using {}",
                    call.callId(), props.getDefaultDepartment());
            dispatched.add(props.getDefaultDepartment());
        }

        Instant now = clock.instant();
        AtomicBoolean delivered = new AtomicBoolean(!dispatched.isEmpty());
        synchronized (lock) {
            for (String requested : awaiting.values()) {
                pending.add(new PendingCall(call, requested, delivered, now, now.plus(props.getPendingTimeout())));
            }
        }

        dispatched.forEach(target -> forward(call, target));
        awaiting.keySet().forEach(target -> requestDepartment(call, target));

        return new DispatchResult(call.callId(), new ArrayList<>(dispatched), new ArrayList<>(awaiting.keySet()));
    }

    private String nextCallId(EmergencyCall call) {
        long n;
        synchronized (lock) {
            n = ++callCounter;
        }
        if (call.callId() != null && !call.callId().isBlank()) {
            return call.callId();
        }
        return "911-" + CALL_ID_TIME.format(clock.instant()) + "-" + String.format("%04d", n % 10_000);
    }

    private void forward(EmergencyCall call, String department) {
        synchronized (lock) {
            dispatches.merge(department, 1L, Long::sum);
        }
        publisher.publish(name, MessageType.EMERGENCY_CALL, department, call)
                .subscribe(
                        id -> log.info("Forwarded call {} to {}", call.callId(), department),
                        err -> log.warn("Call {} to {} not published: {}", call.callId(), department, err.toString())
                );
    }

    private void requestDepartment(EmergencyCall call, String department) {
        String service = department.replace("_department", "").replace('_', ' ');
        ServiceRequest request = new ServiceRequest(
                name,
                call.emergencyType(),
                "Need " + service + " department to handle: " + call.description(),
                call.severity() == null ? "high" : call.severity(),
                call.callId(),
                department);
        publisher.publish(name, MessageType.SERVICE_REQUEST, councilName, request)
                .subscribe(
                        id -> log.warn("Requested department {} from {} for call {}", department, councilName, call.callId()),
                        err -> log.warn("Service request for {} not published: {}", department, err.toString())
                );
    }

    /**
     * Forwards every parked call whose classified department now resolves to a live target.
     *
     * @return number of calls released
     */
    public int retryPending() {
        List<PendingCall> ready = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        synchronized (lock) {
            Iterator<PendingCall> it = pending.iterator();
            while (it.hasNext()) {
                PendingCall p = it.next();
                String target = routing.resolve(p.requested());
                if (directory.isLive(target)) {
                    it.remove();
                    p.delivered().set(true);
                    ready.add(p);
                    targets.add(target);
                }
            }
        }
        for (int i = 0; i < ready.size(); i++) {
            PendingCall p = ready.get(i);
            log.info("Releasing parked call {} to {} after {}",
                    p.call().callId(), targets.get(i), Duration.between(p.parkedAt(), clock.instant()));
            forward(p.call(), targets.get(i));
        }
        return ready.size();
    }

    /**
     * Removes parked calls whose deadline has passed.
     *
     * @return the expired calls no department received
     */
    public List<UndeliverableCall> expirePending() {
        Instant now = clock.instant();
        List<UndeliverableCall> expired = new ArrayList<>();
        List<PendingCall> dropped = new ArrayList<>();
        synchronized (lock) {
            Iterator<PendingCall> it = pending.iterator();
            while (it.hasNext()) {
                PendingCall p = it.next();
                if (now.isBefore(p.deadline())) {
                    continue;
                }
                it.remove();
                if (p.delivered().get()) {
                    dropped.add(p);
                } else {
                    expired.add(new UndeliverableCall(p.call().callId(), p.requested(), p.call(), p.parkedAt()));
                }
            }
            undeliverable += expired.size();
        }
        for (PendingCall p : dropped) {
            log.warn("Call {} handled elsewhere; stopped waiting for {} (parked since {})",
                    p.call().callId(), p.requested(), p.parkedAt());
        }
        for (UndeliverableCall u : expired) {
            log.error("Call {} undeliverable: department {} not available since {}",
                    u.callId(), u.department(), u.parkedAt());
        }
        return expired;
    }

    // ---------------------------------------------------------------------
    // Department changes
    // ---------------------------------------------------------------------

    public void onAnnouncement(DepartmentAnnouncement a) {
        if (a.announcesAvailability()) {
            if (directory.add(a.departmentName())) {
                log.info("Department now available: {} (status={}, pid={})",
                        a.departmentName(), a.status(), a.processId());
            }
            retryPending();
        } else if (DepartmentAnnouncement.FAILED.equals(a.status())) {
            directory.remove(a.departmentName());
            log.error("Council reports department {} failed: {}", a.departmentName(), a.description());
        } else {
            log.info("Council created department {}", a.departmentName());
        }
    }

    public void onChange(ChangeNotification n) {
        if (!n.isEffectiveAt(clock.instant())) {
            synchronized (lock) {
                staged.add(n);
            }
            log.info("Staged change id={} type={} effective at {}", n.changeId(), n.changeType().wire(), n.effectiveAt());
            return;
        }
        apply(n);
        retryPending();
    }

    private void apply(ChangeNotification n) {
        routing.apply(n);
        if (n.changeType() == ChangeType.CREATED && n.newDepartment() != null) {
            directory.add(n.newDepartment());
        }
        if (!n.emergencyTypesAffected().isEmpty()) {
            log.warn("Change {} affects emergency types {}", n.changeId(), n.emergencyTypesAffected());
        }
    }

    /**
     * Applies staged notifications whose effective time has passed, in arrival order.
     *
     * @return number applied
     */
    public int applyStaged() {
        Instant now = clock.instant();
        List<ChangeNotification> due = new ArrayList<>();
        synchronized (lock) {
            Iterator<ChangeNotification> it = staged.iterator();
            while (it.hasNext()) {
                ChangeNotification n = it.next();
                if (n.isEffectiveAt(now)) {
                    it.remove();
                    due.add(n);
                }
            }
        }
        due.forEach(this::apply);
        return due.size();
    }

    public void onHealthCheck(HealthCheckRequest request) {
        double uptime = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        long calls;
        synchronized (lock) {
            calls = callCounter;
        }
        HealthStatusReply reply = new HealthStatusReply(request.checkId(), name, HealthStatusReply.HEALTHY, uptime, calls);
        publisher.publish(name, MessageType.HEALTH_STATUS, request.from(), reply)
                .subscribe(
                        id -> log.debug("Responded to health check from {}", request.from()),
                        err -> log.warn("Health reply to {} not published: {}", request.from(), err.toString())
                );
    }

    // ---------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------

    public DispatchStats stats() {
        synchronized (lock) {
            return new DispatchStats(callCounter, pending.size(), undeliverable, Map.copyOf(dispatches));
        }
    }

    public int stagedCount() {
        synchronized (lock) {
            return staged.size();
        }
    }

    public RoutingTable routing() {
        return routing;
    }

    public DepartmentDirectory directory() {
        return directory;
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
        return List.of(
                new Subscription("inbox", CitySubject.inboxFilter(name)),
                new Subscription("announcements", CitySubject.broadcastFilter(MessageType.DEPARTMENT_ANNOUNCEMENT))
        );
    }

    @Override
    public Map<MessageType, MessageHandler> handlers() {
        Map<MessageType, MessageHandler> h = new EnumMap<>(MessageType.class);
        h.put(MessageType.EMERGENCY_CALL, MessageHandler.of(EmergencyCall.class, this::route));
        h.put(MessageType.DEPARTMENT_CHANGE, MessageHandler.of(ChangeNotification.class, this::onChange));
        h.put(MessageType.DEPARTMENT_ANNOUNCEMENT, MessageHandler.of(DepartmentAnnouncement.class, this::onAnnouncement));
        h.put(MessageType.HEALTH_CHECK, MessageHandler.of(HealthCheckRequest.class, this::onHealthCheck));
        return h;
    }

    /**
     * @param requested classified department name, resolved again on every retry
     * @param delivered shared by every parked entry of the same call
     */
    private record PendingCall(EmergencyCall call,
                               String requested,
                               AtomicBoolean delivered,
                               Instant parkedAt,
                               Instant deadline) {
    }
}
