package com.city.services.council.supervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.model.DepartmentStatus;
import com.city.services.council.CouncilProperties;
import com.city.services.council.process.DepartmentProcess;
import com.city.services.council.process.ProcessLaunchException;
import com.city.services.council.process.ProcessLauncher;

/**
 * =====================================================================
 * ProcessSupervisor
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the lifecycle of every department process: spawn, liveness
 * probe, health request, bounded restart and permanent-failure demotion.
 *
 * TICK (once per supervision cycle, every non-failed department)
 * --------------------------------------------------------------
 *  1. Liveness probe. Dead: process failures + 1. Alive: reset to 0.
 *  2. Alive and awaiting a reply past the silence window: health
 *     failures + 1, awaiting cleared.
 *  3. Either counter at the failure threshold:
 *       restart budget left  -> kill stale, spawn fresh, RESTARTING
 *       budget exhausted     -> kill stale, PERMANENTLY_FAILED
 *  4. Alive and not awaiting: send a health check.
 *
 * A healthy reply while the process is alive moves the department to
 * RUNNING and resets both counters and the restart count.
 *
 * LOCKING
 * -------
 * One monitor guards the department map and every record in it. Spawns,
 * kills and health sends happen after the monitor is released; their
 * outcome is observed on the next tick.
 *
 * RETIREMENT
 * ----------
 * {@link #retire} forgets the record under the monitor and returns the
 * process; {@link #stop} kills it wherever the caller chooses to block.
 *
 * SHUTDOWN
 * --------
 * {@link #drain()} stops new health checks and restarts;
 * {@link #terminateAll()} then kills every tracked process synchronously.
 */
public class ProcessSupervisor implements DepartmentRoster {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final ProcessLauncher launcher;
    private final HealthCheckSender healthSender;
    private final Clock clock;
    private final Duration silenceWindow;
    private final int failureThreshold;
    private final int maxRestarts;

    private final Object lock = new Object();
    private final Map<String, DepartmentRecord> records = new LinkedHashMap<>();
    private boolean draining;

    public ProcessSupervisor(ProcessLauncher launcher,
                             HealthCheckSender healthSender,
                             Clock clock,
                             CouncilProperties.Supervision props) {
        if (props.getFailureThreshold() < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (props.getMaxRestarts() < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0");
        }
        this.launcher = launcher;
        this.healthSender = healthSender;
        this.clock = clock;
        this.silenceWindow = props.getSilenceWindow();
        this.failureThreshold = props.getFailureThreshold();
        this.maxRestarts = props.getMaxRestarts();
    }

    /**
     * Starts tracking a department and spawns its process.
     *
     * <p>An already tracked name is returned as is. A spawn failure leaves the record without a
     * process; the next tick counts it as a process failure.</p>
     *
     * @return the spawned process, empty when the name was already tracked or the spawn failed
     */
    public Optional<DepartmentProcess> register(String name) {
        synchronized (lock) {
            if (draining) {
                log.info("Not registering {} while draining", name);
                return Optional.empty();
            }
            if (records.containsKey(name)) {
                return Optional.empty();
            }
            records.put(name, new DepartmentRecord(name, clock.instant()));
        }

        DepartmentProcess spawned = spawnQuietly(name);

        boolean retired;
        synchronized (lock) {
            DepartmentRecord r = records.get(name);
            retired = r == null;
            if (r != null) {
                if (spawned == null) {
                    r.lastFailure = clock.instant();
                } else {
                    r.process = spawned;
                }
            }
        }
        if (retired) {
            // Retired while spawning.
            if (spawned != null) {
                terminateQuietly(spawned);
            }
            return Optional.empty();
        }
        if (spawned == null) {
            return Optional.empty();
        }
        log.info("Registered department={} pid={}", name, spawned.pid());
        return Optional.of(spawned);
    }

    /**
     * Non-blocking liveness probe of the department's current process.
     */
    public boolean probeLiveness(String name) {
        DepartmentProcess p;
        synchronized (lock) {
            DepartmentRecord r = records.get(name);
            p = r == null ? null : r.process;
        }
        return p != null && launcher.isAlive(p);
    }

    /**
     * Fire-and-forget health check.
     *
     * @return false when the department is unknown, failed, or the supervisor is draining
     */
    public boolean requestHealth(String name) {
        synchronized (lock) {
            DepartmentRecord r = records.get(name);
            if (r == null || r.status == DepartmentStatus.PERMANENTLY_FAILED || draining) {
                return false;
            }
            r.awaitingResponse = true;
            r.lastHealthRequest = clock.instant();
        }

        String checkId = healthSender.sendCheck(name);

        synchronized (lock) {
            DepartmentRecord r = records.get(name);
            if (r != null && r.awaitingResponse) {
                r.pendingCheckId = checkId;
            }
        }
        return true;
    }

    /**
     * Applies a correlated health reply.
     *
     * @return the status change it caused, if any
     */
    public Optional<StatusTransition> recordHealthReply(HealthObservation obs) {
        synchronized (lock) {
            DepartmentRecord r = records.get(obs.departmentName());
            if (r == null || r.status == DepartmentStatus.PERMANENTLY_FAILED) {
                log.debug("Discarding health reply from {} (unknown or permanently failed)", obs.departmentName());
                return Optional.empty();
            }

            r.awaitingResponse = false;
            r.pendingCheckId = null;
            r.reportedStatus = obs.status();
            r.uptimeSeconds = obs.uptimeSeconds();
            r.messageCount = obs.messageCount();

            DepartmentStatus before = r.status;

            if (obs.healthy()) {
                if (r.process == null || r.processFailures > 0) {
                    // Healthy text from a process the last probe saw dead is not a recovery.
                    log.debug("Healthy reply from {} without a live process; ignored", r.name);
                    return Optional.empty();
                }
                r.healthFailures = 0;
                r.restartCount = 0;
                if (before != DepartmentStatus.RUNNING) {
                    r.status = DepartmentStatus.RUNNING;
                    log.info("Department {} is running (was {})", r.name, before);
                    return Optional.of(new StatusTransition(r.name, before, DepartmentStatus.RUNNING,
                            r.process.pid(), "healthy reply"));
                }
                return Optional.empty();
            }

            r.healthFailures++;
            r.lastFailure = clock.instant();
            log.warn("Unhealthy reply from {} status={} healthFailures={}", r.name, obs.status(), r.healthFailures);
            if (before == DepartmentStatus.RUNNING) {
                r.status = DepartmentStatus.UNRESPONSIVE;
                return Optional.of(new StatusTransition(r.name, before, DepartmentStatus.UNRESPONSIVE,
                        r.process == null ? null : r.process.pid(), "unhealthy reply: " + obs.status()));
            }
            return Optional.empty();
        }
    }

    /**
     * Runs one supervision cycle.
     *
     * @return every status change made during the cycle, restarts included
     */
    public List<StatusTransition> tick() {
        Instant now = clock.instant();
        List<StatusTransition> transitions = new ArrayList<>();
        Map<String, DepartmentStatus> restarts = new LinkedHashMap<>();
        List<DepartmentProcess> kills = new ArrayList<>();
        List<String> healthRequests = new ArrayList<>();
        List<String> demoted = new ArrayList<>();

        synchronized (lock) {
            for (DepartmentRecord r : records.values()) {
                if (r.status == DepartmentStatus.PERMANENTLY_FAILED) {
                    continue;
                }

                boolean alive = r.process != null && launcher.isAlive(r.process);
                r.lastProcessCheck = now;

                if (!alive) {
                    r.processFailures++;
                    r.lastFailure = now;
                    log.warn("Department {} process not alive (processFailures={})", r.name, r.processFailures);
                } else {
                    r.processFailures = 0;
                    if (r.awaitingResponse && r.lastHealthRequest != null
                            && Duration.between(r.lastHealthRequest, now).compareTo(silenceWindow) > 0) {
                        r.healthFailures++;
                        r.awaitingResponse = false;
                        r.pendingCheckId = null;
                        r.lastFailure = now;
                        log.warn("Department {} sent no health reply within {} (healthFailures={})",
                                r.name, silenceWindow, r.healthFailures);
                        if (r.status == DepartmentStatus.RUNNING) {
                            r.status = DepartmentStatus.UNRESPONSIVE;
                            transitions.add(new StatusTransition(r.name, DepartmentStatus.RUNNING,
                                    DepartmentStatus.UNRESPONSIVE, r.process.pid(), "no health reply"));
                        }
                    }
                }

                boolean thresholdCrossed = r.processFailures >= failureThreshold || r.healthFailures >= failureThreshold;

                if (thresholdCrossed && !draining) {
                    DepartmentStatus before = r.status;
                    if (r.process != null) {
                        kills.add(r.process);
                        r.process = null;
                    }
                    if (r.restartCount >= maxRestarts) {
                        r.status = DepartmentStatus.PERMANENTLY_FAILED;
                        r.awaitingResponse = false;
                        r.pendingCheckId = null;
                        demoted.add(r.name);
                        log.error("Department {} permanently failed after {} restarts", r.name, r.restartCount);
                        transitions.add(new StatusTransition(r.name, before, DepartmentStatus.PERMANENTLY_FAILED,
                                null, "restart budget exhausted"));
                    } else {
                        r.resetFailures();
                        r.restartCount++;
                        r.lastRestart = now;
                        r.status = DepartmentStatus.RESTARTING;
                        restarts.put(r.name, before);
                        log.warn("Restarting department {} (restart {}/{})", r.name, r.restartCount, maxRestarts);
                    }
                } else if (alive && !r.awaitingResponse && !draining) {
                    healthRequests.add(r.name);
                }
            }
        }

        kills.forEach(this::terminateQuietly);
        demoted.forEach(healthSender::cancel);

        for (Map.Entry<String, DepartmentStatus> restart : restarts.entrySet()) {
            String name = restart.getKey();
            healthSender.cancel(name);
            DepartmentProcess fresh = spawnQuietly(name);
            boolean retired;
            synchronized (lock) {
                DepartmentRecord r = records.get(name);
                retired = r == null;
                if (r != null) {
                    if (fresh != null) {
                        r.process = fresh;
                    } else {
                        r.lastFailure = clock.instant();
                    }
                }
            }
            if (retired) {
                if (fresh != null) {
                    terminateQuietly(fresh);
                }
                continue;
            }
            transitions.add(new StatusTransition(name, restart.getValue(), DepartmentStatus.RESTARTING,
                    fresh == null ? null : fresh.pid(),
                    fresh == null ? "restart spawn failed" : "restarted"));
        }

        healthRequests.forEach(this::requestHealth);
        return transitions;
    }

    /**
     * Stops supervising a department retired by an approved termination.
     *
     * <p>The record is gone when this returns; the process is left running so the
     * caller can hand the kill to another thread through {@link #stop}.</p>
     *
     * @return the process still to stop, empty when the name was untracked or had no process
     */
    public Optional<DepartmentProcess> retire(String name) {
        DepartmentRecord removed;
        synchronized (lock) {
            removed = records.remove(name);
        }
        if (removed == null) {
            return Optional.empty();
        }
        healthSender.cancel(name);
        log.info("Retired department {}", name);
        return Optional.ofNullable(removed.process);
    }

    /**
     * Kills a process no longer tracked by this supervisor. Blocks for as long as the
     * launcher's graceful stop takes.
     */
    public void stop(DepartmentProcess process) {
        terminateQuietly(process);
        log.info("Stopped department={} pid={}", process.departmentName(), process.pid());
    }

    /**
     * Stops issuing health checks and restarts. Irreversible.
     */
    public void drain() {
        synchronized (lock) {
            draining = true;
        }
        log.info("Supervisor draining; no further health checks or restarts");
    }

    /**
     * Synchronously terminates every tracked process.
     */
    public void terminateAll() {
        List<DepartmentProcess> processes = new ArrayList<>();
        synchronized (lock) {
            for (DepartmentRecord r : records.values()) {
                if (r.process != null) {
                    processes.add(r.process);
                    r.process = null;
                }
            }
        }
        log.info("Terminating {} department processes", processes.size());
        processes.forEach(this::terminateQuietly);
    }

    public List<DepartmentSnapshot> snapshots() {
        synchronized (lock) {
            return records.values().stream().map(DepartmentRecord::snapshot).toList();
        }
    }

    public Optional<DepartmentSnapshot> snapshot(String name) {
        synchronized (lock) {
            return Optional.ofNullable(records.get(name)).map(DepartmentRecord::snapshot);
        }
    }

    public Collection<String> names() {
        synchronized (lock) {
            return List.copyOf(records.keySet());
        }
    }

    @Override
    public boolean isKnown(String name) {
        synchronized (lock) {
            return records.containsKey(name);
        }
    }

    @Override
    public boolean isLive(String name) {
        synchronized (lock) {
            DepartmentRecord r = records.get(name);
            return r != null && r.status.isLive();
        }
    }

    public boolean isDraining() {
        synchronized (lock) {
            return draining;
        }
    }

    private DepartmentProcess spawnQuietly(String name) {
        try {
            return launcher.spawn(name);
        } catch (ProcessLaunchException e) {
            log.warn("Spawn failed for department {}: {}", name, e.getMessage());
            return null;
        }
    }

    private void terminateQuietly(DepartmentProcess p) {
        try {
            launcher.terminate(p);
        } catch (RuntimeException e) {
            log.warn("Failed to terminate department={} pid={}: {}", p.departmentName(), p.pid(), e.toString());
        }
    }
}
