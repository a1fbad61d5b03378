package com.city.services.council.supervisor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.city.services.core.model.DepartmentStatus;
import com.city.services.council.CouncilProperties;
import com.city.services.council.process.DepartmentProcess;
import com.city.services.support.FakeLauncher;
import com.city.services.support.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessSupervisorTest {

    /** Records checks instead of publishing them. */
    static final class RecordingSender implements HealthCheckSender {
        final Map<String, String> outstanding = new ConcurrentHashMap<>();
        final List<String> sent = new ArrayList<>();
        final List<String> cancelled = new ArrayList<>();

        @Override
        public synchronized String sendCheck(String departmentName) {
            String id = departmentName + "-" + sent.size();
            sent.add(departmentName);
            outstanding.put(departmentName, id);
            return id;
        }

        @Override
        public synchronized void cancel(String departmentName) {
            cancelled.add(departmentName);
            outstanding.remove(departmentName);
        }

        synchronized long sentTo(String departmentName) {
            return sent.stream().filter(departmentName::equals).count();
        }
    }

    private final MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
    private FakeLauncher launcher;
    private RecordingSender sender;
    private CouncilProperties.Supervision props;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() {
        launcher = new FakeLauncher();
        sender = new RecordingSender();
        props = new CouncilProperties.Supervision();
        props.setFailureThreshold(1);
        props.setMaxRestarts(3);
        props.setSilenceWindow(Duration.ofSeconds(60));
        supervisor = new ProcessSupervisor(launcher, sender, clock, props);
    }

    private HealthObservation healthy(String name) {
        return new HealthObservation(name, sender.outstanding.get(name), true, "healthy", 12.0, 3L);
    }

    private DepartmentStatus status(String name) {
        return supervisor.snapshot(name).orElseThrow().status();
    }

    @Test
    @DisplayName("three departments, one crashing for four ticks: it fails permanently, the others run")
    void crashingDepartmentExhaustsRestartBudget() {
        supervisor.register("a_department");
        supervisor.register("b_department");
        supervisor.register("c_department");
        launcher.crash("b_department");

        List<StatusTransition> all = new ArrayList<>();
        for (int tick = 1; tick <= 4; tick++) {
            all.addAll(supervisor.tick());
            supervisor.recordHealthReply(healthy("a_department"));
            supervisor.recordHealthReply(healthy("c_department"));
        }

        assertThat(status("b_department")).isEqualTo(DepartmentStatus.PERMANENTLY_FAILED);
        assertThat(status("a_department")).isEqualTo(DepartmentStatus.RUNNING);
        assertThat(status("c_department")).isEqualTo(DepartmentStatus.RUNNING);

        // Initial spawn plus exactly maxRestarts restarts.
        assertThat(launcher.spawnCount("b_department")).isEqualTo(4);
        assertThat(supervisor.snapshot("b_department").orElseThrow().restartCount()).isEqualTo(3);
        assertThat(supervisor.isLive("b_department")).isFalse();
        assertThat(supervisor.isKnown("b_department")).isTrue();

        assertThat(all).filteredOn(t -> t.departmentName().equals("b_department"))
                .extracting(StatusTransition::to)
                .containsExactly(DepartmentStatus.RESTARTING, DepartmentStatus.RESTARTING,
                        DepartmentStatus.RESTARTING, DepartmentStatus.PERMANENTLY_FAILED);
    }

    @Test
    @DisplayName("a permanently failed department is never probed, checked or spawned again")
    void permanentlyFailedIsLeftAlone() {
        props.setMaxRestarts(0);
        supervisor = new ProcessSupervisor(launcher, sender, clock, props);
        supervisor.register("b_department");
        launcher.crash("b_department");

        supervisor.tick();
        assertThat(status("b_department")).isEqualTo(DepartmentStatus.PERMANENTLY_FAILED);

        for (int i = 0; i < 5; i++) {
            assertThat(supervisor.tick()).isEmpty();
        }
        assertThat(launcher.spawnCount("b_department")).isEqualTo(1);
        assertThat(sender.sentTo("b_department")).isZero();
        assertThat(supervisor.requestHealth("b_department")).isFalse();
        assertThat(supervisor.recordHealthReply(healthy("b_department"))).isEmpty();
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("a live department gets a check and moves to RUNNING on a healthy reply")
        void healthyReplyRuns() {
            supervisor.register("parks_department");

            supervisor.tick();
            assertThat(sender.sentTo("parks_department")).isEqualTo(1);
            assertThat(supervisor.snapshot("parks_department").orElseThrow().awaitingResponse()).isTrue();

            StatusTransition t = supervisor.recordHealthReply(healthy("parks_department")).orElseThrow();
            assertThat(t.from()).isEqualTo(DepartmentStatus.STARTING);
            assertThat(t.to()).isEqualTo(DepartmentStatus.RUNNING);
            assertThat(supervisor.snapshot("parks_department").orElseThrow().uptimeSeconds()).isEqualTo(12.0);
        }

        @Test
        @DisplayName("no second check while one is outstanding")
        void oneOutstandingCheck() {
            supervisor.register("parks_department");

            supervisor.tick();
            supervisor.tick();

            assertThat(sender.sentTo("parks_department")).isEqualTo(1);
        }

        @Test
        @DisplayName("silence past the window counts as a health failure")
        void silenceIsAFailure() {
            props.setFailureThreshold(2);
            supervisor = new ProcessSupervisor(launcher, sender, clock, props);
            supervisor.register("parks_department");
            supervisor.tick();
            supervisor.recordHealthReply(healthy("parks_department"));
            supervisor.tick();

            clock.advance(Duration.ofSeconds(61));
            List<StatusTransition> transitions = supervisor.tick();

            assertThat(transitions).extracting(StatusTransition::to).containsExactly(DepartmentStatus.UNRESPONSIVE);
            assertThat(supervisor.snapshot("parks_department").orElseThrow().healthFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("unhealthy replies demote RUNNING and count toward a restart")
        void unhealthyReplyCounts() {
            props.setFailureThreshold(2);
            supervisor = new ProcessSupervisor(launcher, sender, clock, props);
            supervisor.register("parks_department");
            supervisor.tick();
            supervisor.recordHealthReply(healthy("parks_department"));

            supervisor.tick();
            HealthObservation sick = new HealthObservation("parks_department", null, false, "critical", null, null);
            assertThat(supervisor.recordHealthReply(sick)).get()
                    .extracting(StatusTransition::to).isEqualTo(DepartmentStatus.UNRESPONSIVE);

            supervisor.tick();
            supervisor.recordHealthReply(sick);

            List<StatusTransition> transitions = supervisor.tick();
            assertThat(transitions).extracting(StatusTransition::to).containsExactly(DepartmentStatus.RESTARTING);
            assertThat(transitions.get(0).from()).isEqualTo(DepartmentStatus.UNRESPONSIVE);
            assertThat(transitions.get(0).pid()).isNotNull();
            assertThat(launcher.spawnCount("parks_department")).isEqualTo(2);
        }

        @Test
        @DisplayName("a healthy reply resets the restart count")
        void recoveryResetsBudget() {
            supervisor.register("b_department");
            launcher.crash("b_department");
            supervisor.tick();
            supervisor.tick();
            assertThat(supervisor.snapshot("b_department").orElseThrow().restartCount()).isEqualTo(2);

            // Stops crashing: the next restart spawns a live process.
            launcher.recover("b_department");
            supervisor.tick();
            assertThat(supervisor.snapshot("b_department").orElseThrow().restartCount()).isEqualTo(3);

            supervisor.tick();
            assertThat(supervisor.recordHealthReply(healthy("b_department"))).get()
                    .extracting(StatusTransition::to).isEqualTo(DepartmentStatus.RUNNING);

            assertThat(supervisor.snapshot("b_department").orElseThrow().restartCount()).isZero();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void registerIsIdempotent() {
            assertThat(supervisor.register("parks_department")).isPresent();
            assertThat(supervisor.register("parks_department")).isEmpty();
            assertThat(launcher.spawnCount("parks_department")).isEqualTo(1);
        }

        @Test
        @DisplayName("a failed first spawn is retried as a restart on the next tick")
        void failedSpawnRetried() {
            launcher.failSpawns("ghost_department");
            assertThat(supervisor.register("ghost_department")).isEmpty();
            assertThat(supervisor.isKnown("ghost_department")).isTrue();

            List<StatusTransition> transitions = supervisor.tick();
            assertThat(transitions).extracting(StatusTransition::to).containsExactly(DepartmentStatus.RESTARTING);
            assertThat(transitions.get(0).pid()).isNull();
        }

        @Test
        @DisplayName("retire forgets the department and leaves the kill to stop")
        void retireForgetsThenStopKills() {
            DepartmentProcess registered = supervisor.register("parks_department").orElseThrow();

            Optional<DepartmentProcess> retired = supervisor.retire("parks_department");
            assertThat(retired).contains(registered);
            assertThat(supervisor.isKnown("parks_department")).isFalse();
            assertThat(launcher.terminated()).isEmpty();

            supervisor.stop(retired.get());
            assertThat(launcher.terminated()).containsExactly(registered);
            assertThat(supervisor.retire("parks_department")).isEmpty();
        }

        @Test
        void retireWithoutProcess() {
            launcher.failSpawns("ghost_department");
            supervisor.register("ghost_department");

            assertThat(supervisor.retire("ghost_department")).isEmpty();
            assertThat(supervisor.isKnown("ghost_department")).isFalse();
        }

        @Test
        @DisplayName("draining stops checks and restarts; terminateAll kills every process")
        void drainThenTerminate() {
            supervisor.register("a_department");
            supervisor.register("b_department");
            launcher.crash("b_department");

            supervisor.drain();
            supervisor.tick();

            assertThat(sender.sent).isEmpty();
            assertThat(launcher.spawnCount("b_department")).isEqualTo(1);
            assertThat(supervisor.register("c_department")).isEmpty();

            supervisor.terminateAll();
            assertThat(launcher.aliveCount()).isZero();
            assertThat(supervisor.snapshots()).allSatisfy(s -> assertThat(s.pid()).isNull());
        }

        @Test
        void rejectsNonsensicalThresholds() {
            CouncilProperties.Supervision bad = new CouncilProperties.Supervision();
            bad.setFailureThreshold(0);
            assertThatThrownBy(() -> new ProcessSupervisor(launcher, sender, clock, bad))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
