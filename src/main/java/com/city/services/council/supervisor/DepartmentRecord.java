package com.city.services.council.supervisor;

import java.time.Instant;

import com.city.services.core.model.DepartmentStatus;
import com.city.services.council.process.DepartmentProcess;

/**
 * Mutable supervision state of one department.
 *
 * <p>Owned by {@link ProcessSupervisor}; every field is read and written while holding the
 * supervisor lock. Nothing outside the package sees an instance, only {@link DepartmentSnapshot}s.</p>
 */
final class DepartmentRecord {

    final String name;
    final Instant createdAt;

    DepartmentProcess process;
    DepartmentStatus status = DepartmentStatus.STARTING;

    int processFailures;
    int healthFailures;
    int restartCount;

    Instant lastProcessCheck;
    Instant lastHealthRequest;
    Instant lastFailure;
    Instant lastRestart;

    boolean awaitingResponse;
    String pendingCheckId;

    String reportedStatus;
    Double uptimeSeconds;
    Long messageCount;

    DepartmentRecord(String name, Instant createdAt) {
        this.name = name;
        this.createdAt = createdAt;
    }

    void resetFailures() {
        processFailures = 0;
        healthFailures = 0;
        awaitingResponse = false;
        pendingCheckId = null;
    }

    DepartmentSnapshot snapshot() {
        return new DepartmentSnapshot(
                name,
                process == null ? null : process.pid(),
                status,
                processFailures,
                healthFailures,
                restartCount,
                createdAt,
                lastProcessCheck,
                lastHealthRequest,
                lastFailure,
                lastRestart,
                awaitingResponse,
                reportedStatus,
                uptimeSeconds,
                messageCount
        );
    }
}
