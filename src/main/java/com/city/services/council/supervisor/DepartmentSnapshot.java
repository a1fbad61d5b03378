package com.city.services.council.supervisor;

import java.time.Instant;

import com.city.services.core.model.DepartmentStatus;

/**
 * Immutable copy of a department record taken under the supervisor lock.
 */
public record DepartmentSnapshot(
        String name,
        Long pid,
        DepartmentStatus status,
        int processFailures,
        int healthFailures,
        int restartCount,
        Instant createdAt,
        Instant lastProcessCheck,
        Instant lastHealthRequest,
        Instant lastFailure,
        Instant lastRestart,
        boolean awaitingResponse,
        String reportedStatus,
        Double uptimeSeconds,
        Long messageCount
) {
}
