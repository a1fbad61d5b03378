package com.city.services.council;

import java.util.Collection;

import com.city.services.core.model.DepartmentStatus;
import com.city.services.council.supervisor.DepartmentSnapshot;

/**
 * Department counts by health bucket: running is healthy, permanently failed is unhealthy,
 * every other status is a warning.
 */
public record HealthSummary(int healthy, int warning, int unhealthy, int monitored) {

    public static HealthSummary of(Collection<DepartmentSnapshot> snapshots) {
        int healthy = 0;
        int warning = 0;
        int unhealthy = 0;
        for (DepartmentSnapshot s : snapshots) {
            if (s.status() == DepartmentStatus.RUNNING) {
                healthy++;
            } else if (s.status() == DepartmentStatus.PERMANENTLY_FAILED) {
                unhealthy++;
            } else {
                warning++;
            }
        }
        return new HealthSummary(healthy, warning, unhealthy, snapshots.size());
    }

    public boolean hasIssues() {
        return warning > 0 || unhealthy > 0;
    }
}
