package com.city.services.council.supervisor;

/**
 * A health reply that passed correlation and is ready to be applied to a department record.
 *
 * @param departmentName department that answered
 * @param checkId        check answered, null for unsolicited reports
 * @param healthy        true only for status {@code healthy}
 * @param status         status text as reported
 * @param uptimeSeconds  reported uptime, may be null
 * @param messageCount   reported message count, may be null
 */
public record HealthObservation(
        String departmentName,
        String checkId,
        boolean healthy,
        String status,
        Double uptimeSeconds,
        Long messageCount
) {
}
