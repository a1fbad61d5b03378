package com.city.services.core.message;

import jakarta.validation.constraints.NotBlank;

/**
 * Request from a routing-aware consumer asking the council to make a department available.
 *
 * @param requestingService consumer that needs the department
 * @param emergencyType     category of the work that could not be routed
 * @param description       human readable reason
 * @param urgency           urgency of the original work
 * @param originalCallId    id of the parked unit of work
 * @param departmentNeeded  department name the consumer resolved to
 */
public record ServiceRequest(
        @NotBlank String requestingService,
        String emergencyType,
        String description,
        String urgency,
        String originalCallId,
        @NotBlank String departmentNeeded
) {
}
