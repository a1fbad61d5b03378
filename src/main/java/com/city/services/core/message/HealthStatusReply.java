package com.city.services.core.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Asynchronous answer to a {@link HealthCheckRequest}.
 *
 * @param checkId       id of the request being answered (may be absent for unsolicited reports)
 * @param serviceName   department reporting
 * @param status        one of {@code healthy}, {@code warning}, {@code critical}, {@code failed}
 * @param uptimeSeconds process uptime reported by the department
 * @param messageCount  messages handled by the department so far
 */
public record HealthStatusReply(
        String checkId,
        @NotBlank String serviceName,
        @NotBlank @Pattern(regexp = "healthy|warning|critical|failed") String status,
        Double uptimeSeconds,
        Long messageCount
) {

    public static final String HEALTHY = "healthy";

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
