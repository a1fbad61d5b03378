package com.city.services.core.message;

import jakarta.validation.constraints.NotBlank;

/**
 * Health probe sent by the council to one department.
 *
 * @param checkId correlation id echoed back in {@link HealthStatusReply#checkId()}
 * @param from    requester
 * @param to      department being probed
 */
public record HealthCheckRequest(@NotBlank String checkId, @NotBlank String from, @NotBlank String to) {
}
