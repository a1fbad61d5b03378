package com.city.services.core.message;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Availability broadcast about a single department.
 *
 * <p>Status values:</p>
 * <ul>
 *   <li>{@code created}: template accepted, process not yet spawned</li>
 *   <li>{@code launched}: process spawned (or respawned after a restart)</li>
 *   <li>{@code active}: process confirmed healthy</li>
 *   <li>{@code failed}: creation failed or restart budget exhausted</li>
 * </ul>
 */
public record DepartmentAnnouncement(
        @NotBlank String departmentName,
        @NotBlank @Pattern(regexp = "created|launched|active|failed") String status,
        Long processId,
        String description
) {

    public static final String CREATED = "created";
    public static final String LAUNCHED = "launched";
    public static final String ACTIVE = "active";
    public static final String FAILED = "failed";

    /**
     * @return true when routing-aware consumers may send work to the department
     */
    public boolean announcesAvailability() {
        return LAUNCHED.equals(status) || ACTIVE.equals(status);
    }
}
