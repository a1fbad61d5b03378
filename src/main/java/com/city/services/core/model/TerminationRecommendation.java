package com.city.services.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Proposal to retire a single department.
 */
public record TerminationRecommendation(
        @NotBlank String recommendationId,
        @NotBlank @Size(min = 3, max = 100) String departmentName,
        @NotBlank
        @Pattern(regexp = "redundant|obsolete|unused|inefficient|duplicate_services|budget_constraints")
        String terminationReason,
        @Size(max = 1000) String detailedRationale,
        List<@Valid ServiceReassignment> servicesToReassign,
        @PositiveOrZero Double annualCost,
        @Pattern(regexp = "low|normal|high|critical") String priority,
        Instant analysisTimestamp,
        @NotBlank String analyzedBy
) implements Recommendation {

    public TerminationRecommendation {
        recommendationId = recommendationId == null ? UUID.randomUUID().toString() : recommendationId;
        servicesToReassign = servicesToReassign == null ? List.of() : List.copyOf(servicesToReassign);
        priority = priority == null ? "normal" : priority;
        analyzedBy = analyzedBy == null ? "doge" : analyzedBy;
    }

    @Override
    public RecommendationType type() {
        return RecommendationType.TERMINATION;
    }

    @Override
    public List<String> involvedDepartments() {
        return departmentName == null ? List.of() : List.of(departmentName);
    }

    /**
     * One capability of the retiring department and the department that takes it over.
     */
    public record ServiceReassignment(@NotBlank String service, @NotBlank String reassignTo) {
    }
}
