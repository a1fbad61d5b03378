package com.city.services.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Proposal to merge two or more departments into one successor.
 *
 * <p>Missing optional fields are normalised in the compact constructor so that
 * downstream code never has to null-check lists or the proposer.</p>
 */
public record ConsolidationRecommendation(
        @NotBlank String recommendationId,
        @NotBlank @Size(min = 3, max = 100) String proposedName,
        @NotNull @Size(min = 2, message = "must provide at least 2 departments to merge") List<@NotBlank String> departmentsToMerge,
        @DecimalMin("0") @DecimalMax("100") Double similarityScore,
        List<String> overlappingFunctions,
        @PositiveOrZero Double estimatedAnnualSavings,
        List<String> unifiedCapabilities,
        @Size(max = 1000) String rationale,
        @Pattern(regexp = "low|normal|high|critical") String priority,
        Instant analysisTimestamp,
        @NotBlank String analyzedBy
) implements Recommendation {

    public ConsolidationRecommendation {
        recommendationId = recommendationId == null ? UUID.randomUUID().toString() : recommendationId;
        departmentsToMerge = departmentsToMerge == null ? null : List.copyOf(departmentsToMerge);
        overlappingFunctions = overlappingFunctions == null ? List.of() : List.copyOf(overlappingFunctions);
        unifiedCapabilities = unifiedCapabilities == null ? List.of() : List.copyOf(unifiedCapabilities);
        priority = priority == null ? "normal" : priority;
        analyzedBy = analyzedBy == null ? "doge" : analyzedBy;
    }

    @Override
    public RecommendationType type() {
        return RecommendationType.CONSOLIDATION;
    }

    @Override
    public List<String> involvedDepartments() {
        return departmentsToMerge == null ? List.of() : departmentsToMerge;
    }
}
