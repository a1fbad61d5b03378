package com.city.services.core.message;

import java.util.List;

/**
 * Periodic request asking an analyzer to review the department set and send back
 * consolidation or termination recommendations.
 */
public record AnalysisRequest(
        String analysisType,
        String requestedBy,
        List<String> targetDepartments,
        List<String> focusAreas,
        String reason
) {

    public AnalysisRequest {
        targetDepartments = targetDepartments == null ? List.of() : List.copyOf(targetDepartments);
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
    }
}
