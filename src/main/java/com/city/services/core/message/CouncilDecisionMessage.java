package com.city.services.core.message;

import java.time.Instant;
import java.time.LocalDate;

import com.city.services.core.model.Decision;
import com.city.services.core.model.DecisionOutcome;
import com.city.services.core.model.RecommendationType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Decision reply sent back to the analyzer that proposed a change.
 */
public record CouncilDecisionMessage(
        @NotBlank String recommendationId,
        @NotNull RecommendationType recommendationType,
        @NotNull DecisionOutcome decision,
        String decisionRationale,
        LocalDate effectiveDate,
        String decidedBy,
        Instant decisionTimestamp
) {

    public static CouncilDecisionMessage from(Decision decision, String decidedBy) {
        return new CouncilDecisionMessage(
                decision.recommendationId(),
                decision.recommendationType(),
                decision.outcome(),
                decision.rationale(),
                decision.effectiveDate(),
                decidedBy,
                decision.decidedAt()
        );
    }
}
