package com.city.services.core.model;

import java.time.Instant;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The council's verdict on one recommendation.
 *
 * @param recommendationId   id of the recommendation decided
 * @param recommendationType consolidation or termination
 * @param outcome            approved, rejected or deferred
 * @param rationale          fixed text derived from {@code outcome}
 * @param effectiveDate      date from which an approved change is binding
 * @param decidedAt          when the decision was taken
 */
public record Decision(
        String recommendationId,
        RecommendationType recommendationType,
        DecisionOutcome outcome,
        String rationale,
        LocalDate effectiveDate,
        Instant decidedAt
) {

    public static Decision of(Recommendation recommendation, DecisionOutcome outcome,
                              LocalDate effectiveDate, Instant decidedAt) {
        return new Decision(
                recommendation.recommendationId(),
                recommendation.type(),
                outcome,
                outcome.rationale(),
                effectiveDate,
                decidedAt
        );
    }

    @JsonIgnore
    public boolean isApproved() {
        return outcome == DecisionOutcome.APPROVED;
    }
}
