package com.city.services.council.policy;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.model.ConsolidationRecommendation;
import com.city.services.core.model.Decision;
import com.city.services.core.model.DecisionOutcome;
import com.city.services.core.model.Recommendation;
import com.city.services.core.model.TerminationRecommendation;
import com.city.services.council.CouncilProperties;

/**
 * =====================================================================
 * RecommendationEvaluator
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns one recommendation into one terminal decision.
 *
 * POLICY TABLE (defaults, all configurable)
 * -----------------------------------------
 * Consolidation:
 *   similarity > 70 and savings > 100000   -> APPROVED
 *   similarity > 50                        -> DEFERRED
 *   otherwise (or no score)                -> REJECTED
 *
 * Termination:
 *   name contains a protected entry        -> REJECTED
 *   reason in {redundant, obsolete, unused} -> APPROVED
 *   otherwise                              -> DEFERRED
 *
 * The rationale comes from the outcome only, never from input text.
 * Evaluation is pure: same recommendation and clock, same decision.
 */
public class RecommendationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEvaluator.class);

    private final CouncilProperties.Policy policy;
    private final Clock clock;

    public RecommendationEvaluator(CouncilProperties.Policy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public Decision evaluate(Recommendation recommendation) {
        DecisionOutcome outcome;
        if (recommendation instanceof ConsolidationRecommendation c) {
            outcome = evaluateConsolidation(c);
        } else if (recommendation instanceof TerminationRecommendation t) {
            outcome = evaluateTermination(t);
        } else {
            throw new IllegalArgumentException("Unsupported recommendation " + recommendation.getClass().getName());
        }

        Instant now = clock.instant();
        LocalDate effective = LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(policy.getEffectiveAfterDays());
        Decision decision = Decision.of(recommendation, outcome, effective, now);

        log.info("Decision id={} type={} departments={} outcome={}",
                recommendation.recommendationId(), recommendation.type().wire(),
                recommendation.involvedDepartments(), outcome.wire());
        return decision;
    }

    DecisionOutcome evaluateConsolidation(ConsolidationRecommendation c) {
        Double similarity = c.similarityScore();
        if (similarity == null) {
            return DecisionOutcome.REJECTED;
        }
        double savings = c.estimatedAnnualSavings() == null ? 0.0 : c.estimatedAnnualSavings();
        if (similarity > policy.getApproveSimilarityAbove() && savings > policy.getApproveSavingsAbove()) {
            return DecisionOutcome.APPROVED;
        }
        // Defer band is (deferAbove, approveAbove].
        if (similarity > policy.getDeferSimilarityAbove() && similarity <= policy.getApproveSimilarityAbove()) {
            return DecisionOutcome.DEFERRED;
        }
        return DecisionOutcome.REJECTED;
    }

    DecisionOutcome evaluateTermination(TerminationRecommendation t) {
        if (isProtected(t.departmentName())) {
            return DecisionOutcome.REJECTED;
        }
        String reason = t.terminationReason() == null ? "" : t.terminationReason().toLowerCase(Locale.ROOT);
        if (policy.getAutoApprovedTerminationReasons().contains(reason)) {
            return DecisionOutcome.APPROVED;
        }
        return DecisionOutcome.DEFERRED;
    }

    public boolean isProtected(String departmentName) {
        if (departmentName == null) {
            return false;
        }
        String name = departmentName.toLowerCase(Locale.ROOT);
        List<String> protectedNames = policy.getProtectedDepartments();
        return protectedNames.stream().anyMatch(p -> name.contains(p.toLowerCase(Locale.ROOT)));
    }
}
