package com.city.services.council.policy;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.city.services.core.model.ConsolidationRecommendation;
import com.city.services.core.model.Decision;
import com.city.services.core.model.DecisionOutcome;
import com.city.services.core.model.Recommendation;
import com.city.services.core.model.RecommendationType;
import com.city.services.core.model.TerminationRecommendation;
import com.city.services.council.CouncilProperties;
import com.city.services.support.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationEvaluatorTest {

    private final MutableClock clock = MutableClock.at("2026-03-10T12:00:00Z");
    private RecommendationEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RecommendationEvaluator(new CouncilProperties.Policy(), clock);
    }

    private static ConsolidationRecommendation consolidation(Double similarity, Double savings) {
        return new ConsolidationRecommendation("rec-1", "water_utilities_department",
                List.of("water_department", "utilities_department"), similarity, List.of(), savings,
                List.of(), "overlap", "normal", null, "doge");
    }

    private static TerminationRecommendation termination(String department, String reason) {
        return new TerminationRecommendation("rec-2", department, reason, null, List.of(), 50_000.0,
                "normal", null, "doge");
    }

    @Nested
    @DisplayName("consolidation")
    class Consolidation {

        @ParameterizedTest(name = "similarity={0} savings={1} -> {2}")
        @CsvSource({
                "85, 150000, APPROVED",
                "85, 100000, REJECTED",
                "85, 50000, REJECTED",
                "71, 0, REJECTED",
                "70, 500000, DEFERRED",
                "60, 150000, DEFERRED",
                "50, 150000, REJECTED",
                "30, 150000, REJECTED"
        })
        void outcomeByThresholds(double similarity, double savings, DecisionOutcome expected) {
            assertThat(evaluator.evaluate(consolidation(similarity, savings)).outcome()).isEqualTo(expected);
        }

        @Test
        @DisplayName("a missing similarity score is rejected")
        void missingScore() {
            assertThat(evaluator.evaluate(consolidation(null, 1_000_000.0)).outcome())
                    .isEqualTo(DecisionOutcome.REJECTED);
        }

        @Test
        @DisplayName("same input and clock give the same decision")
        void deterministic() {
            Decision first = evaluator.evaluate(consolidation(85.0, 150_000.0));
            Decision second = evaluator.evaluate(consolidation(85.0, 150_000.0));

            assertThat(second).isEqualTo(first);
            assertThat(first.recommendationType()).isEqualTo(RecommendationType.CONSOLIDATION);
            assertThat(first.rationale()).isEqualTo(DecisionOutcome.APPROVED.rationale());
            assertThat(first.effectiveDate()).isEqualTo(LocalDate.of(2026, 4, 9));
        }

        @Test
        @DisplayName("thresholds come from configuration")
        void configurableThresholds() {
            CouncilProperties.Policy strict = new CouncilProperties.Policy();
            strict.setApproveSimilarityAbove(90);
            RecommendationEvaluator strictEvaluator = new RecommendationEvaluator(strict, clock);

            assertThat(strictEvaluator.evaluate(consolidation(85.0, 150_000.0)).outcome())
                    .isEqualTo(DecisionOutcome.DEFERRED);
        }
    }

    @Nested
    @DisplayName("termination")
    class Termination {

        @ParameterizedTest
        @ValueSource(strings = {"police_department", "fire_department", "public_health_department",
                "emergency_dispatch_center"})
        @DisplayName("protected departments are never terminated")
        void protectedRejected(String department) {
            assertThat(evaluator.evaluate(termination(department, "redundant")).outcome())
                    .isEqualTo(DecisionOutcome.REJECTED);
        }

        @ParameterizedTest
        @ValueSource(strings = {"redundant", "obsolete", "unused"})
        void autoApprovedReasons(String reason) {
            assertThat(evaluator.evaluate(termination("parks_department", reason)).outcome())
                    .isEqualTo(DecisionOutcome.APPROVED);
        }

        @ParameterizedTest
        @ValueSource(strings = {"inefficient", "duplicate_services", "budget_constraints"})
        void otherReasonsDeferred(String reason) {
            assertThat(evaluator.evaluate(termination("parks_department", reason)).outcome())
                    .isEqualTo(DecisionOutcome.DEFERRED);
        }

        @Test
        void protectionIsCaseInsensitive() {
            assertThat(evaluator.isProtected("Fire_Station_7")).isTrue();
            assertThat(evaluator.isProtected("parks_department")).isFalse();
            assertThat(evaluator.isProtected(null)).isFalse();
        }
    }

    @Test
    void unsupportedRecommendationRejectedLoudly() {
        assertThatThrownBy(() -> evaluator.evaluate(new Recommendation() {
            @Override public String recommendationId() { return "x"; }
            @Override public RecommendationType type() { return RecommendationType.CONSOLIDATION; }
            @Override public List<String> involvedDepartments() { return List.of(); }
            @Override public String analyzedBy() { return "doge"; }
            @Override public String priority() { return "normal"; }
        })).isInstanceOf(IllegalArgumentException.class);
    }
}
