package com.city.services.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * =====================================================================
 * DecisionOutcome
 * =====================================================================
 *
 * Terminal outcome of the council's evaluation of a recommendation.
 *
 *   received ──▶ APPROVED | REJECTED | DEFERRED
 *
 * The rationale text is fixed per outcome. Free-form input from the
 * analyzer never reaches the decision record, which keeps every decision
 * reproducible from its category alone.
 */
public enum DecisionOutcome {

    /** Routing changes are built and broadcast. */
    APPROVED("Recommendation approved based on cost-benefit analysis and efficiency goals"),

    /** Nothing changes; the proposer is told why in general terms. */
    REJECTED("Recommendation rejected to maintain essential services or insufficient justification"),

    /** Parked for human review; nothing changes yet. */
    DEFERRED("Recommendation deferred pending further review and citizen input");

    private final String rationale;

    DecisionOutcome(String rationale) {
        this.rationale = rationale;
    }

    public String rationale() {
        return rationale;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionOutcome fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("decision outcome is required");
        }
        return DecisionOutcome.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
