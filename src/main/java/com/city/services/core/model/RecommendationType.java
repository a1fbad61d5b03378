package com.city.services.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of proposal an analyzer sends to the council.
 *
 * <p>Serialized in lower case ({@code consolidation}, {@code termination}) because the
 * value travels inside {@code council_decision} replies read by non-Java analyzers.</p>
 */
public enum RecommendationType {

    CONSOLIDATION,
    TERMINATION;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecommendationType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("recommendation type is required");
        }
        return RecommendationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
