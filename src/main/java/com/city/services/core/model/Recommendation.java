package com.city.services.core.model;

import java.util.List;

/**
 * A machine-generated proposal to change the set of departments.
 *
 * <p>Implementations are immutable records received from an analyzer. Each one is
 * evaluated exactly once; redeliveries are recognised by {@link #recommendationId()}.</p>
 */
public interface Recommendation {

    String recommendationId();

    RecommendationType type();

    /**
     * @return every department name the proposal touches, in proposal order
     */
    List<String> involvedDepartments();

    /**
     * @return identity of the analyzer that produced the proposal; decisions are sent back to it
     */
    String analyzedBy();

    String priority();
}
