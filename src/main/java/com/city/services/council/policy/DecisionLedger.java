package com.city.services.council.policy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.city.services.core.model.Decision;

/**
 * Bounded memory of decisions already taken, keyed by recommendation id.
 *
 * <p>The bus delivers at least once. A redelivered recommendation must get its first decision
 * back and must not be broadcast a second time. The oldest entry is evicted once
 * {@code capacity} is reached.</p>
 */
public class DecisionLedger {

    private final Map<String, Decision> decisions;

    public DecisionLedger(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.decisions = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Decision> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized Optional<Decision> find(String recommendationId) {
        return Optional.ofNullable(decisions.get(recommendationId));
    }

    /**
     * Records a decision unless one already exists for the same recommendation.
     *
     * @return true when this call recorded it
     */
    public synchronized boolean record(Decision decision) {
        return decisions.putIfAbsent(decision.recommendationId(), decision) == null;
    }

    public synchronized int size() {
        return decisions.size();
    }
}
