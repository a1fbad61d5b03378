package com.city.services.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * =====================================================================
 * ChangeNotification
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Broadcast emitted by the council once a structural change is binding.
 * Every routing-aware consumer applies it to its own routing table mirror.
 *
 * DELIVERY
 * --------
 * The bus delivers at least once. Applying the same notification twice
 * must leave a routing table unchanged, so {@link #routingChanges()} is a
 * map keyed by source (set-union on apply, never append).
 *
 * IDENTITY
 * --------
 * {@link #changeId()} is stable across redeliveries and across the
 * consumers that receive the same change.
 */
public record ChangeNotification(
        @NotNull String changeId,
        @NotNull ChangeType changeType,
        @NotEmpty List<String> affectedDepartments,
        String newDepartment,
        @NotNull Map<String, String> routingChanges,
        Map<String, List<String>> capabilitiesMapping,
        List<String> emergencyTypesAffected,
        String fallbackDepartment,
        boolean effectiveImmediately,
        Instant effectiveAt,
        String additionalInstructions,
        String initiatedBy,
        Instant changedAt,
        boolean rollbackAvailable,
        RollbackInstructions rollback
) {

    public ChangeNotification {
        changeId = changeId == null ? UUID.randomUUID().toString() : changeId;
        affectedDepartments = affectedDepartments == null ? List.of() : List.copyOf(affectedDepartments);
        // Insertion order is kept so logs read in proposal order.
        routingChanges = routingChanges == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(routingChanges));
        capabilitiesMapping = capabilitiesMapping == null ? Map.of() : Map.copyOf(capabilitiesMapping);
        emergencyTypesAffected = emergencyTypesAffected == null ? List.of() : List.copyOf(emergencyTypesAffected);
    }

    /**
     * @return true when the change may be applied at {@code now}
     */
    public boolean isEffectiveAt(Instant now) {
        return effectiveImmediately || effectiveAt == null || !now.isBefore(effectiveAt);
    }

    public static Builder builder(ChangeType changeType) {
        return new Builder(changeType);
    }

    public static final class Builder {
        private String changeId;
        private final ChangeType changeType;
        private List<String> affectedDepartments = List.of();
        private String newDepartment;
        private Map<String, String> routingChanges = new LinkedHashMap<>();
        private Map<String, List<String>> capabilitiesMapping = Map.of();
        private List<String> emergencyTypesAffected = List.of();
        private String fallbackDepartment;
        private boolean effectiveImmediately = true;
        private Instant effectiveAt;
        private String additionalInstructions;
        private String initiatedBy = "city_council";
        private Instant changedAt;
        private boolean rollbackAvailable;
        private RollbackInstructions rollback;

        private Builder(ChangeType changeType) {
            this.changeType = changeType;
        }

        public Builder changeId(String v) { this.changeId = v; return this; }
        public Builder affectedDepartments(List<String> v) { this.affectedDepartments = v; return this; }
        public Builder newDepartment(String v) { this.newDepartment = v; return this; }
        public Builder routingChanges(Map<String, String> v) { this.routingChanges = v; return this; }
        public Builder capabilitiesMapping(Map<String, List<String>> v) { this.capabilitiesMapping = v; return this; }
        public Builder emergencyTypesAffected(List<String> v) { this.emergencyTypesAffected = v; return this; }
        public Builder fallbackDepartment(String v) { this.fallbackDepartment = v; return this; }
        public Builder effectiveImmediately(boolean v) { this.effectiveImmediately = v; return this; }
        public Builder effectiveAt(Instant v) { this.effectiveAt = v; return this; }
        public Builder additionalInstructions(String v) { this.additionalInstructions = v; return this; }
        public Builder initiatedBy(String v) { this.initiatedBy = v; return this; }
        public Builder changedAt(Instant v) { this.changedAt = v; return this; }
        public Builder rollback(RollbackInstructions v) {
            this.rollback = v;
            this.rollbackAvailable = v != null;
            return this;
        }

        public ChangeNotification build() {
            return new ChangeNotification(
                    changeId, changeType, affectedDepartments, newDepartment, routingChanges,
                    capabilitiesMapping, emergencyTypesAffected, fallbackDepartment,
                    effectiveImmediately, effectiveAt, additionalInstructions, initiatedBy,
                    changedAt, rollbackAvailable, rollback
            );
        }
    }
}
