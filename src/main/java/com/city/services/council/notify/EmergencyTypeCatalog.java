package com.city.services.council.notify;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Emergency types a department name is assumed to handle, used to tell routing-aware consumers
 * which call categories a change touches.
 */
final class EmergencyTypeCatalog {

    private record Entry(List<String> keywords, List<String> types) {
    }

    // First match per department name.
    private static final List<Entry> ENTRIES = List.of(
            new Entry(List.of("police"), List.of("crime", "theft", "assault", "traffic_accident")),
            new Entry(List.of("fire"), List.of("fire", "rescue", "hazmat")),
            new Entry(List.of("health", "medical", "ems"), List.of("medical", "injury", "illness")),
            new Entry(List.of("animal"), List.of("animal_attack", "animal_rescue")),
            new Entry(List.of("water", "utility"), List.of("water_leak", "service_outage")),
            new Entry(List.of("parks", "recreation"), List.of("park_emergency", "facility_issue"))
    );

    private EmergencyTypeCatalog() {}

    static List<String> affectedBy(List<String> departmentNames) {
        Set<String> out = new LinkedHashSet<>();
        for (String dept : departmentNames) {
            String name = dept.toLowerCase(Locale.ROOT);
            for (Entry e : ENTRIES) {
                if (e.keywords().stream().anyMatch(name::contains)) {
                    out.addAll(e.types());
                    break;
                }
            }
        }
        return List.copyOf(out);
    }
}
