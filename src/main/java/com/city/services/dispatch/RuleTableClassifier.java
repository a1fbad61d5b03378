package com.city.services.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.city.services.core.message.EmergencyCall;

/**
 * =====================================================================
 * RuleTableClassifier
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Deterministic call classification by emergency type, refined by the
 * description for infrastructure and uncategorised calls.
 *
 * RULES
 * -----
 *  - A requested department wins outright.
 *  - emergency_type picks the primary department (table below).
 *  - infrastructure / other: description keywords pick the department.
 *  - Weapons, suspects on scene or critical severity add police.
 *  - Injuries, hazardous materials or fire add the fire department.
 *  - Anything unrecognised goes to police.
 */
public class RuleTableClassifier implements DepartmentClassifier {

    static final String POLICE = "police_department";
    static final String FIRE = "fire_department";

    private static final Map<String, String> BY_TYPE = Map.ofEntries(
            Map.entry("fire", FIRE),
            Map.entry("rescue", FIRE),
            // EMS is run by the fire department.
            Map.entry("medical", FIRE),
            Map.entry("crime", POLICE),
            Map.entry("accident", POLICE),
            Map.entry("water_emergency", "water_department"),
            Map.entry("animal_emergency", "animal_control"),
            Map.entry("transportation_emergency", "transportation_department"),
            Map.entry("environmental_emergency", "environmental_services"),
            Map.entry("parks_emergency", "parks_department"),
            Map.entry("sanitation_emergency", "sanitation_department")
    );

    private static final List<KeywordRule> INFRASTRUCTURE = List.of(
            new KeywordRule(Pattern.compile("water|sewer|pipe|hydrant"), "water_management_department"),
            new KeywordRule(Pattern.compile("power|electric|gas|utility"), "utilities_department"),
            new KeywordRule(Pattern.compile("road|street|traffic|bridge"), "transportation_department")
    );

    private static final List<KeywordRule> OTHER = List.of(
            new KeywordRule(Pattern.compile("animal|dog|cat|wildlife"), "animal_control_department"),
            new KeywordRule(Pattern.compile("building|structure|construction"), "building_inspection_department"),
            new KeywordRule(Pattern.compile("park|tree|playground"), "parks_recreation_department")
    );

    @Override
    public List<String> classify(EmergencyCall call) {
        List<String> departments = new ArrayList<>();

        if (call.requestedDepartment() != null && !call.requestedDepartment().isBlank()) {
            departments.add(call.requestedDepartment());
            return departments;
        }

        String type = call.emergencyType() == null ? "" : call.emergencyType().toLowerCase(Locale.ROOT);
        String description = call.description() == null ? "" : call.description().toLowerCase(Locale.ROOT);

        switch (type) {
            case "infrastructure", "infrastructure_emergency" ->
                    departments.add(match(INFRASTRUCTURE, description, "public_works_department"));
            case "other" -> departments.add(match(OTHER, description, POLICE));
            default -> departments.add(BY_TYPE.getOrDefault(type, POLICE));
        }

        if ((call.weaponsInvolved() || call.suspectsOnScene() || "critical".equals(call.severity()))
                && !departments.contains(POLICE)) {
            departments.add(POLICE);
        }
        if ((call.injuriesReported() || call.hazardousMaterials() || call.fireInvolved())
                && !departments.contains(FIRE)) {
            departments.add(FIRE);
        }
        return departments;
    }

    private static String match(List<KeywordRule> rules, String description, String otherwise) {
        for (KeywordRule r : rules) {
            if (r.pattern().matcher(description).find()) {
                return r.department();
            }
        }
        return otherwise;
    }

    private record KeywordRule(Pattern pattern, String department) {
    }
}
