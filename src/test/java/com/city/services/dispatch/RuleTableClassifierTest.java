package com.city.services.dispatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.city.services.core.message.EmergencyCall;

import static org.assertj.core.api.Assertions.assertThat;

class RuleTableClassifierTest {

    private final RuleTableClassifier classifier = new RuleTableClassifier();

    private static EmergencyCall call(String type, String description) {
        return new EmergencyCall(null, type, description, "12 Elm St", null, null, "medium", null,
                false, false, false, false, false, null);
    }

    @ParameterizedTest(name = "{0} / \"{1}\" -> {2}")
    @CsvSource({
            "fire, kitchen fire, fire_department",
            "medical, chest pain, fire_department",
            "crime, burglary in progress, police_department",
            "water_emergency, flooding, water_department",
            "animal_emergency, loose dog, animal_control",
            "infrastructure, burst water main, water_management_department",
            "infrastructure, downed power line, utilities_department",
            "infrastructure, pothole on the bridge, transportation_department",
            "infrastructure, strange noise, public_works_department",
            "other, stray cat on roof, animal_control_department",
            "other, collapsed structure, building_inspection_department",
            "other, fallen tree in playground, parks_recreation_department",
            "other, something odd, police_department",
            "alien_invasion, lights in the sky, police_department"
    })
    void primaryDepartment(String type, String description, String expected) {
        assertThat(classifier.classify(call(type, description))).containsExactly(expected);
    }

    @Test
    void requestedDepartmentWins() {
        EmergencyCall c = new EmergencyCall(null, "fire", "fire", null, null, null, "critical",
                "harbor_patrol_department", true, true, true, true, true, 2);

        assertThat(classifier.classify(c)).containsExactly("harbor_patrol_department");
    }

    @Test
    void seriousCallsAddPoliceAndFire() {
        EmergencyCall c = new EmergencyCall(null, "water_emergency", "flooding with injuries", null, null, null,
                "critical", null, true, false, false, false, false, null);

        assertThat(classifier.classify(c))
                .containsExactly("water_department", "police_department", "fire_department");
    }

    @Test
    void noDuplicates() {
        EmergencyCall c = new EmergencyCall(null, "fire", "warehouse fire", null, null, null, "high", null,
                false, true, true, true, false, null);

        assertThat(classifier.classify(c)).containsExactly("fire_department", "police_department");
    }
}
