package com.city.services.dispatch;

import java.util.List;

import com.city.services.core.message.EmergencyCall;

/**
 * Decides which departments an emergency call needs.
 */
@FunctionalInterface
public interface DepartmentClassifier {

    /**
     * @return department names in dispatch order, never empty
     */
    List<String> classify(EmergencyCall call);
}
