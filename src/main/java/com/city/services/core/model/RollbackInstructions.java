package com.city.services.core.model;

import java.util.Map;

/**
 * Data needed to undo a routing change.
 *
 * @param action         what the operator (or the council) must do, e.g. {@code restore_department}
 * @param department     department the change retired
 * @param previousRoutes routing edges that the change introduced, source to target; reverting removes them
 */
public record RollbackInstructions(String action, String department, Map<String, String> previousRoutes) {

    public static final String RESTORE_DEPARTMENT = "restore_department";

    public RollbackInstructions {
        previousRoutes = previousRoutes == null ? Map.of() : Map.copyOf(previousRoutes);
    }
}
