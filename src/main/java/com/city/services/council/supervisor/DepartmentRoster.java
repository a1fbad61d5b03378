package com.city.services.council.supervisor;

import com.city.services.routing.LiveDepartments;

/**
 * Read-only view of the supervised department set.
 */
public interface DepartmentRoster extends LiveDepartments {

    /**
     * @return true when the department is tracked, whatever its status
     */
    boolean isKnown(String departmentName);
}
