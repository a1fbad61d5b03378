package com.city.services.council.supervisor;

import com.city.services.core.model.DepartmentStatus;

/**
 * One lifecycle change observed by the supervisor.
 *
 * @param departmentName department concerned
 * @param from           previous status, null when the record was just created
 * @param to             new status
 * @param pid            process id after the change, null when no process is running
 * @param reason         short human readable cause
 */
public record StatusTransition(
        String departmentName,
        DepartmentStatus from,
        DepartmentStatus to,
        Long pid,
        String reason
) {
}
