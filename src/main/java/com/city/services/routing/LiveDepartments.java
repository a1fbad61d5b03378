package com.city.services.routing;

/**
 * View of which department names can currently receive work.
 */
@FunctionalInterface
public interface LiveDepartments {

    boolean isLive(String departmentName);
}
