package com.city.services.council.process;

/**
 * Opaque handle of one spawned department process.
 *
 * @param departmentName department the process serves
 * @param pid            operating system process id
 */
public record DepartmentProcess(String departmentName, long pid) {
}
