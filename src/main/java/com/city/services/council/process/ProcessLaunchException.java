package com.city.services.council.process;

/**
 * A department process could not be started.
 */
public class ProcessLaunchException extends Exception {

    private final String departmentName;

    public ProcessLaunchException(String departmentName, String message, Throwable cause) {
        super(message, cause);
        this.departmentName = departmentName;
    }

    public String departmentName() {
        return departmentName;
    }
}
