package com.city.services.council.process;

/**
 * Process-launch facility used by the supervisor.
 *
 * <p>Implementations must not block on {@link #isAlive(DepartmentProcess)}; it is called for
 * every department on every supervision tick.</p>
 */
public interface ProcessLauncher {

    DepartmentProcess spawn(String departmentName) throws ProcessLaunchException;

    boolean isAlive(DepartmentProcess process);

    /**
     * Stops the process, forcibly if it does not exit within the grace period.
     * A process that is already gone is not an error.
     */
    void terminate(DepartmentProcess process);
}
