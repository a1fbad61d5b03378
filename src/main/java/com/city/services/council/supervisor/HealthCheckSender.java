package com.city.services.council.supervisor;

/**
 * Outbound half of the health protocol as seen by the supervisor.
 */
public interface HealthCheckSender {

    /**
     * Emits a health check to the department without waiting for the reply.
     *
     * @return correlation id of the check
     */
    String sendCheck(String departmentName);

    /**
     * Forgets any outstanding check; later replies from the department are discarded.
     */
    void cancel(String departmentName);
}
