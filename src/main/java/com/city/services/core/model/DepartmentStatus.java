package com.city.services.core.model;

/**
 * =====================================================================
 * DepartmentStatus
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Lifecycle state of a supervised department process.
 *
 * STATE MACHINE
 * -------------
 *
 *   STARTING ──liveness + healthy reply──▶ RUNNING
 *      │                                     │
 *      │                         health failure
 *      │                                     ▼
 *      │                               UNRESPONSIVE
 *      │                                     │
 *      └──────failure threshold crossed──────┴──▶ RESTARTING
 *                                                   │
 *                       restart budget exhausted    ▼
 *                                          PERMANENTLY_FAILED
 *
 * RESTARTING and UNRESPONSIVE return to RUNNING on the next successful
 * liveness + healthy reply pair. PERMANENTLY_FAILED is terminal.
 */
public enum DepartmentStatus {

    /** Process spawned, no healthy reply observed yet. */
    STARTING,

    /** Process alive and answering health checks. */
    RUNNING,

    /** Process alive but health checks failing or unanswered. */
    UNRESPONSIVE,

    /** A restart was attempted and has not been confirmed healthy yet. */
    RESTARTING,

    /**
     * Restart budget exhausted.
     *
     * BEHAVIOR
     * --------
     * - No further probes, health checks or spawns
     * - Never a routing target
     * - Still a valid routing source (edges and fallbacks keyed by it remain)
     */
    PERMANENTLY_FAILED;

    /**
     * @return true when the department can receive work
     */
    public boolean isLive() {
        return this != PERMANENTLY_FAILED;
    }
}
