package com.city.services.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Emergency dispatch center settings.
 *
 * <p>Prefix: {@code city.dispatch.*}</p>
 */
@ConfigurationProperties(prefix = "city.dispatch")
public class DispatchProperties {

    /**
     * Department used when none of the classified departments is live.
     */
    private String defaultDepartment = "police_department";

    /**
     * How long a call waits for an unavailable department before it is reported undeliverable.
     */
    private Duration pendingTimeout = Duration.ofMinutes(2);

    /**
     * Cadence of housekeeping: registry rescan, staged notifications, pending retries and expiry.
     */
    private Duration rescanInterval = Duration.ofSeconds(30);

    /** Directory scanned for department templates. */
    private String registryDirectory = ".";

    /** Names always considered available. */
    private List<String> staticDepartments = new ArrayList<>();

    public String getDefaultDepartment() { return defaultDepartment; }
    public void setDefaultDepartment(String defaultDepartment) { this.defaultDepartment = defaultDepartment; }

    public Duration getPendingTimeout() { return pendingTimeout; }
    public void setPendingTimeout(Duration pendingTimeout) { this.pendingTimeout = pendingTimeout; }

    public Duration getRescanInterval() { return rescanInterval; }
    public void setRescanInterval(Duration rescanInterval) { this.rescanInterval = rescanInterval; }

    public String getRegistryDirectory() { return registryDirectory; }
    public void setRegistryDirectory(String registryDirectory) { this.registryDirectory = registryDirectory; }

    public List<String> getStaticDepartments() { return staticDepartments; }
    public void setStaticDepartments(List<String> staticDepartments) { this.staticDepartments = staticDepartments; }
}
