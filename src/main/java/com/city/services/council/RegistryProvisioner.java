package com.city.services.council;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.message.ServiceRequest;
import com.city.services.council.registry.RegistryScanner;

/**
 * Provides a department only when the registry already declares it, i.e. a template exists
 * but the department was not yet picked up by a rescan.
 */
public class RegistryProvisioner implements DepartmentProvisioner {

    private static final Logger log = LoggerFactory.getLogger(RegistryProvisioner.class);

    private final RegistryScanner registry;

    public RegistryProvisioner(RegistryScanner registry) {
        this.registry = registry;
    }

    @Override
    public Optional<String> provision(ServiceRequest request) {
        String needed = request.departmentNeeded();
        if (registry.scan().contains(needed)) {
            return Optional.of(needed);
        }
        log.info("No template for requested department {} (requested by {})", needed, request.requestingService());
        return Optional.empty();
    }
}
