package com.city.services.council;

import java.util.Optional;

import com.city.services.core.message.ServiceRequest;

/**
 * Makes a department that is needed but not tracked available for supervision.
 *
 * <p>Generating new department templates is outside the council; implementations decide
 * whether a template for the requested department exists or can be obtained.</p>
 */
public interface DepartmentProvisioner {

    /**
     * @return the name to register, empty when the department cannot be provided
     */
    Optional<String> provision(ServiceRequest request);
}
