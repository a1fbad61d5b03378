package com.city.services.council.registry;

import java.util.List;

/**
 * Source of the set of department names that should exist.
 */
public interface RegistryScanner {

    /**
     * @return sorted, de-duplicated department names currently declared
     */
    List<String> scan();
}
