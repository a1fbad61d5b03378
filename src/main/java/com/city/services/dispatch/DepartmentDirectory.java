package com.city.services.dispatch;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.city.services.routing.LiveDepartments;

/**
 * The dispatch center's view of which departments can take calls: the registry scan plus
 * launch and activation announcements, minus departments announced as failed.
 */
public class DepartmentDirectory implements LiveDepartments {

    private final Set<String> available = ConcurrentHashMap.newKeySet();

    /**
     * @return true when the department was not available before
     */
    public boolean add(String departmentName) {
        return available.add(departmentName);
    }

    /**
     * @return the names that were not available before
     */
    public List<String> addAll(Collection<String> departmentNames) {
        return departmentNames.stream().filter(available::add).toList();
    }

    public boolean remove(String departmentName) {
        return available.remove(departmentName);
    }

    @Override
    public boolean isLive(String departmentName) {
        return departmentName != null && available.contains(departmentName);
    }

    public List<String> names() {
        return List.copyOf(new TreeSet<>(available));
    }
}
