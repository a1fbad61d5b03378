package com.city.services.routing;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.city.services.core.model.ChangeNotification;

/**
 * =====================================================================
 * RoutingTable
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Redirection edges (source to target) and per-name fallbacks, built
 * from {@link ChangeNotification}s, answering "which department actually
 * receives work addressed to X".
 *
 * INVARIANTS
 * ----------
 *  - At most one outgoing edge per source. Applying a notification is a
 *    map put, so applying it twice leaves the table unchanged.
 *  - The edge set is never assumed acyclic. {@link #resolve(String)}
 *    terminates for any table.
 *  - A fallback is used only when the resolved target is not live, and
 *    it is keyed by the name originally asked for.
 *
 * THREAD SAFETY
 * -------------
 * Resolutions share a read lock; mutations take the write lock.
 */
public class RoutingTable {

    private static final Logger log = LoggerFactory.getLogger(RoutingTable.class);

    private final LiveDepartments live;
    private final Map<String, String> edges = new LinkedHashMap<>();
    private final Map<String, String> fallbacks = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RoutingTable(LiveDepartments live) {
        this.live = Objects.requireNonNull(live, "live");
    }

    /**
     * Applies one change notification.
     *
     * <ul>
     *   <li>consolidated: edges merged, fallback keyed by the successor</li>
     *   <li>terminated: edges merged, fallback keyed by each retired department</li>
     *   <li>created: any override of the new department is cleared</li>
     *   <li>renamed: {@code old -> new} added and edges into {@code old} re-pointed</li>
     * </ul>
     */
    public void apply(ChangeNotification n) {
        lock.writeLock().lock();
        try {
            switch (n.changeType()) {
                case CONSOLIDATED -> {
                    edges.putAll(n.routingChanges());
                    if (n.fallbackDepartment() != null && n.newDepartment() != null) {
                        fallbacks.put(n.newDepartment(), n.fallbackDepartment());
                    }
                }
                case TERMINATED -> {
                    edges.putAll(n.routingChanges());
                    if (n.fallbackDepartment() != null) {
                        for (String dept : n.affectedDepartments()) {
                            fallbacks.put(dept, n.fallbackDepartment());
                        }
                    }
                }
                case CREATED -> {
                    if (n.newDepartment() != null && edges.remove(n.newDepartment()) != null) {
                        log.info("Routing override cleared for recreated department {}", n.newDepartment());
                    }
                }
                case RENAMED -> applyRename(n);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Applied routing change id={} type={} edges={} fallback={}",
                n.changeId(), n.changeType().wire(), n.routingChanges(), n.fallbackDepartment());
    }

    // Caller holds the write lock.
    private void applyRename(ChangeNotification n) {
        Map<String, String> renames = new LinkedHashMap<>(n.routingChanges());
        if (renames.isEmpty() && n.newDepartment() != null) {
            for (String old : n.affectedDepartments()) {
                renames.put(old, n.newDepartment());
            }
        }
        for (Map.Entry<String, String> r : renames.entrySet()) {
            String oldName = r.getKey();
            String newName = r.getValue();
            edges.replaceAll((source, target) -> target.equals(oldName) ? newName : target);
            edges.put(oldName, newName);
        }
    }

    /**
     * Removes what a previously applied notification introduced. Edges and fallbacks
     * are only removed while they still hold the value the notification set.
     */
    public void revert(ChangeNotification n) {
        lock.writeLock().lock();
        try {
            n.routingChanges().forEach(edges::remove);
            if (n.fallbackDepartment() != null) {
                if (n.newDepartment() != null) {
                    fallbacks.remove(n.newDepartment(), n.fallbackDepartment());
                }
                for (String dept : n.affectedDepartments()) {
                    fallbacks.remove(dept, n.fallbackDepartment());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Reverted routing change id={} type={}", n.changeId(), n.changeType().wire());
    }

    /**
     * Resolves the department that should receive work addressed to {@code name}.
     *
     * <p>Follows edges until a name without an outgoing edge is reached. A cycle stops the
     * walk at the last name before the repeat. When the result is not live and a fallback
     * exists for {@code name}, the fallback is returned.</p>
     */
    public String resolve(String name) {
        lock.readLock().lock();
        try {
            Set<String> visited = new HashSet<>();
            String current = name;
            while (edges.containsKey(current) && visited.add(current)) {
                String next = edges.get(current);
                if (visited.contains(next)) {
                    log.warn("Routing cycle detected resolving {} at {} -> {}", name, current, next);
                    break;
                }
                current = next;
            }
            if (!live.isLive(current)) {
                String fallback = fallbacks.get(name);
                if (fallback != null) {
                    return fallback;
                }
            }
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return every name that currently redirects (directly) to {@code target}
     */
    public List<String> sourcesOf(String target) {
        lock.readLock().lock();
        try {
            return edges.entrySet().stream()
                    .filter(e -> e.getValue().equals(target))
                    .map(Map.Entry::getKey)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> edges() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> fallbacks() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(fallbacks));
        } finally {
            lock.readLock().unlock();
        }
    }
}
