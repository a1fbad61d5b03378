package com.city.services.support;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.city.services.council.process.DepartmentProcess;
import com.city.services.council.process.ProcessLaunchException;
import com.city.services.council.process.ProcessLauncher;

/**
 * Process launcher that hands out fake pids. Departments marked crashing spawn processes that
 * are never alive.
 */
public final class FakeLauncher implements ProcessLauncher {

    private final AtomicLong pids = new AtomicLong(1000);
    private final Set<Long> alive = ConcurrentHashMap.newKeySet();
    private final Set<String> crashing = ConcurrentHashMap.newKeySet();
    private final Set<String> unlaunchable = ConcurrentHashMap.newKeySet();
    private final List<DepartmentProcess> spawned = new CopyOnWriteArrayList<>();
    private final List<DepartmentProcess> terminated = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch terminationGate;

    public void crash(String departmentName) {
        crashing.add(departmentName);
        spawned.stream()
                .filter(p -> p.departmentName().equals(departmentName))
                .forEach(p -> alive.remove(p.pid()));
    }

    public void recover(String departmentName) {
        crashing.remove(departmentName);
    }

    /**
     * Makes every terminate wait for {@code gate}, like a process ignoring its graceful stop.
     */
    public void holdTerminations(CountDownLatch gate) {
        this.terminationGate = gate;
    }

    public void failSpawns(String departmentName) {
        unlaunchable.add(departmentName);
    }

    @Override
    public DepartmentProcess spawn(String departmentName) throws ProcessLaunchException {
        if (unlaunchable.contains(departmentName)) {
            throw new ProcessLaunchException(departmentName, "no such template", null);
        }
        DepartmentProcess p = new DepartmentProcess(departmentName, pids.incrementAndGet());
        spawned.add(p);
        if (!crashing.contains(departmentName)) {
            alive.add(p.pid());
        }
        return p;
    }

    @Override
    public boolean isAlive(DepartmentProcess process) {
        return alive.contains(process.pid());
    }

    @Override
    public void terminate(DepartmentProcess process) {
        CountDownLatch gate = terminationGate;
        if (gate != null) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        alive.remove(process.pid());
        terminated.add(process);
    }

    public List<DepartmentProcess> spawned() {
        return List.copyOf(spawned);
    }

    public long spawnCount(String departmentName) {
        return spawned.stream().filter(p -> p.departmentName().equals(departmentName)).count();
    }

    public List<DepartmentProcess> terminated() {
        return List.copyOf(terminated);
    }

    public long aliveCount() {
        return alive.size();
    }
}
