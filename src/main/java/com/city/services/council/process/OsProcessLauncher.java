package com.city.services.council.process;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches departments as operating system processes.
 *
 * <p>The command template is a list of arguments; every {@code {name}} placeholder is replaced
 * with the department name. Output is inherited so department logs land next to the council's.</p>
 *
 * <p>Liveness goes through {@link ProcessHandle#of(long)}, so it works for processes this JVM
 * did not start itself.</p>
 */
public class OsProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);

    static final String NAME_PLACEHOLDER = "{name}";

    private final List<String> commandTemplate;
    private final File workingDirectory;
    private final Duration terminationGrace;

    public OsProcessLauncher(List<String> commandTemplate, File workingDirectory, Duration terminationGrace) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("process command is required");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.workingDirectory = workingDirectory;
        this.terminationGrace = terminationGrace;
    }

    @Override
    public DepartmentProcess spawn(String departmentName) throws ProcessLaunchException {
        List<String> command = commandFor(departmentName);
        ProcessBuilder pb = new ProcessBuilder(command).inheritIO();
        if (workingDirectory != null) {
            pb.directory(workingDirectory);
        }
        try {
            Process p = pb.start();
            log.info("Spawned department={} pid={} command={}", departmentName, p.pid(), command);
            return new DepartmentProcess(departmentName, p.pid());
        } catch (IOException | SecurityException e) {
            throw new ProcessLaunchException(departmentName, "Cannot start " + departmentName + ": " + e.getMessage(), e);
        }
    }

    List<String> commandFor(String departmentName) {
        return commandTemplate.stream()
                .map(arg -> arg.replace(NAME_PLACEHOLDER, departmentName))
                .toList();
    }

    @Override
    public boolean isAlive(DepartmentProcess process) {
        return ProcessHandle.of(process.pid()).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public void terminate(DepartmentProcess process) {
        Optional<ProcessHandle> handle = ProcessHandle.of(process.pid());
        if (handle.isEmpty() || !handle.get().isAlive()) {
            log.debug("Process already gone department={} pid={}", process.departmentName(), process.pid());
            return;
        }
        ProcessHandle h = handle.get();
        h.destroy();
        try {
            h.onExit().get(terminationGrace.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Terminated department={} pid={}", process.departmentName(), process.pid());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            h.destroyForcibly();
        } catch (Exception e) {
            log.warn("Department did not stop within {}; killing department={} pid={}",
                    terminationGrace, process.departmentName(), process.pid());
            h.destroyForcibly();
        }
    }
}
