package com.city.services.council.registry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers departments from template files in one directory.
 *
 * <p>A file named {@code <name>_department.yml} (declarative template) or
 * {@code <name>_department.rb} (code-backed department) declares the department
 * {@code <name>_department}. Excluded file names (the generic runner) and the configured
 * static names are applied on top.</p>
 *
 * <p>A missing directory yields only the static names.</p>
 */
public class TemplateDirectoryScanner implements RegistryScanner {

    private static final Logger log = LoggerFactory.getLogger(TemplateDirectoryScanner.class);

    private static final String GLOB = "*_department.{yml,rb}";

    private final Path directory;
    private final Set<String> excludedFiles;
    private final List<String> staticDepartments;

    public TemplateDirectoryScanner(Path directory, Collection<String> excludedFiles, Collection<String> staticDepartments) {
        this.directory = directory;
        this.excludedFiles = Set.copyOf(excludedFiles);
        this.staticDepartments = List.copyOf(staticDepartments);
    }

    @Override
    public List<String> scan() {
        TreeSet<String> names = new TreeSet<>(staticDepartments);

        if (!Files.isDirectory(directory)) {
            log.debug("Registry directory {} does not exist; static departments only", directory);
            return new ArrayList<>(names);
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, GLOB)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                if (excludedFiles.contains(fileName) || !Files.isRegularFile(file)) {
                    continue;
                }
                names.add(fileName.substring(0, fileName.lastIndexOf('.')));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan registry directory " + directory, e);
        }

        return new ArrayList<>(names);
    }

    public Path directory() {
        return directory;
    }
}
