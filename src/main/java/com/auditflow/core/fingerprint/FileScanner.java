package com.auditflow.core.fingerprint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Walks a project directory and fingerprints the in-scope files.
 * <p>
 * Excluded directories (e.g. {@code .git}, {@code node_modules}, the audit's own
 * cache directories) are pruned during traversal and never descended into.
 * Source files are selected by extension; an empty extension set selects every file.
 */
public class FileScanner {

    private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(".DS_Store", "Thumbs.db");

    private final Set<String> excludedDirs;
    private final Set<String> includedExtensions;

    public FileScanner(Set<String> excludedDirs, Set<String> includedExtensions) {
        this.excludedDirs = Set.copyOf(excludedDirs);
        this.includedExtensions = Set.copyOf(includedExtensions);
    }

    public Set<String> excludedDirs() {
        return excludedDirs;
    }

    public Set<String> includedExtensions() {
        return includedExtensions;
    }

    /**
     * Lists every source file under {@code root} and returns its fingerprint.
     *
     * @param root the project root
     * @return sorted map of relative path to fingerprint
     * @throws ProjectAccessException if the root is missing or the walk fails
     */
    public Map<String, String> scan(Path root) {
        return fingerprint(root, listFiles(root, this::isSourceFile));
    }

    /**
     * Lists files under {@code root} whose relative path passes {@code filter},
     * pruning excluded directories.
     *
     * @return sorted relative paths
     * @throws ProjectAccessException if the root is missing or the walk fails
     */
    public List<String> listFiles(Path root, Predicate<String> filter) {
        requireReadableRoot(root);
        var files = new ArrayList<String>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excludedDirs.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !IGNORE_FILES.contains(file.getFileName().toString())) {
                        String relative = relativize(root, file);
                        if (filter.test(relative)) {
                            files.add(relative);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    if (file.equals(root)) {
                        throw new ProjectAccessException("Cannot read project root " + root, e);
                    }
                    log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ProjectAccessException("Failed to walk project root " + root, e);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Fingerprints the given relative paths. Files that vanish or cannot be
     * read between listing and hashing are left out.
     */
    public Map<String, String> fingerprint(Path root, Collection<String> relativePaths) {
        var fingerprints = new TreeMap<String, String>();
        for (String relative : relativePaths) {
            try {
                fingerprints.put(relative, Fingerprinter.fingerprint(root.resolve(relative)));
            } catch (IOException e) {
                log.warn("Failed to fingerprint {}: {}", relative, e.getMessage());
            }
        }
        return fingerprints;
    }

    public boolean isSourceFile(String relativePath) {
        if (includedExtensions.isEmpty()) {
            return true;
        }
        int dot = relativePath.lastIndexOf('.');
        int slash = relativePath.lastIndexOf('/');
        return dot > slash && includedExtensions.contains(relativePath.substring(dot));
    }

    /** Relative path with {@code /} separators regardless of platform. */
    public static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    private static void requireReadableRoot(Path root) {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new ProjectAccessException("Project root is not a readable directory: " + root);
        }
    }
}
