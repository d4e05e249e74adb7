package com.auditflow.core.cache;

import com.auditflow.core.fingerprint.FileScanner;
import com.auditflow.core.model.PatternCacheEntry;
import com.auditflow.core.model.ToolCacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Whole-payload cache for tools that cannot be sliced by file, one slot per
 * tool at {@code <cacheDir>/<tool>_cache.json}.
 * <p>
 * A slot is valid while it is younger than the max age and every file matched
 * by the tool's dependency patterns still has the fingerprint recorded when the
 * slot was written. Adding or removing a matching file also invalidates it.
 * <p>
 * Patterns without {@code *} or {@code ?} name exact relative paths. A glob
 * without {@code /} matches the file name at any depth; a glob with {@code /}
 * matches the whole relative path, and a leading {@code **}{@code /} also
 * matches at the top level.
 */
public class PatternCache {

    private static final Logger log = LoggerFactory.getLogger(PatternCache.class);

    static final String SUFFIX = "_cache.json";

    private final Path projectRoot;
    private final Path cacheDir;
    private final FileScanner scanner;
    private final CacheArtifacts artifacts;
    private final Clock clock;
    private final Duration maxAge;
    private final boolean updateGitignore;

    public PatternCache(Path projectRoot, String cacheDirName, FileScanner scanner, CacheArtifacts artifacts,
                        Clock clock, Duration maxAge, boolean updateGitignore) {
        this.projectRoot = projectRoot;
        this.cacheDir = projectRoot.resolve(cacheDirName);
        this.scanner = scanner;
        this.artifacts = artifacts;
        this.clock = clock;
        this.maxAge = maxAge;
        this.updateGitignore = updateGitignore;
    }

    public Path artifactFile(String tool) {
        if (tool.contains("/") || tool.contains("\\") || tool.startsWith(".")) {
            throw new IllegalArgumentException("Invalid tool name for a cache artifact: " + tool);
        }
        return cacheDir.resolve(tool + SUFFIX);
    }

    /**
     * @return the cached payload if the slot is present, fresh and its dependencies are unchanged
     */
    public Optional<Map<String, Object>> get(String tool, Collection<String> patterns) {
        Optional<PatternCacheEntry> entry = artifacts.read(artifactFile(tool), PatternCacheEntry.class)
                .filter(e -> e.timestamp() != null && e.payload() != null && e.dependencyFingerprints() != null);
        if (entry.isEmpty()) {
            log.debug("No pattern cache for {}", tool);
            return Optional.empty();
        }
        Duration age = Duration.between(entry.get().timestamp(), clock.instant());
        if (age.compareTo(maxAge) > 0) {
            log.debug("Pattern cache for {} expired ({}s old)", tool, age.getSeconds());
            return Optional.empty();
        }
        if (!dependencyFingerprints(patterns).equals(entry.get().dependencyFingerprints())) {
            log.debug("Dependencies of {} changed; pattern cache invalid", tool);
            return Optional.empty();
        }
        log.info("Using cached {} results ({}s old)", tool, age.getSeconds());
        return Optional.of(entry.get().payload());
    }

    /**
     * Replaces the tool's slot with {@code payload} and the current fingerprints of its dependencies.
     *
     * @return the payload in the form a later {@link #get} returns it
     * @throws IOException if the payload cannot be serialised or the slot could not be written
     */
    public Map<String, Object> put(String tool, Collection<String> patterns, Map<String, Object> payload)
            throws IOException {
        Map<String, Object> stored = artifacts.normalize(payload);
        Map<String, String> dependencies = dependencyFingerprints(patterns);
        if (updateGitignore) {
            artifacts.ensureGitignored(projectRoot, cacheDir.getFileName().toString());
        }
        artifacts.write(artifactFile(tool), new PatternCacheEntry(tool, clock.instant(), dependencies, stored));
        log.debug("Cached {} results ({} dependency files)", tool, dependencies.size());
        return stored;
    }

    public boolean invalidate(String tool) {
        boolean removed = artifacts.delete(artifactFile(tool));
        if (removed) {
            log.info("Invalidated pattern cache for {}", tool);
        }
        return removed;
    }

    /**
     * @return number of slots deleted
     */
    public int clearAll() {
        int removed = 0;
        for (Path file : listArtifacts()) {
            if (artifacts.delete(file)) {
                removed++;
            }
        }
        return removed;
    }

    public List<ToolCacheStats> stats() {
        Instant now = clock.instant();
        var stats = new ArrayList<ToolCacheStats>();
        for (Path file : listArtifacts()) {
            artifacts.read(file, PatternCacheEntry.class)
                    .filter(e -> e.tool() != null && e.timestamp() != null)
                    .ifPresent(e -> {
                        int files = e.dependencyFingerprints() == null ? 0 : e.dependencyFingerprints().size();
                        boolean fresh = Duration.between(e.timestamp(), now).compareTo(maxAge) <= 0;
                        stats.add(new ToolCacheStats(e.tool(), "pattern", e.timestamp(),
                                ResultStore.ageSeconds(e.timestamp(), now), files, fresh));
                    });
        }
        return stats;
    }

    /**
     * Fingerprints every file under the project root matched by {@code patterns}.
     */
    Map<String, String> dependencyFingerprints(Collection<String> patterns) {
        Predicate<String> matcher = matcher(patterns);
        return scanner.fingerprint(projectRoot, scanner.listFiles(projectRoot, matcher));
    }

    static Predicate<String> matcher(Collection<String> patterns) {
        Predicate<String> any = path -> false;
        for (String pattern : patterns) {
            any = any.or(single(pattern.replace('\\', '/')));
        }
        return any;
    }

    private static Predicate<String> single(String pattern) {
        if (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0) {
            String exact = pattern.startsWith("./") ? pattern.substring(2) : pattern;
            return path -> path.equals(exact);
        }
        if (pattern.indexOf('/') < 0) {
            PathMatcher glob = glob(pattern);
            return path -> glob.matches(Path.of(fileName(path)));
        }
        PathMatcher glob = glob(pattern);
        if (pattern.startsWith("**/")) {
            PathMatcher topLevel = glob(pattern.substring(3));
            return path -> glob.matches(Path.of(path)) || topLevel.matches(Path.of(path));
        }
        return path -> glob.matches(Path.of(path));
    }

    private static PathMatcher glob(String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private List<Path> listArtifacts() {
        if (!Files.isDirectory(cacheDir)) {
            return List.of();
        }
        var files = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir, "*" + SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.warn("Failed to list pattern cache artifacts in {}: {}", cacheDir, e.getMessage());
        }
        files.sort(null);
        return files;
    }
}
