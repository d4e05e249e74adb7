package com.auditflow.core.cache;

import com.auditflow.core.model.ToolCacheEntry;
import com.auditflow.core.model.ToolCacheStats;
import com.auditflow.core.tools.ToolStrategies;
import com.auditflow.core.tools.ToolStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Per-file findings store for file-decomposable tools, one artifact per tool at
 * {@code <indexDir>/<tool>_results.json}.
 * <p>
 * The stored aggregate is always the tool's reducer applied to the stored
 * per-file map, so folding in a handful of changed files and re-reducing gives
 * the same aggregate as a full run over the same file set.
 */
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    static final String SUFFIX = "_results.json";

    private final Path storeDir;
    private final CacheArtifacts artifacts;
    private final ToolStrategies strategies;
    private final Clock clock;

    public ResultStore(Path projectRoot, String indexDirName, CacheArtifacts artifacts,
                       ToolStrategies strategies, Clock clock) {
        this.storeDir = projectRoot.resolve(indexDirName);
        this.artifacts = artifacts;
        this.strategies = strategies;
        this.clock = clock;
    }

    public Path artifactFile(String tool) {
        if (tool.contains("/") || tool.contains("\\") || tool.startsWith(".")) {
            throw new IllegalArgumentException("Invalid tool name for a cache artifact: " + tool);
        }
        return storeDir.resolve(tool + SUFFIX);
    }

    public boolean supports(String tool) {
        return strategies.find(tool).isPresent();
    }

    /**
     * @return the stored entry, or empty if absent or unreadable
     */
    public Optional<ToolCacheEntry> load(String tool) {
        return artifacts.read(artifactFile(tool), ToolCacheEntry.class)
                .filter(entry -> entry.perFileFindings() != null && entry.aggregate() != null);
    }

    /**
     * Extracts per-file findings from a tool's raw payload. The payload is first
     * normalised to its stored JSON form so that fresh and reloaded findings compare equal.
     */
    public Map<String, List<Map<String, Object>>> extract(String tool, Path projectRoot, Map<String, Object> payload) {
        Map<String, Object> normalized = payload;
        try {
            normalized = artifacts.normalize(payload);
        } catch (IOException e) {
            log.warn("Cannot normalise {} output, using it as returned: {}", tool, e.getMessage());
        }
        return strategy(tool).extractor().extract(projectRoot, normalized);
    }

    /**
     * Builds a wholesale replacement entry from a full run. Files with no findings are not stored.
     */
    public ToolCacheEntry prepareFull(String tool, Map<String, List<Map<String, Object>>> perFileFindings) {
        return prepareFull(tool, perFileFindings, file -> true);
    }

    /**
     * As {@link #prepareFull(String, Map)}, keeping only files accepted by {@code tracked}.
     * Findings for files the fingerprint index does not track could never be
     * invalidated by a change set, so they are not stored.
     */
    public ToolCacheEntry prepareFull(String tool, Map<String, List<Map<String, Object>>> perFileFindings,
                                      Predicate<String> tracked) {
        var perFile = new TreeMap<String, List<Map<String, Object>>>();
        perFileFindings.forEach((path, findings) -> {
            if (findings != null && !findings.isEmpty() && tracked.test(path)) {
                perFile.put(path, List.copyOf(findings));
            }
        });
        logUntracked(tool, perFileFindings.keySet(), tracked);
        return new ToolCacheEntry(tool, clock.instant(), perFile, strategy(tool).reducer().reduce(perFile));
    }

    /**
     * Computes the entry that results from folding fresh findings for the
     * changed files into {@code existing}, without writing anything.
     * <p>
     * Removed files are dropped. Each changed file takes its fresh findings, or is
     * dropped if the fresh run reported none. Fresh findings for files outside
     * {@code changedFiles} are discarded.
     */
    public ToolCacheEntry prepareMerge(String tool, Optional<ToolCacheEntry> existing,
                                       Map<String, List<Map<String, Object>>> freshPerFile,
                                       Collection<String> changedFiles, Collection<String> removedFiles) {
        return prepareMerge(tool, existing, freshPerFile, changedFiles, removedFiles, file -> true);
    }

    /**
     * As {@link #prepareMerge(String, Optional, Map, Collection, Collection)}, also dropping
     * stored files not accepted by {@code tracked}.
     */
    public ToolCacheEntry prepareMerge(String tool, Optional<ToolCacheEntry> existing,
                                       Map<String, List<Map<String, Object>>> freshPerFile,
                                       Collection<String> changedFiles, Collection<String> removedFiles,
                                       Predicate<String> tracked) {
        var perFile = new TreeMap<String, List<Map<String, Object>>>();
        existing.ifPresent(entry -> entry.perFileFindings().forEach((path, findings) -> {
            if (tracked.test(path)) {
                perFile.put(path, findings);
            }
        }));

        removedFiles.forEach(perFile::remove);
        for (String file : changedFiles) {
            List<Map<String, Object>> fresh = freshPerFile.get(file);
            if (fresh == null || fresh.isEmpty()) {
                perFile.remove(file);
            } else {
                perFile.put(file, List.copyOf(fresh));
            }
        }

        var changed = Set.copyOf(changedFiles);
        long outside = freshPerFile.keySet().stream().filter(f -> !changed.contains(f)).count();
        if (outside > 0) {
            log.debug("Discarding {} tool findings for files outside the changed subset of {}", outside, tool);
        }
        return new ToolCacheEntry(tool, clock.instant(), perFile, strategy(tool).reducer().reduce(perFile));
    }

    /**
     * Merges fresh findings into the stored entry and persists it.
     *
     * @return the recomputed aggregate
     * @throws IOException if the entry could not be written
     */
    public Map<String, Object> merge(String tool, Map<String, List<Map<String, Object>>> freshPerFile,
                                     Collection<String> changedFiles, Collection<String> removedFiles)
            throws IOException {
        ToolCacheEntry merged = prepareMerge(tool, load(tool), freshPerFile, changedFiles, removedFiles);
        save(merged);
        return merged.aggregate();
    }

    public void save(String tool, Map<String, List<Map<String, Object>>> perFileFindings,
                     Map<String, Object> aggregate) throws IOException {
        save(new ToolCacheEntry(tool, clock.instant(), new TreeMap<>(perFileFindings), aggregate));
    }

    public void save(ToolCacheEntry entry) throws IOException {
        artifacts.write(artifactFile(entry.tool()), entry);
        log.debug("Saved {} results for {} files", entry.tool(), entry.perFileFindings().size());
    }

    public boolean clear(String tool) {
        return artifacts.delete(artifactFile(tool));
    }

    /**
     * @return number of artifacts deleted
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

    /** Names of the tools that currently have an artifact. */
    public List<String> storedTools() {
        return listArtifacts().stream()
                .map(file -> file.getFileName().toString())
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .toList();
    }

    public List<ToolCacheStats> stats() {
        Instant now = clock.instant();
        var stats = new ArrayList<ToolCacheStats>();
        for (String tool : storedTools()) {
            load(tool).ifPresent(entry -> stats.add(new ToolCacheStats(tool, "result", entry.timestamp(),
                    ageSeconds(entry.timestamp(), now), entry.perFileFindings().size(), true)));
        }
        return stats;
    }

    private List<Path> listArtifacts() {
        if (!Files.isDirectory(storeDir)) {
            return List.of();
        }
        var files = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(storeDir, "*" + SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.warn("Failed to list result artifacts in {}: {}", storeDir, e.getMessage());
        }
        files.sort(null);
        return files;
    }

    private static void logUntracked(String tool, Collection<String> files, Predicate<String> tracked) {
        long untracked = files.stream().filter(tracked.negate()).count();
        if (untracked > 0) {
            log.debug("Not storing {} findings for {} files outside the fingerprint index", tool, untracked);
        }
    }

    private ToolStrategy strategy(String tool) {
        return strategies.find(tool)
                .orElseThrow(() -> new IllegalArgumentException("No findings strategy registered for " + tool));
    }

    static long ageSeconds(Instant timestamp, Instant now) {
        return timestamp == null ? -1 : Math.max(0, Duration.between(timestamp, now).getSeconds());
    }
}
