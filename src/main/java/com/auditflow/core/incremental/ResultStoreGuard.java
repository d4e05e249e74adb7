package com.auditflow.core.incremental;

import com.auditflow.core.cache.ResultStore;
import com.auditflow.core.model.ToolCacheEntry;
import com.auditflow.core.orchestrator.CacheGuard;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Guards a file-decomposable tool with its result-store entry.
 * <p>
 * Nothing is written from the worker thread: the updated entry is staged here
 * and the coordinator persists it after fan-in, only if the tool succeeded.
 * Only findings for files in the current fingerprint scan are kept, since no
 * change set can ever invalidate the others.
 */
class ResultStoreGuard implements CacheGuard {

    enum Plan {
        /** Run over the whole project and replace the entry. */
        REPLACE,
        /** Nothing to re-analyse; serve the entry, folding in removals if any. */
        REUSE,
        /** Run over the changed files and merge into the entry. */
        MERGE
    }

    private final ResultStore store;
    private final String tool;
    private final Path projectRoot;
    private final Plan plan;
    private final boolean consultsCache;
    private final Optional<ToolCacheEntry> existing;
    private final List<String> changed;
    private final List<String> removed;
    private final Predicate<String> tracked;
    private final AtomicReference<ToolCacheEntry> staged = new AtomicReference<>();

    private ResultStoreGuard(ResultStore store, String tool, Path projectRoot, Plan plan, boolean consultsCache,
                             Optional<ToolCacheEntry> existing, List<String> changed, List<String> removed,
                             Predicate<String> tracked) {
        this.store = store;
        this.tool = tool;
        this.projectRoot = projectRoot;
        this.plan = plan;
        this.consultsCache = consultsCache;
        this.existing = existing;
        this.changed = List.copyOf(changed);
        this.removed = List.copyOf(removed);
        this.tracked = tracked;
    }

    /** Full audit: the entry is not consulted and is replaced wholesale. */
    static ResultStoreGuard replace(ResultStore store, String tool, Path projectRoot, Predicate<String> tracked) {
        return new ResultStoreGuard(store, tool, projectRoot, Plan.REPLACE, false,
                Optional.empty(), List.of(), List.of(), tracked);
    }

    /**
     * Incremental audit: picks the plan from the stored entry and the change set.
     * A tool that scans the whole project whatever subset it is given replaces its
     * entry instead of merging, since its output is fresh for every file.
     */
    static ResultStoreGuard incremental(ResultStore store, String tool, Path projectRoot, boolean honorsSubset,
                                        List<String> changed, List<String> removed, Predicate<String> tracked) {
        Optional<ToolCacheEntry> existing = store.load(tool);
        Plan plan;
        if (existing.isEmpty()) {
            plan = Plan.REPLACE;
        } else if (changed.isEmpty()) {
            plan = Plan.REUSE;
        } else {
            plan = honorsSubset ? Plan.MERGE : Plan.REPLACE;
        }
        return new ResultStoreGuard(store, tool, projectRoot, plan, true, existing, changed, removed, tracked);
    }

    Plan plan() {
        return plan;
    }

    /** The subset the tool should analyse, or empty for the whole project. */
    Optional<List<String>> fileSubset() {
        return plan == Plan.MERGE ? Optional.of(changed) : Optional.empty();
    }

    Optional<ToolCacheEntry> staged() {
        return Optional.ofNullable(staged.get());
    }

    @Override
    public String cacheName() {
        return "result";
    }

    @Override
    public boolean consultsCache() {
        return consultsCache;
    }

    @Override
    public Optional<Map<String, Object>> lookup() {
        if (plan != Plan.REUSE) {
            return Optional.empty();
        }
        ToolCacheEntry entry = existing.orElseThrow();
        if (removed.isEmpty() && entry.perFileFindings().keySet().stream().allMatch(tracked)) {
            return Optional.of(entry.aggregate());
        }
        ToolCacheEntry merged = store.prepareMerge(tool, existing, Map.of(), List.of(), removed, tracked);
        staged.set(merged);
        return Optional.of(merged.aggregate());
    }

    @Override
    public Map<String, Object> store(Map<String, Object> fresh) {
        var perFile = store.extract(tool, projectRoot, fresh);
        ToolCacheEntry entry = plan == Plan.MERGE
                ? store.prepareMerge(tool, existing, perFile, changed, removed, tracked)
                : store.prepareFull(tool, perFile, tracked);
        staged.set(entry);
        return entry.aggregate();
    }
}
