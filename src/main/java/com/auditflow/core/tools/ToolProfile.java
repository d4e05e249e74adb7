package com.auditflow.core.tools;

import java.util.List;

/**
 * How the coordinator may schedule and cache a tool.
 *
 * @param kind             file-decomposable or whole-project
 * @param cachePatterns    dependency globs for the pattern cache; empty means the tool is never pattern-cached
 * @param honorsFileSubset false if the tool always scans the whole project regardless of the subset it is given
 */
public record ToolProfile(
    ToolKind kind,
    List<String> cachePatterns,
    boolean honorsFileSubset
) {

    public ToolProfile {
        cachePatterns = List.copyOf(cachePatterns);
    }

    public static ToolProfile fileDecomposable() {
        return new ToolProfile(ToolKind.FILE_DECOMPOSABLE, List.of(), true);
    }

    public static ToolProfile wholeProject() {
        return new ToolProfile(ToolKind.WHOLE_PROJECT, List.of(), false);
    }

    public static ToolProfile patternCached(String... patterns) {
        return new ToolProfile(ToolKind.WHOLE_PROJECT, List.of(patterns), false);
    }

    public boolean isPatternCached() {
        return !cachePatterns.isEmpty();
    }
}
