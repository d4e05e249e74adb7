package com.auditflow.core.tools;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit table of per-file extractors and reducers, keyed by tool name.
 * <p>
 * Every file-decomposable tool the result store handles must have an entry here.
 * Reducers walk files in path order so the aggregate of a merged map is identical
 * to the aggregate of a full run over the same files.
 */
public class ToolStrategies {

    private static final List<String> RUFF_CATEGORIES =
            List.of("quality", "style", "imports", "performance", "security", "complexity");

    private final Map<String, ToolStrategy> strategies = new ConcurrentHashMap<>();

    /**
     * The strategies for the analyzers a Python audit typically wires in,
     * plus the built-in marker scan.
     */
    public static ToolStrategies defaults() {
        return new ToolStrategies()
                .register(listStrategy("bandit", "bandit", "issues", List.of("filename", "file"),
                        "total_issues", "issues_found", 50))
                .register(categorizedStrategy("ruff", "ruff", RUFF_CATEGORIES, "quality", List.of("file", "filename")))
                .register(listStrategy("deadcode", "vulture", "dead_code", List.of("file"),
                        "total_dead", "issues_found", 30))
                .register(listStrategy("efficiency", "radon", "high_complexity_functions", List.of("file"),
                        "total_high_complexity", "issues_found", 0))
                .register(listStrategy("secrets", "detect-secrets", "findings", List.of("filename", "file"),
                        "total_secrets", "secrets_found", 0))
                .register(listStrategy("typing", "mypy", "issues", List.of("file", "filename"),
                        "total_issues", "issues_found", 0))
                .register(listStrategy(MarkerScanTool.NAME, MarkerScanTool.NAME, "markers", List.of("file"),
                        "total_markers", "markers_found", 0));
    }

    public ToolStrategies register(ToolStrategy strategy) {
        strategies.put(strategy.tool(), strategy);
        return this;
    }

    public Optional<ToolStrategy> find(String tool) {
        return Optional.ofNullable(strategies.get(tool));
    }

    public Set<String> tools() {
        return Set.copyOf(strategies.keySet());
    }

    /**
     * Strategy for a payload with one findings list.
     *
     * @param tool        tool name
     * @param label       value of the aggregate's {@code tool} field
     * @param listKey     payload key holding the findings list
     * @param fileKeys    finding fields naming the file, tried in order
     * @param totalKey    aggregate key for the finding count
     * @param foundStatus aggregate status when any finding exists ({@code clean} otherwise)
     * @param limit       maximum findings listed in the aggregate; 0 lists all
     */
    public static ToolStrategy listStrategy(String tool, String label, String listKey, List<String> fileKeys,
                                            String totalKey, String foundStatus, int limit) {
        FindingsExtractor extractor = (root, payload) -> {
            var perFile = new TreeMap<String, List<Map<String, Object>>>();
            for (Map<String, Object> finding : findingsUnder(payload, listKey)) {
                fileOf(root, finding, fileKeys)
                        .ifPresent(file -> perFile.computeIfAbsent(file, k -> new ArrayList<>()).add(finding));
            }
            return perFile;
        };
        FindingsReducer reducer = perFile -> {
            List<Map<String, Object>> all = flatten(perFile);
            var aggregate = new LinkedHashMap<String, Object>();
            aggregate.put("tool", label);
            aggregate.put("status", all.isEmpty() ? "clean" : foundStatus);
            aggregate.put(totalKey, all.size());
            aggregate.put("files_with_findings", countFilesWithFindings(perFile));
            aggregate.put(listKey, limit > 0 && all.size() > limit ? List.copyOf(all.subList(0, limit)) : all);
            return aggregate;
        };
        return new ToolStrategy(tool, extractor, reducer);
    }

    /**
     * Strategy for a payload that spreads findings over several category lists.
     * Each extracted finding carries its category so the reducer can file it back.
     */
    public static ToolStrategy categorizedStrategy(String tool, String label, List<String> categories,
                                                   String defaultCategory, List<String> fileKeys) {
        FindingsExtractor extractor = (root, payload) -> {
            var perFile = new TreeMap<String, List<Map<String, Object>>>();
            for (String category : categories) {
                for (Map<String, Object> finding : findingsUnder(payload, category)) {
                    var tagged = new LinkedHashMap<String, Object>(finding);
                    tagged.putIfAbsent("category", category);
                    fileOf(root, tagged, fileKeys)
                            .ifPresent(file -> perFile.computeIfAbsent(file, k -> new ArrayList<>()).add(tagged));
                }
            }
            return perFile;
        };
        FindingsReducer reducer = perFile -> {
            var byCategory = new LinkedHashMap<String, List<Map<String, Object>>>();
            categories.forEach(c -> byCategory.put(c, new ArrayList<>()));
            for (Map<String, Object> finding : flatten(perFile)) {
                Object category = finding.get("category");
                String key = category instanceof String s && byCategory.containsKey(s) ? s : defaultCategory;
                byCategory.get(key).add(finding);
            }
            int total = byCategory.values().stream().mapToInt(List::size).sum();
            var aggregate = new LinkedHashMap<String, Object>();
            aggregate.put("tool", label);
            aggregate.put("status", total > 0 ? "issues_found" : "clean");
            aggregate.put("total_issues", total);
            aggregate.put("files_with_findings", countFilesWithFindings(perFile));
            aggregate.putAll(byCategory);
            return aggregate;
        };
        return new ToolStrategy(tool, extractor, reducer);
    }

    /**
     * Normalises a file reference from analyzer output to a project-relative,
     * {@code /}-separated path. Absolute paths outside the project are kept as given.
     */
    public static String normalizePath(Path projectRoot, String raw) {
        String path = raw.replace('\\', '/');
        try {
            Path candidate = Path.of(raw);
            if (candidate.isAbsolute()) {
                Path root = projectRoot.toAbsolutePath().normalize();
                Path absolute = candidate.normalize();
                if (absolute.startsWith(root)) {
                    path = root.relativize(absolute).toString().replace('\\', '/');
                }
            }
        } catch (InvalidPathException e) {
            // not a filesystem path; keep the raw text
        }
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        return path;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> findingsUnder(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var findings = new ArrayList<Map<String, Object>>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                findings.add((Map<String, Object>) map);
            }
        }
        return findings;
    }

    private static Optional<String> fileOf(Path root, Map<String, Object> finding, List<String> fileKeys) {
        for (String key : fileKeys) {
            if (finding.get(key) instanceof String file && !file.isBlank()) {
                return Optional.of(normalizePath(root, file));
            }
        }
        return Optional.empty();
    }

    private static List<Map<String, Object>> flatten(Map<String, List<Map<String, Object>>> perFile) {
        var all = new ArrayList<Map<String, Object>>();
        new TreeMap<>(perFile).values().forEach(all::addAll);
        return all;
    }

    private static int countFilesWithFindings(Map<String, List<Map<String, Object>>> perFile) {
        return (int) perFile.values().stream().filter(list -> !list.isEmpty()).count();
    }
}
