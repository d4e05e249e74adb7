package com.auditflow.core.tools;

import com.auditflow.core.config.AuditProperties;
import com.auditflow.core.fingerprint.FileScanner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Built-in whole-project tool summarising file and line counts per extension.
 * Ignores any file subset. Pattern-cached on the configured source extensions,
 * so it only re-runs when a source file changes or the cache expires.
 */
@Component
@ConditionalOnProperty(prefix = "auditflow.tools", name = "builtin-enabled", havingValue = "true", matchIfMissing = true)
public class StructureTool implements AnalysisTool {

    public static final String NAME = "structure";

    private static final int LARGEST_FILES = 10;

    private final FileScanner scanner;
    private final ToolProfile profile;

    @Autowired
    public StructureTool(AuditProperties properties) {
        this(new FileScanner(properties.effectiveExcludeDirs(), properties.getIncludeExtensions()));
    }

    StructureTool(FileScanner scanner) {
        this.scanner = scanner;
        String[] patterns = scanner.includedExtensions().stream()
                .sorted()
                .map(ext -> "*" + ext)
                .toArray(String[]::new);
        this.profile = patterns.length == 0 ? ToolProfile.wholeProject() : ToolProfile.patternCached(patterns);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolProfile profile() {
        return profile;
    }

    @Override
    public Map<String, Object> analyze(Path projectRoot, Optional<List<String>> files) throws IOException {
        List<String> all = scanner.listFiles(projectRoot, scanner::isSourceFile);

        var byExtension = new TreeMap<String, Map<String, Object>>();
        var sizes = new ArrayList<Map<String, Object>>();
        long totalLines = 0;
        for (String file : all) {
            long lines = countLines(projectRoot.resolve(file));
            totalLines += lines;
            var bucket = byExtension.computeIfAbsent(extensionOf(file),
                    k -> new LinkedHashMap<>(Map.of("files", 0, "lines", 0L)));
            bucket.put("files", (Integer) bucket.get("files") + 1);
            bucket.put("lines", (Long) bucket.get("lines") + lines);
            sizes.add(Map.of("file", file, "lines", lines));
        }
        sizes.sort(Comparator.comparing((Map<String, Object> m) -> (Long) m.get("lines")).reversed()
                .thenComparing(m -> (String) m.get("file")));

        var payload = new LinkedHashMap<String, Object>();
        payload.put("tool", NAME);
        payload.put("total_files", all.size());
        payload.put("total_lines", totalLines);
        payload.put("by_extension", byExtension);
        payload.put("largest_files", List.copyOf(sizes.subList(0, Math.min(LARGEST_FILES, sizes.size()))));
        return payload;
    }

    private static long countLines(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file)) {
            return lines.count();
        } catch (UncheckedIOException e) {
            // malformed input; fall back to counting newlines in the raw bytes
            byte[] bytes = Files.readAllBytes(file);
            long count = 0;
            for (byte b : bytes) {
                if (b == '\n') count++;
            }
            return bytes.length > 0 && bytes[bytes.length - 1] != '\n' ? count + 1 : count;
        }
    }

    private static String extensionOf(String file) {
        int dot = file.lastIndexOf('.');
        int slash = file.lastIndexOf('/');
        return dot > slash ? file.substring(dot) : "";
    }
}
