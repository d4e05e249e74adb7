package com.auditflow.core.tools;

import com.auditflow.core.fingerprint.FileScanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MarkerScanToolTest {

    @TempDir
    Path project;

    MarkerScanTool tool = new MarkerScanTool(new FileScanner(Set.of(".git"), Set.of(".py")));

    private void write(String relative, String content) throws IOException {
        Path file = project.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> markers(Map<String, Object> payload) {
        return (List<Map<String, Object>>) payload.get("markers");
    }

    @Test
    @DisplayName("reports markers with file, line, kind and text")
    void findsMarkers() throws IOException {
        write("a.py", "x = 1\n# TODO: handle None\ny = 2  # FIXME broken\n");
        write("notes.txt", "TODO not a source file");

        var found = markers(tool.analyze(project, Optional.empty()));

        assertEquals(2, found.size());
        assertEquals(Map.of("file", "a.py", "line", 2, "kind", "TODO", "text", "handle None"), found.get(0));
        assertEquals("FIXME", found.get(1).get("kind"));
        assertEquals(3, found.get(1).get("line"));
    }

    @Test
    @DisplayName("analyses only the given subset")
    void honorsSubset() throws IOException {
        write("a.py", "# TODO a");
        write("b.py", "# XXX b");

        var found = markers(tool.analyze(project, Optional.of(List.of("b.py"))));

        assertEquals(1, found.size());
        assertEquals("b.py", found.get(0).get("file"));
    }

    @Test
    @DisplayName("subset entries that no longer exist are ignored")
    void ignoresMissingFiles() throws IOException {
        var payload = tool.analyze(project, Optional.of(List.of("gone.py")));

        assertTrue(markers(payload).isEmpty());
    }

    @Test
    @DisplayName("output round-trips through the markers strategy")
    void matchesStrategy() throws IOException {
        write("pkg/a.py", "# HACK: temporary");

        var payload = tool.analyze(project, Optional.empty());
        var strategy = ToolStrategies.defaults().find(MarkerScanTool.NAME).orElseThrow();
        var aggregate = strategy.reducer().reduce(strategy.extractor().extract(project, payload));

        assertEquals("markers_found", aggregate.get("status"));
        assertEquals(1, aggregate.get("total_markers"));
        assertEquals(ToolKind.FILE_DECOMPOSABLE, tool.profile().kind());
    }
}
