package com.auditflow.core.fingerprint;

import com.auditflow.core.cache.CacheArtifacts;
import com.auditflow.core.model.ChangeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintIndexTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path project;

    FingerprintIndex index;

    @BeforeEach
    void setUp() {
        index = new FingerprintIndex(project, ".audit_index",
                new FileScanner(Set.of(".git", ".audit_index"), Set.of(".py")),
                new CacheArtifacts(), Clock.fixed(NOW, ZoneOffset.UTC), true);
    }

    private void write(String relative, String content) throws IOException {
        Path file = project.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Nested
    @DisplayName("diff")
    class DiffTests {

        @Test
        @DisplayName("without a persisted index every file is added")
        void firstRunAllAdded() throws IOException {
            write("a.py", "a");
            write("pkg/b.py", "b");

            ChangeSet changes = index.diff(index.scan());

            assertEquals(List.of("a.py", "pkg/b.py"), changes.added());
            assertTrue(changes.modified().isEmpty());
            assertTrue(changes.removed().isEmpty());
            assertTrue(changes.unchanged().isEmpty());
        }

        @Test
        @DisplayName("classifies added, modified, removed and unchanged files")
        void classifiesChanges() throws IOException {
            write("keep.py", "k");
            write("edit.py", "v1");
            write("drop.py", "d");
            index.commit(index.scan());

            write("edit.py", "v2");
            Files.delete(project.resolve("drop.py"));
            write("new.py", "n");

            ChangeSet changes = index.diff(index.scan());

            assertEquals(List.of("new.py"), changes.added());
            assertEquals(List.of("edit.py"), changes.modified());
            assertEquals(List.of("drop.py"), changes.removed());
            assertEquals(List.of("keep.py"), changes.unchanged());
            assertEquals("1 new, 1 modified, 1 deleted (1 unchanged)", changes.summary());
        }

        @Test
        @DisplayName("no changes after commit gives an empty change set")
        void noChangesAfterCommit() throws IOException {
            write("a.py", "a");
            index.commit(index.scan());

            ChangeSet changes = index.diff(index.scan());

            assertFalse(changes.hasChanges());
            assertEquals(List.of("a.py"), changes.unchanged());
            assertEquals("No changes detected", changes.summary());
        }

        @RepeatedTest(20)
        @DisplayName("partition is disjoint and covers the union of both file sets")
        void partitionInvariant() {
            var random = new Random();
            var previous = new HashMap<String, String>();
            var current = new HashMap<String, String>();
            for (int i = 0; i < 60; i++) {
                String path = "f" + i + ".py";
                int roll = random.nextInt(4);
                if (roll != 0) previous.put(path, "h" + random.nextInt(3));
                if (roll != 1) current.put(path, "h" + random.nextInt(3));
            }

            ChangeSet changes = FingerprintIndex.diff(current, previous);

            var union = new TreeSet<>(current.keySet());
            union.addAll(previous.keySet());
            List<String> all = Stream.of(changes.added(), changes.modified(), changes.removed(), changes.unchanged())
                    .flatMap(List::stream).toList();
            assertEquals(union.size(), all.size(), "categories must be disjoint");
            assertEquals(union, new TreeSet<>(all));

            changes.added().forEach(p -> assertTrue(current.containsKey(p) && !previous.containsKey(p)));
            changes.removed().forEach(p -> assertTrue(previous.containsKey(p) && !current.containsKey(p)));
            changes.modified().forEach(p -> assertNotEquals(previous.get(p), current.get(p)));
            changes.unchanged().forEach(p -> assertEquals(previous.get(p), current.get(p)));
        }
    }

    @Nested
    @DisplayName("persistence")
    class PersistenceTests {

        @Test
        @DisplayName("commit writes a readable index with timestamps from the clock")
        void commitAndLoad() throws IOException {
            write("a.py", "a");
            Map<String, String> current = index.scan();
            index.commit(current);

            IndexSnapshot snapshot = index.load().orElseThrow();
            assertEquals(NOW, snapshot.lastUpdated());
            assertEquals(current, snapshot.fingerprints());
            assertEquals(NOW, snapshot.files().get("a.py").lastSeen());
            assertTrue(index.exists());
        }

        @Test
        @DisplayName("commit leaves no temp files behind")
        void commitLeavesNoTempFiles() throws IOException {
            write("a.py", "a");
            index.commit(index.scan());
            index.commit(index.scan());

            try (Stream<Path> files = Files.list(index.indexFile().getParent())) {
                assertEquals(List.of("file_index.json"),
                        files.map(p -> p.getFileName().toString()).toList());
            }
        }

        @Test
        @DisplayName("corrupt index is treated as missing")
        void corruptIndexIsEmpty() throws IOException {
            write("a.py", "a");
            Files.createDirectories(index.indexFile().getParent());
            Files.writeString(index.indexFile(), "{\"files\": {\"a.py\": ");

            assertTrue(index.load().isEmpty());
            assertFalse(index.exists());
            assertEquals(List.of("a.py"), index.diff(index.scan()).added());
        }

        @Test
        @DisplayName("clear removes the index")
        void clearRemovesIndex() throws IOException {
            write("a.py", "a");
            index.commit(index.scan());

            assertTrue(index.clear());
            assertFalse(index.exists());
            assertFalse(index.clear());
        }

        @Test
        @DisplayName("commit adds the index directory to an existing .gitignore once")
        void updatesGitignore() throws IOException {
            write(".gitignore", "*.pyc\n");
            write("a.py", "a");

            index.commit(index.scan());
            index.commit(index.scan());

            String gitignore = Files.readString(project.resolve(".gitignore"));
            assertEquals(1, gitignore.lines().filter(l -> l.equals(".audit_index/")).count());
            assertTrue(gitignore.startsWith("*.pyc\n"));
        }
    }
}
