package com.auditflow.core.fingerprint;

import com.auditflow.core.cache.CacheArtifacts;
import com.auditflow.core.model.ChangeSet;
import com.auditflow.core.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Persisted path-to-fingerprint index for one project, stored at
 * {@code <indexDir>/file_index.json}. This class is the only writer of that file.
 * <p>
 * A missing or unreadable index behaves like an empty one, so the first diff
 * after a crash or a fresh checkout reports every file as added.
 */
public class FingerprintIndex {

    private static final Logger log = LoggerFactory.getLogger(FingerprintIndex.class);

    static final String INDEX_FILE = "file_index.json";
    static final String FORMAT_VERSION = "1.0";

    private final Path projectRoot;
    private final Path indexDir;
    private final FileScanner scanner;
    private final CacheArtifacts artifacts;
    private final Clock clock;
    private final boolean updateGitignore;

    public FingerprintIndex(Path projectRoot, String indexDirName, FileScanner scanner,
                            CacheArtifacts artifacts, Clock clock, boolean updateGitignore) {
        this.projectRoot = projectRoot;
        this.indexDir = projectRoot.resolve(indexDirName);
        this.scanner = scanner;
        this.artifacts = artifacts;
        this.clock = clock;
        this.updateGitignore = updateGitignore;
    }

    public Path indexFile() {
        return indexDir.resolve(INDEX_FILE);
    }

    public FileScanner scanner() {
        return scanner;
    }

    /**
     * Fingerprints every in-scope file under the project root.
     *
     * @throws ProjectAccessException if the root cannot be read
     */
    public Map<String, String> scan() {
        Map<String, String> current = scanner.scan(projectRoot);
        log.info("Scanned {} files under {}", current.size(), projectRoot);
        return current;
    }

    public boolean exists() {
        return load().isPresent();
    }

    /**
     * Loads the persisted index.
     *
     * @return the snapshot, or empty if it is missing or unreadable
     */
    public Optional<IndexSnapshot> load() {
        return artifacts.read(indexFile(), IndexDocument.class)
                .filter(doc -> doc.files() != null)
                .map(doc -> {
                    var records = new TreeMap<String, FileRecord>();
                    doc.files().forEach((path, file) -> {
                        if (file != null && file.fingerprint() != null) {
                            records.put(path, new FileRecord(path, file.fingerprint(), file.lastSeen()));
                        }
                    });
                    return new IndexSnapshot(doc.lastUpdated(), records);
                });
    }

    /**
     * Diffs {@code current} against the persisted index.
     */
    public ChangeSet diff(Map<String, String> current) {
        Map<String, String> previous = load().map(IndexSnapshot::fingerprints).orElse(Map.of());
        ChangeSet changes = diff(current, previous);
        log.info("Change detection: {}", changes.summary());
        return changes;
    }

    /**
     * Four-way partition of {@code current ∪ previous}.
     */
    public static ChangeSet diff(Map<String, String> current, Map<String, String> previous) {
        var added = new ArrayList<String>();
        var modified = new ArrayList<String>();
        var removed = new ArrayList<String>();
        var unchanged = new ArrayList<String>();

        var all = new TreeSet<String>(current.keySet());
        all.addAll(previous.keySet());
        for (String path : all) {
            String now = current.get(path);
            String before = previous.get(path);
            if (before == null) {
                added.add(path);
            } else if (now == null) {
                removed.add(path);
            } else if (now.equals(before)) {
                unchanged.add(path);
            } else {
                modified.add(path);
            }
        }
        return new ChangeSet(added, modified, removed, unchanged);
    }

    /**
     * Replaces the persisted index with {@code current}. The write goes through
     * a temp file so an interrupted commit leaves the previous index readable.
     *
     * @throws IOException if the index could not be written
     */
    public void commit(Map<String, String> current) throws IOException {
        Instant now = clock.instant();
        var files = new LinkedHashMap<String, IndexedFile>();
        new TreeMap<>(current).forEach((path, fingerprint) -> files.put(path, new IndexedFile(fingerprint, now)));

        if (updateGitignore) {
            artifacts.ensureGitignored(projectRoot, indexDir.getFileName().toString());
        }
        artifacts.write(indexFile(), new IndexDocument(
                FORMAT_VERSION, projectRoot.toString(), now, files.size(), files));
        log.info("Saved file index with {} entries", files.size());
    }

    /**
     * Deletes the persisted index, forcing the next audit into full mode.
     *
     * @return true if an index was removed
     */
    public boolean clear() {
        boolean removed = artifacts.delete(indexFile());
        if (removed) {
            log.info("Cleared file index for {}", projectRoot);
        }
        return removed;
    }

    /**
     * On-disk index layout.
     */
    public record IndexDocument(
            String version,
            String projectPath,
            Instant lastUpdated,
            int totalFiles,
            Map<String, IndexedFile> files
    ) {}

    public record IndexedFile(String fingerprint, Instant lastSeen) {}
}
