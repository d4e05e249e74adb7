package com.auditflow.core.fingerprint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FileScanner} and {@link Fingerprinter}.
 */
class FileScannerTest {

    @TempDir
    Path tempDir;

    FileScanner scanner = new FileScanner(Set.of(".git", "node_modules", ".audit_index"), Set.of(".py"));

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("scans empty directory and returns no files")
    void scansEmptyDirectory() {
        assertTrue(scanner.scan(tempDir).isEmpty());
    }

    @Test
    @DisplayName("keeps only included extensions and uses / separators")
    void filtersByExtension() throws IOException {
        write("app.py", "print('hi')");
        write("pkg/mod.py", "x = 1");
        write("README.md", "# readme");

        Map<String, String> files = scanner.scan(tempDir);

        assertEquals(List.of("app.py", "pkg/mod.py"), List.copyOf(files.keySet()));
    }

    @Test
    @DisplayName("never descends into excluded directories")
    void prunesExcludedDirectories() throws IOException {
        write(".git/hooks/pre-commit.py", "");
        write("node_modules/lib/index.py", "");
        write(".audit_index/cached.py", "");
        write("src/main.py", "");

        assertEquals(Set.of("src/main.py"), scanner.scan(tempDir).keySet());
    }

    @Test
    @DisplayName("ignores OS metadata files")
    void ignoresMetadataFiles() throws IOException {
        write(".DS_Store", "");
        write("a.py", "");
        var all = new FileScanner(Set.of(), Set.of());

        assertEquals(List.of("a.py"), all.listFiles(tempDir, all::isSourceFile));
    }

    @Test
    @DisplayName("fingerprint is the hex MD5 of the content")
    void fingerprintIsMd5() throws IOException {
        write("a.py", "hello");

        assertEquals("5d41402abc4b2a76b9719d911017c592", scanner.scan(tempDir).get("a.py"));
        assertEquals("5d41402abc4b2a76b9719d911017c592", Fingerprinter.fingerprint("hello".getBytes()));
    }

    @Test
    @DisplayName("identical content gives identical fingerprints, different content differs")
    void fingerprintTracksContent() throws IOException {
        write("a.py", "same");
        write("b.py", "same");
        write("c.py", "other");

        Map<String, String> files = scanner.scan(tempDir);

        assertEquals(files.get("a.py"), files.get("b.py"));
        assertNotEquals(files.get("a.py"), files.get("c.py"));
    }

    @Test
    @DisplayName("large files are hashed across chunk boundaries")
    void hashesLargeFiles() throws IOException {
        byte[] content = new byte[8192 * 3 + 17];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        Files.write(tempDir.resolve("big.py"), content);

        assertEquals(Fingerprinter.fingerprint(content), scanner.scan(tempDir).get("big.py"));
    }

    @Test
    @DisplayName("missing root raises ProjectAccessException")
    void missingRootFails() {
        assertThrows(ProjectAccessException.class, () -> scanner.scan(tempDir.resolve("nope")));
    }

    @Test
    @DisplayName("files that vanish before hashing are skipped")
    void skipsVanishedFiles() throws IOException {
        write("a.py", "a");

        Map<String, String> files = scanner.fingerprint(tempDir, List.of("a.py", "gone.py"));

        assertEquals(Set.of("a.py"), files.keySet());
    }

    @Test
    @DisplayName("empty extension set selects every file")
    void emptyExtensionSetSelectsAll() {
        var all = new FileScanner(Set.of(), Set.of());
        assertTrue(all.isSourceFile("Makefile"));
        assertTrue(all.isSourceFile("docs/guide.md"));
        assertFalse(scanner.isSourceFile("dir.py/Makefile"));
    }
}
