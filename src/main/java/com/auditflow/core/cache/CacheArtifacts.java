package com.auditflow.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the JSON artifacts behind the index and both caches.
 * <p>
 * Writes go to a temp file in the target directory and are then moved over the
 * target, so a crash mid-write leaves the previous artifact intact. Reads never
 * throw: a missing, truncated or otherwise unparseable artifact is reported as empty.
 */
public class CacheArtifacts {

    private static final Logger log = LoggerFactory.getLogger(CacheArtifacts.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CacheArtifacts() {
        this(defaultMapper());
    }

    public CacheArtifacts(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Reads an artifact.
     *
     * @return the parsed value, or empty if the file is absent or corrupt
     */
    public <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache artifact {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns {@code payload} as it reads back from an artifact: numbers take the
     * narrowest JSON type, dates become strings, maps keep insertion order.
     * Fresh results and cache hits then compare equal.
     *
     * @throws IOException if the payload cannot be serialised
     */
    public Map<String, Object> normalize(Map<String, Object> payload) throws IOException {
        return mapper.readValue(mapper.writeValueAsBytes(payload), PAYLOAD);
    }

    /**
     * Writes an artifact via temp-file-then-move.
     *
     * @throws IOException if the artifact could not be written
     */
    public void write(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);

        Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, mapper.writeValueAsBytes(value));
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Deletes an artifact.
     *
     * @return true if a file was removed
     */
    public boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache artifact {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Appends {@code dirName/} to the project's {@code .gitignore} if the file
     * exists and does not mention the directory yet.
     */
    public void ensureGitignored(Path projectRoot, String dirName) {
        Path gitignore = projectRoot.resolve(".gitignore");
        if (!Files.isRegularFile(gitignore)) {
            return;
        }
        try {
            String content = Files.readString(gitignore, StandardCharsets.UTF_8);
            if (content.lines().map(String::strip).anyMatch(line ->
                    line.equals(dirName) || line.equals(dirName + "/")
                            || line.equals("/" + dirName) || line.equals("/" + dirName + "/"))) {
                return;
            }
            String prefix = content.isEmpty() || content.endsWith("\n") ? "" : "\n";
            Files.writeString(gitignore, prefix + "\n# Audit cache\n" + dirName + "/\n",
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            log.info("Added {} to .gitignore", dirName);
        } catch (IOException e) {
            log.debug("Could not update .gitignore: {}", e.getMessage());
        }
    }
}
