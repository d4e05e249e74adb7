package com.auditflow.core.tools;

import com.auditflow.core.config.AuditProperties.CommandToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adapter for an external analyzer configured under {@code auditflow.tools.commands}.
 * The command runs in the project root and must print a JSON object on stdout.
 * <p>
 * When {@code pass-files} is set and a file subset is given, the subset is appended
 * to the command line; otherwise the analyzer scans the whole project.
 */
public class CommandTool implements AnalysisTool {

    private static final Logger log = LoggerFactory.getLogger(CommandTool.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final CommandToolSpec spec;
    private final ProcessRunner runner;
    private final ObjectMapper mapper;
    private final ToolProfile profile;

    public CommandTool(CommandToolSpec spec, ProcessRunner runner, ObjectMapper mapper) {
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new IllegalArgumentException("Command tool requires a name");
        }
        if (spec.getCommand() == null || spec.getCommand().isEmpty()) {
            throw new IllegalArgumentException("Command tool " + spec.getName() + " has no command");
        }
        this.spec = spec;
        this.runner = runner;
        this.mapper = mapper;
        this.profile = spec.isFileDecomposable()
                ? new ToolProfile(ToolKind.FILE_DECOMPOSABLE, List.of(), spec.isPassFiles())
                : new ToolProfile(ToolKind.WHOLE_PROJECT, spec.getCachePatterns(), false);
    }

    @Override
    public String name() {
        return spec.getName();
    }

    @Override
    public ToolProfile profile() {
        return profile;
    }

    @Override
    public Map<String, Object> analyze(Path projectRoot, Optional<List<String>> files)
            throws IOException, InterruptedException {
        var command = new ArrayList<>(spec.getCommand());
        if (spec.isPassFiles() && files.isPresent()) {
            command.addAll(files.get());
        }

        ProcessResult result = runner.run(command, projectRoot, spec.getTimeout());
        if (result.timedOut()) {
            throw new ToolExecutionException(name() + " timed out after " + spec.getTimeout().toSeconds() + "s");
        }
        if (!spec.getAcceptedExitCodes().contains(result.exitCode())) {
            throw new ToolExecutionException(name() + " exited with code " + result.exitCode()
                    + abbreviate(result.stderr()));
        }
        if (result.stdout().isBlank()) {
            log.debug("{} produced no output; treating as no findings", name());
            return Map.of();
        }
        try {
            return mapper.readValue(result.stdout(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(name() + " produced output that is not a JSON object", e);
        }
    }

    private static String abbreviate(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        String trimmed = stderr.strip();
        return ": " + (trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed);
    }
}
