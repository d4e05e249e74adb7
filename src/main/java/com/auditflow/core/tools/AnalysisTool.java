package com.auditflow.core.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An analysis procedure the audit runs. Implementations are opaque to the
 * orchestration layer: they take a project root and optionally a subset of
 * project-relative files, and return a JSON-shaped findings payload.
 * <p>
 * A tool may ignore {@code files} and scan the whole project; callers never
 * rely on the subset being honored.
 */
public interface AnalysisTool {

    String name();

    ToolProfile profile();

    Map<String, Object> analyze(Path projectRoot, Optional<List<String>> files)
            throws IOException, InterruptedException;
}
