package com.auditflow.core.tools;

import com.auditflow.core.config.AuditProperties;
import com.auditflow.core.fingerprint.FileScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in file-decomposable tool reporting TODO/FIXME/XXX/HACK markers.
 * Honors the file subset it is given.
 */
@Component
@ConditionalOnProperty(prefix = "auditflow.tools", name = "builtin-enabled", havingValue = "true", matchIfMissing = true)
public class MarkerScanTool implements AnalysisTool {

    private static final Logger log = LoggerFactory.getLogger(MarkerScanTool.class);

    public static final String NAME = "markers";

    private static final Pattern MARKER = Pattern.compile("\\b(TODO|FIXME|XXX|HACK)\\b[:\\s]*(.*)");

    private final FileScanner scanner;

    @Autowired
    public MarkerScanTool(AuditProperties properties) {
        this(new FileScanner(properties.effectiveExcludeDirs(), properties.getIncludeExtensions()));
    }

    MarkerScanTool(FileScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ToolProfile profile() {
        return ToolProfile.fileDecomposable();
    }

    @Override
    public Map<String, Object> analyze(Path projectRoot, Optional<List<String>> files) throws IOException {
        List<String> targets = files.orElseGet(() -> scanner.listFiles(projectRoot, scanner::isSourceFile));

        var markers = new ArrayList<Map<String, Object>>();
        for (String file : targets) {
            Path path = projectRoot.resolve(file);
            if (!Files.isRegularFile(path)) {
                continue;
            }
            List<String> lines;
            try {
                lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (MalformedInputException e) {
                log.debug("Skipping non-UTF-8 file {}", file);
                continue;
            }
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = MARKER.matcher(lines.get(i));
                if (matcher.find()) {
                    var marker = new LinkedHashMap<String, Object>();
                    marker.put("file", file);
                    marker.put("line", i + 1);
                    marker.put("kind", matcher.group(1));
                    marker.put("text", matcher.group(2).strip());
                    markers.add(marker);
                }
            }
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("tool", NAME);
        payload.put("files_scanned", targets.size());
        payload.put("markers", markers);
        return payload;
    }
}
