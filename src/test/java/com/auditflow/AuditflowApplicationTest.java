package com.auditflow;

import com.auditflow.core.engine.AuditService;
import com.auditflow.core.events.AuditProgressListener;
import com.auditflow.core.model.AuditResult;
import com.auditflow.core.model.ToolState;
import com.auditflow.core.tools.ToolRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "auditflow.cache.update-gitignore=false")
class AuditflowApplicationTest {

    @Autowired
    AuditService auditService;

    @Autowired
    ToolRegistry registry;

    @Autowired
    AuditProgressListener progress;

    @TempDir
    Path project;

    @Test
    @DisplayName("wires the built-in tools into the registry")
    void builtinToolsRegistered() {
        assertTrue(registry.tools().keySet().containsAll(Set.of("markers", "structure")));
    }

    @Test
    @DisplayName("audits a project end to end with the built-in tools")
    void auditsProject() throws IOException {
        Files.writeString(project.resolve("app.py"), "x = 1  # TODO: drop this\n");

        AuditResult result = auditService.runAudit(project, false);

        assertEquals(ToolState.SUCCEEDED, result.perToolStatus().get("markers").state());
        assertEquals(1, result.perToolResult().get("markers").get("total_markers"));
        assertFalse(Files.exists(project.resolve(".gitignore")));
        assertTrue(progress.progress(result.runId()).isEmpty(), "finished runs are no longer tracked");
    }
}
