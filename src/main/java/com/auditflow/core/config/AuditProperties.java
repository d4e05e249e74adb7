package com.auditflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "auditflow")
public class AuditProperties {

    private Index index = new Index();
    private Cache cache = new Cache();
    private Orchestrator orchestrator = new Orchestrator();
    private Tools tools = new Tools();

    // -- Flattened accessors --
    public String getIndexDir() { return index.dir; }
    public Set<String> getIncludeExtensions() { return index.includeExtensions; }
    public Set<String> getExcludeDirs() { return index.excludeDirs; }
    public String getCacheDir() { return cache.dir; }
    public Duration getCacheMaxAge() { return cache.maxAge; }
    public boolean isUpdateGitignore() { return cache.updateGitignore; }
    public int getMaxParallel() { return orchestrator.maxParallel; }
    public Duration getAuditTimeout() { return orchestrator.auditTimeout; }
    public Duration getLockTimeout() { return orchestrator.lockTimeout; }
    public boolean isBuiltinToolsEnabled() { return tools.builtinEnabled; }
    public List<CommandToolSpec> getCommandTools() { return tools.commands; }

    public Index getIndex() { return index; }
    public void setIndex(Index index) { this.index = index; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }

    /**
     * Directory names the fingerprint index and pattern cache never descend into.
     * Includes both cache directories so the audit never fingerprints its own artifacts.
     */
    public Set<String> effectiveExcludeDirs() {
        var dirs = new LinkedHashSet<>(index.excludeDirs);
        dirs.add(index.dir);
        dirs.add(cache.dir);
        return dirs;
    }

    public static class Index {
        private String dir = ".audit_index";
        private Set<String> includeExtensions = new LinkedHashSet<>(List.of(".py", ".java"));
        private Set<String> excludeDirs = new LinkedHashSet<>(List.of(
                ".git", ".venv", "venv", "env", "node_modules", "__pycache__",
                ".pytest_cache", ".mypy_cache", ".ruff_cache", ".tox", ".eggs", "eggs",
                "site-packages", "dist", "build", "htmlcov", "target", ".gradle",
                ".idea", ".vscode"));

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public Set<String> getIncludeExtensions() { return includeExtensions; }
        public void setIncludeExtensions(Set<String> includeExtensions) { this.includeExtensions = includeExtensions; }
        public Set<String> getExcludeDirs() { return excludeDirs; }
        public void setExcludeDirs(Set<String> excludeDirs) { this.excludeDirs = excludeDirs; }
    }

    public static class Cache {
        private String dir = ".audit_cache";
        private Duration maxAge = Duration.ofHours(1);
        private boolean updateGitignore = true;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
        public boolean isUpdateGitignore() { return updateGitignore; }
        public void setUpdateGitignore(boolean updateGitignore) { this.updateGitignore = updateGitignore; }
    }

    public static class Orchestrator {
        private int maxParallel = 8;
        private Duration auditTimeout = Duration.ofMinutes(15);
        private Duration lockTimeout = Duration.ofMinutes(5);

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public Duration getAuditTimeout() { return auditTimeout; }
        public void setAuditTimeout(Duration auditTimeout) { this.auditTimeout = auditTimeout; }
        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
    }

    public static class Tools {
        private boolean builtinEnabled = true;
        private List<CommandToolSpec> commands = new ArrayList<>();

        public boolean isBuiltinEnabled() { return builtinEnabled; }
        public void setBuiltinEnabled(boolean builtinEnabled) { this.builtinEnabled = builtinEnabled; }
        public List<CommandToolSpec> getCommands() { return commands; }
        public void setCommands(List<CommandToolSpec> commands) { this.commands = commands; }
    }

    /**
     * An external analyzer invoked as a command whose stdout is a JSON findings payload.
     */
    public static class CommandToolSpec {
        private String name;
        private List<String> command = new ArrayList<>();
        private boolean fileDecomposable = false;
        private boolean passFiles = false;
        private List<String> cachePatterns = new ArrayList<>();
        private Set<Integer> acceptedExitCodes = new LinkedHashSet<>(List.of(0, 1));
        private Duration timeout = Duration.ofMinutes(5);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public boolean isFileDecomposable() { return fileDecomposable; }
        public void setFileDecomposable(boolean fileDecomposable) { this.fileDecomposable = fileDecomposable; }
        public boolean isPassFiles() { return passFiles; }
        public void setPassFiles(boolean passFiles) { this.passFiles = passFiles; }
        public List<String> getCachePatterns() { return cachePatterns; }
        public void setCachePatterns(List<String> cachePatterns) { this.cachePatterns = cachePatterns; }
        public Set<Integer> getAcceptedExitCodes() { return acceptedExitCodes; }
        public void setAcceptedExitCodes(Set<Integer> acceptedExitCodes) { this.acceptedExitCodes = acceptedExitCodes; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
