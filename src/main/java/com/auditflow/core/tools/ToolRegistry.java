package com.auditflow.core.tools;

import com.auditflow.core.config.AuditProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name-to-tool map built once at startup from the tool beans and the
 * configured command tools. The first registration of a name wins.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AnalysisTool> tools;

    @Autowired
    public ToolRegistry(ObjectProvider<AnalysisTool> beans, AuditProperties properties,
                        ProcessRunner runner, ObjectMapper mapper) {
        var all = new ArrayList<AnalysisTool>(beans.orderedStream().toList());
        for (AuditProperties.CommandToolSpec spec : properties.getCommandTools()) {
            all.add(new CommandTool(spec, runner, mapper));
        }
        this.tools = index(all);
        log.info("Registered {} analysis tools: {}", tools.size(), tools.keySet());
    }

    public ToolRegistry(Collection<? extends AnalysisTool> tools) {
        this.tools = index(tools);
    }

    /** All registered tools in name order. */
    public Map<String, AnalysisTool> tools() {
        return tools;
    }

    /**
     * Selects the named tools.
     *
     * @throws IllegalArgumentException if a name is not registered
     */
    public Map<String, AnalysisTool> select(Collection<String> names) {
        var selected = new LinkedHashMap<String, AnalysisTool>();
        for (String name : names) {
            AnalysisTool tool = tools.get(name);
            if (tool == null) {
                throw new IllegalArgumentException("Unknown tool: " + name + " (registered: " + tools.keySet() + ")");
            }
            selected.put(name, tool);
        }
        return selected;
    }

    private static Map<String, AnalysisTool> index(Collection<? extends AnalysisTool> candidates) {
        var byName = new TreeMap<String, AnalysisTool>();
        for (AnalysisTool tool : candidates) {
            AnalysisTool existing = byName.putIfAbsent(tool.name(), tool);
            if (existing != null) {
                log.warn("Duplicate tool name '{}': keeping {}, ignoring {}", tool.name(),
                        existing.getClass().getSimpleName(), tool.getClass().getSimpleName());
            }
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }
}
