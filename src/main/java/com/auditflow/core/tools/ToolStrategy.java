package com.auditflow.core.tools;

/**
 * Per-tool pair of extractor and reducer that makes a tool eligible for the result store.
 */
public record ToolStrategy(
    String tool,
    FindingsExtractor extractor,
    FindingsReducer reducer
) {}
