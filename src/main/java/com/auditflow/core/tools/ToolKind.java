package com.auditflow.core.tools;

/**
 * Whether a tool's findings can be attributed to individual source files.
 */
public enum ToolKind {
    /** Findings belong to single files; eligible for per-file merge in the result store. */
    FILE_DECOMPOSABLE,
    /** Output only makes sense over the whole project; never sliced by file. */
    WHOLE_PROJECT
}
