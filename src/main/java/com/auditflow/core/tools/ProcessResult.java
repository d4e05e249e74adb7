package com.auditflow.core.tools;

/**
 * Captured outcome of an external command.
 *
 * @param exitCode process exit code, -1 if the process was killed on timeout
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut true if the process exceeded its timeout and was destroyed
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {}
