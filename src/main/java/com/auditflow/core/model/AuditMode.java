package com.auditflow.core.model;

public enum AuditMode {
    FULL,
    INCREMENTAL
}
