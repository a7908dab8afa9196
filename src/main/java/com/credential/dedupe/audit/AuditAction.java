package com.credential.dedupe.audit;

/**
 * Destructive or policy actions taken on imported records.
 */
public enum AuditAction {
    EXACT_DUPLICATE_REMOVED,
    REVIEW_REQUESTED,
    DECISION_APPLIED,
    RECORD_DISCARDED,
    RISKY_MERGE_AVOIDED
}
