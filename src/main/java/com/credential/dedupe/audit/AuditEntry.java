package com.credential.dedupe.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an audited action on one vault record.
 *
 * @param id        unique entry id
 * @param action    what happened
 * @param recordId  internal id of the record acted on
 * @param clusterId duplicate cluster the action belongs to, or {@code null} outside clustering
 * @param details   ids, counts and labels only; never credential values
 * @param timestamp when the entry was recorded
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String recordId,
        String clusterId,
        Map<String, String> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String recordId, String clusterId, Map<String, String> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, recordId, clusterId, details, Instant.now());
    }
}
