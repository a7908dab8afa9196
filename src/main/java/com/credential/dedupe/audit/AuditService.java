package com.credential.dedupe.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only, in-memory trail of every record removal, review hand-off and
 * policy outcome of a run.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} recordId={} clusterId={}",
                entry.action(), entry.recordId(), entry.clusterId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String recordId, String clusterId, Map<String, String> details) {
        return record(AuditEntry.of(action, recordId, clusterId, details));
    }

    public AuditEntry record(AuditAction action, String recordId, String clusterId) {
        return record(action, recordId, clusterId, null);
    }

    public AuditEntry record(AuditAction action, String recordId) {
        return record(action, recordId, null, null);
    }

    /**
     * All entries in recording order (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForRecord(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.recordId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesForCluster(String clusterId) {
        return entries.stream()
                .filter(e -> clusterId.equals(e.clusterId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
