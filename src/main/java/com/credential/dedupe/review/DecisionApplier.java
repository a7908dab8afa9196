package com.credential.dedupe.review;

import com.credential.dedupe.audit.AuditAction;
import com.credential.dedupe.audit.AuditService;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.grouping.DuplicateCluster;
import com.credential.dedupe.merge.MergeNotesBuilder;
import com.credential.dedupe.merge.PreferredRecordSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a reviewer's decision into the records that survive a cluster.
 * This is the only place where a near-duplicate record is discarded.
 */
public class DecisionApplier {
    private static final Logger log = LoggerFactory.getLogger(DecisionApplier.class);

    private final PreferredRecordSelector selector;
    private final MergeNotesBuilder notesBuilder;
    private final AuditService auditService;

    public DecisionApplier(AuditService auditService) {
        this(new PreferredRecordSelector(), new MergeNotesBuilder(), auditService);
    }

    public DecisionApplier(PreferredRecordSelector selector, MergeNotesBuilder notesBuilder,
                           AuditService auditService) {
        this.selector = Objects.requireNonNull(selector, "selector is required");
        this.notesBuilder = Objects.requireNonNull(notesBuilder, "notesBuilder is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    public List<VaultItem> apply(ReviewCluster review, ReviewDecision decision) {
        Objects.requireNonNull(review, "review is required");
        return apply(review.cluster(), review.preferredCandidate(), decision);
    }

    public List<VaultItem> apply(DuplicateCluster cluster, ReviewDecision decision) {
        Objects.requireNonNull(cluster, "cluster is required");
        return apply(cluster, selector.select(cluster.members()), decision);
    }

    private List<VaultItem> apply(DuplicateCluster cluster, VaultItem preferred, ReviewDecision decision) {
        Objects.requireNonNull(decision, "decision is required");
        List<VaultItem> members = cluster.members();

        List<VaultItem> result = switch (decision.action()) {
            case KEEP_BEST -> List.of(notesBuilder.merge(preferred, members));
            case KEEP_ONE -> List.of(notesBuilder.merge(find(cluster, decision.recordId()), members));
            case KEEP_ALL, SKIP -> members;
        };

        if (decision.action().discardsRecords()) {
            String keptId = result.get(0).getInternalId();
            for (VaultItem member : members) {
                if (!member.getInternalId().equals(keptId)) {
                    auditService.record(AuditAction.RECORD_DISCARDED, member.getInternalId(),
                            cluster.id(), Map.of("keptRecordId", keptId));
                }
            }
        }
        auditService.record(AuditAction.DECISION_APPLIED, result.get(0).getInternalId(),
                cluster.id(), Map.of("action", decision.action().name(),
                        "members", String.valueOf(members.size()), "kept", String.valueOf(result.size())));
        log.info("decision.applied clusterId={} action={} members={} kept={}",
                cluster.id(), decision.action(), members.size(), result.size());
        return result;
    }

    private static VaultItem find(DuplicateCluster cluster, String recordId) {
        return cluster.members().stream()
                .filter(m -> m.getInternalId().equals(recordId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Record " + recordId + " is not a member of " + cluster.id()));
    }
}
