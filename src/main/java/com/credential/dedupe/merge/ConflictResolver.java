package com.credential.dedupe.merge;

import com.credential.dedupe.audit.AuditAction;
import com.credential.dedupe.audit.AuditService;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.grouping.DuplicateCluster;
import com.credential.dedupe.grouping.GroupingResult;
import com.credential.dedupe.review.ReviewCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Settles what can be settled without a reviewer and prepares the rest.
 *
 * <ol>
 *   <li>Singletons pass through unchanged.</li>
 *   <li>Clusters whose members carry identical important content collapse onto the
 *       preferred record; the others are removed.</li>
 *   <li>Any other cluster becomes a {@link ReviewCluster} with a proposed preferred record
 *       and a preview of its merged notes. Nothing is discarded for these.</li>
 * </ol>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final PreferredRecordSelector selector;
    private final MergeNotesBuilder notesBuilder;
    private final AuditService auditService;

    public ConflictResolver(AuditService auditService) {
        this(new PreferredRecordSelector(), new MergeNotesBuilder(), auditService);
    }

    public ConflictResolver(PreferredRecordSelector selector, MergeNotesBuilder notesBuilder,
                            AuditService auditService) {
        this.selector = Objects.requireNonNull(selector, "selector is required");
        this.notesBuilder = Objects.requireNonNull(notesBuilder, "notesBuilder is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    public ResolutionResult resolve(GroupingResult grouping) {
        Objects.requireNonNull(grouping, "grouping is required");
        List<ResolvedCluster> resolved = new ArrayList<>();
        List<ReviewCluster> pending = new ArrayList<>();
        List<VaultItem> removed = new ArrayList<>();
        List<String> order = new ArrayList<>();

        for (DuplicateCluster cluster : grouping.clusters()) {
            order.add(cluster.id());
            if (cluster.isSingleton()) {
                if (cluster.isolated()) {
                    auditService.record(AuditAction.RISKY_MERGE_AVOIDED, cluster.members().get(0).getInternalId(),
                            cluster.id());
                }
                resolved.add(new ResolvedCluster(cluster.id(), cluster.members(), false));
                continue;
            }

            VaultItem preferred = selector.select(cluster.members());
            if (ImportantFields.allSameContent(cluster.members())) {
                resolved.add(new ResolvedCluster(cluster.id(), List.of(preferred), true));
                for (VaultItem member : cluster.members()) {
                    if (member != preferred) {
                        removed.add(member);
                        auditService.record(AuditAction.EXACT_DUPLICATE_REMOVED, member.getInternalId(),
                                cluster.id(), Map.of("keptRecordId", preferred.getInternalId()));
                    }
                }
                log.debug("resolution.exact_duplicate clusterId={} members={}", cluster.id(), cluster.size());
                continue;
            }

            List<VaultItem> alternatives = new ArrayList<>(cluster.members());
            alternatives.removeIf(m -> m == preferred);
            pending.add(ReviewCluster.of(cluster, preferred, alternatives,
                    notesBuilder.build(preferred, cluster.members())));
            auditService.record(AuditAction.REVIEW_REQUESTED, preferred.getInternalId(),
                    cluster.id(), Map.of("members", String.valueOf(cluster.size())));
        }

        log.info("resolution.completed clusters={} autoResolved={} pending={} exactRemoved={} risky={}",
                order.size(), resolved.size(), pending.size(), removed.size(), grouping.riskyMergesAvoided().size());
        return new ResolutionResult(resolved, pending, removed, grouping.riskyMergesAvoided(), order);
    }
}
