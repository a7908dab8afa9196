package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.review.ReviewCluster;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of resolving one grouping run.
 *
 * @param resolvedClusters        clusters settled without review, in cluster order
 * @param pendingClusters         near-duplicate clusters waiting for a decision, in cluster order
 * @param removedExactDuplicates  records dropped by the exact-duplicate rule
 * @param riskyMergesAvoided      records kept apart for lack of identity signals
 * @param clusterOrder            every cluster id in grouping order
 */
public record ResolutionResult(
        List<ResolvedCluster> resolvedClusters,
        List<ReviewCluster> pendingClusters,
        List<VaultItem> removedExactDuplicates,
        List<VaultItem> riskyMergesAvoided,
        List<String> clusterOrder
) {
    public ResolutionResult {
        resolvedClusters = List.copyOf(resolvedClusters);
        pendingClusters = List.copyOf(pendingClusters);
        removedExactDuplicates = List.copyOf(removedExactDuplicates);
        riskyMergesAvoided = List.copyOf(riskyMergesAvoided);
        clusterOrder = List.copyOf(clusterOrder);
    }

    /**
     * Every record that needs no decision, in cluster order.
     */
    public List<VaultItem> autoResolvedRecords() {
        List<VaultItem> records = new ArrayList<>();
        resolvedClusters.forEach(c -> records.addAll(c.records()));
        return records;
    }

    public boolean hasPendingClusters() {
        return !pendingClusters.isEmpty();
    }
}
