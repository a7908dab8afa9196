package com.credential.dedupe.grouping;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;

/**
 * Every record assigned to exactly one cluster.
 *
 * @param clusters            clusters in order of their first member
 * @param riskyMergesAvoided  records isolated for lack of identity signals
 */
public record GroupingResult(List<DuplicateCluster> clusters, List<VaultItem> riskyMergesAvoided) {

    public GroupingResult {
        clusters = List.copyOf(clusters);
        riskyMergesAvoided = List.copyOf(riskyMergesAvoided);
    }

    public long duplicateCandidateCount() {
        return clusters.stream().filter(c -> !c.isSingleton()).count();
    }
}
