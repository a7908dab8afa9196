package com.credential.dedupe.review;

import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.grouping.DuplicateCluster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A near-duplicate cluster waiting for a reviewer.
 *
 * @param id                          the cluster id
 * @param cluster                     the underlying cluster
 * @param preferredCandidate          the record proposed to keep
 * @param alternatives                the other members, in encounter order
 * @param proposedMergedNotesPreview  notes the candidate would carry after a keep-best decision
 * @param differences                 per member id, how it differs from the candidate
 * @param sharedPasswordWith          per member id, the other members with the same password
 */
public record ReviewCluster(
        String id,
        DuplicateCluster cluster,
        VaultItem preferredCandidate,
        List<VaultItem> alternatives,
        String proposedMergedNotesPreview,
        Map<String, Set<MemberDifference>> differences,
        Map<String, List<String>> sharedPasswordWith
) {
    public ReviewCluster {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(cluster, "cluster is required");
        Objects.requireNonNull(preferredCandidate, "preferredCandidate is required");
        alternatives = List.copyOf(alternatives);
        proposedMergedNotesPreview = proposedMergedNotesPreview != null ? proposedMergedNotesPreview : "";
        differences = differences != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(differences)) : Map.of();
        sharedPasswordWith = sharedPasswordWith != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sharedPasswordWith)) : Map.of();
    }

    /**
     * Builds a review cluster with reviewer aids computed from the members.
     */
    public static ReviewCluster of(DuplicateCluster cluster, VaultItem preferredCandidate,
                                   List<VaultItem> alternatives, String proposedMergedNotesPreview) {
        return new ReviewCluster(cluster.id(), cluster, preferredCandidate, alternatives, proposedMergedNotesPreview,
                MemberComparison.differences(cluster.members(), preferredCandidate),
                MemberComparison.sharedPasswords(cluster.members()));
    }

    /**
     * Difference labels of one member; empty for the candidate and for unknown ids.
     */
    public Set<MemberDifference> differencesOf(String internalId) {
        return differences.getOrDefault(internalId, Set.of());
    }

    /**
     * Other members sharing this member's password; empty when the password is unique or empty.
     */
    public List<String> sharedPasswordWith(String internalId) {
        return sharedPasswordWith.getOrDefault(internalId, List.of());
    }

    public List<VaultItem> members() {
        return cluster.members();
    }
}
