package com.credential.dedupe.grouping;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;
import java.util.Objects;

/**
 * Records sharing one grouping key, in first-seen order.
 *
 * @param id       stable id within one grouping run ({@code cluster-N})
 * @param key      the shared key
 * @param members  records in encounter order, never empty
 * @param isolated true when the record lacked identity signals and was kept apart
 */
public record DuplicateCluster(String id, GroupingKey key, List<VaultItem> members, boolean isolated) {

    public DuplicateCluster {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(key, "key is required");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("cluster must have at least one member");
        }
    }

    public int size() {
        return members.size();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }

    public boolean contains(String internalId) {
        return members.stream().anyMatch(m -> m.getInternalId().equals(internalId));
    }
}
