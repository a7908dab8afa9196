package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;
import java.util.Objects;

/**
 * A cluster settled without review.
 *
 * @param clusterId      the cluster id
 * @param records        the surviving records (one for collapsed exact duplicates)
 * @param exactDuplicate true when members were collapsed as exact duplicates
 */
public record ResolvedCluster(String clusterId, List<VaultItem> records, boolean exactDuplicate) {

    public ResolvedCluster {
        Objects.requireNonNull(clusterId, "clusterId is required");
        records = List.copyOf(records);
    }
}
