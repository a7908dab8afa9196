package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;

/**
 * Picks the record a cluster collapses onto.
 *
 * <p>Order: greatest {@code updatedAt} (missing counts as earliest), then most non-empty
 * important fields, then first in encounter order. The order is total, so the choice
 * never depends on anything but the member list.</p>
 */
public class PreferredRecordSelector {

    public VaultItem select(List<VaultItem> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members must not be empty");
        }
        VaultItem best = members.get(0);
        for (int i = 1; i < members.size(); i++) {
            VaultItem candidate = members.get(i);
            if (isPreferred(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Strictly better; an equal candidate never displaces an earlier one.
     */
    private boolean isPreferred(VaultItem candidate, VaultItem current) {
        int byTime = Long.compare(timeOf(candidate), timeOf(current));
        if (byTime != 0) {
            return byTime > 0;
        }
        return ImportantFields.countNonEmpty(candidate) > ImportantFields.countNonEmpty(current);
    }

    private static long timeOf(VaultItem item) {
        return item.getUpdatedAt() != null ? item.getUpdatedAt() : Long.MIN_VALUE;
    }
}
