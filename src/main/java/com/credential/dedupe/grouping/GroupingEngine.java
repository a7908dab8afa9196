package com.credential.dedupe.grouping;

import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.rules.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partitions records into duplicate-candidate clusters in a single pass.
 *
 * <p>The key is {@code (itemType, domainOrName, loginId, password?)}. Records with neither a
 * site identity nor a login identifier are never grouped; each becomes its own isolated
 * cluster. Clusters keep encounter order both among themselves and within their members,
 * so the same input and options always give the same assignment.</p>
 */
public class GroupingEngine {
    private static final Logger log = LoggerFactory.getLogger(GroupingEngine.class);

    private static final String CLUSTER_ID_PREFIX = "cluster-";

    public GroupingResult group(List<VaultItem> records, GroupingOptions options) {
        Objects.requireNonNull(records, "records is required");
        GroupingOptions opts = options != null ? options : GroupingOptions.defaults();

        // isolated records get a slot of their own, keyed by position
        Map<Object, Slot> slots = new LinkedHashMap<>();
        List<VaultItem> risky = new ArrayList<>();

        for (int position = 0; position < records.size(); position++) {
            VaultItem record = records.get(position);
            GroupingKey key = keyOf(record, opts);
            if (key.lacksIdentity()) {
                risky.add(record);
                Slot slot = new Slot(key, true);
                slot.members.add(record);
                slots.put(position, slot);
                continue;
            }
            slots.computeIfAbsent(key, k -> new Slot(key, false)).members.add(record);
        }

        List<DuplicateCluster> clusters = new ArrayList<>(slots.size());
        int index = 0;
        for (Slot slot : slots.values()) {
            clusters.add(new DuplicateCluster(CLUSTER_ID_PREFIX + (++index), slot.key, slot.members, slot.isolated));
        }

        log.info("grouping.completed records={} clusters={} candidates={} isolated={} options={}",
                records.size(), clusters.size(),
                clusters.stream().filter(c -> !c.isSingleton()).count(), risky.size(), opts);
        return new GroupingResult(clusters, risky);
    }

    /**
     * Computes the grouping key of one record.
     */
    public GroupingKey keyOf(VaultItem record, GroupingOptions options) {
        return new GroupingKey(
                record.getItemType(),
                RecordNormalizer.domainOrName(record),
                RecordNormalizer.loginId(record, options.isEmailUsernameEquivalence()),
                options.isStrictPasswords() ? record.getPassword() : "");
    }

    private static final class Slot {
        private final GroupingKey key;
        private final boolean isolated;
        private final List<VaultItem> members = new ArrayList<>();

        private Slot(GroupingKey key, boolean isolated) {
            this.key = key;
            this.isolated = isolated;
        }
    }
}
