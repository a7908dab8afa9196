package com.credential.dedupe.review;

import com.credential.dedupe.core.model.VaultItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reviewer aids computed from a cluster without exposing secrets. Passwords are compared
 * in memory; only internal ids and difference labels leave this class.
 */
public final class MemberComparison {

    private MemberComparison() {
        // Utility class
    }

    /**
     * Differences of every member against the preferred record, keyed by internal id in
     * member order. The preferred record maps to an empty set.
     */
    public static Map<String, Set<MemberDifference>> differences(List<VaultItem> members, VaultItem preferred) {
        Map<String, Set<MemberDifference>> result = new LinkedHashMap<>();
        for (VaultItem member : members) {
            result.put(member.getInternalId(), Collections.unmodifiableSet(compare(member, preferred)));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * For every member, the ids of the other members with the same non-empty password,
     * in member order. Members without a password share nothing.
     */
    public static Map<String, List<String>> sharedPasswords(List<VaultItem> members) {
        Map<String, List<String>> idsByPassword = new LinkedHashMap<>();
        for (VaultItem member : members) {
            if (!member.getPassword().isEmpty()) {
                idsByPassword.computeIfAbsent(member.getPassword(), k -> new ArrayList<>())
                        .add(member.getInternalId());
            }
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        for (VaultItem member : members) {
            List<String> others = new ArrayList<>(
                    idsByPassword.getOrDefault(member.getPassword(), List.of()));
            others.remove(member.getInternalId());
            result.put(member.getInternalId(), List.copyOf(others));
        }
        return Collections.unmodifiableMap(result);
    }

    private static EnumSet<MemberDifference> compare(VaultItem member, VaultItem preferred) {
        EnumSet<MemberDifference> flags = EnumSet.noneOf(MemberDifference.class);
        if (member == preferred) {
            return flags;
        }
        if (!member.getTitle().equals(preferred.getTitle())) {
            flags.add(MemberDifference.TITLE);
        }
        if (!member.getNotes().trim().equals(preferred.getNotes().trim())) {
            flags.add(MemberDifference.NOTES);
        }
        if (!member.getPassword().equals(preferred.getPassword())) {
            flags.add(MemberDifference.PASSWORD);
        }
        if (!Objects.equals(member.getFolder(), preferred.getFolder())) {
            flags.add(MemberDifference.FOLDER);
        }
        Long changed = lastChanged(member);
        Long preferredChanged = lastChanged(preferred);
        if (changed != null && preferredChanged != null) {
            int order = Long.compare(changed, preferredChanged);
            if (order < 0) {
                flags.add(MemberDifference.OLDER);
            } else if (order > 0) {
                flags.add(MemberDifference.NEWER);
            }
        }
        return flags;
    }

    private static Long lastChanged(VaultItem item) {
        return item.getUpdatedAt() != null ? item.getUpdatedAt() : item.getCreatedAt();
    }
}
