package com.credential.dedupe.grouping;

import com.credential.dedupe.core.model.ItemType;

import java.util.Objects;

/**
 * Key under which records are considered duplicate candidates.
 * {@code password} is empty unless strict-password mode is on.
 */
public record GroupingKey(ItemType itemType, String domainOrName, String loginId, String password) {

    public GroupingKey {
        Objects.requireNonNull(itemType, "itemType is required");
        domainOrName = domainOrName != null ? domainOrName : "";
        loginId = loginId != null ? loginId : "";
        password = password != null ? password : "";
    }

    /**
     * True when neither a site identity nor a login identifier is available.
     */
    public boolean lacksIdentity() {
        return domainOrName.isEmpty() && loginId.isEmpty();
    }

    @Override
    public String toString() {
        // password left out
        return "GroupingKey{itemType=" + itemType +
                ", domainOrName='" + domainOrName + '\'' +
                ", loginId='" + loginId + '\'' + '}';
    }
}
