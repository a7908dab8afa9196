package com.credential.dedupe.review;

import java.util.Objects;

/**
 * A reviewer's decision for one cluster.
 *
 * @param action   the chosen action
 * @param recordId internal id of the record to keep, only for {@link ReviewAction#KEEP_ONE}
 */
public record ReviewDecision(ReviewAction action, String recordId) {

    public ReviewDecision {
        Objects.requireNonNull(action, "action is required");
        if (action == ReviewAction.KEEP_ONE && (recordId == null || recordId.isBlank())) {
            throw new IllegalArgumentException("KEEP_ONE requires a record id");
        }
        if (action != ReviewAction.KEEP_ONE && recordId != null) {
            throw new IllegalArgumentException(action + " does not take a record id");
        }
    }

    public static ReviewDecision keepOne(String recordId) {
        return new ReviewDecision(ReviewAction.KEEP_ONE, recordId);
    }

    public static ReviewDecision keepBest() {
        return new ReviewDecision(ReviewAction.KEEP_BEST, null);
    }

    public static ReviewDecision keepAll() {
        return new ReviewDecision(ReviewAction.KEEP_ALL, null);
    }

    public static ReviewDecision skip() {
        return new ReviewDecision(ReviewAction.SKIP, null);
    }
}
