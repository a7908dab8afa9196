package com.credential.dedupe.review;

/**
 * What a reviewer decided for a cluster.
 */
public enum ReviewAction {
    /** Keep one chosen record, with the others' values folded into its notes. */
    KEEP_ONE,
    /** Keep the proposed preferred record, with the others' values folded into its notes. */
    KEEP_BEST,
    /** Keep every member unchanged. */
    KEEP_ALL,
    /** Leave the cluster alone; every member is kept unchanged. */
    SKIP;

    public boolean discardsRecords() {
        return this == KEEP_ONE || this == KEEP_BEST;
    }
}
