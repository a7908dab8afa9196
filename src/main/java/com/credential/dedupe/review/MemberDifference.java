package com.credential.dedupe.review;

/**
 * How a cluster member differs from the preferred record. Labels only; values are never
 * carried.
 */
public enum MemberDifference {
    TITLE,
    NOTES,
    PASSWORD,
    FOLDER,
    /** Last changed before the preferred record. */
    OLDER,
    /** Last changed after the preferred record. */
    NEWER
}
