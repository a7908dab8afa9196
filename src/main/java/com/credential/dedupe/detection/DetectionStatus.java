package com.credential.dedupe.detection;

/**
 * Outcome class of a format detection.
 */
public enum DetectionStatus {
    /** One provider clearly fits the header row. */
    DETECTED,
    /** Several providers tie at the best score; the caller must choose. */
    AMBIGUOUS,
    /** No provider fits well enough; the caller must choose. */
    UNKNOWN
}
