package com.credential.dedupe.config;

import com.credential.dedupe.detection.FormatDetector;
import com.credential.dedupe.grouping.GroupingOptions;

import java.util.Objects;

/**
 * Run settings of the deduplication pipeline.
 *
 * @param grouping            grouping options
 * @param confidenceThreshold minimum detection confidence to accept a provider, in [0,1]
 */
public record DedupeSettings(GroupingOptions grouping, double confidenceThreshold) {

    public DedupeSettings {
        Objects.requireNonNull(grouping, "grouping is required");
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0.0 and 1.0");
        }
    }

    public static DedupeSettings defaults() {
        return new DedupeSettings(GroupingOptions.defaults(), FormatDetector.DEFAULT_CONFIDENCE_THRESHOLD);
    }
}
