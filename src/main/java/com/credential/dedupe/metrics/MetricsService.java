package com.credential.dedupe.metrics;

import com.credential.dedupe.review.ReviewAction;

/**
 * Interface for recording deduplication metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void incrementRowsImported(String providerId, int count);

    void incrementRowsFailed(String providerId, int count);

    void incrementClustersFormed(int count);

    void incrementExactDuplicatesRemoved(int count);

    void incrementReviewsRequested(int count);

    void incrementDecisionApplied(ReviewAction action);

    void incrementRiskyMergesAvoided(int count);

    void recordDetectionConfidence(double confidence);
}
