package com.credential.dedupe.metrics;

import com.credential.dedupe.review.ReviewAction;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementRowsImported(String providerId, int count) {
    }

    @Override
    public void incrementRowsFailed(String providerId, int count) {
    }

    @Override
    public void incrementClustersFormed(int count) {
    }

    @Override
    public void incrementExactDuplicatesRemoved(int count) {
    }

    @Override
    public void incrementReviewsRequested(int count) {
    }

    @Override
    public void incrementDecisionApplied(ReviewAction action) {
    }

    @Override
    public void incrementRiskyMergesAvoided(int count) {
    }

    @Override
    public void recordDetectionConfidence(double confidence) {
    }
}
