package com.credential.dedupe.metrics;

import com.credential.dedupe.review.ReviewAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedupe.rows.imported} - Counter (tag: provider)</li>
 *   <li>{@code dedupe.rows.failed} - Counter (tag: provider)</li>
 *   <li>{@code dedupe.clusters.formed} - Counter</li>
 *   <li>{@code dedupe.duplicates.exact.removed} - Counter</li>
 *   <li>{@code dedupe.reviews.requested} - Counter</li>
 *   <li>{@code dedupe.decisions.applied} - Counter (tag: action)</li>
 *   <li>{@code dedupe.risky.merges.avoided} - Counter</li>
 *   <li>{@code dedupe.detection.confidence} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter clustersFormed;
    private final Counter exactDuplicatesRemoved;
    private final Counter reviewsRequested;
    private final Counter riskyMergesAvoided;
    private final DistributionSummary detectionConfidence;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.clustersFormed = Counter.builder("dedupe.clusters.formed")
                .description("Number of duplicate-candidate clusters formed")
                .register(registry);
        this.exactDuplicatesRemoved = Counter.builder("dedupe.duplicates.exact.removed")
                .description("Number of records removed as exact duplicates")
                .register(registry);
        this.reviewsRequested = Counter.builder("dedupe.reviews.requested")
                .description("Number of clusters sent to review")
                .register(registry);
        this.riskyMergesAvoided = Counter.builder("dedupe.risky.merges.avoided")
                .description("Number of records kept apart for lack of identity signals")
                .register(registry);
        this.detectionConfidence = DistributionSummary.builder("dedupe.detection.confidence")
                .description("Distribution of format detection confidence")
                .register(registry);
    }

    @Override
    public void incrementRowsImported(String providerId, int count) {
        providerCounter("dedupe.rows.imported", "Number of rows imported", providerId).increment(count);
    }

    @Override
    public void incrementRowsFailed(String providerId, int count) {
        providerCounter("dedupe.rows.failed", "Number of rows that failed to import", providerId).increment(count);
    }

    @Override
    public void incrementClustersFormed(int count) {
        clustersFormed.increment(count);
    }

    @Override
    public void incrementExactDuplicatesRemoved(int count) {
        exactDuplicatesRemoved.increment(count);
    }

    @Override
    public void incrementReviewsRequested(int count) {
        reviewsRequested.increment(count);
    }

    @Override
    public void incrementDecisionApplied(ReviewAction action) {
        String key = "decision:" + action.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("dedupe.decisions.applied")
                        .description("Number of review decisions applied")
                        .tag("action", action.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRiskyMergesAvoided(int count) {
        riskyMergesAvoided.increment(count);
    }

    @Override
    public void recordDetectionConfidence(double confidence) {
        detectionConfidence.record(confidence);
    }

    private Counter providerCounter(String name, String description, String providerId) {
        String key = name + ":" + providerId;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("provider", providerId)
                        .register(registry));
    }
}
