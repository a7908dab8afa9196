package com.credential.dedupe.metrics;

import com.credential.dedupe.review.ReviewAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.incrementRowsImported("bitwarden", 10);
                noOp.incrementRowsFailed("bitwarden", 1);
                noOp.incrementClustersFormed(3);
                noOp.incrementExactDuplicatesRemoved(2);
                noOp.incrementReviewsRequested(1);
                noOp.incrementDecisionApplied(ReviewAction.KEEP_BEST);
                noOp.incrementRiskyMergesAvoided(1);
                noOp.recordDetectionConfidence(0.9);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count imported and failed rows per provider")
        void rowsPerProvider() {
            metrics.incrementRowsImported("bitwarden", 10);
            metrics.incrementRowsImported("bitwarden", 5);
            metrics.incrementRowsImported("lastpass", 2);
            metrics.incrementRowsFailed("lastpass", 1);

            Counter bitwarden = registry.find("dedupe.rows.imported").tag("provider", "bitwarden").counter();
            Counter lastpass = registry.find("dedupe.rows.imported").tag("provider", "lastpass").counter();
            Counter failed = registry.find("dedupe.rows.failed").tag("provider", "lastpass").counter();

            assertNotNull(bitwarden);
            assertEquals(15.0, bitwarden.count());
            assertNotNull(lastpass);
            assertEquals(2.0, lastpass.count());
            assertNotNull(failed);
            assertEquals(1.0, failed.count());
        }

        @Test
        @DisplayName("Should count pipeline outcomes")
        void pipelineCounters() {
            metrics.incrementClustersFormed(4);
            metrics.incrementExactDuplicatesRemoved(3);
            metrics.incrementReviewsRequested(2);
            metrics.incrementRiskyMergesAvoided(1);

            assertEquals(4.0, registry.get("dedupe.clusters.formed").counter().count());
            assertEquals(3.0, registry.get("dedupe.duplicates.exact.removed").counter().count());
            assertEquals(2.0, registry.get("dedupe.reviews.requested").counter().count());
            assertEquals(1.0, registry.get("dedupe.risky.merges.avoided").counter().count());
        }

        @Test
        @DisplayName("Should tag applied decisions by action")
        void decisionsByAction() {
            metrics.incrementDecisionApplied(ReviewAction.KEEP_BEST);
            metrics.incrementDecisionApplied(ReviewAction.KEEP_BEST);
            metrics.incrementDecisionApplied(ReviewAction.SKIP);

            assertEquals(2.0, registry.find("dedupe.decisions.applied")
                    .tag("action", "KEEP_BEST").counter().count());
            assertEquals(1.0, registry.find("dedupe.decisions.applied")
                    .tag("action", "SKIP").counter().count());
        }

        @Test
        @DisplayName("Should record detection confidence distribution")
        void detectionConfidence() {
            metrics.recordDetectionConfidence(1.0);
            metrics.recordDetectionConfidence(0.5);

            DistributionSummary summary = registry.find("dedupe.detection.confidence").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.5, summary.totalAmount(), 0.0001);
            assertEquals(1.0, summary.max(), 0.0001);
        }
    }
}
