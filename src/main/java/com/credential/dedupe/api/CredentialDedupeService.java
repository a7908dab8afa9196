package com.credential.dedupe.api;

import com.credential.dedupe.audit.AuditService;
import com.credential.dedupe.bulk.ImportResult;
import com.credential.dedupe.config.DedupeSettings;
import com.credential.dedupe.core.model.VaultItem;
import com.credential.dedupe.detection.DetectionResult;
import com.credential.dedupe.detection.FormatDetector;
import com.credential.dedupe.grouping.GroupingEngine;
import com.credential.dedupe.grouping.GroupingOptions;
import com.credential.dedupe.grouping.GroupingResult;
import com.credential.dedupe.logging.LogContext;
import com.credential.dedupe.merge.ConflictResolver;
import com.credential.dedupe.merge.ResolutionResult;
import com.credential.dedupe.merge.ResolvedCluster;
import com.credential.dedupe.metrics.MetricsService;
import com.credential.dedupe.metrics.NoOpMetricsService;
import com.credential.dedupe.provider.BuiltInProviders;
import com.credential.dedupe.provider.MissingRequiredColumnException;
import com.credential.dedupe.provider.ProviderPlugin;
import com.credential.dedupe.provider.ProviderRegistry;
import com.credential.dedupe.review.DecisionApplier;
import com.credential.dedupe.review.ReviewCluster;
import com.credential.dedupe.review.ReviewDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service facade over the deduplication pipeline.
 *
 * <p>Rows go in through {@link #importAll} or {@link #importRows}, are clustered and
 * auto-resolved by {@link #group}, near-duplicates are settled one by one with
 * {@link #applyDecision} (or all at once with {@link #finalizeRecords}), and the surviving
 * records leave through {@link #exportAll}.</p>
 *
 * <p>The service holds no per-file state; one instance may process several files in turn.</p>
 */
public class CredentialDedupeService {
    private static final Logger log = LoggerFactory.getLogger(CredentialDedupeService.class);

    private final ProviderRegistry registry;
    private final FormatDetector detector;
    private final GroupingEngine groupingEngine;
    private final ConflictResolver resolver;
    private final DecisionApplier decisionApplier;
    private final MetricsService metricsService;
    private final AuditService auditService;
    private final GroupingOptions defaultGroupingOptions;
    private final String runId;

    private CredentialDedupeService(Builder builder) {
        this.registry = (builder.registry != null ? builder.registry : BuiltInProviders.createDefaultRegistry())
                .freeze();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.detector = new FormatDetector(registry, builder.settings.confidenceThreshold());
        this.defaultGroupingOptions = builder.settings.grouping();
        this.groupingEngine = new GroupingEngine();
        this.resolver = new ConflictResolver(auditService);
        this.decisionApplier = new DecisionApplier(auditService);
        this.runId = builder.runId != null ? builder.runId : LogContext.generateRunId();
    }

    /**
     * Proposes the provider of a header row. Never binding.
     */
    public DetectionResult detect(List<String> headerRow) {
        try (LogContext ctx = LogContext.forOperation(runId, "detect")) {
            DetectionResult result = detector.detect(headerRow);
            metricsService.recordDetectionConfidence(result.confidence());
            log.info("detect.completed status={} providerId={} columns={}",
                    result.status(), result.providerId(), headerRow != null ? headerRow.size() : 0);
            return result;
        }
    }

    /**
     * Imports every row, collecting failures instead of stopping at them.
     *
     * @throws com.credential.dedupe.provider.UnknownProviderException if the provider is not registered
     */
    public ImportResult importRows(String providerId, List<Map<String, String>> rows) {
        Objects.requireNonNull(rows, "rows is required");
        ProviderPlugin plugin = registry.get(providerId);
        try (LogContext ctx = LogContext.forImport(runId, providerId)) {
            List<VaultItem> records = new ArrayList<>(rows.size());
            List<ImportResult.ImportError> errors = new ArrayList<>();
            long rowIndex = 0;
            for (Map<String, String> row : rows) {
                rowIndex++;
                try {
                    records.add(plugin.importRow(row));
                } catch (MissingRequiredColumnException e) {
                    MissingRequiredColumnException located = e.atRow(rowIndex);
                    errors.add(new ImportResult.ImportError(rowIndex, located.getColumn(), located.getMessage()));
                    log.warn("import.row_failed provider={} row={} column={}",
                            providerId, rowIndex, located.getColumn());
                }
            }
            metricsService.incrementRowsImported(providerId, records.size());
            if (!errors.isEmpty()) {
                metricsService.incrementRowsFailed(providerId, errors.size());
            }
            ImportResult result = new ImportResult(providerId, rows.size(), records, errors);
            log.info("import.completed result={}", result);
            return result;
        }
    }

    /**
     * Imports every row or fails. All rows are examined first, so the failure lists every
     * bad row, not just the first one.
     *
     * @throws MissingRequiredColumnException carrying the first failing row index and all row errors
     */
    public List<VaultItem> importAll(String providerId, List<Map<String, String>> rows) {
        ImportResult result = importRows(providerId, rows);
        if (result.hasErrors()) {
            ImportResult.ImportError first = result.errors().get(0);
            List<String> messages = result.errors().stream().map(ImportResult.ImportError::message).toList();
            String message = first.message() + (messages.size() > 1
                    ? " (and " + (messages.size() - 1) + " more failing rows)" : "");
            throw new MissingRequiredColumnException(providerId, first.column(), first.rowIndex(), message, messages);
        }
        return result.records();
    }

    /**
     * Groups with the configured default options, then auto-resolves.
     */
    public ResolutionResult group(List<VaultItem> records) {
        return group(records, defaultGroupingOptions);
    }

    /**
     * Groups records into duplicate-candidate clusters, collapses exact duplicates and
     * prepares every other multi-member cluster for review.
     */
    public ResolutionResult group(List<VaultItem> records, GroupingOptions options) {
        try (LogContext ctx = LogContext.forOperation(runId, "group")) {
            GroupingResult grouping = groupingEngine.group(records, options);
            ResolutionResult result = resolver.resolve(grouping);
            metricsService.incrementClustersFormed((int) grouping.duplicateCandidateCount());
            metricsService.incrementExactDuplicatesRemoved(result.removedExactDuplicates().size());
            metricsService.incrementReviewsRequested(result.pendingClusters().size());
            metricsService.incrementRiskyMergesAvoided(result.riskyMergesAvoided().size());
            return result;
        }
    }

    /**
     * Applies a reviewer's decision and returns the records the cluster leaves behind.
     */
    public List<VaultItem> applyDecision(ReviewCluster cluster, ReviewDecision decision) {
        try (LogContext ctx = LogContext.forOperation(runId, "decide").with("clusterId", cluster.id())) {
            List<VaultItem> result = decisionApplier.apply(cluster, decision);
            metricsService.incrementDecisionApplied(decision.action());
            return result;
        }
    }

    /**
     * The final record list of a run, in cluster order. Pending clusters without a decision
     * are skipped, i.e. all their members are kept.
     *
     * @param decisions decisions keyed by cluster id
     */
    public List<VaultItem> finalizeRecords(ResolutionResult result, Map<String, ReviewDecision> decisions) {
        Objects.requireNonNull(result, "result is required");
        Map<String, ReviewDecision> byCluster = decisions != null ? decisions : Map.of();

        Map<String, ResolvedCluster> resolved = new HashMap<>();
        result.resolvedClusters().forEach(c -> resolved.put(c.clusterId(), c));
        Map<String, ReviewCluster> pending = new HashMap<>();
        result.pendingClusters().forEach(c -> pending.put(c.id(), c));

        for (String clusterId : byCluster.keySet()) {
            if (!pending.containsKey(clusterId)) {
                throw new IllegalArgumentException("No pending cluster with id " + clusterId);
            }
        }

        List<VaultItem> records = new ArrayList<>();
        for (String clusterId : result.clusterOrder()) {
            ResolvedCluster auto = resolved.get(clusterId);
            if (auto != null) {
                records.addAll(auto.records());
                continue;
            }
            ReviewCluster review = pending.get(clusterId);
            ReviewDecision decision = byCluster.getOrDefault(clusterId, ReviewDecision.skip());
            records.addAll(applyDecision(review, decision));
        }
        log.info("finalize.completed clusters={} decisions={} records={}",
                result.clusterOrder().size(), byCluster.size(), records.size());
        return records;
    }

    /**
     * Serializes records into rows of the target provider, in its export column order.
     */
    public List<Map<String, String>> exportAll(String providerId, List<VaultItem> records) {
        Objects.requireNonNull(records, "records is required");
        ProviderPlugin plugin = registry.get(providerId);
        try (LogContext ctx = LogContext.forExport(runId, providerId)) {
            List<Map<String, String>> rows = new ArrayList<>(records.size());
            for (VaultItem record : records) {
                rows.add(plugin.exportRow(record));
            }
            log.info("export.completed provider={} rows={}", providerId, rows.size());
            return rows;
        }
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public String getRunId() {
        return runId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProviderRegistry registry;
        private MetricsService metricsService;
        private AuditService auditService;
        private DedupeSettings settings = DedupeSettings.defaults();
        private String runId;

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder settings(DedupeSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings is required");
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.settings = new DedupeSettings(settings.grouping(), confidenceThreshold);
            return this;
        }

        public Builder groupingOptions(GroupingOptions groupingOptions) {
            this.settings = new DedupeSettings(groupingOptions, settings.confidenceThreshold());
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public CredentialDedupeService build() {
            return new CredentialDedupeService(this);
        }
    }
}
