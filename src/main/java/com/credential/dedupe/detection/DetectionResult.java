package com.credential.dedupe.detection;

import java.util.List;
import java.util.Objects;

/**
 * Proposal of the provider a header row belongs to. Never binding: the caller may
 * always override, and must choose explicitly when {@link #requiresUserSelection()}.
 *
 * @param status               detected, ambiguous or unknown
 * @param providerId           the proposed provider, or {@link #UNKNOWN} unless detected
 * @param confidence           score of the best exact candidate, in [0,1]
 * @param explanation          which columns matched and which were missing
 * @param ambiguousCandidates  the tied providers when ambiguous, otherwise empty
 * @param matches              every provider with a nonzero coverage, best first
 */
public record DetectionResult(
        DetectionStatus status,
        String providerId,
        double confidence,
        String explanation,
        List<String> ambiguousCandidates,
        List<ProviderMatch> matches
) {
    public static final String UNKNOWN = "unknown";

    public DetectionResult {
        Objects.requireNonNull(status, "status is required");
        providerId = providerId != null ? providerId : UNKNOWN;
        ambiguousCandidates = ambiguousCandidates != null ? List.copyOf(ambiguousCandidates) : List.of();
        matches = matches != null ? List.copyOf(matches) : List.of();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
    }

    public boolean isDetected() {
        return status == DetectionStatus.DETECTED;
    }

    public boolean requiresUserSelection() {
        return status != DetectionStatus.DETECTED;
    }
}
