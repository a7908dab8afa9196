package com.credential.dedupe.detection;

import java.util.List;

/**
 * How well one provider's fingerprint fits a header row.
 *
 * @param providerId       the scored provider
 * @param coverage         weighted share of the provider's columns present, in [0,1]
 * @param headerShare      share of the header's columns the provider documents, in [0,1]
 * @param exactFit         true when every required column is present
 * @param matchedRequired  required columns found
 * @param missingRequired  required columns absent
 * @param matchedOptional  optional columns found
 */
public record ProviderMatch(
        String providerId,
        double coverage,
        double headerShare,
        boolean exactFit,
        List<String> matchedRequired,
        List<String> missingRequired,
        List<String> matchedOptional
) {
    public ProviderMatch {
        matchedRequired = List.copyOf(matchedRequired);
        missingRequired = List.copyOf(missingRequired);
        matchedOptional = List.copyOf(matchedOptional);
    }

    /**
     * Score of this provider as an exact candidate; zero unless every required column is present.
     */
    public double score() {
        return exactFit ? coverage * headerShare : 0.0;
    }

    /**
     * A candidate worth reporting even though it lacks required columns.
     */
    public boolean isPartial() {
        return !exactFit && coverage > 0.0;
    }
}
