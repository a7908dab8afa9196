package com.credential.dedupe.detection;

import com.credential.dedupe.provider.HeaderSpec;
import com.credential.dedupe.provider.ProviderPlugin;
import com.credential.dedupe.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a CSV header row against every registered provider fingerprint.
 *
 * <p>Header tokens and fingerprint columns are compared after normalization
 * (byte-order mark removed, trimmed, lower-cased, punctuation stripped, whitespace
 * collapsed). For each provider:</p>
 * <ul>
 *   <li>coverage = (4 x required present + optional present) / (4 x required + optional)</li>
 *   <li>header share = header tokens the provider documents / header tokens</li>
 *   <li>score = coverage x header share when every required column is present, else 0</li>
 * </ul>
 *
 * <p>Several providers tying at the best nonzero score yield {@link DetectionStatus#AMBIGUOUS};
 * a best score under the threshold, or no exact fit at all, yields
 * {@link DetectionStatus#UNKNOWN}.</p>
 */
public class FormatDetector {
    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
    static final int REQUIRED_WEIGHT = 4;
    private static final double EPSILON = 1e-9;

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ProviderRegistry registry;
    private final double confidenceThreshold;

    public FormatDetector(ProviderRegistry registry) {
        this(registry, DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public FormatDetector(ProviderRegistry registry, double confidenceThreshold) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0,1]: " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
        registry.freeze();
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public DetectionResult detect(List<String> headerRow) {
        if (headerRow == null || headerRow.isEmpty()) {
            return new DetectionResult(DetectionStatus.UNKNOWN, null, 0.0,
                    "No header columns provided", List.of(), List.of());
        }
        if (registry.size() == 0) {
            return new DetectionResult(DetectionStatus.UNKNOWN, null, 0.0,
                    "No provider plugins registered", List.of(), List.of());
        }

        Set<String> tokens = new LinkedHashSet<>();
        for (String column : headerRow) {
            String token = normalizeToken(column);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }

        List<ProviderMatch> matches = new ArrayList<>();
        for (ProviderPlugin plugin : registry.plugins()) {
            ProviderMatch match = score(plugin, tokens);
            if (match.coverage() > 0.0) {
                matches.add(match);
            }
        }
        // stable sort keeps registration order among equal scores
        matches.sort(Comparator.comparingDouble(ProviderMatch::score).reversed()
                .thenComparing(Comparator.comparingDouble(ProviderMatch::coverage).reversed()));

        DetectionResult result = classify(matches);
        log.debug("detection.completed status={} providerId={} confidence={}",
                result.status(), result.providerId(), String.format(Locale.ROOT, "%.3f", result.confidence()));
        return result;
    }

    private DetectionResult classify(List<ProviderMatch> matches) {
        if (matches.isEmpty()) {
            return new DetectionResult(DetectionStatus.UNKNOWN, null, 0.0,
                    "No provider matched the header row", List.of(), matches);
        }
        ProviderMatch best = matches.get(0);
        double bestScore = best.score();
        if (bestScore <= 0.0) {
            return new DetectionResult(DetectionStatus.UNKNOWN, null, 0.0,
                    "No provider has all required columns. Closest: " + describe(best), List.of(), matches);
        }

        List<String> tied = new ArrayList<>();
        for (ProviderMatch match : matches) {
            if (Math.abs(match.score() - bestScore) < EPSILON) {
                tied.add(match.providerId());
            }
        }
        double confidence = Math.min(1.0, bestScore);
        if (tied.size() > 1) {
            return new DetectionResult(DetectionStatus.AMBIGUOUS, null, confidence,
                    "Header matches several providers equally well: " + String.join(", ", tied),
                    tied, matches);
        }
        if (confidence < confidenceThreshold) {
            return new DetectionResult(DetectionStatus.UNKNOWN, null, confidence,
                    String.format(Locale.ROOT, "Best match below threshold %.2f. %s",
                            confidenceThreshold, describe(best)),
                    List.of(), matches);
        }
        return new DetectionResult(DetectionStatus.DETECTED, best.providerId(), confidence,
                describe(best), List.of(), matches);
    }

    ProviderMatch score(ProviderPlugin plugin, Set<String> tokens) {
        HeaderSpec columns = plugin.getHeaderSpec();
        List<String> matchedRequired = new ArrayList<>();
        List<String> missingRequired = new ArrayList<>();
        List<String> matchedOptional = new ArrayList<>();
        Set<String> documented = new LinkedHashSet<>();

        for (String column : columns.required()) {
            String token = normalizeToken(column);
            documented.add(token);
            if (tokens.contains(token)) {
                matchedRequired.add(column);
            } else {
                missingRequired.add(column);
            }
        }
        for (String column : columns.optional()) {
            String token = normalizeToken(column);
            documented.add(token);
            if (tokens.contains(token)) {
                matchedOptional.add(column);
            }
        }

        int totalWeight = REQUIRED_WEIGHT * columns.required().size() + columns.optional().size();
        double coverage = totalWeight == 0 ? 0.0
                : (double) (REQUIRED_WEIGHT * matchedRequired.size() + matchedOptional.size()) / totalWeight;

        long explained = tokens.stream().filter(documented::contains).count();
        double headerShare = tokens.isEmpty() ? 0.0 : (double) explained / tokens.size();

        return new ProviderMatch(plugin.getProviderId(), coverage, headerShare, missingRequired.isEmpty(),
                matchedRequired, missingRequired, matchedOptional);
    }

    private static String describe(ProviderMatch match) {
        StringBuilder sb = new StringBuilder();
        sb.append("Best match: ").append(match.providerId())
                .append(String.format(Locale.ROOT, " (score=%.2f", match.score()))
                .append(", required ").append(match.matchedRequired().size())
                .append('/').append(match.matchedRequired().size() + match.missingRequired().size())
                .append(", optional ").append(match.matchedOptional().size()).append(')');
        if (!match.matchedRequired().isEmpty() || !match.matchedOptional().isEmpty()) {
            List<String> matched = new ArrayList<>(match.matchedRequired());
            matched.addAll(match.matchedOptional());
            sb.append(". Matched: ").append(String.join(", ", matched));
        }
        if (!match.missingRequired().isEmpty()) {
            sb.append(". Missing required: ").append(String.join(", ", match.missingRequired()));
        }
        return sb.toString();
    }

    /**
     * Normalizes a header token for comparison.
     */
    public static String normalizeToken(String column) {
        if (column == null) {
            return "";
        }
        String value = column.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        value = PUNCTUATION.matcher(value).replaceAll("");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
