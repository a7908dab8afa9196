package com.credential.dedupe.config;

import com.credential.dedupe.detection.FormatDetector;
import com.credential.dedupe.grouping.GroupingOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads {@link DedupeSettings} from JSON. Missing keys keep their defaults.
 *
 * <pre>
 * {
 *   "grouping":  { "strictPasswords": true, "emailUsernameEquivalence": true },
 *   "detection": { "confidenceThreshold": 0.5 }
 * }
 * </pre>
 */
public class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "credential-dedupe.json";

    private final ObjectMapper objectMapper;

    public SettingsLoader() {
        this(new ObjectMapper());
    }

    public SettingsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses settings from a JSON document.
     *
     * @throws IOException if the document is not valid JSON
     * @throws IllegalArgumentException if a value is out of range
     */
    public DedupeSettings load(Reader reader) throws IOException {
        JsonNode root = objectMapper.readTree(reader);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return DedupeSettings.defaults();
        }

        GroupingOptions defaults = GroupingOptions.defaults();
        JsonNode grouping = root.path("grouping");
        GroupingOptions options = GroupingOptions.builder()
                .strictPasswords(grouping.path("strictPasswords").asBoolean(defaults.isStrictPasswords()))
                .emailUsernameEquivalence(grouping.path("emailUsernameEquivalence")
                        .asBoolean(defaults.isEmailUsernameEquivalence()))
                .build();

        double threshold = root.path("detection").path("confidenceThreshold")
                .asDouble(FormatDetector.DEFAULT_CONFIDENCE_THRESHOLD);

        DedupeSettings settings = new DedupeSettings(options, threshold);
        log.debug("settings.loaded grouping={} confidenceThreshold={}", options, threshold);
        return settings;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or defaults when it is absent.
     */
    public DedupeSettings loadFromClasspath() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public DedupeSettings loadFromClasspath(String resource) {
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.debug("settings.defaults resource={} reason=not_found", resource);
            return DedupeSettings.defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings from " + resource, e);
        }
    }
}
