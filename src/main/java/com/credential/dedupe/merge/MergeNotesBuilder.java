package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the notes of a merged record.
 *
 * <p>The preferred record's notes come first and are never altered. After them comes a
 * labeled block listing, per category, every distinct value the other members carry that
 * the preferred record does not, in first-seen order:</p>
 * <pre>
 * Merged from duplicates:
 * - Alternative names: Example Old
 * - Alternative URLs: https://login.example.com
 * - Alternative passwords: hunter2
 * </pre>
 * <p>Then the distinct notes of the other members, separated by blank lines.</p>
 */
public class MergeNotesBuilder {

    static final String BLOCK_HEADER = "Merged from duplicates:";
    private static final String SEPARATOR = "\n\n";

    public String build(VaultItem preferred, List<VaultItem> members) {
        List<String> lines = new ArrayList<>();
        addCategory(lines, "Alternative names", preferred, members, item -> List.of(item.getTitle()));
        addCategory(lines, "Alternative URLs", preferred, members, MergeNotesBuilder::urlsOf);
        addCategory(lines, "Alternative emails", preferred, members, item -> List.of(item.getEmail()));
        addCategory(lines, "Alternative usernames", preferred, members, item -> List.of(item.getUsername()));
        addCategory(lines, "Alternative passwords", preferred, members, item -> List.of(item.getPassword()));
        addCategory(lines, "Alternative TOTP secrets", preferred, members, item -> List.of(item.getTotpValue()));
        addCategory(lines, "Original vaults", preferred, members, item -> listOf(item.getFolder()));

        List<String> otherNotes = distinct(members, item -> List.of(item.getNotes()));
        otherNotes.remove(preferred.getNotes().trim());

        List<String> sections = new ArrayList<>();
        if (!preferred.getNotes().isEmpty()) {
            sections.add(preferred.getNotes());
        }
        if (!lines.isEmpty()) {
            sections.add(BLOCK_HEADER + "\n" + String.join("\n", lines));
        }
        if (!otherNotes.isEmpty()) {
            sections.add(String.join(SEPARATOR, otherNotes));
        }
        return String.join(SEPARATOR, sections);
    }

    /**
     * The preferred record with merged notes. Every other field is left as it was.
     */
    public VaultItem merge(VaultItem preferred, List<VaultItem> members) {
        String notes = build(preferred, members);
        return notes.equals(preferred.getNotes()) ? preferred : preferred.withNotes(notes);
    }

    private static void addCategory(List<String> lines, String label, VaultItem preferred,
                                    List<VaultItem> members, Function<VaultItem, List<String>> extractor) {
        List<String> values = distinct(members, extractor);
        values.removeAll(distinct(List.of(preferred), extractor));
        if (!values.isEmpty()) {
            lines.add("- " + label + ": " + String.join(", ", values));
        }
    }

    private static List<String> distinct(List<VaultItem> members, Function<VaultItem, List<String>> extractor) {
        Set<String> seen = new LinkedHashSet<>();
        for (VaultItem member : members) {
            for (String value : extractor.apply(member)) {
                if (value != null && !value.isBlank()) {
                    seen.add(value.trim());
                }
            }
        }
        return new ArrayList<>(seen);
    }

    private static List<String> urlsOf(VaultItem item) {
        List<String> urls = new ArrayList<>();
        if (item.getPrimaryUrl() != null) {
            urls.add(item.getPrimaryUrl());
        }
        urls.addAll(item.getSecondaryUrls());
        return urls;
    }

    private static List<String> listOf(String value) {
        return value != null ? List.of(value) : List.of();
    }
}
