package com.credential.dedupe.rules;

import com.credential.dedupe.core.model.VaultItem;

import java.util.Locale;
import java.util.Optional;

/**
 * Pure normalization functions over a {@link VaultItem}.
 * Results are derived on demand and never stored on the item.
 */
public final class RecordNormalizer {

    private static final String DEFAULT_SCHEME = "https://";
    private static final String WWW_PREFIX = "www.";

    private RecordNormalizer() {
        // Utility class
    }

    /**
     * Canonical site identity of an item: the normalized domain of its primary URL,
     * or the normalized title when the item has no usable URL.
     */
    public static String domainOrName(VaultItem item) {
        String domain = normalizeDomain(item.getPrimaryUrl());
        if (!domain.isEmpty()) {
            return domain;
        }
        return normalizeText(item.getTitle());
    }

    /**
     * Login identifier of an item. The normalized username, or, when email/username
     * equivalence is enabled and the username is empty, the normalized email field.
     *
     * <p>This is a fallback, not a union: a record with username {@code bob} and email
     * {@code bob@x.com} has login id {@code bob}, so it does not cluster with an email-only
     * record for {@code bob@x.com}.</p>
     */
    public static String loginId(VaultItem item, boolean emailUsernameEquivalence) {
        String username = normalizeLogin(item.getUsername());
        if (!username.isEmpty() || !emailUsernameEquivalence) {
            return username;
        }
        return normalizeLogin(item.getEmail());
    }

    /**
     * Parses a provider timestamp with the default parser chain.
     */
    public static Optional<Long> parseTimestamp(String value) {
        return DefaultTimestampParsers.defaultChain().parse(value);
    }

    /**
     * Extracts the host of a URL for comparison.
     *
     * <p>A scheme is assumed when none is present, the result is lower-cased and a single
     * leading {@code www.} label is removed. User info and port are dropped.</p>
     *
     * @return the normalized host, or an empty string for null, blank or host-less input
     */
    public static String normalizeDomain(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim();
        if (!value.contains("://")) {
            value = value.startsWith("//") ? "https:" + value : DEFAULT_SCHEME + value;
        }
        value = value.toLowerCase(Locale.ROOT);

        String rest = value.substring(value.indexOf("://") + 3);
        int end = indexOfAny(rest, '/', '?', '#');
        String authority = end >= 0 ? rest.substring(0, end) : rest;

        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        String host;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            host = close >= 0 ? authority.substring(0, close + 1) : authority;
        } else {
            int colon = authority.indexOf(':');
            host = colon >= 0 ? authority.substring(0, colon) : authority;
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.startsWith(WWW_PREFIX)) {
            host = host.substring(WWW_PREFIX.length());
        }
        return host.trim();
    }

    /**
     * Trims, lower-cases and collapses internal whitespace.
     */
    public static String normalizeText(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /**
     * Trims and lower-cases a login identifier.
     */
    public static String normalizeLogin(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static int indexOfAny(String value, char... chars) {
        int result = -1;
        for (char c : chars) {
            int idx = value.indexOf(c);
            if (idx >= 0 && (result < 0 || idx < result)) {
                result = idx;
            }
        }
        return result;
    }
}
