package com.credential.dedupe.merge;

import com.credential.dedupe.core.model.VaultItem;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The fields that decide whether two records carry the same information:
 * title, primary URL, secondary URLs, username, email, password, notes, TOTP URI,
 * TOTP secret and every provider column kept in {@code extra} (card numbers, custom
 * fields, secondary logins). Timestamps and identity fields are not among them.
 */
public final class ImportantFields {

    /**
     * Provider timestamp columns. Kept in {@code extra} under their own name or as
     * {@code providerId:column} raw values, and ignored like the canonical timestamps.
     */
    static final Set<String> TIMESTAMP_COLUMNS = Set.of(
            "createTime", "modifyTime", "timeCreated", "timeLastUsed", "timePasswordChanged");

    private ImportantFields() {
        // Utility class
    }

    /**
     * True when every important field of {@code a} equals that of {@code b},
     * and both sit in the same folder.
     */
    public static boolean sameContent(VaultItem a, VaultItem b) {
        return a.getItemType() == b.getItemType()
                && values(a).equals(values(b))
                && a.getSecondaryUrls().equals(b.getSecondaryUrls())
                && Objects.equals(emptyToNull(a.getFolder()), emptyToNull(b.getFolder()))
                && comparableExtra(a).equals(comparableExtra(b));
    }

    /**
     * True when all records carry identical important content.
     */
    public static boolean allSameContent(List<VaultItem> records) {
        if (records.size() < 2) {
            return true;
        }
        VaultItem first = records.get(0);
        return records.stream().skip(1).allMatch(r -> sameContent(first, r));
    }

    /**
     * Number of non-empty important fields, used as a richness tie-breaker.
     */
    public static int countNonEmpty(VaultItem item) {
        int count = (int) values(item).stream().filter(v -> !v.isBlank()).count();
        return item.getSecondaryUrls().isEmpty() ? count : count + 1;
    }

    private static List<String> values(VaultItem item) {
        return Arrays.asList(
                item.getTitle(),
                nullToEmpty(item.getPrimaryUrl()),
                item.getUsername(),
                item.getEmail(),
                item.getPassword(),
                item.getNotes(),
                nullToEmpty(item.getTotpUri()),
                nullToEmpty(item.getTotpSecret()));
    }

    /**
     * Non-empty {@code extra} entries without timestamp columns. An absent column and an
     * empty one compare equal.
     */
    static Map<String, String> comparableExtra(VaultItem item) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : item.getExtra().entrySet()) {
            if (entry.getValue() != null && !entry.getValue().isEmpty() && !isTimestampColumn(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private static boolean isTimestampColumn(String key) {
        int colon = key.indexOf(':');
        return TIMESTAMP_COLUMNS.contains(colon >= 0 ? key.substring(colon + 1) : key);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
