package com.credential.dedupe.provider;

import com.credential.dedupe.core.model.VaultItem;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for provider plugins.
 *
 * <p>Handles the parts every format shares: required-column checks, tolerant column
 * lookup (exact name first, then trimmed and case-insensitive), preservation of
 * undocumented columns in {@code extra}, write-back of documented columns that have no
 * canonical home, and emission of exactly the export columns in order.</p>
 *
 * <p>Subclasses map the columns that do have a canonical home. Where the canonical form
 * would not reproduce the original text (flags, type labels, raw timestamps) they keep
 * the original under {@link #rawKey(String)} and export it back through
 * {@link #rawOr(VaultItem, String, String)}.</p>
 */
public abstract class AbstractProviderPlugin implements ProviderPlugin {

    private static final String OTPAUTH_SCHEME = "otpauth://";

    private final String providerId;
    private final HeaderSpec headerSpec;
    private final List<String> exportColumns;
    private final Set<String> extraColumns;
    private final Set<String> documentedColumns;

    /**
     * @param providerId    unique provider id
     * @param headerSpec    detection fingerprint
     * @param exportColumns fixed export order
     * @param extraColumns  documented columns without canonical home, kept in {@code extra}
     *                      under their documented name and written back on export
     */
    protected AbstractProviderPlugin(String providerId, HeaderSpec headerSpec,
                                     List<String> exportColumns, List<String> extraColumns) {
        this.providerId = Objects.requireNonNull(providerId, "providerId is required");
        this.headerSpec = Objects.requireNonNull(headerSpec, "headerSpec is required");
        this.exportColumns = List.copyOf(exportColumns);
        this.extraColumns = new LinkedHashSet<>(extraColumns);
        this.documentedColumns = new LinkedHashSet<>(headerSpec.allColumns());
        this.documentedColumns.addAll(this.exportColumns);
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public HeaderSpec getHeaderSpec() {
        return headerSpec;
    }

    @Override
    public List<String> getExportColumns() {
        return exportColumns;
    }

    @Override
    public VaultItem importRow(Map<String, String> row) {
        if (row == null) {
            throw MissingRequiredColumnException.uninterpretable(providerId, "row is null");
        }
        RowView view = new RowView(row);
        for (String column : headerSpec.required()) {
            if (!view.has(column)) {
                throw new MissingRequiredColumnException(providerId, column);
            }
        }

        VaultItem.Builder builder = VaultItem.builder().source(providerId);
        mapRow(view, builder);

        for (String column : extraColumns) {
            if (view.has(column)) {
                builder.putExtra(column, view.get(column));
            }
        }
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (entry.getKey() != null && !view.isDocumented(entry.getKey())) {
                builder.putExtra(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    @Override
    public Map<String, String> exportRow(VaultItem item) {
        Objects.requireNonNull(item, "item is required");
        Map<String, String> values = new HashMap<>();
        mapItem(item, values);

        Map<String, String> row = new LinkedHashMap<>();
        for (String column : exportColumns) {
            String value = values.get(column);
            if (value == null && extraColumns.contains(column)) {
                value = item.getExtra().get(column);
            }
            row.put(column, value != null ? value : "");
        }
        return row;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + providerId + '}';
    }

    /**
     * Maps the canonical columns of a row onto the builder.
     * The builder already carries {@code source}; extra columns are handled by the caller.
     */
    protected abstract void mapRow(RowView row, VaultItem.Builder builder);

    /**
     * Puts the export value of every canonical column into {@code values}.
     * Columns left out are filled from {@code extra} or emitted empty.
     */
    protected abstract void mapItem(VaultItem item, Map<String, String> values);

    /**
     * Key under which this provider keeps the original text of a lossy column.
     */
    protected String rawKey(String column) {
        return providerId + ":" + column;
    }

    /**
     * Keeps the original text of a column whose canonical form may not reproduce it.
     */
    protected void preserveRaw(VaultItem.Builder builder, RowView row, String column) {
        if (row.has(column)) {
            builder.putExtra(rawKey(column), row.get(column));
        }
    }

    /**
     * The original text of a column if this provider imported the item, otherwise
     * the value computed from canonical fields.
     */
    protected String rawOr(VaultItem item, String column, String computed) {
        String raw = item.getExtra().get(rawKey(column));
        return raw != null ? raw : computed;
    }

    /**
     * Assigns a single-column TOTP value: otpauth URIs go to {@code totpUri},
     * anything else non-empty to {@code totpSecret}.
     */
    protected static void assignTotp(VaultItem.Builder builder, String raw) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        if (raw.trim().toLowerCase(Locale.ROOT).startsWith(OTPAUTH_SCHEME)) {
            builder.totpUri(raw);
        } else {
            builder.totpSecret(raw);
        }
    }

    protected static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    protected static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    protected static boolean isTruthy(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("true") || v.equals("yes");
    }

    /**
     * Read-only view of a CSV row with tolerant column lookup.
     */
    protected final class RowView {
        private final Map<String, String> row;
        private final Map<String, String> byNormalizedName = new HashMap<>();

        RowView(Map<String, String> row) {
            this.row = row;
            for (String key : row.keySet()) {
                if (key != null) {
                    byNormalizedName.putIfAbsent(normalize(key), key);
                }
            }
        }

        public boolean has(String column) {
            return resolve(column) != null;
        }

        /**
         * Value of the column, or an empty string when absent.
         */
        public String get(String column) {
            String key = resolve(column);
            if (key == null) {
                return "";
            }
            return nullToEmpty(row.get(key));
        }

        boolean isDocumented(String actualKey) {
            if (documentedColumns.contains(actualKey)) {
                return true;
            }
            String normalized = normalize(actualKey);
            for (String column : documentedColumns) {
                if (normalize(column).equals(normalized)) {
                    return true;
                }
            }
            return false;
        }

        private String resolve(String column) {
            if (row.containsKey(column)) {
                return column;
            }
            return byNormalizedName.get(normalize(column));
        }

        private String normalize(String key) {
            return key.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        }
    }
}
