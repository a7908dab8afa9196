package com.credential.dedupe.provider;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;
import java.util.Map;

/**
 * Converts rows of one provider's CSV export to and from {@link VaultItem}s.
 *
 * <p>Implementations are stateless and safe to share between concurrent runs.</p>
 */
public interface ProviderPlugin {

    /**
     * Stable identifier, unique within a {@link ProviderRegistry}.
     */
    String getProviderId();

    /**
     * Columns that identify this format, used by format detection.
     */
    HeaderSpec getHeaderSpec();

    /**
     * Fixed export column order. {@link #exportRow(VaultItem)} emits exactly these columns.
     */
    List<String> getExportColumns();

    /**
     * Maps one CSV row to a canonical item.
     *
     * @param row column name to value
     * @return the canonical item
     * @throws MissingRequiredColumnException if a required column is absent or the row
     *                                        cannot be interpreted
     */
    VaultItem importRow(Map<String, String> row);

    /**
     * Maps a canonical item to a row in {@link #getExportColumns()} order.
     * Columns without a canonical source are emitted as empty strings.
     */
    Map<String, String> exportRow(VaultItem item);
}
