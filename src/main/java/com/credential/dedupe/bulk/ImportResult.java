package com.credential.dedupe.bulk;

import com.credential.dedupe.core.model.VaultItem;

import java.util.List;

/**
 * Result of importing the rows of one provider file.
 *
 * @param providerId  the provider the rows were read as
 * @param totalRows   number of data rows in the input
 * @param records     records of the rows that imported, in row order
 * @param errors      one entry per failed row, in row order
 */
public record ImportResult(
        String providerId,
        long totalRows,
        List<VaultItem> records,
        List<ImportError> errors
) {
    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be imported.
     *
     * @param rowIndex the 1-based data row index
     * @param column   the missing column, or null when the row was uninterpretable
     * @param message  the error message
     */
    public record ImportError(long rowIndex, String column, String message) {}

    @Override
    public String toString() {
        return "ImportResult{provider=" + providerId +
                ", total=" + totalRows +
                ", imported=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}
