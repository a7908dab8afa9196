package com.credential.dedupe.provider;

import java.util.List;

/**
 * Thrown when an import row lacks a column its provider requires, or cannot be
 * interpreted at all. Carries the 1-based data row index when known.
 */
public class MissingRequiredColumnException extends RuntimeException {

    /**
     * Marker for a row index that is not known at the point of failure.
     */
    public static final long UNKNOWN_ROW = -1;

    private final String providerId;
    private final String column;
    private final long rowIndex;
    private final List<String> rowErrors;

    public MissingRequiredColumnException(String providerId, String column) {
        this(providerId, column, UNKNOWN_ROW, null, List.of());
    }

    public MissingRequiredColumnException(String providerId, String column, long rowIndex,
                                          String message, List<String> rowErrors) {
        super(message != null ? message : defaultMessage(providerId, column, rowIndex));
        this.providerId = providerId;
        this.column = column;
        this.rowIndex = rowIndex;
        this.rowErrors = rowErrors != null ? List.copyOf(rowErrors) : List.of();
    }

    /**
     * Creates a failure for a row that cannot be interpreted, with no single missing column.
     */
    public static MissingRequiredColumnException uninterpretable(String providerId, String reason) {
        return new MissingRequiredColumnException(providerId, null, UNKNOWN_ROW,
                "Row cannot be interpreted as " + providerId + ": " + reason, List.of());
    }

    /**
     * Returns a copy of this failure attributed to the given row.
     */
    public MissingRequiredColumnException atRow(long row) {
        String message = column != null
                ? defaultMessage(providerId, column, row)
                : "Row " + row + ": " + getMessage();
        MissingRequiredColumnException copy =
                new MissingRequiredColumnException(providerId, column, row, message, rowErrors);
        copy.initCause(this);
        return copy;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * The missing column, or null when the row was uninterpretable for another reason.
     */
    public String getColumn() {
        return column;
    }

    public long getRowIndex() {
        return rowIndex;
    }

    /**
     * Every row error collected during a strict import, in row order.
     */
    public List<String> getRowErrors() {
        return rowErrors;
    }

    private static String defaultMessage(String providerId, String column, long rowIndex) {
        String where = rowIndex == UNKNOWN_ROW ? "" : "Row " + rowIndex + ": ";
        return where + "missing required column '" + column + "' for provider " + providerId;
    }
}
