package com.credential.dedupe.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Header fingerprint of a provider format.
 *
 * @param required columns every export of this format carries
 * @param optional columns that may or may not be present
 */
public record HeaderSpec(List<String> required, List<String> optional) {

    public HeaderSpec {
        Objects.requireNonNull(required, "required is required");
        required = List.copyOf(required);
        optional = optional != null ? List.copyOf(optional) : List.of();
        for (String column : optional) {
            if (required.contains(column)) {
                throw new IllegalArgumentException("Column is both required and optional: " + column);
            }
        }
    }

    public static HeaderSpec of(List<String> required, List<String> optional) {
        return new HeaderSpec(required, optional);
    }

    /**
     * Every documented column, required first.
     */
    public List<String> allColumns() {
        List<String> all = new ArrayList<>(required);
        all.addAll(optional);
        return all;
    }
}
