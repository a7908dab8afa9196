package com.credential.dedupe.core.model;

import java.util.Locale;

/**
 * Canonical item type shared by every provider format.
 */
public enum ItemType {
    LOGIN("login"),
    NOTE("note"),
    CARD("card"),
    IDENTITY("identity"),
    OTHER("other");

    private final String label;

    ItemType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps a provider type label to an item type.
     * Blank input maps to {@link #LOGIN}; unrecognized labels map to {@link #OTHER}.
     */
    public static ItemType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return LOGIN;
        }
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (ItemType type : values()) {
            if (type.label.equals(key)) {
                return type;
            }
        }
        return OTHER;
    }
}
