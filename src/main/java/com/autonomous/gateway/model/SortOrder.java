package com.autonomous.gateway.model;

import java.util.Locale;

public enum SortOrder {
    ASCENDING,
    DESCENDING;

    /**
     * Accepts "Ascending"/"Descending" in any case, and the short forms "asc"/"desc".
     * A null or blank value means the default, {@link #DESCENDING}.
     */
    public static SortOrder parse(String value) {
        if (value == null || value.isBlank()) {
            return DESCENDING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ascending", "asc" -> ASCENDING;
            case "descending", "desc" -> DESCENDING;
            default -> throw new IllegalArgumentException("Unknown sort order: " + value);
        };
    }
}
