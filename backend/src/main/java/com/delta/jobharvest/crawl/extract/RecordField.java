package com.delta.jobharvest.crawl.extract;

import java.util.Locale;

public enum RecordField {
    TITLE("title"),
    COMPANY("company"),
    LOCATION("location"),
    COMPENSATION("compensation"),
    EMPLOYMENT_TYPE("employmentType"),
    POSTED_AT("postedAt"),
    CATEGORY("category"),
    DESCRIPTION("description");

    private final String key;

    RecordField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a configuration key such as {@code employmentType}, {@code employment_type} or
     * {@code employment-type}. Returns null for unknown keys.
     */
    public static RecordField fromKey(String raw) {
        if (raw == null) {
            return null;
        }
        String compact = raw.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
        for (RecordField field : values()) {
            if (field.key.toLowerCase(Locale.ROOT).equals(compact)) {
                return field;
            }
        }
        return null;
    }
}
